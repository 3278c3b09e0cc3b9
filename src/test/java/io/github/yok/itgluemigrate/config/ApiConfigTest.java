package io.github.yok.itgluemigrate.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

/** Unit tests for {@link ApiConfig}. */
class ApiConfigTest {

    @Test
    void resolveUrl_正常ケース_指定値が設定値より優先されること() {
        ApiConfig config = new ApiConfig();
        config.setUrl("https://configured");

        assertEquals("https://cli", config.resolveUrl("https://cli"));
        assertEquals("https://configured", config.resolveUrl(null));
        assertEquals("https://configured", config.resolveUrl("  "));
    }

    @Test
    void resolveUrl_正常ケース_どちらも無い場合はnullを返すこと() {
        ApiConfig config = new ApiConfig();
        config.setUrl(" ");
        assertNull(config.resolveUrl(null));
    }

    @Test
    void resolveToken_正常ケース_空白の設定値はnullとして扱うこと() {
        ApiConfig config = new ApiConfig();
        config.setToken("");
        assertNull(config.resolveToken(null));
        assertEquals("t", config.resolveToken("t"));

        config.setToken("env-token");
        assertEquals("env-token", config.resolveToken(""));
    }

    @Test
    void defaults_正常ケース_既定のタイムアウト値を持つこと() {
        ApiConfig config = new ApiConfig();
        assertEquals(30, config.getTimeoutSeconds());
        assertEquals(300, config.getUploadTimeoutSeconds());
    }
}
