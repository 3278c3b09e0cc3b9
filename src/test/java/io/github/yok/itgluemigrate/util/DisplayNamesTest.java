package io.github.yok.itgluemigrate.util;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

/** Unit tests for {@link DisplayNames}. */
class DisplayNamesTest {

    @Test
    void slugToDisplayName_正常ケース_略語を大文字にすること() {
        assertEquals("SSL Certificates", DisplayNames.slugToDisplayName("ssl-certificates"));
        assertEquals("VPN Accounts", DisplayNames.slugToDisplayName("vpn-accounts"));
    }

    @Test
    void slugToDisplayName_正常ケース_先頭以外の接続語は小文字のままにすること() {
        assertEquals("Backup and Recovery",
                DisplayNames.slugToDisplayName("backup-and-recovery"));
        assertEquals("The Office", DisplayNames.slugToDisplayName("the-office"));
    }

    @Test
    void slugToDisplayName_正常ケース_空の入力は空文字を返すこと() {
        assertEquals("", DisplayNames.slugToDisplayName(null));
        assertEquals("", DisplayNames.slugToDisplayName(" "));
    }
}
