package io.github.yok.itgluemigrate.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Unit tests for {@link TextFiles}. */
class TextFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void readText_正常ケース_BOM付きUTF8はBOMを除去すること() throws Exception {
        Path file = tempDir.resolve("bom.html");
        Files.write(file, "\uFEFF<p>Zürich</p>".getBytes(StandardCharsets.UTF_8));
        assertEquals("<p>Zürich</p>", TextFiles.readText(file));
    }

    @Test
    void readText_正常ケース_不正なUTF8はLatin1として読むこと() throws Exception {
        Path file = tempDir.resolve("latin1.csv");
        Files.write(file, "café".getBytes(StandardCharsets.ISO_8859_1));
        assertEquals("café", TextFiles.readText(file));
    }

    @Test
    void decode_正常ケース_空のバイト列は空文字を返すこと() {
        assertEquals("", TextFiles.decode(new byte[0], tempDir));
    }

    @Test
    void readText_異常ケース_存在しないファイルはIOExceptionとなること() {
        assertThrows(IOException.class, () -> TextFiles.readText(tempDir.resolve("none.txt")));
    }
}
