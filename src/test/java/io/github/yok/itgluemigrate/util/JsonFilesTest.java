package io.github.yok.itgluemigrate.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Unit tests for {@link JsonFiles}. */
class JsonFilesTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void writeAtomically_正常ケース_親ディレクトリを作成し既存ファイルを置き換えること()
            throws Exception {
        Path target = tempDir.resolve("nested").resolve("data.json");

        JsonFiles.writeAtomically(mapper, target, Map.of("v", 1));
        JsonFiles.writeAtomically(mapper, target, Map.of("v", 2));

        assertEquals(2, mapper.readTree(target.toFile()).get("v").asInt());
        assertFalse(Files.exists(target.resolveSibling("data.json.tmp")));
    }

    @Test
    void writeAtomically_異常ケース_置き換えに失敗すると一時ファイルが削除されること()
            throws Exception {
        Path target = tempDir.resolve("data.json");
        Files.createDirectories(target.resolve("child"));

        assertThrows(IOException.class,
                () -> JsonFiles.writeAtomically(mapper, target, Map.of("v", 1)));

        assertTrue(Files.isDirectory(target));
        assertFalse(Files.exists(tempDir.resolve("data.json.tmp")));
    }
}
