package io.github.yok.itgluemigrate.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Unit tests for {@link IdMapper}. */
class IdMapperTest {

    @TempDir
    Path tempDir;

    @Test
    void add_正常ケース_種別ごとに独立して対応付けられること() {
        IdMapper mapper = new IdMapper();
        mapper.add(MappingType.ORGANIZATION, "1", "org-uuid");
        mapper.add(MappingType.CONFIGURATION, "1", "cfg-uuid");

        assertEquals("org-uuid", mapper.get(MappingType.ORGANIZATION, "1"));
        assertEquals("cfg-uuid", mapper.get(MappingType.CONFIGURATION, "1"));
        assertTrue(mapper.has(MappingType.ORGANIZATION, "1"));
        assertFalse(mapper.has(MappingType.LOCATION, "1"));
        assertNull(mapper.get(MappingType.ORGANIZATION, null));
        assertEquals(2, mapper.getTotalCount());
    }

    @Test
    void add_異常ケース_空のIDは拒否されること() {
        IdMapper mapper = new IdMapper();
        assertThrows(IllegalArgumentException.class,
                () -> mapper.add(MappingType.DOCUMENT, "", "uuid"));
        assertThrows(IllegalArgumentException.class,
                () -> mapper.add(MappingType.DOCUMENT, "1", " "));
    }

    @Test
    void removeByDestinationPrefix_正常ケース_接頭辞の一致する対応だけを削除すること() {
        IdMapper mapper = new IdMapper();
        mapper.add(MappingType.ORGANIZATION, "1", "dry-run-org-1");
        mapper.add(MappingType.ORGANIZATION, "Acme", "dry-run-org-1");
        mapper.add(MappingType.ORGANIZATION, "2", "org-uuid");
        mapper.add(MappingType.LOCATION, "5", "dry-run-location-5");

        assertEquals(3, mapper.removeByDestinationPrefix("dry-run-"));

        assertNull(mapper.get(MappingType.ORGANIZATION, "Acme"));
        assertNull(mapper.get(MappingType.LOCATION, "5"));
        assertEquals("org-uuid", mapper.get(MappingType.ORGANIZATION, "2"));
        assertThrows(IllegalArgumentException.class, () -> mapper.removeByDestinationPrefix(""));
    }

    @Test
    void getStats_正常ケース_種別名の昇順で件数を返すこと() {
        IdMapper mapper = new IdMapper();
        mapper.add(MappingType.PASSWORD, "1", "a");
        mapper.add(MappingType.PASSWORD, "2", "b");

        Map<String, Integer> stats = mapper.getStats();

        assertEquals("configuration", stats.keySet().iterator().next());
        assertEquals(Integer.valueOf(2), stats.get("password"));
        assertEquals(Integer.valueOf(0), stats.get("organization"));
    }

    @Test
    void save_正常ケース_保存した内容を読み込めること() throws Exception {
        IdMapper mapper = new IdMapper();
        mapper.add(MappingType.CUSTOM_ASSET_TYPE, "type:servers", "cat-uuid");
        mapper.add(MappingType.ORGANIZATION, "name:Acme", "org-uuid");
        Path file = tempDir.resolve("nested").resolve("ids.json");
        mapper.save(file);

        IdMapper loaded = new IdMapper();
        loaded.add(MappingType.DOCUMENT, "9", "doc-uuid");
        loaded.load(file);

        assertEquals("cat-uuid", loaded.get(MappingType.CUSTOM_ASSET_TYPE, "type:servers"));
        assertEquals("org-uuid", loaded.get(MappingType.ORGANIZATION, "name:Acme"));
        // 既存の対応付けは残る
        assertEquals("doc-uuid", loaded.get(MappingType.DOCUMENT, "9"));
    }

    @Test
    void load_正常ケース_未知の種別は無視されること() throws Exception {
        Path file = tempDir.resolve("ids.json");
        Files.write(file, ("{\"version\":1,\"mappings\":{\"widget\":{\"1\":\"x\"},"
                + "\"location\":{\"2\":\"loc\"}}}").getBytes(StandardCharsets.UTF_8));

        IdMapper mapper = new IdMapper();
        mapper.load(file);

        assertEquals(1, mapper.getTotalCount());
        assertEquals("loc", mapper.get(MappingType.LOCATION, "2"));
    }

    @Test
    void load_異常ケース_バージョン不一致で例外となること() throws Exception {
        Path file = tempDir.resolve("ids.json");
        Files.write(file, "{\"version\":2,\"mappings\":{}}".getBytes(StandardCharsets.UTF_8));
        assertThrows(StateValidationException.class, () -> new IdMapper().load(file));
    }

    @Test
    void load_異常ケース_mappingsが無い場合は例外となること() throws Exception {
        Path file = tempDir.resolve("ids.json");
        Files.write(file, "{\"version\":1}".getBytes(StandardCharsets.UTF_8));
        assertThrows(StateValidationException.class, () -> new IdMapper().load(file));
    }

    @Test
    void clear_正常ケース_全種別が空になること() {
        IdMapper mapper = new IdMapper();
        mapper.add(MappingType.ORGANIZATION, "1", "a");
        mapper.clear();
        assertEquals(0, mapper.getTotalCount());
    }

    @Test
    void fromValue_異常ケース_未知の種別名で例外となること() {
        assertEquals(MappingType.CUSTOM_ASSET, MappingType.fromValue("custom_asset"));
        assertThrows(InvalidEntityTypeException.class, () -> MappingType.fromValue("widget"));
    }
}
