package io.github.yok.itgluemigrate.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Unit tests for {@link MigrationState}. */
class MigrationStateTest {

    @TempDir
    Path tempDir;

    @Test
    void markCompleted_正常ケース_失敗済みIDが完了すると失敗記録が消えること() {
        MigrationState state = new MigrationState("/export", "https://dest");
        state.markFailed(Phase.ORGANIZATIONS, "1", "boom");
        assertTrue(state.isFailed(Phase.ORGANIZATIONS, "1"));
        assertEquals("boom", state.getFailureError(Phase.ORGANIZATIONS, "1"));

        state.markCompleted(Phase.ORGANIZATIONS, "1");

        assertTrue(state.isCompleted(Phase.ORGANIZATIONS, "1"));
        assertFalse(state.isFailed(Phase.ORGANIZATIONS, "1"));
        assertEquals(1, state.getTotalCompleted());
        assertEquals(0, state.getTotalFailed());
    }

    @Test
    void markFailed_正常ケース_同じIDの失敗は上書きされること() {
        MigrationState state = new MigrationState("/export", "https://dest");
        state.markFailed(Phase.PASSWORDS, "7", "first");
        state.markFailed(Phase.PASSWORDS, "7", "second");

        assertEquals(1, state.getFailures(Phase.PASSWORDS).size());
        assertEquals("second", state.getFailureError(Phase.PASSWORDS, "7"));
        assertEquals(1, state.getPhaseStats(Phase.PASSWORDS).getFailedCount());
    }

    @Test
    void markFailed_異常ケース_空のエラーは拒否されること() {
        MigrationState state = new MigrationState("/export", "https://dest");
        assertThrows(IllegalArgumentException.class,
                () -> state.markFailed(Phase.DOCUMENTS, "1", " "));
        assertThrows(IllegalArgumentException.class,
                () -> state.markCompleted(Phase.DOCUMENTS, ""));
    }

    @Test
    void clearAllFailures_正常ケース_全フェーズの失敗件数を返して消去すること() {
        MigrationState state = new MigrationState("/export", "https://dest");
        state.markFailed(Phase.ORGANIZATIONS, "1", "a");
        state.markFailed(Phase.LOCATIONS, "2", "b");
        state.markFailed(Phase.LOCATIONS, "3", "c");
        state.markCompleted(Phase.LOCATIONS, "4");

        assertEquals(3, state.clearAllFailures());
        assertEquals(0, state.getTotalFailed());
        // 完了記録は残る
        assertTrue(state.isCompleted(Phase.LOCATIONS, "4"));
    }

    @Test
    void clearFailures_正常ケース_指定フェーズのみ消去すること() {
        MigrationState state = new MigrationState("/export", "https://dest");
        state.markFailed(Phase.ORGANIZATIONS, "1", "a");
        state.markFailed(Phase.LOCATIONS, "2", "b");

        assertEquals(1, state.clearFailures(Phase.LOCATIONS));
        assertTrue(state.isFailed(Phase.ORGANIZATIONS, "1"));
        assertFalse(state.isFailed(Phase.LOCATIONS, "2"));
    }

    @Test
    void resetPhase_正常ケース_完了と失敗の両方が消えること() {
        MigrationState state = new MigrationState("/export", "https://dest");
        state.markCompleted(Phase.DOCUMENTS, "1");
        state.markFailed(Phase.DOCUMENTS, "2", "x");
        assertTrue(state.isPhaseStarted(Phase.DOCUMENTS));

        state.resetPhase(Phase.DOCUMENTS);

        assertFalse(state.isPhaseStarted(Phase.DOCUMENTS));
        assertEquals(0, state.getPhaseStats(Phase.DOCUMENTS).getTotalProcessed());
    }

    @Test
    void markAttachmentCompleted_正常ケース_失敗済み添付が完了すると失敗が消えること() {
        MigrationState state = new MigrationState("/export", "https://dest");
        state.markAttachmentFailed("configurations", "10", "a.pdf", "API Error 500: x");
        assertTrue(state.isAttachmentFailed("configurations", "10", "a.pdf"));
        assertEquals("API Error 500: x",
                state.getAttachmentFailureError("configurations", "10", "a.pdf"));

        state.markAttachmentCompleted("configurations", "10", "a.pdf");
        state.markAttachmentCompleted("configurations", "10", "b.pdf");

        assertTrue(state.isAttachmentCompleted("configurations", "10", "a.pdf"));
        assertFalse(state.isAttachmentFailed("configurations", "10", "a.pdf"));
        assertNull(state.getAttachmentFailureError("configurations", "10", "a.pdf"));
        assertEquals(2, state.getAttachmentsCompletedCount());
        assertEquals(0, state.getAttachmentsFailedCount());
    }

    @Test
    void addWarning_正常ケース_警告を保持しクリアできること() {
        MigrationState state = new MigrationState("/export", "https://dest");
        state.addWarning("duplicate name");
        assertEquals(1, state.getWarnings().size());
        state.clearWarnings();
        assertTrue(state.getWarnings().isEmpty());
    }

    @Test
    void save_正常ケース_状態とIDマップを保存し復元できること() throws Exception {
        MigrationState state = new MigrationState("/export", "https://dest");
        state.setCurrentPhase(Phase.CONFIGURATIONS);
        state.markCompleted(Phase.ORGANIZATIONS, "1");
        state.markFailed(Phase.CONFIGURATIONS, "5", "API Error 422: invalid");
        state.markAttachmentCompleted("configurations", "6", "doc.pdf");
        state.addWarning("w1");
        state.getIdMapper().add(MappingType.ORGANIZATION, "1", "uuid-1");

        Path file = tempDir.resolve("sub").resolve("state.json");
        state.save(file);

        // IDマップは拡張子を置き換えた別ファイルに保存される
        assertTrue(Files.exists(tempDir.resolve("sub").resolve("state.id_map.json")));

        MigrationState loaded = MigrationState.load(file);
        assertEquals("/export", loaded.getExportPath());
        assertEquals("https://dest", loaded.getApiUrl());
        assertEquals(Phase.CONFIGURATIONS, loaded.getCurrentPhase());
        assertTrue(loaded.isCompleted(Phase.ORGANIZATIONS, "1"));
        assertEquals("API Error 422: invalid",
                loaded.getFailureError(Phase.CONFIGURATIONS, "5"));
        assertTrue(loaded.isAttachmentCompleted("configurations", "6", "doc.pdf"));
        assertEquals("w1", loaded.getWarnings().get(0));
        assertEquals("uuid-1", loaded.getIdMapper().get(MappingType.ORGANIZATION, "1"));
        assertEquals(state.getStartTime(), loaded.getStartTime());
    }

    @Test
    void load_正常ケース_IDマップが無くても読み込めること() throws Exception {
        MigrationState state = new MigrationState("/export", "https://dest");
        state.markCompleted(Phase.ORGANIZATIONS, "1");
        Path file = tempDir.resolve("state.json");
        state.save(file);
        Files.delete(MigrationState.idMapPath(file));

        MigrationState loaded = MigrationState.load(file);

        assertTrue(loaded.isCompleted(Phase.ORGANIZATIONS, "1"));
        assertEquals(0, loaded.getIdMapper().getTotalCount());
    }

    @Test
    void fromJson_異常ケース_バージョン不一致で例外となること() {
        ObjectNode json = new MigrationState("/export", "https://dest").toJson();
        json.put("version", 1);
        assertThrows(StateValidationException.class, () -> MigrationState.fromJson(json));

        json.put("version", "2");
        assertThrows(StateValidationException.class, () -> MigrationState.fromJson(json));
    }

    @Test
    void fromJson_正常ケース_未知のフェーズは無視されること() {
        ObjectNode json = new MigrationState("/export", "https://dest").toJson();
        ((ObjectNode) json.get("completed")).putArray("legacy_phase").add("1");

        MigrationState state = MigrationState.fromJson(json);

        assertEquals(0, state.getTotalCompleted());
    }

    @Test
    void load_異常ケース_JSONでないファイルは例外となること() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.write(file, "not json".getBytes(StandardCharsets.UTF_8));
        assertThrows(StateValidationException.class, () -> MigrationState.load(file));
    }

    @Test
    void toJson_正常ケース_キーがソートされていること() throws Exception {
        MigrationState state = new MigrationState("/export", "https://dest");
        String text = new ObjectMapper().writeValueAsString(state.toJson());
        assertTrue(text.indexOf("\"api_url\"") < text.indexOf("\"version\""));
        assertTrue(text.indexOf("\"attachments_completed\"") < text.indexOf("\"completed\""));
    }

    @Test
    void save_正常ケース_上書き保存後に一時ファイルが残らないこと() throws Exception {
        Path file = tempDir.resolve("state.json");
        MigrationState state = new MigrationState("/export", "https://dest");
        state.save(file);
        state.markCompleted(Phase.LOCATIONS, "5");
        state.getIdMapper().add(MappingType.LOCATION, "5", "loc-uuid");

        state.save(file);

        MigrationState loaded = MigrationState.load(file);
        assertTrue(loaded.isCompleted(Phase.LOCATIONS, "5"));
        assertEquals("loc-uuid", loaded.getIdMapper().get(MappingType.LOCATION, "5"));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertTrue(files.noneMatch(p -> p.getFileName().toString().endsWith(".tmp")));
        }
    }

    @Test
    void save_異常ケース_IDマップが書けなければ既存の状態ファイルは変更されないこと()
            throws Exception {
        Path file = tempDir.resolve("state.json");
        MigrationState state = new MigrationState("/export", "https://dest");
        state.markCompleted(Phase.ORGANIZATIONS, "1");
        state.getIdMapper().add(MappingType.ORGANIZATION, "1", "org-uuid");
        state.save(file);
        // IDマップの置き換え先を空でないディレクトリにして書き込みを失敗させる
        Path idMap = MigrationState.idMapPath(file);
        Files.delete(idMap);
        Files.createDirectories(idMap.resolve("blocker"));

        state.markCompleted(Phase.LOCATIONS, "5");
        state.getIdMapper().add(MappingType.LOCATION, "5", "loc-uuid");
        assertThrows(IOException.class, () -> state.save(file));

        MigrationState loaded = MigrationState.fromJson(
                new ObjectMapper().readTree(file.toFile()));
        assertTrue(loaded.isCompleted(Phase.ORGANIZATIONS, "1"));
        assertFalse(loaded.isCompleted(Phase.LOCATIONS, "5"));
        assertFalse(Files.exists(tempDir.resolve("state.id_map.json.tmp")));
    }

    @Test
    void idMapPath_正常ケース_拡張子をid_map_jsonに置き換えること() {
        assertEquals(Paths.get("dir", "migration_state.id_map.json"),
                MigrationState.idMapPath(Paths.get("dir", "migration_state.json")));
    }
}
