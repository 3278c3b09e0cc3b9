package io.github.yok.itgluemigrate.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Unit tests for {@link MigrationPlan}. */
class MigrationPlanTest {

    @TempDir
    Path tempDir;

    @Test
    void read_正常ケース_未知の項目は無視して読み込むこと() throws Exception {
        Path file = tempDir.resolve("plan.json");
        write(file, "{\"version\":1,\"export_path\":\"/e\",\"api_url\":\"https://d\","
                + "\"future_field\":true,\"organizations\":{\"total\":1,\"mapping\":"
                + "{\"Acme\":{\"status\":\"create\",\"uuid\":null,\"match_type\":null}}}}");

        MigrationPlan plan = MigrationPlan.read(file);

        assertEquals("/e", plan.getExportPath());
        assertEquals("https://d", plan.getApiUrl());
        assertEquals(MatchResult.STATUS_CREATE,
                plan.getOrganizations().getMapping().get("Acme").getStatus());
    }

    @Test
    void read_異常ケース_バージョン不一致はPlanFormatExceptionとなること() throws Exception {
        Path file = tempDir.resolve("plan.json");
        write(file, "{\"version\":2}");

        PlanFormatException ex =
                assertThrows(PlanFormatException.class, () -> MigrationPlan.read(file));
        assertTrue(ex.getMessage().contains("expected version 1"));
    }

    @Test
    void read_異常ケース_JSONでない場合はPlanFormatExceptionとなること() throws Exception {
        Path file = tempDir.resolve("plan.json");
        write(file, "[1,2]");
        assertThrows(PlanFormatException.class, () -> MigrationPlan.read(file));
        assertThrows(PlanFormatException.class,
                () -> MigrationPlan.read(tempDir.resolve("missing.json")));
    }

    private static void write(Path file, String json) throws Exception {
        Files.write(file, json.getBytes(StandardCharsets.UTF_8));
    }
}
