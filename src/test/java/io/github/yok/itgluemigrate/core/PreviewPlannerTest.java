package io.github.yok.itgluemigrate.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.yok.itgluemigrate.attachment.AttachmentScanner;
import io.github.yok.itgluemigrate.client.DestinationApiClient;
import io.github.yok.itgluemigrate.parser.CustomAssetRecord;
import io.github.yok.itgluemigrate.parser.ExportCsvParser;
import io.github.yok.itgluemigrate.parser.ExportNotFoundException;
import io.github.yok.itgluemigrate.parser.ExportParseException;
import io.github.yok.itgluemigrate.parser.FieldDefinition;
import io.github.yok.itgluemigrate.parser.FieldInferrer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Unit tests for {@link PreviewPlanner}. */
class PreviewPlannerTest {

    @TempDir
    Path export;

    private final ObjectMapper mapper = new ObjectMapper();
    private DestinationApiClient client;
    private PreviewPlanner planner;

    @BeforeEach
    void setUp() throws Exception {
        FieldInferrer inferrer = new FieldInferrer();
        planner = new PreviewPlanner(new ExportCsvParser(inferrer, mapper),
                new AttachmentScanner(), inferrer, new WarningDetector());
        client = mock(DestinationApiClient.class);
        when(client.listOrganizations()).thenReturn(mapper.readTree(
                "{\"items\":[{\"id\":\"u1\",\"name\":\"acme\"}]}"));
    }

    @Test
    void createPlan_正常ケース_組織照合と件数とスキーマを計画に含めること() throws Exception {
        write("organizations.csv", "id,name,organization_status\n1,Acme,Active\n2,Beta,\n");
        write("configurations.csv",
                "id,name,organization_id,archived\n10,srv1,1,No\n11,srv2,1,Yes\n");
        write("ssl-certificates.csv", "id,organization_id,Name,Expires\n"
                + "50,1,example.com,2025-01-01\n51,2,beta.com,2026-02-02\n");
        Path attachDir = export.resolve("attachments").resolve("configurations").resolve("10");
        Files.createDirectories(attachDir);
        Files.write(attachDir.resolve("a.txt"), new byte[] {1, 2, 3});
        Path orphanDir = export.resolve("attachments").resolve("configurations").resolve("99");
        Files.createDirectories(orphanDir);
        Files.write(orphanDir.resolve("b.txt"), new byte[] {1});

        MigrationPlan plan = planner.createPlan(export, "https://dest", client);

        assertEquals("https://dest", plan.getApiUrl());
        assertEquals(export.toAbsolutePath().normalize().toString(), plan.getExportPath());
        assertNotNull(plan.getScannedAt());
        assertEquals(2, plan.getOrganizations().getTotal());
        assertEquals(1, plan.getOrganizations().getMatched());
        assertEquals(1, plan.getOrganizations().getToCreate());
        assertEquals("u1", plan.getOrganizations().getMapping().get("Acme").getUuid());

        assertEquals(Integer.valueOf(2), plan.getEntityCounts().get("configurations"));
        assertEquals(Integer.valueOf(1), plan.getDisabledCounts().get("configurations"));
        assertEquals(Integer.valueOf(2), plan.getEntityCounts().get("custom_assets"));

        CustomAssetTypePlan schema = plan.getCustomAssetTypes().get("ssl-certificates");
        assertEquals("SSL Certificates", schema.getDisplayName());
        assertEquals(2, schema.getCount());
        assertEquals("example.com", schema.getSampleRow().get("Name"));
        assertTrue(schema.getFields().stream().map(FieldDefinition::getKey)
                .noneMatch("organization_id"::equals));

        assertEquals(2, plan.getAttachments().getTotalFiles());
        assertEquals(1, plan.getAttachmentValidation().getTotalMatchedFiles());
        assertEquals(1, plan.getAttachmentValidation().getTotalOrphanedFolders());
        verify(client).listOrganizations();
    }

    @Test
    void createPlan_異常ケース_organizations_csvが無い場合はAPIを呼ばずに失敗すること()
            throws Exception {
        write("configurations.csv", "id,name\n1,a\n");

        assertThrows(ExportParseException.class,
                () -> planner.createPlan(export, "https://dest", client));
        verifyNoInteractions(client);
    }

    @Test
    void createPlan_異常ケース_エクスポートが存在しない場合は例外となること() {
        assertThrows(ExportNotFoundException.class,
                () -> planner.createPlan(export.resolve("missing"), "https://dest", client));
    }

    @Test
    void createPlan_正常ケース_計画をファイルに書き出して読み戻せること() throws Exception {
        write("organizations.csv", "id,name\n1,Acme\n");
        MigrationPlan plan = planner.createPlan(export, "https://dest", client);
        Path file = export.resolve("out").resolve("plan.json");

        plan.write(file);
        MigrationPlan read = MigrationPlan.read(file);

        assertEquals(MigrationPlan.PLAN_VERSION, read.getVersion());
        assertEquals("u1", read.getOrganizations().getMapping().get("Acme").getUuid());
        assertEquals(MatchResult.BY_NAME,
                read.getOrganizations().getMapping().get("Acme").getMatchType());
    }

    @Test
    void createPlan_正常ケース_フロアプラン写真は所有アセットがあれば照合済みになること()
            throws Exception {
        write("organizations.csv", "id,name\n1,Acme\n");
        write("ssl-certificates.csv", "id,organization_id,Name\n50,1,example.com\n");
        Path floorDir = export.resolve("ssl-certificates-floor-plans-photos");
        Files.createDirectories(floorDir);
        Files.write(floorDir.resolve("50-plan.png"), new byte[] {1, 2});
        Files.write(floorDir.resolve("77-other.png"), new byte[] {3});

        MigrationPlan plan = planner.createPlan(export, "https://dest", client);

        assertEquals(1, plan.getAttachmentValidation().getTotalMatchedFiles());
        assertEquals(1, plan.getAttachmentValidation().getTotalOrphanedFolders());
    }

    @Test
    void entitiesToMigrate_正常ケース_カスタムアセットは種別名をキーにすること() {
        ExportData data = new ExportData();
        CustomAssetRecord asset = new CustomAssetRecord();
        asset.setId("7");
        data.getCustomAssets().put("servers", List.of(asset));

        Map<String, Set<String>> entities = PreviewPlanner.entitiesToMigrate(data);

        assertEquals(Set.of("7"), entities.get("servers"));
        assertEquals(Set.of("7"), entities.get("servers_floor_plans_photos"));
        assertTrue(entities.get("configurations").isEmpty());
        assertTrue(entities.containsKey("locations_floor_plans_photos"));
    }

    private void write(String name, String content) throws Exception {
        Files.write(export.resolve(name), content.getBytes(StandardCharsets.UTF_8));
    }
}
