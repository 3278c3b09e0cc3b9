package io.github.yok.itgluemigrate.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.yok.itgluemigrate.parser.ConfigurationRecord;
import io.github.yok.itgluemigrate.parser.CustomAssetRecord;
import io.github.yok.itgluemigrate.parser.DocumentRecord;
import io.github.yok.itgluemigrate.parser.FieldDefinition;
import io.github.yok.itgluemigrate.parser.OrganizationRecord;
import io.github.yok.itgluemigrate.parser.PasswordRecord;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link WarningDetector}. */
class WarningDetectorTest {

    private final WarningDetector detector = new WarningDetector();

    @Test
    void detectMissingReferences_正常ケース_存在しない参照先を警告すること() {
        ExportData data = new ExportData();
        data.getConfigurations().add(config("100", "srv"));
        data.getPasswords().add(password("1", "Configuration", "100"));
        data.getPasswords().add(password("2", "Configuration", "999"));
        // セルと行はエクスポートに含まれないため対象外
        data.getPasswords().add(password("3", "StructuredData::Cell", "777"));

        List<MigrationWarning> warnings = detector.detectMissingReferences(data);

        assertEquals(1, warnings.size());
        MigrationWarning w = warnings.get(0);
        assertEquals(WarningCategory.MISSING_REFERENCE, w.getCategory());
        assertEquals(WarningSeverity.WARNING, w.getSeverity());
        assertEquals("2", w.getEntityId());
        assertEquals("Password references non-existent Configuration with ID '999'",
                w.getMessage());
    }

    @Test
    void detectMissingReferences_正常ケース_カスタムアセットは種別ごとに照合すること() {
        ExportData data = new ExportData();
        data.getCustomAssets().put("ssl-certificates", List.of(asset("50")));
        data.getCustomAssets().put("servers", List.of(asset("60")));
        data.getPasswords().add(password("1", "StructuredData::SSL Certificates", "50"));
        data.getPasswords().add(password("2", "StructuredData::SSL Certificates", "60"));

        List<MigrationWarning> warnings = detector.detectMissingReferences(data);

        assertEquals(1, warnings.size());
        assertEquals("2", warnings.get(0).getEntityId());
    }

    @Test
    void detectUnknownTypes_正常ケース_未知のリソース種別をINFOで報告すること() {
        ExportData data = new ExportData();
        data.getCustomAssets().put("servers", List.of(asset("1")));
        data.getPasswords().add(password("1", "Contact", "5"));
        data.getPasswords().add(password("2", "StructuredData::Servers", "1"));
        data.getPasswords().add(password("3", "Ticket", "5"));

        List<MigrationWarning> warnings = detector.detectUnknownTypes(data);

        assertEquals(1, warnings.size());
        assertEquals(WarningSeverity.INFO, warnings.get(0).getSeverity());
        assertEquals("3", warnings.get(0).getEntityId());
    }

    @Test
    void detectDuplicates_正常ケース_大文字小文字違いの同名組織を警告すること() {
        ExportData data = new ExportData();
        data.getOrganizations().add(org("1", "Acme"));
        data.getOrganizations().add(org("2", "ACME"));
        data.getOrganizations().add(org("3", "Other"));

        List<MigrationWarning> warnings = detector.detectDuplicates(data);

        assertEquals(1, warnings.size());
        assertEquals(List.of("1", "2"), warnings.get(0).getDetails().get("duplicate_ids"));
    }

    @Test
    void detectEmptyValues_正常ケース_空の組織名はERRORとなること() {
        ExportData data = new ExportData();
        data.getOrganizations().add(org("1", ""));
        data.getConfigurations().add(config("2", null));
        PasswordRecord pwd = password("3", null, null);
        pwd.setPassword("");
        data.getPasswords().add(pwd);

        List<MigrationWarning> warnings = detector.detectEmptyValues(data);

        assertEquals(3, warnings.size());
        assertEquals(WarningSeverity.INFO, warnings.get(0).getSeverity());
        assertEquals(WarningSeverity.ERROR, warnings.get(1).getSeverity());
        assertEquals(WarningSeverity.ERROR, warnings.get(2).getSeverity());
    }

    @Test
    void detectDataQualityIssues_正常ケース_大きな文書と必須項目の欠落を報告すること() {
        ExportData data = new ExportData();
        DocumentRecord doc = new DocumentRecord();
        doc.setId("d1");
        doc.setName("Huge");
        doc.setContent(StringUtils.repeat('x', WarningDetector.LARGE_DOCUMENT_THRESHOLD + 1));
        data.getDocuments().add(doc);

        CustomAssetRecord sparse = asset("a1");
        sparse.getFields().put("Name", "x");
        data.getCustomAssets().put("servers", List.of(sparse));
        data.getFieldDefinitions().put("servers",
                List.of(required("Name", "name"), required("Host", "host"),
                        required("Owner", "owner")));

        List<MigrationWarning> warnings = detector.detectDataQualityIssues(data);

        assertEquals(2, warnings.size());
        assertEquals("document", warnings.get(0).getEntityType());
        assertTrue(warnings.get(0).getMessage().startsWith("Document has very large content"));
        // 必須3項目のうち2項目が空
        assertEquals("custom_asset:servers", warnings.get(1).getEntityType());
        assertEquals("Custom asset has 2 empty required fields", warnings.get(1).getMessage());
    }

    @Test
    void summarize_正常ケース_ERRORがあればブロッカーありとなること() {
        List<MigrationWarning> warnings = List.of(
                new MigrationWarning(WarningCategory.EMPTY_VALUE, WarningSeverity.ERROR, "e",
                        "organization", "1", null),
                new MigrationWarning(WarningCategory.DUPLICATE, WarningSeverity.WARNING, "w",
                        "organization", "2", null));

        WarningSummary summary = WarningDetector.summarize(warnings);

        assertEquals(2, summary.getTotal());
        assertEquals(1, summary.getErrors());
        assertTrue(summary.isHasBlockers());
        assertEquals(Integer.valueOf(0), summary.getBySeverity().get("info"));
        assertEquals(Integer.valueOf(1), summary.getByCategory().get("duplicate"));
    }

    @Test
    void summarize_正常ケース_警告が無ければブロッカーなしとなること() {
        WarningSummary summary = WarningDetector.summarize(List.of());
        assertFalse(summary.isHasBlockers());
        assertEquals(0, summary.getTotal());
    }

    private static OrganizationRecord org(String id, String name) {
        OrganizationRecord org = new OrganizationRecord();
        org.setId(id);
        org.setName(name);
        return org;
    }

    private static ConfigurationRecord config(String id, String name) {
        ConfigurationRecord config = new ConfigurationRecord();
        config.setId(id);
        config.setName(name);
        return config;
    }

    private static PasswordRecord password(String id, String type, String resourceId) {
        PasswordRecord pwd = new PasswordRecord();
        pwd.setId(id);
        pwd.setName("pw" + id);
        pwd.setPassword("secret");
        pwd.setResourceType(type);
        pwd.setResourceId(resourceId);
        return pwd;
    }

    private static CustomAssetRecord asset(String id) {
        CustomAssetRecord asset = new CustomAssetRecord();
        asset.setId(id);
        return asset;
    }

    private static FieldDefinition required(String name, String key) {
        FieldDefinition field = new FieldDefinition();
        field.setName(name);
        field.setKey(key);
        field.setRequired(true);
        return field;
    }
}
