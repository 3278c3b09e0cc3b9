package io.github.yok.itgluemigrate.core;

import io.github.yok.itgluemigrate.parser.ConfigurationRecord;
import io.github.yok.itgluemigrate.parser.CustomAssetCsv;
import io.github.yok.itgluemigrate.parser.CustomAssetRecord;
import io.github.yok.itgluemigrate.parser.DocumentRecord;
import io.github.yok.itgluemigrate.parser.ExportCsvParser;
import io.github.yok.itgluemigrate.parser.FieldDefinition;
import io.github.yok.itgluemigrate.parser.LocationRecord;
import io.github.yok.itgluemigrate.parser.OrganizationRecord;
import io.github.yok.itgluemigrate.parser.PasswordRecord;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Every parsed CSV of one export.
 *
 * <p>
 * Core files that are absent yield empty lists. Custom asset rows and their inferred field
 * definitions are keyed by type slug in slug order.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public class ExportData {

    private final List<OrganizationRecord> organizations = new ArrayList<>();
    private final List<ConfigurationRecord> configurations = new ArrayList<>();
    private final List<DocumentRecord> documents = new ArrayList<>();
    private final List<LocationRecord> locations = new ArrayList<>();
    private final List<PasswordRecord> passwords = new ArrayList<>();
    private final Map<String, List<CustomAssetRecord>> customAssets = new TreeMap<>();
    private final Map<String, List<FieldDefinition>> fieldDefinitions = new TreeMap<>();

    /**
     * Parses the core files present in the export and every custom asset CSV.
     *
     * @param parser CSV parser
     * @param exportPath export root
     * @return parsed export
     */
    public static ExportData load(ExportCsvParser parser, Path exportPath) {
        ExportData data = new ExportData();
        Path orgs = exportPath.resolve("organizations.csv");
        if (Files.exists(orgs)) {
            data.organizations.addAll(parser.parseOrganizations(orgs));
        }
        Path configs = exportPath.resolve("configurations.csv");
        if (Files.exists(configs)) {
            data.configurations.addAll(parser.parseConfigurations(configs));
        }
        Path docs = exportPath.resolve("documents.csv");
        if (Files.exists(docs)) {
            data.documents.addAll(parser.parseDocuments(docs));
        }
        Path locations = exportPath.resolve("locations.csv");
        if (Files.exists(locations)) {
            data.locations.addAll(parser.parseLocations(locations));
        }
        Path passwords = exportPath.resolve("passwords.csv");
        if (Files.exists(passwords)) {
            data.passwords.addAll(parser.parsePasswords(passwords));
        }
        for (String slug : parser.discoverCustomAssetTypes(exportPath)) {
            CustomAssetCsv csv =
                    parser.parseCustomAssetCsv(exportPath.resolve(slug + ".csv"), slug);
            data.customAssets.put(slug, csv.getAssets());
            data.fieldDefinitions.put(slug, csv.getFieldDefinitions());
        }
        log.info("Loaded export {}: {} organizations, {} custom asset types", exportPath,
                data.organizations.size(), data.customAssets.size());
        return data;
    }

    public int getCustomAssetTotal() {
        return customAssets.values().stream().mapToInt(List::size).sum();
    }
}
