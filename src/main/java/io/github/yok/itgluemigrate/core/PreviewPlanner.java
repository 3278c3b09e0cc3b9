package io.github.yok.itgluemigrate.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableSet;
import io.github.yok.itgluemigrate.attachment.AttachmentScanner;
import io.github.yok.itgluemigrate.attachment.AttachmentStats;
import io.github.yok.itgluemigrate.attachment.AttachmentValidationResult;
import io.github.yok.itgluemigrate.client.ApiResponses;
import io.github.yok.itgluemigrate.client.DestinationApiClient;
import io.github.yok.itgluemigrate.parser.ConfigurationRecord;
import io.github.yok.itgluemigrate.parser.CustomAssetRecord;
import io.github.yok.itgluemigrate.parser.DocumentRecord;
import io.github.yok.itgluemigrate.parser.ExportCsvParser;
import io.github.yok.itgluemigrate.parser.ExportParseException;
import io.github.yok.itgluemigrate.parser.ExportValidationResult;
import io.github.yok.itgluemigrate.parser.FieldInferrer;
import io.github.yok.itgluemigrate.parser.LocationRecord;
import io.github.yok.itgluemigrate.parser.OrganizationRecord;
import io.github.yok.itgluemigrate.parser.PasswordRecord;
import io.github.yok.itgluemigrate.util.DisplayNames;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds a {@link MigrationPlan} from an export and the organizations already present in the
 * destination.
 *
 * <p>
 * Steps: validate the export, list existing organizations, parse the CSV files, match
 * organizations, infer custom asset schemas, scan and validate attachments, and detect warnings.
 * Nothing is written to the destination.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class PreviewPlanner {

    /**
     * Columns never turned into custom asset fields.
     */
    public static final Set<String> SCHEMA_SKIP_COLUMNS = ImmutableSet.of("id", "organization",
            "organization_id", "created_at", "updated_at");

    private final ExportCsvParser parser;
    private final AttachmentScanner scanner;
    private final FieldInferrer fieldInferrer;
    private final WarningDetector warningDetector;

    /**
     * Scans the export and produces the plan.
     *
     * @param exportPath export root
     * @param apiUrl destination base URL recorded in the plan
     * @param client destination client used to list organizations
     * @return the plan
     * @throws io.github.yok.itgluemigrate.parser.ExportNotFoundException if the export is missing
     * @throws ExportParseException if the export structure is invalid
     * @throws io.github.yok.itgluemigrate.client.ApiException if organizations cannot be listed
     */
    public MigrationPlan createPlan(Path exportPath, String apiUrl,
            DestinationApiClient client) {
        Path root = exportPath.toAbsolutePath().normalize();

        log.info("Step 1: Validating export path {}", root);
        ExportValidationResult validation = parser.validateExportStructure(root);
        if (!validation.isValid()) {
            throw new ExportParseException(root,
                    "Invalid export structure: " + String.join("; ", validation.getErrors()));
        }

        log.info("Step 2: Fetching existing organizations from {}", apiUrl);
        List<JsonNode> existingOrgs = ApiResponses.items(client.listOrganizations());
        log.info("Found {} existing organizations", existingOrgs.size());

        log.info("Step 3: Parsing CSV files");
        ExportData data = ExportData.load(parser, root);

        log.info("Step 4: Matching organizations");
        OrganizationMatcher matcher = new OrganizationMatcher(existingOrgs);
        data.getOrganizations().forEach(matcher::match);
        Map<String, Integer> matchStats = matcher.getStats();
        int matched = matchStats.get("matched_by_itglue_id") + matchStats.get("matched_by_name");
        log.info("Matched: {}, To create: {}", matched, matchStats.get("create"));

        log.info("Step 5: Inferring custom asset type schemas");
        Map<String, CustomAssetTypePlan> schemas = inferCustomAssetSchemas(data);
        log.info("Inferred {} custom asset type schemas", schemas.size());

        log.info("Step 6: Scanning attachments");
        AttachmentStats attachments = scanner.scanExport(root);

        log.info("Step 7: Validating attachment mappings");
        AttachmentValidationResult attachmentValidation =
                scanner.validateAttachments(root, entitiesToMigrate(data));

        log.info("Step 8: Detecting potential issues");
        List<MigrationWarning> warnings = warningDetector.detectAll(data);
        WarningSummary summary = WarningDetector.summarize(warnings);
        log.info("Found {} warnings", summary.getTotal());

        MigrationPlan plan = new MigrationPlan();
        plan.setExportPath(root.toString());
        plan.setApiUrl(apiUrl);
        plan.setScannedAt(Instant.now().toString());
        plan.getOrganizations().setTotal(data.getOrganizations().size());
        plan.getOrganizations().setMatched(matched);
        plan.getOrganizations().setToCreate(matchStats.get("create"));
        plan.getOrganizations().setMapping(matcher.getMapping());
        plan.setCustomAssetTypes(schemas);

        plan.getEntityCounts().put("configurations", data.getConfigurations().size());
        plan.getEntityCounts().put("documents", data.getDocuments().size());
        plan.getEntityCounts().put("passwords", data.getPasswords().size());
        plan.getEntityCounts().put("locations", data.getLocations().size());
        plan.getEntityCounts().put("custom_assets", data.getCustomAssetTotal());

        plan.getDisabledCounts().put("configurations",
                countArchived(data.getConfigurations(), ConfigurationRecord::getArchived));
        plan.getDisabledCounts().put("documents",
                countArchived(data.getDocuments(), DocumentRecord::getArchived));
        plan.getDisabledCounts().put("passwords",
                countArchived(data.getPasswords(), PasswordRecord::getArchived));
        plan.getDisabledCounts().put("custom_assets",
                data.getCustomAssets().values().stream()
                        .mapToInt(a -> countArchived(a, CustomAssetRecord::getArchived)).sum());

        plan.setAttachments(attachments);
        plan.setAttachmentValidation(attachmentValidation);
        plan.setWarnings(warnings);
        plan.setWarningSummary(summary);
        return plan;
    }

    /**
     * Infers one schema per custom asset type from the union of the columns of its rows.
     *
     * @param data parsed export
     * @return {@code slug → schema}; types without rows or columns are left out
     */
    Map<String, CustomAssetTypePlan> inferCustomAssetSchemas(ExportData data) {
        Map<String, CustomAssetTypePlan> schemas = new LinkedHashMap<>();
        data.getCustomAssets().forEach((slug, assets) -> {
            if (assets.isEmpty()) {
                return;
            }
            Set<String> columns = new TreeSet<>();
            assets.forEach(a -> columns.addAll(a.getFields().keySet()));
            if (columns.isEmpty()) {
                return;
            }
            List<Map<String, String>> rows =
                    assets.stream().map(CustomAssetRecord::getFields).collect(Collectors.toList());
            CustomAssetTypePlan schema = new CustomAssetTypePlan();
            schema.setDisplayName(DisplayNames.slugToDisplayName(slug));
            schema.setFields(fieldInferrer.inferSchema(new ArrayList<>(columns), rows,
                    SCHEMA_SKIP_COLUMNS));
            assets.get(0).getFields().forEach((k, v) -> {
                if (v != null) {
                    schema.getSampleRow().put(k, v);
                }
            });
            schema.setCount(assets.size());
            schemas.put(slug, schema);
        });
        return schemas;
    }

    /**
     * Lists the ids of every entity that owns attachments, keyed by attachment folder name.
     *
     * @param data parsed export
     * @return {@code entity type → ids}
     */
    static Map<String, Set<String>> entitiesToMigrate(ExportData data) {
        Map<String, Set<String>> entities = new LinkedHashMap<>();
        entities.put("configurations", idSet(data.getConfigurations(), ConfigurationRecord::getId));
        entities.put("documents", idSet(data.getDocuments(), DocumentRecord::getId));
        entities.put("passwords", idSet(data.getPasswords(), PasswordRecord::getId));
        entities.put("locations", idSet(data.getLocations(), LocationRecord::getId));
        data.getCustomAssets().forEach((slug, assets) -> entities
                .computeIfAbsent(slug, k -> new TreeSet<>())
                .addAll(idSet(assets, CustomAssetRecord::getId)));
        // {type}-floor-plans-photos files are uploaded with the entity of their id prefix
        Map<String, Set<String>> floorPlans = new LinkedHashMap<>();
        entities.forEach((type, ids) -> floorPlans.put(AttachmentScanner.floorPlanKey(type), ids));
        entities.putAll(floorPlans);
        return entities;
    }

    /**
     * Logs the headline numbers of a plan.
     *
     * @param plan plan to describe
     */
    public static void logSummary(MigrationPlan plan) {
        MigrationPlan.Organizations orgs = plan.getOrganizations();
        log.info("Organizations: total={}, matched={}, to create={}", orgs.getTotal(),
                orgs.getMatched(), orgs.getToCreate());
        plan.getEntityCounts().forEach((entity, count) -> log.info("  {}: {} (disabled: {})",
                entity, count, plan.getDisabledCounts().getOrDefault(entity, 0)));
        plan.getCustomAssetTypes().forEach((slug, schema) -> log.info(
                "  Custom asset type {}: {} assets, {} fields", slug, schema.getCount(),
                schema.getFields().size()));
        if (plan.getAttachments() != null && plan.getAttachments().getTotalFiles() > 0) {
            log.info("Attachments: {} files ({})", plan.getAttachments().getTotalFiles(),
                    plan.getAttachments().getFormattedSize());
        }
        AttachmentValidationResult validation = plan.getAttachmentValidation();
        if (validation != null) {
            log.info("Attachments to upload: {} files ({})", validation.getTotalMatchedFiles(),
                    validation.getFormattedMatchedSize());
            if (validation.getTotalOrphanedFolders() > 0) {
                log.warn("Orphaned attachments: {} folders with no matching entity",
                        validation.getTotalOrphanedFolders());
            }
        }
        WarningSummary summary = plan.getWarningSummary();
        if (summary != null && summary.getTotal() > 0) {
            log.info("Warnings: {}", summary.getBySeverity());
            if (summary.isHasBlockers()) {
                log.warn("Errors detected! Review the plan file for details before proceeding.");
            }
        }
    }

    private static <T> int countArchived(List<T> records, Function<T, String> archived) {
        return (int) records.stream().map(archived).filter("yes"::equalsIgnoreCase).count();
    }

    private static <T> Set<String> idSet(List<T> records, Function<T, String> id) {
        return records.stream().map(id).filter(i -> i != null)
                .collect(Collectors.toCollection(TreeSet::new));
    }
}
