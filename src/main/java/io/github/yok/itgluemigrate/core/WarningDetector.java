package io.github.yok.itgluemigrate.core;

import com.google.common.collect.ImmutableSet;
import io.github.yok.itgluemigrate.parser.ConfigurationRecord;
import io.github.yok.itgluemigrate.parser.CustomAssetRecord;
import io.github.yok.itgluemigrate.parser.DocumentRecord;
import io.github.yok.itgluemigrate.parser.FieldDefinition;
import io.github.yok.itgluemigrate.parser.LocationRecord;
import io.github.yok.itgluemigrate.parser.OrganizationRecord;
import io.github.yok.itgluemigrate.parser.PasswordRecord;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * Finds issues in a parsed export that should be reviewed before migrating.
 *
 * @author Yasuharu.Okawauchi
 */
public class WarningDetector {

    /**
     * Password resource types that need no custom asset lookup.
     */
    public static final Set<String> KNOWN_RESOURCE_TYPES = ImmutableSet.of("Configuration",
            "Location", "Organization", "Contact", "Document", "StructuredData::Cell",
            "StructuredData::Row");

    // Cell and row ids are not part of the CSV export.
    private static final Set<String> UNRESOLVABLE_RESOURCE_TYPES =
            ImmutableSet.of("StructuredData::Cell", "StructuredData::Row");

    private static final String STRUCTURED_DATA = "StructuredData::";

    static final int LARGE_DOCUMENT_THRESHOLD = 1024 * 1024;

    /**
     * Runs every check.
     *
     * @param data parsed export
     * @return warnings in check order
     */
    public List<MigrationWarning> detectAll(ExportData data) {
        List<MigrationWarning> warnings = new ArrayList<>();
        warnings.addAll(detectMissingReferences(data));
        warnings.addAll(detectUnknownTypes(data));
        warnings.addAll(detectDuplicates(data));
        warnings.addAll(detectEmptyValues(data));
        warnings.addAll(detectDataQualityIssues(data));
        return warnings;
    }

    List<MigrationWarning> detectMissingReferences(ExportData data) {
        Set<String> configIds = ids(data.getConfigurations(), ConfigurationRecord::getId);
        Set<String> locationIds = ids(data.getLocations(), LocationRecord::getId);
        Set<String> orgIds = ids(data.getOrganizations(), OrganizationRecord::getId);
        Set<String> docIds = ids(data.getDocuments(), DocumentRecord::getId);
        Map<String, Set<String>> assetIdsByType = new HashMap<>();
        Set<String> allAssetIds = new HashSet<>();
        data.getCustomAssets().forEach((slug, assets) -> {
            Set<String> assetIds = ids(assets, CustomAssetRecord::getId);
            assetIdsByType.put(slug, assetIds);
            allAssetIds.addAll(assetIds);
        });

        List<MigrationWarning> warnings = new ArrayList<>();
        for (PasswordRecord pwd : data.getPasswords()) {
            String resourceId = pwd.getResourceId();
            String resourceType = pwd.getResourceType();
            if (StringUtils.isEmpty(resourceId)
                    || UNRESOLVABLE_RESOURCE_TYPES.contains(resourceType)) {
                continue;
            }
            boolean valid;
            if ("Configuration".equals(resourceType)) {
                valid = configIds.contains(resourceId);
            } else if ("Location".equals(resourceType)) {
                valid = locationIds.contains(resourceId);
            } else if ("Organization".equals(resourceType)) {
                valid = orgIds.contains(resourceId);
            } else if ("Document".equals(resourceType)) {
                valid = docIds.contains(resourceId);
            } else if (resourceType != null && resourceType.startsWith(STRUCTURED_DATA)) {
                Set<String> typed = assetIdsByType.get(structuredDataSlug(resourceType));
                valid = typed != null ? typed.contains(resourceId)
                        : allAssetIds.contains(resourceId);
            } else {
                valid = configIds.contains(resourceId) || locationIds.contains(resourceId)
                        || orgIds.contains(resourceId) || docIds.contains(resourceId)
                        || allAssetIds.contains(resourceId);
            }
            if (!valid) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("password_name", pwd.getName());
                details.put("resource_type", resourceType);
                details.put("resource_id", resourceId);
                warnings.add(new MigrationWarning(WarningCategory.MISSING_REFERENCE,
                        WarningSeverity.WARNING,
                        "Password references non-existent "
                                + StringUtils.defaultIfEmpty(resourceType, "resource")
                                + " with ID '" + resourceId + "'",
                        "password", pwd.getId(), details));
            }
        }
        return warnings;
    }

    List<MigrationWarning> detectUnknownTypes(ExportData data) {
        List<MigrationWarning> warnings = new ArrayList<>();
        Set<String> customTypes = data.getCustomAssets().keySet();
        for (PasswordRecord pwd : data.getPasswords()) {
            String resourceType = pwd.getResourceType();
            if (StringUtils.isEmpty(resourceType)) {
                continue;
            }
            boolean known = KNOWN_RESOURCE_TYPES.contains(resourceType)
                    || resourceType.startsWith(STRUCTURED_DATA)
                            && customTypes.contains(structuredDataSlug(resourceType));
            if (!known) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("password_name", pwd.getName());
                details.put("resource_type", resourceType);
                warnings.add(new MigrationWarning(WarningCategory.UNKNOWN_TYPE,
                        WarningSeverity.INFO,
                        "Password has unknown resource_type '" + resourceType + "'", "password",
                        pwd.getId(), details));
            }
        }
        return warnings;
    }

    List<MigrationWarning> detectDuplicates(ExportData data) {
        Map<String, List<OrganizationRecord>> byName = new LinkedHashMap<>();
        for (OrganizationRecord org : data.getOrganizations()) {
            if (StringUtils.isNotEmpty(org.getName()) && org.getId() != null) {
                byName.computeIfAbsent(org.getName().toLowerCase(Locale.ROOT),
                        k -> new ArrayList<>()).add(org);
            }
        }
        List<MigrationWarning> warnings = new ArrayList<>();
        for (List<OrganizationRecord> orgs : byName.values()) {
            if (orgs.size() < 2) {
                continue;
            }
            List<String> duplicateIds =
                    orgs.stream().map(OrganizationRecord::getId).collect(Collectors.toList());
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("duplicate_ids", duplicateIds);
            details.put("count", duplicateIds.size());
            warnings.add(new MigrationWarning(WarningCategory.DUPLICATE, WarningSeverity.WARNING,
                    "Multiple organizations found with name '" + orgs.get(0).getName() + "'",
                    "organization", duplicateIds.get(0), details));
        }
        // Custom assets may share names within an organization.
        return warnings;
    }

    List<MigrationWarning> detectEmptyValues(ExportData data) {
        List<MigrationWarning> warnings = new ArrayList<>();
        for (PasswordRecord pwd : data.getPasswords()) {
            if (StringUtils.isEmpty(pwd.getPassword())) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("password_name", pwd.getName());
                warnings.add(new MigrationWarning(WarningCategory.EMPTY_VALUE,
                        WarningSeverity.INFO, "Password entry has empty password field",
                        "password", pwd.getId(), details));
            }
        }
        for (OrganizationRecord org : data.getOrganizations()) {
            if (StringUtils.isEmpty(org.getName())) {
                warnings.add(new MigrationWarning(WarningCategory.EMPTY_VALUE,
                        WarningSeverity.ERROR, "Organization has empty name", "organization",
                        org.getId(), null));
            }
        }
        for (ConfigurationRecord config : data.getConfigurations()) {
            if (StringUtils.isEmpty(config.getName())) {
                warnings.add(new MigrationWarning(WarningCategory.EMPTY_VALUE,
                        WarningSeverity.ERROR, "Configuration has empty name", "configuration",
                        config.getId(), null));
            }
        }
        return warnings;
    }

    List<MigrationWarning> detectDataQualityIssues(ExportData data) {
        List<MigrationWarning> warnings = new ArrayList<>();
        for (DocumentRecord doc : data.getDocuments()) {
            String content = doc.getContent();
            if (content == null) {
                continue;
            }
            int size = content.getBytes(StandardCharsets.UTF_8).length;
            if (size > LARGE_DOCUMENT_THRESHOLD) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("document_name", doc.getName());
                details.put("content_size_bytes", size);
                warnings.add(new MigrationWarning(WarningCategory.DATA_QUALITY,
                        WarningSeverity.WARNING,
                        String.format(Locale.ROOT, "Document has very large content (%.2fMB)",
                                size / (1024.0 * 1024.0)),
                        "document", doc.getId(), details));
            }
        }

        data.getCustomAssets().forEach((slug, assets) -> {
            List<String> required = data.getFieldDefinitions().getOrDefault(slug, List.of())
                    .stream().filter(FieldDefinition::isRequired).map(FieldDefinition::getName)
                    .filter(StringUtils::isNotEmpty).collect(Collectors.toList());
            if (required.isEmpty()) {
                return;
            }
            for (CustomAssetRecord asset : assets) {
                List<String> empty = required.stream()
                        .filter(name -> StringUtils.isEmpty(asset.getFields().get(name)))
                        .collect(Collectors.toList());
                if (empty.size() > required.size() / 2 && empty.size() > 1) {
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("asset_type", slug);
                    details.put("empty_required_fields", empty);
                    details.put("total_required_fields", required.size());
                    warnings.add(new MigrationWarning(WarningCategory.DATA_QUALITY,
                            WarningSeverity.INFO,
                            "Custom asset has " + empty.size() + " empty required fields",
                            "custom_asset:" + slug, asset.getId(), details));
                }
            }
        });
        return warnings;
    }

    /**
     * Counts warnings by severity and category.
     *
     * @param warnings detected warnings
     * @return summary; {@code has_blockers} is set when any warning is an error
     */
    public static WarningSummary summarize(List<MigrationWarning> warnings) {
        WarningSummary summary = new WarningSummary();
        for (WarningSeverity severity : WarningSeverity.values()) {
            summary.getBySeverity().put(severity.getValue(), 0);
        }
        for (MigrationWarning warning : warnings) {
            summary.getBySeverity().merge(warning.getSeverity().getValue(), 1, Integer::sum);
            summary.getByCategory().merge(warning.getCategory().getValue(), 1, Integer::sum);
        }
        int errors = summary.getBySeverity().get(WarningSeverity.ERROR.getValue());
        summary.setTotal(warnings.size());
        summary.setErrors(errors);
        summary.setHasBlockers(errors > 0);
        return summary;
    }

    // "StructuredData::SSL Certificate" -> "ssl-certificate"
    private static String structuredDataSlug(String resourceType) {
        return resourceType.substring(STRUCTURED_DATA.length()).trim().toLowerCase(Locale.ROOT)
                .replace(' ', '-');
    }

    private static <T> Set<String> ids(List<T> records, Function<T, String> id) {
        return records.stream().map(id).filter(StringUtils::isNotEmpty)
                .collect(Collectors.toSet());
    }
}
