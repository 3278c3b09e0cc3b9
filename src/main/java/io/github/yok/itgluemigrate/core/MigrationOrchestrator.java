package io.github.yok.itgluemigrate.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import io.github.yok.itgluemigrate.attachment.AttachmentScanner;
import io.github.yok.itgluemigrate.attachment.DocumentFolder;
import io.github.yok.itgluemigrate.client.ApiException;
import io.github.yok.itgluemigrate.client.ApiResponses;
import io.github.yok.itgluemigrate.client.ConfigurationRequest;
import io.github.yok.itgluemigrate.client.DestinationApiClient;
import io.github.yok.itgluemigrate.client.PasswordRequest;
import io.github.yok.itgluemigrate.document.DocumentProcessor;
import io.github.yok.itgluemigrate.document.ProcessedDocument;
import io.github.yok.itgluemigrate.parser.ConfigurationRecord;
import io.github.yok.itgluemigrate.parser.CustomAssetRecord;
import io.github.yok.itgluemigrate.parser.DocumentRecord;
import io.github.yok.itgluemigrate.parser.FieldDefinition;
import io.github.yok.itgluemigrate.parser.FieldInferrer;
import io.github.yok.itgluemigrate.parser.FieldType;
import io.github.yok.itgluemigrate.parser.LocationRecord;
import io.github.yok.itgluemigrate.parser.OrganizationRecord;
import io.github.yok.itgluemigrate.parser.PasswordRecord;
import io.github.yok.itgluemigrate.state.MappingType;
import io.github.yok.itgluemigrate.state.MigrationState;
import io.github.yok.itgluemigrate.state.Phase;
import io.github.yok.itgluemigrate.util.DisplayNames;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.util.HtmlUtils;

/**
 * Runs the nine migration phases in {@link Phase#ORDER} against the destination.
 *
 * <p>
 * Every phase skips entities already completed in the {@link MigrationState}, resolves parent ids
 * through its {@link io.github.yok.itgluemigrate.state.IdMapper}, and records each entity as
 * completed or failed. A failing entity never stops the run. The state is saved after every
 * phase when a state file is configured and the run is not a dry run.
 * </p>
 *
 * <p>
 * In a dry run no destination call is made: placeholder ids {@code dry-run-{type}-{id}} are
 * registered so later phases can resolve their parents, and nothing is marked completed. A real
 * run drops any such placeholders before its first phase.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MigrationOrchestrator {

    /**
     * Prefix of the destination ids registered by a dry run.
     */
    public static final String PLACEHOLDER_PREFIX = "dry-run-";

    private static final Set<String> CHECKBOX_TRUE =
            ImmutableSet.of("true", "yes", "1", "on", "enabled");

    private final DestinationApiClient client;
    private final DocumentProcessor documentProcessor;
    private final AttachmentScanner scanner;
    private final ProgressReporter reporter;

    // per-run context
    private MigrationState state;
    private RunOptions options;
    private ExportData data;
    private MigrationPlan plan;
    private Path exportPath;

    /**
     * Creates an orchestrator.
     *
     * @param client destination API client
     * @param documentProcessor processor for document HTML and attachments
     * @param scanner attachment scanner, used for the document folder map
     * @param reporter progress reporter
     */
    public MigrationOrchestrator(DestinationApiClient client, DocumentProcessor documentProcessor,
            AttachmentScanner scanner, ProgressReporter reporter) {
        this.client = Preconditions.checkNotNull(client, "client must not be null");
        this.documentProcessor =
                Preconditions.checkNotNull(documentProcessor, "documentProcessor must not be null");
        this.scanner = Preconditions.checkNotNull(scanner, "scanner must not be null");
        this.reporter = Preconditions.checkNotNull(reporter, "reporter must not be null");
    }

    /**
     * Runs every phase.
     *
     * @param plan migration plan
     * @param data parsed export
     * @param state state to resume from and update
     * @param options run options
     * @return {@code 1} if the state holds any failure after the run, otherwise {@code 0}
     * @throws UncheckedIOException if the state file cannot be written
     */
    public int execute(MigrationPlan plan, ExportData data, MigrationState state,
            RunOptions options) {
        this.plan = plan;
        this.data = data;
        this.state = state;
        this.options = options;
        this.exportPath = Paths.get(plan.getExportPath());
        documentProcessor.clearCache();
        if (!options.isDryRun()) {
            int removed = state.getIdMapper().removeByDestinationPrefix(PLACEHOLDER_PREFIX);
            if (removed > 0) {
                log.info("Dropped {} dry-run placeholder mappings", removed);
            }
        }

        migrateOrganizations();
        persist();
        migrateLocations();
        persist();
        migrateConfigurationTypes();
        persist();
        migrateConfigurations();
        persist();
        migrateCustomAssetTypes();
        persist();
        migrateCustomAssets();
        persist();
        migrateDocuments();
        persist();
        migratePasswords();
        persist();
        migrateRelationships();
        persist();

        return state.getTotalFailed() > 0 ? 1 : 0;
    }

    // ----------------------------------------------------------------------
    // Phases
    // ----------------------------------------------------------------------

    void migrateOrganizations() {
        List<OrganizationRecord> orgs = data.getOrganizations().stream()
                .filter(o -> inScope(o.getName())).collect(Collectors.toList());
        begin(Phase.ORGANIZATIONS, orgs.size());
        Map<String, MatchResult> mapping = plan.getOrganizations().getMapping();
        // organizations created, matched or completed in this run, by name
        Map<String, String> seen = new HashMap<>();

        for (OrganizationRecord org : orgs) {
            String id = org.getId();
            String name = StringUtils.defaultString(org.getName());
            if (!hasId(Phase.ORGANIZATIONS, id, name)) {
                continue;
            }
            if (skipCompleted(Phase.ORGANIZATIONS, id, name)) {
                String done = state.getIdMapper().get(MappingType.ORGANIZATION, id);
                if (StringUtils.isNotEmpty(name) && done != null) {
                    seen.putIfAbsent(name, done);
                }
                continue;
            }
            reporter.setCurrentItem(name);

            // duplicate names in the export share the first organization
            String existing = StringUtils.isNotEmpty(name) ? seen.get(name) : null;
            if (existing != null) {
                state.getIdMapper().add(MappingType.ORGANIZATION, id, existing);
                complete(Phase.ORGANIZATIONS, id);
                reporter.updateProgress(1, 0, 0, 0, "Reused: " + name);
                continue;
            }

            MatchResult match = mapping.get(StringUtils.isNotEmpty(name) ? name : id);
            if (match != null && match.isMatched()) {
                registerOrganization(id, name, match.getUuid());
                seen.put(name, match.getUuid());
                complete(Phase.ORGANIZATIONS, id);
                reporter.updateProgress(1, 0, 0, 0, "Matched: " + name);
                continue;
            }
            if (options.isDryRun()) {
                String placeholder = PLACEHOLDER_PREFIX + "org-" + id;
                registerOrganization(id, name, placeholder);
                seen.put(name, placeholder);
                reporter.updateProgress(1, 0, 0, 0, "[DRY RUN] Would create: " + name);
                continue;
            }
            try {
                Map<String, Object> metadata = itglueMetadata(id);
                if (StringUtils.isNotEmpty(org.getDescription())) {
                    metadata.put("description", org.getDescription());
                }
                boolean enabled = isOrganizationEnabled(org.getOrganizationStatus());
                JsonNode created = client.createOrganization(name, enabled, metadata);
                String uuid = requireId(created, name);
                registerOrganization(id, name, uuid);
                seen.put(name, uuid);
                state.markCompleted(Phase.ORGANIZATIONS, id);
                reporter.updateProgress(1, 0, 0, enabled ? 0 : 1, "Created: " + name);
            } catch (RuntimeException e) {
                fail(Phase.ORGANIZATIONS, id, "org '" + name + "'", e);
            }
        }
        reporter.completePhase();
    }

    void migrateLocations() {
        List<LocationRecord> locations = data.getLocations().stream()
                .filter(l -> inScope(l.getOrganizationId())).collect(Collectors.toList());
        begin(Phase.LOCATIONS, locations.size());

        for (LocationRecord location : locations) {
            String id = location.getId();
            String name = StringUtils.defaultString(location.getName());
            if (!hasId(Phase.LOCATIONS, id, name) || skipCompleted(Phase.LOCATIONS, id, name)) {
                continue;
            }
            reporter.setCurrentItem(name);
            String orgUuid = resolveOrganization(Phase.LOCATIONS, id, location.getOrganizationId());
            if (orgUuid == null) {
                continue;
            }
            if (options.isDryRun()) {
                state.getIdMapper().add(MappingType.LOCATION, id,
                        PLACEHOLDER_PREFIX + "location-" + id);
                reporter.updateProgress(1, 0, 0, 0, "[DRY RUN] Would create: " + name);
                continue;
            }
            try {
                JsonNode created = client.createLocation(orgUuid, name, locationNotes(location),
                        itglueMetadata(id));
                String uuid = requireId(created, name);
                state.getIdMapper().add(MappingType.LOCATION, id, uuid);
                state.markCompleted(Phase.LOCATIONS, id);
                uploadAttachments("locations", id, orgUuid, uuid, "location " + name);
                reporter.updateProgress(1, 0, 0, 0, "Created: " + name);
            } catch (RuntimeException e) {
                fail(Phase.LOCATIONS, id, "location '" + name + "'", e);
            }
        }
        reporter.completePhase();
    }

    void migrateConfigurationTypes() {
        Set<String> typeNames = scopedConfigurations().stream()
                .map(ConfigurationRecord::getConfigurationType).filter(StringUtils::isNotEmpty)
                .collect(Collectors.toCollection(TreeSet::new));
        begin(Phase.CONFIGURATION_TYPES, typeNames.size());

        List<String> pending = new ArrayList<>();
        for (String typeName : typeNames) {
            if (!skipCompleted(Phase.CONFIGURATION_TYPES, typeKey(typeName), typeName)) {
                pending.add(typeName);
            }
        }
        Map<String, String> existing = pending.isEmpty() || options.isDryRun() ? new HashMap<>()
                : existingByLowerName(Phase.CONFIGURATION_TYPES);

        for (String typeName : pending) {
            String key = typeKey(typeName);
            reporter.setCurrentItem(typeName);
            String existingId = existing.get(typeName.toLowerCase(Locale.ROOT));
            if (existingId != null) {
                state.getIdMapper().add(MappingType.CONFIGURATION_TYPE, typeName, existingId);
                complete(Phase.CONFIGURATION_TYPES, key);
                reporter.updateProgress(0, 0, 1, 0, "Exists: " + typeName);
                continue;
            }
            if (options.isDryRun()) {
                state.getIdMapper().add(MappingType.CONFIGURATION_TYPE, typeName,
                        PLACEHOLDER_PREFIX + "config-type-" + typeName);
                reporter.updateProgress(1, 0, 0, 0, "[DRY RUN] Would create: " + typeName);
                continue;
            }
            try {
                JsonNode created = client.createConfigurationType(typeName);
                String uuid = requireId(created, typeName);
                state.getIdMapper().add(MappingType.CONFIGURATION_TYPE, typeName, uuid);
                existing.put(typeName.toLowerCase(Locale.ROOT), uuid);
                state.markCompleted(Phase.CONFIGURATION_TYPES, key);
                reporter.updateProgress(1, 0, 0, 0, "Created: " + typeName);
            } catch (RuntimeException e) {
                fail(Phase.CONFIGURATION_TYPES, key, "config type '" + typeName + "'", e);
            }
        }
        reporter.completePhase();
    }

    void migrateConfigurations() {
        List<ConfigurationRecord> configs = scopedConfigurations();
        begin(Phase.CONFIGURATIONS, configs.size());

        for (ConfigurationRecord config : configs) {
            String id = config.getId();
            String name = StringUtils.defaultString(config.getName());
            if (!hasId(Phase.CONFIGURATIONS, id, name)
                    || skipCompleted(Phase.CONFIGURATIONS, id, name)) {
                continue;
            }
            reporter.setCurrentItem(name);
            String orgUuid =
                    resolveOrganization(Phase.CONFIGURATIONS, id, config.getOrganizationId());
            if (orgUuid == null) {
                continue;
            }
            if (options.isDryRun()) {
                state.getIdMapper().add(MappingType.CONFIGURATION, id,
                        PLACEHOLDER_PREFIX + "config-" + id);
                reporter.updateProgress(1, 0, 0, 0, "[DRY RUN] Would create: " + name);
                continue;
            }
            boolean enabled = isConfigurationEnabled(config.getArchived(),
                    config.getConfigurationStatus());
            ConfigurationRequest request = new ConfigurationRequest();
            request.setName(name);
            request.setConfigurationTypeId(state.getIdMapper()
                    .get(MappingType.CONFIGURATION_TYPE, config.getConfigurationType()));
            request.setSerialNumber(config.getSerial());
            request.setManufacturer(config.getManufacturer());
            request.setModel(config.getModel());
            request.setIpAddress(config.getIp());
            request.setMacAddress(config.getMac());
            request.setNotes(config.getNotes());
            request.setMetadata(itglueMetadata(id));
            request.setInterfaces(config.getConfigurationInterfaces());
            request.setEnabled(enabled);
            try {
                String uuid = requireId(client.createConfiguration(orgUuid, request), name);
                state.getIdMapper().add(MappingType.CONFIGURATION, id, uuid);
                state.markCompleted(Phase.CONFIGURATIONS, id);
                uploadAttachments("configurations", id, orgUuid, uuid, "config " + name);
                reporter.updateProgress(1, 0, 0, enabled ? 0 : 1, "Created: " + name);
            } catch (RuntimeException e) {
                fail(Phase.CONFIGURATIONS, id, "config '" + name + "'", e);
            }
        }
        reporter.completePhase();
    }

    void migrateCustomAssetTypes() {
        Map<String, CustomAssetTypePlan> schemas = new LinkedHashMap<>();
        plan.getCustomAssetTypes().forEach((slug, schema) -> {
            if (options.getTargetOrg() == null || data.getCustomAssets()
                    .getOrDefault(slug, List.of()).stream()
                    .anyMatch(a -> inScope(a.getOrganizationId()))) {
                schemas.put(slug, schema);
            }
        });
        begin(Phase.CUSTOM_ASSET_TYPES, schemas.size());

        Map<String, CustomAssetTypePlan> pending = new LinkedHashMap<>();
        schemas.forEach((slug, schema) -> {
            if (!skipCompleted(Phase.CUSTOM_ASSET_TYPES, slug, displayName(slug, schema))) {
                pending.put(slug, schema);
            }
        });
        Map<String, String> existing = pending.isEmpty() || options.isDryRun() ? new HashMap<>()
                : existingByLowerName(Phase.CUSTOM_ASSET_TYPES);

        for (Map.Entry<String, CustomAssetTypePlan> entry : pending.entrySet()) {
            String slug = entry.getKey();
            String displayName = displayName(slug, entry.getValue());
            reporter.setCurrentItem(displayName);
            String existingId = existing.get(displayName.toLowerCase(Locale.ROOT));
            if (existingId != null) {
                state.getIdMapper().add(MappingType.CUSTOM_ASSET_TYPE, slug, existingId);
                complete(Phase.CUSTOM_ASSET_TYPES, slug);
                reporter.updateProgress(0, 0, 1, 0, "Exists: " + displayName);
                continue;
            }
            if (options.isDryRun()) {
                state.getIdMapper().add(MappingType.CUSTOM_ASSET_TYPE, slug,
                        PLACEHOLDER_PREFIX + "asset-type-" + slug);
                reporter.updateProgress(1, 0, 0, 0, "[DRY RUN] Would create: " + displayName);
                continue;
            }
            try {
                List<FieldDefinition> fields = entry.getValue().getFields();
                JsonNode created = client.createCustomAssetType(displayName, fields,
                        displayFieldKey(fields));
                String uuid = requireId(created, displayName);
                state.getIdMapper().add(MappingType.CUSTOM_ASSET_TYPE, slug, uuid);
                existing.put(displayName.toLowerCase(Locale.ROOT), uuid);
                state.markCompleted(Phase.CUSTOM_ASSET_TYPES, slug);
                reporter.updateProgress(1, 0, 0, 0, "Created: " + displayName);
            } catch (RuntimeException e) {
                fail(Phase.CUSTOM_ASSET_TYPES, slug, "custom asset type '" + displayName + "'",
                        e);
            }
        }
        reporter.completePhase();
    }

    void migrateCustomAssets() {
        List<CustomAssetRecord> assets = new ArrayList<>();
        data.getCustomAssets().values().forEach(list -> list.stream()
                .filter(a -> inScope(a.getOrganizationId())).forEach(assets::add));
        begin(Phase.CUSTOM_ASSETS, assets.size());
        Set<String> knownTypes = data.getCustomAssets().keySet();

        for (CustomAssetRecord asset : assets) {
            String id = asset.getId();
            String slug = asset.getAssetType();
            String name = customAssetName(asset);
            if (!hasId(Phase.CUSTOM_ASSETS, id, name)
                    || skipCompleted(Phase.CUSTOM_ASSETS, id, name)) {
                continue;
            }
            reporter.setCurrentItem(name);
            String orgUuid =
                    resolveOrganization(Phase.CUSTOM_ASSETS, id, asset.getOrganizationId());
            if (orgUuid == null) {
                continue;
            }
            String typeUuid = state.getIdMapper().get(MappingType.CUSTOM_ASSET_TYPE, slug);
            if (typeUuid == null) {
                state.markFailed(Phase.CUSTOM_ASSETS, id,
                        "Custom asset type " + slug + " not migrated");
                reporter.updateProgress(0, 1, 0, 0, "");
                continue;
            }
            if (options.isDryRun()) {
                state.getIdMapper().add(MappingType.CUSTOM_ASSET, id,
                        PLACEHOLDER_PREFIX + "custom-asset-" + id);
                reporter.updateProgress(1, 0, 0, 0, "[DRY RUN] Would create: " + name);
                continue;
            }
            Map<String, Object> values = customAssetValues(asset, fieldTypes(slug));
            boolean enabled = isEnabled(asset.getArchived());
            try {
                JsonNode created = client.createCustomAsset(orgUuid, typeUuid, values,
                        itglueMetadata(id), enabled);
                String uuid = requireId(created, name);
                state.getIdMapper().add(MappingType.CUSTOM_ASSET, id, uuid);
                state.markCompleted(Phase.CUSTOM_ASSETS, id);
                int count = documentProcessor.uploadEntityAttachments(slug, id, orgUuid, uuid,
                        state, knownTypes);
                if (count > 0) {
                    reporter.info("Uploaded " + count + " attachments for " + slug + " " + name);
                }
                reporter.updateProgress(1, 0, 0, enabled ? 0 : 1, "Created: " + name);
            } catch (RuntimeException e) {
                fail(Phase.CUSTOM_ASSETS, id, "custom asset '" + name + "'", e);
            }
        }
        reporter.completePhase();
    }

    void migrateDocuments() {
        List<DocumentRecord> docs = data.getDocuments().stream()
                .filter(d -> inScope(d.getOrganizationId())).collect(Collectors.toList());
        begin(Phase.DOCUMENTS, docs.size());
        Map<String, DocumentFolder> folders = null;

        for (DocumentRecord doc : docs) {
            String id = doc.getId();
            String name = StringUtils.defaultString(doc.getName());
            if (!hasId(Phase.DOCUMENTS, id, name) || skipCompleted(Phase.DOCUMENTS, id, name)) {
                continue;
            }
            reporter.setCurrentItem(name);
            String orgUuid = resolveOrganization(Phase.DOCUMENTS, id, doc.getOrganizationId());
            if (orgUuid == null) {
                continue;
            }
            if (options.isDryRun()) {
                state.getIdMapper().add(MappingType.DOCUMENT, id,
                        PLACEHOLDER_PREFIX + "document-" + id);
                reporter.updateProgress(1, 0, 0, 0, "[DRY RUN] Would create: " + name);
                continue;
            }
            if (folders == null) {
                folders = scanner.getDocumentFolderMapping(exportPath);
            }
            DocumentFolder folder = folders.get(id);
            String path = folder != null ? folder.getVirtualPath() : "/";
            log.debug("Document {}: path '{}'", id, path);

            boolean enabled = isEnabled(doc.getArchived());
            try {
                ProcessedDocument processed = documentProcessor.processDocument(doc, orgUuid);
                for (String warning : processed.getWarnings()) {
                    reporter.warning("Document '" + name + "': " + warning);
                }
                JsonNode created = client.createDocument(orgUuid, path, name, processed.getHtml(),
                        itglueMetadata(id), enabled);
                String uuid = requireId(created, name);
                state.getIdMapper().add(MappingType.DOCUMENT, id, uuid);
                state.markCompleted(Phase.DOCUMENTS, id);
                uploadAttachments("documents", id, orgUuid, uuid, "document " + name);
                reporter.updateProgress(1, 0, 0, enabled ? 0 : 1, "Created: " + name);
            } catch (RuntimeException e) {
                fail(Phase.DOCUMENTS, id, "document '" + name + "'", e);
            }
        }
        reporter.completePhase();
    }

    void migratePasswords() {
        List<PasswordRecord> passwords = scopedPasswords();
        begin(Phase.PASSWORDS, passwords.size());

        for (PasswordRecord pwd : passwords) {
            String id = pwd.getId();
            String name = StringUtils.defaultString(pwd.getName());
            if (!hasId(Phase.PASSWORDS, id, name) || skipCompleted(Phase.PASSWORDS, id, name)) {
                continue;
            }
            reporter.setCurrentItem(name);
            String orgUuid = resolveOrganization(Phase.PASSWORDS, id, pwd.getOrganizationId());
            if (orgUuid == null) {
                continue;
            }
            if (options.isDryRun()) {
                state.getIdMapper().add(MappingType.PASSWORD, id,
                        PLACEHOLDER_PREFIX + "password-" + id);
                reporter.updateProgress(1, 0, 0, 0, "[DRY RUN] Would create: " + name);
                continue;
            }
            PasswordRequest request = new PasswordRequest();
            request.setName(name);
            request.setPassword(StringUtils.defaultString(pwd.getPassword()));
            request.setUsername(pwd.getUsername());
            request.setTotpSecret(pwd.getOtpSecret());
            request.setUrl(pwd.getUrl());
            request.setNotes(pwd.getNotes());
            request.setMetadata(itglueMetadata(id));
            request.setEnabled(isEnabled(pwd.getArchived()));
            try {
                String uuid = requireId(client.createPassword(orgUuid, request), name);
                state.getIdMapper().add(MappingType.PASSWORD, id, uuid);
                state.markCompleted(Phase.PASSWORDS, id);
                uploadAttachments("passwords", id, orgUuid, uuid, "password " + name);
                reporter.updateProgress(1, 0, 0, request.isEnabled() ? 0 : 1, "Created: " + name);
            } catch (RuntimeException e) {
                fail(Phase.PASSWORDS, id, "password '" + name + "'", e);
            }
        }
        reporter.completePhase();
    }

    void migrateRelationships() {
        List<PasswordRecord> linked = scopedPasswords().stream()
                .filter(p -> StringUtils.isNotEmpty(p.getResourceType())
                        && StringUtils.isNotEmpty(p.getResourceId()))
                .collect(Collectors.toList());
        begin(Phase.RELATIONSHIPS, linked.size());

        for (PasswordRecord pwd : linked) {
            String id = pwd.getId();
            String name = StringUtils.defaultString(pwd.getName());
            String resourceType = pwd.getResourceType().toLowerCase(Locale.ROOT);
            String resourceId = pwd.getResourceId();
            if (!hasId(Phase.RELATIONSHIPS, id, name)) {
                continue;
            }
            String key = id + ":" + resourceType + ":" + resourceId;
            if (skipCompleted(Phase.RELATIONSHIPS, key, name)) {
                continue;
            }
            reporter.setCurrentItem(name + " -> " + resourceType);
            String orgUuid = resolveOrganization(Phase.RELATIONSHIPS, key, pwd.getOrganizationId());
            if (orgUuid == null) {
                continue;
            }
            String passwordUuid = state.getIdMapper().get(MappingType.PASSWORD, id);
            if (passwordUuid == null) {
                state.markFailed(Phase.RELATIONSHIPS, key, "Password " + id + " not migrated");
                reporter.updateProgress(0, 1, 0, 0, "");
                continue;
            }
            String targetType = null;
            String targetUuid = null;
            if ("configuration".equals(resourceType)) {
                targetType = "configuration";
                targetUuid = state.getIdMapper().get(MappingType.CONFIGURATION, resourceId);
            } else if (resourceType.contains("asset")) {
                targetType = "custom_asset";
                targetUuid = state.getIdMapper().get(MappingType.CUSTOM_ASSET, resourceId);
            }
            if (targetUuid == null) {
                state.markFailed(Phase.RELATIONSHIPS, key,
                        "Target " + resourceType + ":" + resourceId + " not migrated");
                reporter.updateProgress(0, 1, 0, 0, "");
                continue;
            }
            if (options.isDryRun()) {
                reporter.updateProgress(1, 0, 0, 0, "[DRY RUN] Would link: " + name);
                continue;
            }
            try {
                client.createRelationship(orgUuid, "password", passwordUuid, targetType,
                        targetUuid);
                state.markCompleted(Phase.RELATIONSHIPS, key);
                reporter.updateProgress(1, 0, 0, 0, "Linked: " + name);
            } catch (RuntimeException e) {
                fail(Phase.RELATIONSHIPS, key, "relationship for '" + name + "'", e);
            }
        }
        reporter.completePhase();
    }

    // ----------------------------------------------------------------------
    // Value mapping
    // ----------------------------------------------------------------------

    /**
     * Returns {@code false} only when the archived flag is {@code yes}.
     *
     * @param archived exported archived flag
     * @return whether the entity is enabled
     */
    static boolean isEnabled(String archived) {
        return !"yes".equalsIgnoreCase(StringUtils.trimToEmpty(archived));
    }

    static boolean isConfigurationEnabled(String archived, String status) {
        return isEnabled(archived)
                && (StringUtils.isEmpty(status) || "active".equalsIgnoreCase(status));
    }

    static boolean isOrganizationEnabled(String status) {
        return StringUtils.isEmpty(status) || "active".equalsIgnoreCase(status);
    }

    /**
     * Converts a CSV value to the JSON value of its field type.
     *
     * <p>
     * Checkboxes become booleans. Numbers become a {@code Long} when integral and a
     * {@code Double} otherwise; unparsable numbers stay text. Other types stay text.
     * </p>
     *
     * @param value CSV value
     * @param type field type
     * @return converted value
     */
    static Object convertFieldValue(String value, FieldType type) {
        if (type == FieldType.CHECKBOX) {
            return CHECKBOX_TRUE.contains(value.trim().toLowerCase(Locale.ROOT));
        }
        if (type == FieldType.NUMBER) {
            try {
                if (value.contains(".")) {
                    double d = Double.parseDouble(value);
                    if (!Double.isInfinite(d) && d == Math.rint(d)) {
                        return (long) d;
                    }
                    return d;
                }
                return Long.parseLong(value.trim());
            } catch (NumberFormatException e) {
                return value;
            }
        }
        return value;
    }

    /**
     * Picks the field that names an asset: {@code name}, then {@code title}, then the first text
     * field.
     *
     * @param fields field definitions
     * @return field key, or {@code null} if there is no candidate
     */
    static String displayFieldKey(List<FieldDefinition> fields) {
        for (String preferred : List.of("name", "title")) {
            for (FieldDefinition field : fields) {
                if (preferred.equals(field.getKey())) {
                    return preferred;
                }
            }
        }
        return fields.stream().filter(f -> f.getFieldType() == FieldType.TEXT)
                .map(FieldDefinition::getKey).findFirst().orElse(null);
    }

    static String locationNotes(LocationRecord location) {
        List<String> parts = new ArrayList<>();
        addNote(parts, "Address 1", location.getAddress1());
        addNote(parts, "Address 2", location.getAddress2());
        addNote(parts, "City", location.getCity());
        addNote(parts, "Region", location.getRegion());
        addNote(parts, "Country", location.getCountry());
        addNote(parts, "Postal Code", location.getPostalCode());
        addNote(parts, "Phone", location.getPhone());
        return parts.isEmpty() ? null : "<p>" + String.join("<br>", parts) + "</p>";
    }

    private static void addNote(List<String> parts, String label, String value) {
        if (StringUtils.isNotEmpty(value)) {
            parts.add("<strong>" + label + ":</strong> " + HtmlUtils.htmlEscape(value));
        }
    }

    static String customAssetName(CustomAssetRecord asset) {
        for (Map.Entry<String, String> field : asset.getFields().entrySet()) {
            if ("name".equals(FieldInferrer.columnNameToKey(field.getKey()))
                    && StringUtils.isNotEmpty(field.getValue())) {
                return field.getValue();
            }
        }
        return "Asset " + asset.getId();
    }

    static Map<String, Object> customAssetValues(CustomAssetRecord asset,
            Map<String, FieldType> types) {
        Map<String, Object> values = new LinkedHashMap<>();
        asset.getFields().forEach((column, value) -> {
            if (value != null) {
                String key = FieldInferrer.columnNameToKey(column);
                values.put(key, convertFieldValue(value, types.getOrDefault(key, FieldType.TEXT)));
            }
        });
        return values;
    }

    private Map<String, FieldType> fieldTypes(String slug) {
        Map<String, FieldType> types = new HashMap<>();
        CustomAssetTypePlan schema = plan.getCustomAssetTypes().get(slug);
        if (schema != null) {
            for (FieldDefinition field : schema.getFields()) {
                if (StringUtils.isNotEmpty(field.getKey())) {
                    types.put(field.getKey(), field.getFieldType());
                }
            }
        }
        return types;
    }

    // ----------------------------------------------------------------------
    // Helpers
    // ----------------------------------------------------------------------

    private void begin(Phase phase, int total) {
        state.setCurrentPhase(phase);
        reporter.startPhase(phase, total);
    }

    private boolean inScope(String orgName) {
        return options.getTargetOrg() == null || options.getTargetOrg().equals(orgName);
    }

    private List<ConfigurationRecord> scopedConfigurations() {
        return data.getConfigurations().stream().filter(c -> inScope(c.getOrganizationId()))
                .collect(Collectors.toList());
    }

    private List<PasswordRecord> scopedPasswords() {
        return data.getPasswords().stream().filter(p -> inScope(p.getOrganizationId()))
                .collect(Collectors.toList());
    }

    private boolean hasId(Phase phase, String id, String name) {
        if (StringUtils.isNotBlank(id)) {
            return true;
        }
        reporter.error("Skipping " + phase.getValue() + " entry '" + name + "' without id");
        reporter.updateProgress(0, 1, 0, 0, "");
        return false;
    }

    private boolean skipCompleted(Phase phase, String key, String name) {
        if (state.isCompleted(phase, key)) {
            reporter.updateProgress(0, 0, 1, 0, "Skipped: " + name);
            return true;
        }
        return false;
    }

    private String resolveOrganization(Phase phase, String key, String orgName) {
        String orgUuid = state.getIdMapper().get(MappingType.ORGANIZATION, orgName);
        if (orgUuid == null) {
            state.markFailed(phase, key, "Organization " + orgName + " not migrated");
            reporter.updateProgress(0, 1, 0, 0, "");
        }
        return orgUuid;
    }

    private void registerOrganization(String id, String name, String uuid) {
        state.getIdMapper().add(MappingType.ORGANIZATION, id, uuid);
        if (StringUtils.isNotEmpty(name)) {
            state.getIdMapper().add(MappingType.ORGANIZATION, name, uuid);
        }
    }

    // dry runs leave completion untouched so a real run processes everything
    private void complete(Phase phase, String key) {
        if (!options.isDryRun()) {
            state.markCompleted(phase, key);
        }
    }

    private void fail(Phase phase, String key, String what, RuntimeException e) {
        String message = StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getName());
        if (!(e instanceof ApiException)) {
            log.error("Unexpected error migrating {}", what, e);
        }
        state.markFailed(phase, key, message);
        reporter.error("Failed to migrate " + what + ": " + message);
        reporter.updateProgress(0, 1, 0, 0, "");
    }

    private void uploadAttachments(String entityType, String id, String orgUuid, String uuid,
            String label) {
        int count = documentProcessor.uploadEntityAttachments(entityType, id, orgUuid, uuid,
                state, data.getCustomAssets().keySet());
        if (count > 0) {
            reporter.info("Uploaded " + count + " attachments for " + label);
        }
    }

    private Map<String, String> existingByLowerName(Phase phase) {
        Map<String, String> byName = new HashMap<>();
        try {
            JsonNode response = phase == Phase.CONFIGURATION_TYPES
                    ? client.listConfigurationTypes(true)
                    : client.listCustomAssetTypes(true);
            for (JsonNode type : ApiResponses.items(response)) {
                String name = ApiResponses.text(type, "name");
                String uuid = ApiResponses.text(type, "id");
                if (name != null && uuid != null) {
                    byName.put(name.toLowerCase(Locale.ROOT), uuid);
                }
            }
        } catch (ApiException e) {
            reporter.warning("Failed to fetch existing " + phase.getDisplayName().toLowerCase(
                    Locale.ROOT) + ": " + e.getMessage());
        }
        return byName;
    }

    private void persist() {
        if (options.isDryRun() || options.getStateFile() == null) {
            return;
        }
        try {
            state.save(options.getStateFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save state file: " + options.getStateFile(),
                    e);
        }
    }

    private static Map<String, Object> itglueMetadata(String id) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("itglue_id", id);
        return metadata;
    }

    private static String typeKey(String typeName) {
        return "type:" + typeName;
    }

    private static String displayName(String slug, CustomAssetTypePlan schema) {
        return StringUtils.defaultIfEmpty(schema.getDisplayName(),
                DisplayNames.slugToDisplayName(slug));
    }

    private static String requireId(JsonNode created, String what) {
        String id = ApiResponses.text(created, "id");
        if (id == null) {
            throw new ApiException(0, "Destination returned no id for '" + what + "'");
        }
        return id;
    }
}
