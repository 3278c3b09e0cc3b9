package io.github.yok.itgluemigrate.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import io.github.yok.itgluemigrate.util.JsonFiles;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;

/**
 * Resumable progress of a migration.
 *
 * <p>
 * Tracks, per {@link Phase}, the export ids that completed and the ones that failed with their
 * error, plus collected warnings and per-entity attachment upload outcomes. Marking an id
 * completed removes it from the failed set of the same phase. The state owns the
 * {@link IdMapper}, which {@link #save(Path)} writes next to the state file.
 * </p>
 *
 * <p>
 * All accessors are {@code synchronized}; attachment uploads record their outcome from worker
 * threads.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class MigrationState {

    /**
     * Supported state file format version.
     */
    public static final int VERSION = 2;

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS).build();

    @Getter
    private final String exportPath;

    @Getter
    private final String apiUrl;

    @Getter
    private final IdMapper idMapper;

    private Instant startTime;
    private Instant lastUpdateTime;
    private Phase currentPhase;

    private final Map<Phase, Set<String>> completed = new EnumMap<>(Phase.class);
    private final Map<Phase, Map<String, FailedEntity>> failed = new EnumMap<>(Phase.class);
    private final List<String> warnings = new ArrayList<>();
    private final Map<String, Set<String>> attachmentsCompleted = new LinkedHashMap<>();
    private final Map<String, Map<String, FailedAttachment>> attachmentsFailed =
            new LinkedHashMap<>();

    public MigrationState(String exportPath, String apiUrl) {
        this(exportPath, apiUrl, new IdMapper());
    }

    /**
     * Creates an empty state.
     *
     * @param exportPath export directory being migrated
     * @param apiUrl destination API base URL
     * @param idMapper id mapper owned by this state
     */
    public MigrationState(String exportPath, String apiUrl, IdMapper idMapper) {
        this.exportPath = exportPath;
        this.apiUrl = apiUrl;
        this.idMapper = Preconditions.checkNotNull(idMapper, "idMapper must not be null");
        this.startTime = Instant.now();
        this.lastUpdateTime = startTime;
        for (Phase phase : Phase.ORDER) {
            completed.put(phase, new LinkedHashSet<>());
            failed.put(phase, new LinkedHashMap<>());
        }
    }

    public synchronized Instant getStartTime() {
        return startTime;
    }

    public synchronized Instant getLastUpdateTime() {
        return lastUpdateTime;
    }

    public synchronized Phase getCurrentPhase() {
        return currentPhase;
    }

    public synchronized void setCurrentPhase(Phase phase) {
        this.currentPhase = phase;
        touch();
    }

    // ----------------------------------------------------------------------
    // Entities
    // ----------------------------------------------------------------------

    /**
     * Records a successful migration and clears any earlier failure of the same id.
     *
     * @param phase phase
     * @param itglueId export id
     * @throws IllegalArgumentException if {@code itglueId} is blank
     */
    public synchronized void markCompleted(Phase phase, String itglueId) {
        Preconditions.checkNotNull(phase, "phase must not be null");
        Preconditions.checkArgument(StringUtils.isNotBlank(itglueId), "itglue_id cannot be empty");
        completed.get(phase).add(itglueId);
        failed.get(phase).remove(itglueId);
        touch();
    }

    /**
     * Records a failed migration, replacing any earlier failure of the same id.
     *
     * @param phase phase
     * @param itglueId export id
     * @param error failure description
     * @throws IllegalArgumentException if {@code itglueId} or {@code error} is blank
     */
    public synchronized void markFailed(Phase phase, String itglueId, String error) {
        Preconditions.checkNotNull(phase, "phase must not be null");
        Preconditions.checkArgument(StringUtils.isNotBlank(itglueId), "itglue_id cannot be empty");
        Preconditions.checkArgument(StringUtils.isNotBlank(error), "error cannot be empty");
        failed.get(phase).put(itglueId,
                new FailedEntity(itglueId, error, Instant.now().toString()));
        touch();
    }

    public synchronized boolean isCompleted(Phase phase, String itglueId) {
        Preconditions.checkNotNull(phase, "phase must not be null");
        return completed.get(phase).contains(itglueId);
    }

    public synchronized boolean isFailed(Phase phase, String itglueId) {
        Preconditions.checkNotNull(phase, "phase must not be null");
        return failed.get(phase).containsKey(itglueId);
    }

    /**
     * Returns the recorded error of a failed id.
     *
     * @param phase phase
     * @param itglueId export id
     * @return the error, or {@code null} if the id has not failed
     */
    public synchronized String getFailureError(Phase phase, String itglueId) {
        Preconditions.checkNotNull(phase, "phase must not be null");
        FailedEntity entity = failed.get(phase).get(itglueId);
        return entity == null ? null : entity.getError();
    }

    public synchronized Set<String> getCompletedIds(Phase phase) {
        return new LinkedHashSet<>(completed.get(phase));
    }

    public synchronized List<String> getFailedIds(Phase phase) {
        return new ArrayList<>(failed.get(phase).keySet());
    }

    /**
     * Returns the failure records of one phase.
     *
     * @param phase phase
     * @return copies in failure order
     */
    public synchronized List<FailedEntity> getFailures(Phase phase) {
        List<FailedEntity> out = new ArrayList<>();
        for (FailedEntity f : failed.get(phase).values()) {
            out.add(new FailedEntity(f.getItglueId(), f.getError(), f.getTimestamp()));
        }
        return out;
    }

    public synchronized PhaseStats getPhaseStats(Phase phase) {
        return new PhaseStats(completed.get(phase).size(), failed.get(phase).size());
    }

    /**
     * Returns a phase's statistics for every phase, in execution order.
     *
     * @return {@code phase → stats}
     */
    public synchronized Map<Phase, PhaseStats> getAllStats() {
        Map<Phase, PhaseStats> stats = new LinkedHashMap<>();
        for (Phase phase : Phase.ORDER) {
            stats.put(phase, getPhaseStats(phase));
        }
        return stats;
    }

    public synchronized boolean isPhaseStarted(Phase phase) {
        return !completed.get(phase).isEmpty() || !failed.get(phase).isEmpty();
    }

    public synchronized int getTotalCompleted() {
        return completed.values().stream().mapToInt(Set::size).sum();
    }

    public synchronized int getTotalFailed() {
        return failed.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Forgets the failures of one phase so they are retried.
     *
     * @param phase phase
     * @return number of failures removed
     */
    public synchronized int clearFailures(Phase phase) {
        int count = failed.get(phase).size();
        failed.get(phase).clear();
        touch();
        return count;
    }

    /**
     * Forgets the failures of every phase.
     *
     * @return number of failures removed
     */
    public synchronized int clearAllFailures() {
        int total = 0;
        for (Phase phase : Phase.ORDER) {
            total += failed.get(phase).size();
            failed.get(phase).clear();
        }
        touch();
        return total;
    }

    public synchronized void resetPhase(Phase phase) {
        completed.get(phase).clear();
        failed.get(phase).clear();
        touch();
    }

    // ----------------------------------------------------------------------
    // Warnings
    // ----------------------------------------------------------------------

    public synchronized void addWarning(String message) {
        Preconditions.checkArgument(StringUtils.isNotBlank(message), "message cannot be empty");
        warnings.add(message);
        touch();
    }

    public synchronized List<String> getWarnings() {
        return new ArrayList<>(warnings);
    }

    public synchronized void clearWarnings() {
        warnings.clear();
        touch();
    }

    // ----------------------------------------------------------------------
    // Attachments
    // ----------------------------------------------------------------------

    /**
     * Records a successful attachment upload and clears an earlier failure of the same file.
     *
     * @param entityType export entity type, e.g. {@code configurations}
     * @param itglueId export id of the owning entity
     * @param filename attachment file name
     */
    public synchronized void markAttachmentCompleted(String entityType, String itglueId,
            String filename) {
        String key = attachmentKey(entityType, itglueId, filename);
        attachmentsCompleted.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(filename);
        Map<String, FailedAttachment> failures = attachmentsFailed.get(key);
        if (failures != null) {
            failures.remove(filename);
            if (failures.isEmpty()) {
                attachmentsFailed.remove(key);
            }
        }
        touch();
    }

    /**
     * Records a failed attachment upload.
     *
     * @param entityType export entity type
     * @param itglueId export id of the owning entity
     * @param filename attachment file name
     * @param error failure description
     */
    public synchronized void markAttachmentFailed(String entityType, String itglueId,
            String filename, String error) {
        String key = attachmentKey(entityType, itglueId, filename);
        Preconditions.checkArgument(StringUtils.isNotBlank(error), "error cannot be empty");
        attachmentsFailed.computeIfAbsent(key, k -> new LinkedHashMap<>()).put(filename,
                new FailedAttachment(filename, error, Instant.now().toString()));
        touch();
    }

    public synchronized boolean isAttachmentCompleted(String entityType, String itglueId,
            String filename) {
        Set<String> files = attachmentsCompleted.get(entityType + ":" + itglueId);
        return files != null && files.contains(filename);
    }

    public synchronized boolean isAttachmentFailed(String entityType, String itglueId,
            String filename) {
        Map<String, FailedAttachment> files = attachmentsFailed.get(entityType + ":" + itglueId);
        return files != null && files.containsKey(filename);
    }

    public synchronized String getAttachmentFailureError(String entityType, String itglueId,
            String filename) {
        Map<String, FailedAttachment> files = attachmentsFailed.get(entityType + ":" + itglueId);
        FailedAttachment f = files == null ? null : files.get(filename);
        return f == null ? null : f.getError();
    }

    public synchronized int getAttachmentsCompletedCount() {
        return attachmentsCompleted.values().stream().mapToInt(Set::size).sum();
    }

    public synchronized int getAttachmentsFailedCount() {
        return attachmentsFailed.values().stream().mapToInt(Map::size).sum();
    }

    private static String attachmentKey(String entityType, String itglueId, String filename) {
        Preconditions.checkArgument(StringUtils.isNotBlank(entityType),
                "entity_type cannot be empty");
        Preconditions.checkArgument(StringUtils.isNotBlank(itglueId), "itglue_id cannot be empty");
        Preconditions.checkArgument(StringUtils.isNotBlank(filename), "filename cannot be empty");
        return entityType + ":" + itglueId;
    }

    private void touch() {
        lastUpdateTime = Instant.now();
    }

    // ----------------------------------------------------------------------
    // Persistence
    // ----------------------------------------------------------------------

    /**
     * Converts the state (without the id mapper) to JSON with sorted keys.
     *
     * @return JSON object
     */
    public synchronized ObjectNode toJson() {
        Map<String, Object> root = new TreeMap<>();
        root.put("version", VERSION);
        root.put("export_path", exportPath);
        root.put("api_url", apiUrl);
        root.put("start_time", startTime.toString());
        root.put("last_update_time", lastUpdateTime.toString());
        root.put("current_phase", currentPhase == null ? null : currentPhase.getValue());

        Map<String, List<String>> completedOut = new TreeMap<>();
        Map<String, List<FailedEntity>> failedOut = new TreeMap<>();
        for (Phase phase : Phase.ORDER) {
            completedOut.put(phase.getValue(),
                    new ArrayList<>(new TreeSet<>(completed.get(phase))));
            failedOut.put(phase.getValue(), new ArrayList<>(failed.get(phase).values()));
        }
        root.put("completed", completedOut);
        root.put("failed", failedOut);
        root.put("warnings", new ArrayList<>(warnings));

        Map<String, List<String>> attCompleted = new TreeMap<>();
        attachmentsCompleted
                .forEach((k, v) -> attCompleted.put(k, new ArrayList<>(new TreeSet<>(v))));
        root.put("attachments_completed", attCompleted);
        Map<String, List<FailedAttachment>> attFailed = new TreeMap<>();
        attachmentsFailed.forEach((k, v) -> attFailed.put(k, new ArrayList<>(v.values())));
        root.put("attachments_failed", attFailed);

        return MAPPER.valueToTree(root);
    }

    /**
     * Restores a state from its JSON form.
     *
     * <p>
     * Unknown phase names are skipped. The id mapper starts empty.
     * </p>
     *
     * @param data JSON produced by {@link #toJson()}
     * @return the restored state
     * @throws StateValidationException if the version is not {@value #VERSION} or the
     *         structure is invalid
     */
    public static MigrationState fromJson(JsonNode data) {
        if (data == null || !data.isObject()) {
            throw new StateValidationException("Invalid state file format: expected object");
        }
        JsonNode version = data.get("version");
        if (version == null || !version.isInt() || version.intValue() != VERSION) {
            throw new StateValidationException("Unsupported state file version: "
                    + (version == null ? null : version.asText()) + ". Expected version "
                    + VERSION + ".");
        }

        MigrationState state = new MigrationState(textOrNull(data, "export_path"),
                textOrNull(data, "api_url"));
        state.startTime = instantOr(data, "start_time", state.startTime);
        state.lastUpdateTime = instantOr(data, "last_update_time", state.lastUpdateTime);
        String current = textOrNull(data, "current_phase");
        if (current != null) {
            state.currentPhase = Phase.fromValue(current).orElse(null);
        }

        Iterator<Map.Entry<String, JsonNode>> it = objectField(data, "completed").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            Optional<Phase> phase = Phase.fromValue(e.getKey());
            if (phase.isEmpty()) {
                log.debug("Skipping unknown phase in completed: {}", e.getKey());
                continue;
            }
            requireArray(e.getValue(), "completed IDs for phase " + e.getKey());
            Set<String> ids = state.completed.get(phase.get());
            e.getValue().forEach(id -> ids.add(id.asText()));
        }

        it = objectField(data, "failed").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            Optional<Phase> phase = Phase.fromValue(e.getKey());
            if (phase.isEmpty()) {
                log.debug("Skipping unknown phase in failed: {}", e.getKey());
                continue;
            }
            requireArray(e.getValue(), "failed entities for phase " + e.getKey());
            for (JsonNode entity : e.getValue()) {
                if (!entity.isObject() || !entity.hasNonNull("itglue_id")
                        || !entity.hasNonNull("error")) {
                    throw new StateValidationException(
                            "Invalid failed entity in phase " + e.getKey() + ": " + entity);
                }
                FailedEntity f = new FailedEntity(entity.get("itglue_id").asText(),
                        entity.get("error").asText(), timestampOrNow(entity));
                state.failed.get(phase.get()).put(f.getItglueId(), f);
            }
        }

        JsonNode warnings = data.get("warnings");
        if (warnings != null && !warnings.isNull()) {
            requireArray(warnings, "warnings");
            warnings.forEach(w -> state.warnings.add(w.asText()));
        }

        it = objectField(data, "attachments_completed").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (e.getValue().isArray()) {
                Set<String> files = new LinkedHashSet<>();
                e.getValue().forEach(f -> files.add(f.asText()));
                state.attachmentsCompleted.put(e.getKey(), files);
            }
        }

        it = objectField(data, "attachments_failed").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!e.getValue().isArray()) {
                continue;
            }
            Map<String, FailedAttachment> files = new LinkedHashMap<>();
            for (JsonNode fa : e.getValue()) {
                if (fa.isObject() && fa.hasNonNull("filename") && fa.hasNonNull("error")) {
                    String name = fa.get("filename").asText();
                    files.put(name, new FailedAttachment(name, fa.get("error").asText(),
                            timestampOrNow(fa)));
                }
            }
            state.attachmentsFailed.put(e.getKey(), files);
        }
        return state;
    }

    /**
     * Writes the companion id map file, then the state file.
     *
     * <p>
     * Each file is replaced atomically. The id map goes first so that a completed id in the state
     * file always has its mapping on disk.
     * </p>
     *
     * @param path state file; parent directories are created
     * @throws IOException if either file cannot be written
     */
    public synchronized void save(Path path) throws IOException {
        idMapper.save(idMapPath(path));
        JsonFiles.writeAtomically(MAPPER, path, toJson());
        log.debug("Saved migration state: {}", path);
    }

    /**
     * Loads a state file and, if present, its companion id map file.
     *
     * @param path state file
     * @return the restored state
     * @throws StateValidationException if a file is unreadable, not JSON, or invalid
     */
    public static MigrationState load(Path path) {
        JsonNode data;
        try {
            data = MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new StateValidationException("Failed to read state file: " + path, e);
        }
        MigrationState state = fromJson(data);
        Path idMap = idMapPath(path);
        if (Files.exists(idMap)) {
            state.idMapper.load(idMap);
        }
        log.info("Loaded migration state: {} (completed={}, failed={})", path,
                state.getTotalCompleted(), state.getTotalFailed());
        return state;
    }

    /**
     * Returns the companion id map path: the state file name with its extension replaced by
     * {@code .id_map.json}.
     *
     * @param statePath state file
     * @return id map file in the same directory
     */
    public static Path idMapPath(Path statePath) {
        String name = statePath.getFileName().toString();
        return statePath.resolveSibling(FilenameUtils.removeExtension(name) + ".id_map.json");
    }

    private static String textOrNull(JsonNode data, String field) {
        JsonNode node = data.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }

    private static Instant instantOr(JsonNode data, String field, Instant fallback) {
        String text = textOrNull(data, field);
        if (text == null) {
            return fallback;
        }
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new StateValidationException("Invalid " + field + " format: " + text, e);
        }
    }

    private static String timestampOrNow(JsonNode node) {
        String ts = textOrNull(node, "timestamp");
        return ts == null ? Instant.now().toString() : ts;
    }

    private static JsonNode objectField(JsonNode data, String field) {
        JsonNode node = data.get(field);
        if (node == null || node.isNull()) {
            return MAPPER.createObjectNode();
        }
        if (!node.isObject()) {
            throw new StateValidationException(
                    "Invalid " + field + " data: expected object, got " + node.getNodeType());
        }
        return node;
    }

    private static void requireArray(JsonNode node, String what) {
        if (!node.isArray()) {
            throw new StateValidationException(
                    "Invalid " + what + ": expected array, got " + node.getNodeType());
        }
    }

    @Override
    public synchronized String toString() {
        return "MigrationState(completed=" + getTotalCompleted() + ", failed="
                + getTotalFailed() + ", warnings=" + warnings.size() + ")";
    }
}
