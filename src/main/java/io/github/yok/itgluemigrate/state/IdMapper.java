package io.github.yok.itgluemigrate.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Preconditions;
import io.github.yok.itgluemigrate.util.JsonFiles;
import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Maps export ids to destination ids, one namespace per {@link MappingType}.
 *
 * <p>
 * Persisted as {@code {"version": 1, "mappings": {type: {source: destination}}}}. Loading merges
 * into the current content, with loaded entries winning on conflicts.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class IdMapper {

    /**
     * Supported file format version.
     */
    public static final int VERSION = 1;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private final Map<MappingType, Map<String, String>> mappings =
            new EnumMap<>(MappingType.class);

    public IdMapper() {
        for (MappingType type : MappingType.values()) {
            mappings.put(type, new LinkedHashMap<>());
        }
    }

    /**
     * Registers a mapping, replacing any previous destination id.
     *
     * @param type namespace
     * @param sourceId export id (or name for organizations)
     * @param destinationId destination id
     * @throws IllegalArgumentException if either id is blank
     */
    public synchronized void add(MappingType type, String sourceId, String destinationId) {
        Preconditions.checkNotNull(type, "type must not be null");
        Preconditions.checkArgument(StringUtils.isNotBlank(sourceId),
                "source id cannot be empty");
        Preconditions.checkArgument(StringUtils.isNotBlank(destinationId),
                "destination id cannot be empty");
        mappings.get(type).put(sourceId, destinationId);
    }

    /**
     * Looks up a destination id.
     *
     * @param type namespace
     * @param sourceId export id; {@code null} yields {@code null}
     * @return destination id, or {@code null} if unmapped
     */
    public synchronized String get(MappingType type, String sourceId) {
        Preconditions.checkNotNull(type, "type must not be null");
        return sourceId == null ? null : mappings.get(type).get(sourceId);
    }

    public synchronized boolean has(MappingType type, String sourceId) {
        return get(type, sourceId) != null;
    }

    /**
     * Returns a copy of one namespace.
     *
     * @param type namespace
     * @return {@code source → destination}
     */
    public synchronized Map<String, String> getAll(MappingType type) {
        Preconditions.checkNotNull(type, "type must not be null");
        return new LinkedHashMap<>(mappings.get(type));
    }

    /**
     * Drops every mapping whose destination id starts with {@code prefix}.
     *
     * @param prefix destination id prefix, such as the dry-run placeholder prefix
     * @return number of removed mappings
     */
    public synchronized int removeByDestinationPrefix(String prefix) {
        Preconditions.checkArgument(StringUtils.isNotEmpty(prefix), "prefix cannot be empty");
        int removed = 0;
        for (Map<String, String> m : mappings.values()) {
            Iterator<Map.Entry<String, String>> it = m.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue().startsWith(prefix)) {
                    it.remove();
                    removed++;
                }
            }
        }
        return removed;
    }

    public synchronized void clear() {
        mappings.values().forEach(Map::clear);
    }

    /**
     * Counts mappings per namespace.
     *
     * @return {@code type value → count}, ordered by type value
     */
    public synchronized Map<String, Integer> getStats() {
        Map<String, Integer> stats = new TreeMap<>();
        mappings.forEach((type, m) -> stats.put(type.getValue(), m.size()));
        return stats;
    }

    public synchronized int getTotalCount() {
        return mappings.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Atomically writes the mappings as pretty JSON with sorted keys, creating parent
     * directories.
     *
     * @param path target file
     * @throws IOException if the file cannot be written
     */
    public synchronized void save(Path path) throws IOException {
        Map<String, Object> root = new TreeMap<>();
        root.put("version", VERSION);
        Map<String, Map<String, String>> body = new TreeMap<>();
        mappings.forEach((type, m) -> body.put(type.getValue(), new TreeMap<>(m)));
        root.put("mappings", body);
        JsonFiles.writeAtomically(MAPPER, path, root);
    }

    /**
     * Merges the mappings of a file into this mapper.
     *
     * <p>
     * Unknown namespace names are skipped.
     * </p>
     *
     * @param path id map file
     * @throws StateValidationException if the file is unreadable, has another version, or is
     *         malformed
     */
    public synchronized void load(Path path) {
        JsonNode root;
        try {
            root = MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new StateValidationException("Failed to read id map file: " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new StateValidationException("Invalid id map file format: expected object");
        }
        JsonNode version = root.get("version");
        if (version == null || !version.isInt() || version.intValue() != VERSION) {
            throw new StateValidationException("Unsupported id map version: " + version);
        }
        JsonNode body = root.get("mappings");
        if (body == null || !body.isObject()) {
            throw new StateValidationException(
                    "Invalid id map file format: missing or invalid 'mappings' field");
        }
        Iterator<Map.Entry<String, JsonNode>> types = body.fields();
        while (types.hasNext()) {
            Map.Entry<String, JsonNode> entry = types.next();
            MappingType type = MappingType.fromValueOrNull(entry.getKey());
            if (type == null) {
                log.debug("Skipping unknown id map type: {}", entry.getKey());
                continue;
            }
            if (!entry.getValue().isObject()) {
                throw new StateValidationException(
                        "Invalid mappings for entity type '" + entry.getKey() + "'");
            }
            Iterator<Map.Entry<String, JsonNode>> ids = entry.getValue().fields();
            while (ids.hasNext()) {
                Map.Entry<String, JsonNode> id = ids.next();
                mappings.get(type).put(id.getKey(), id.getValue().asText());
            }
        }
    }

    @Override
    public String toString() {
        return "IdMapper(total_mappings=" + getTotalCount() + ")";
    }
}
