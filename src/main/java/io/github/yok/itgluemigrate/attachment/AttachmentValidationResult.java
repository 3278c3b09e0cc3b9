package io.github.yok.itgluemigrate.attachment;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.Data;

/**
 * Split of the discovered attachment groups into those whose owner is being migrated
 * ({@code matched}) and those without one ({@code orphaned}).
 *
 * <p>
 * Every discovered {@code (type, id)} group lands in exactly one of the two.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class AttachmentValidationResult {

    private Map<String, EntityAttachmentStats> matched = new TreeMap<>();

    private Map<String, List<String>> orphaned = new TreeMap<>();

    @JsonProperty("total_matched_files")
    private long totalMatchedFiles;

    @JsonProperty("total_matched_bytes")
    private long totalMatchedBytes;

    @JsonProperty("total_orphaned_folders")
    private long totalOrphanedFolders;

    void addMatched(String entityType, long bytes) {
        matched.computeIfAbsent(entityType, k -> new EntityAttachmentStats()).add(bytes);
        totalMatchedFiles++;
        totalMatchedBytes += bytes;
    }

    void addOrphan(String entityType, String entityId) {
        orphaned.computeIfAbsent(entityType, k -> new ArrayList<>()).add(entityId);
        totalOrphanedFolders++;
    }

    /**
     * Returns the matched byte total in human-readable form.
     *
     * @return formatted size
     */
    @JsonProperty(value = "formatted_matched_size", access = JsonProperty.Access.READ_ONLY)
    public String getFormattedMatchedSize() {
        return AttachmentScanner.formatSize(totalMatchedBytes);
    }
}
