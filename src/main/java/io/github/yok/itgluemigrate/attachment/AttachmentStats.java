package io.github.yok.itgluemigrate.attachment;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;
import java.util.TreeMap;
import lombok.Data;

/**
 * Totals of every attachment found in an export, grouped by export entity type.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
public class AttachmentStats {

    @JsonProperty("total_files")
    private long totalFiles;

    @JsonProperty("total_size_bytes")
    private long totalSizeBytes;

    @JsonProperty("by_entity_type")
    private Map<String, EntityAttachmentStats> byEntityType = new TreeMap<>();

    void put(String entityType, EntityAttachmentStats stats) {
        byEntityType.put(entityType, stats);
        totalFiles += stats.getCount();
        totalSizeBytes += stats.getSizeBytes();
    }

    /**
     * Returns the overall byte total in human-readable form.
     *
     * @return formatted size
     */
    @JsonProperty(value = "formatted_size", access = JsonProperty.Access.READ_ONLY)
    public String getFormattedSize() {
        return AttachmentScanner.formatSize(totalSizeBytes);
    }
}
