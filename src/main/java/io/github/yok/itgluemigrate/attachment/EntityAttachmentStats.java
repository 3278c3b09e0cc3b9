package io.github.yok.itgluemigrate.attachment;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * File count and byte total for one attachment group.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
public class EntityAttachmentStats {

    private long count;

    @JsonProperty("size_bytes")
    private long sizeBytes;

    /**
     * Creates stats with initial values.
     *
     * @param count number of files
     * @param sizeBytes total bytes
     */
    public EntityAttachmentStats(long count, long sizeBytes) {
        this.count = count;
        this.sizeBytes = sizeBytes;
    }

    void add(long bytes) {
        count++;
        sizeBytes += bytes;
    }

    /**
     * Returns the byte total rendered by {@link AttachmentScanner#formatSize(long)}.
     *
     * @return human-readable size
     */
    @JsonProperty(value = "formatted_size", access = JsonProperty.Access.READ_ONLY)
    public String getFormattedSize() {
        return AttachmentScanner.formatSize(sizeBytes);
    }
}
