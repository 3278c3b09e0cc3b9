package io.github.yok.itgluemigrate.attachment;

import java.util.Comparator;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Identifies the export entity that owns a group of attachment files.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@EqualsAndHashCode
@AllArgsConstructor
public class AttachmentKey implements Comparable<AttachmentKey> {

    private static final Comparator<AttachmentKey> ORDER = Comparator
            .comparing(AttachmentKey::getEntityType).thenComparing(AttachmentKey::getEntityId);

    // Export-side type name, e.g. "configurations" or "lan_floor_plans_photos"
    private final String entityType;

    private final String entityId;

    @Override
    public int compareTo(AttachmentKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return entityType + ":" + entityId;
    }
}
