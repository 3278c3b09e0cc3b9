package io.github.yok.itgluemigrate.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Kind of issue found by {@link WarningDetector}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum WarningCategory {

    // Reference to an entity that is not in the export.
    MISSING_REFERENCE("missing_reference"),

    DUPLICATE("duplicate"),

    // Unrecognized resource type.
    UNKNOWN_TYPE("unknown_type"),

    EMPTY_VALUE("empty_value"),

    DATA_QUALITY("data_quality");

    @JsonValue
    private final String value;

    @JsonCreator
    static WarningCategory fromValue(String value) {
        for (WarningCategory category : values()) {
            if (category.value.equals(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown warning category: " + value);
    }
}
