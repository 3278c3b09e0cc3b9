package io.github.yok.itgluemigrate.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Impact of a preview warning. {@link #ERROR} blocks a clean migration.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum WarningSeverity {

    INFO("info"),

    WARNING("warning"),

    ERROR("error");

    @JsonValue
    private final String value;

    @JsonCreator
    static WarningSeverity fromValue(String value) {
        for (WarningSeverity severity : values()) {
            if (severity.value.equals(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown warning severity: " + value);
    }
}
