package io.github.yok.itgluemigrate.parser;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Field types understood by the destination custom asset schema.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum FieldType {

    // Single-line text.
    TEXT("text"),

    // Multi-line text.
    TEXTBOX("textbox"),

    NUMBER("number"),

    DATE("date"),

    // Boolean flag.
    CHECKBOX("checkbox"),

    // One of a fixed list of options.
    SELECT("select"),

    // Secret value, masked by the destination.
    PASSWORD("password"),

    // TOTP seed.
    TOTP("totp");

    @JsonValue
    private final String value;

    /**
     * Resolves a type from its wire value; unknown values map to {@link #TEXT}.
     *
     * @param value wire value such as {@code "checkbox"}
     * @return matching type
     */
    @JsonCreator
    public static FieldType fromValue(String value) {
        for (FieldType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return TEXT;
    }
}
