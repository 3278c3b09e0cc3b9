package io.github.yok.itgluemigrate.state;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Namespaces of the {@link IdMapper}.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum MappingType {

    // Keyed by export id and by organization name.
    ORGANIZATION("organization"),

    LOCATION("location"),

    CONFIGURATION("configuration"),

    // Keyed by type name.
    CONFIGURATION_TYPE("configuration_type"),

    // Keyed by asset type slug.
    CUSTOM_ASSET_TYPE("custom_asset_type"),

    CUSTOM_ASSET("custom_asset"),

    DOCUMENT("document"),

    PASSWORD("password");

    private final String value;

    /**
     * Resolves a mapping type from its persisted name.
     *
     * @param value persisted name such as {@code "custom_asset"}
     * @return the mapping type
     * @throws InvalidEntityTypeException if the name is unknown
     */
    public static MappingType fromValue(String value) {
        MappingType type = fromValueOrNull(value);
        if (type == null) {
            throw new InvalidEntityTypeException(value);
        }
        return type;
    }

    static MappingType fromValueOrNull(String value) {
        for (MappingType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        return null;
    }
}
