package io.github.yok.itgluemigrate.state;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Migration phases.
 *
 * <p>
 * Execution order is {@link #ORDER}; each phase depends on the id mappings produced by the
 * phases before it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public enum Phase {

    ORGANIZATIONS("organizations", "Organizations"),

    // Needs organizations.
    LOCATIONS("locations", "Locations"),

    CONFIGURATION_TYPES("configuration_types", "Configuration Types"),

    // Needs organizations and configuration types.
    CONFIGURATIONS("configurations", "Configurations"),

    CUSTOM_ASSET_TYPES("custom_asset_types", "Custom Asset Types"),

    // Needs organizations and custom asset types.
    CUSTOM_ASSETS("custom_assets", "Custom Assets"),

    DOCUMENTS("documents", "Documents"),

    PASSWORDS("passwords", "Passwords"),

    // Needs passwords and their targets.
    RELATIONSHIPS("relationships", "Relationships");

    /**
     * Execution order of the phases.
     */
    public static final List<Phase> ORDER = ImmutableList.of(ORGANIZATIONS, LOCATIONS,
            CONFIGURATION_TYPES, CONFIGURATIONS, CUSTOM_ASSET_TYPES, CUSTOM_ASSETS, DOCUMENTS,
            PASSWORDS, RELATIONSHIPS);

    // Name persisted in state files.
    private final String value;

    // Name shown in progress output.
    private final String displayName;

    /**
     * Resolves a phase from its persisted value.
     *
     * @param value persisted value such as {@code "custom_assets"}
     * @return the phase, or empty for unknown values
     */
    public static Optional<Phase> fromValue(String value) {
        for (Phase phase : ORDER) {
            if (phase.value.equals(value)) {
                return Optional.of(phase);
            }
        }
        return Optional.empty();
    }
}
