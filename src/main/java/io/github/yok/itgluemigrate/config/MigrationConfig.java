package io.github.yok.itgluemigrate.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Migration run settings, bound from the {@code migration} prefix.
 *
 * @author Yasuharu.Okawauchi
 */
@Component
@ConfigurationProperties(prefix = "migration")
@Data
public class MigrationConfig {

    // Default state file for `run` when --state-file is not given; empty disables resume.
    private String stateFile;

    // Default plan output of `preview` when --output is not given.
    private String planFile = "migration_plan.json";

    // Parallel attachment uploads per entity.
    private int uploadConcurrency = 4;
}
