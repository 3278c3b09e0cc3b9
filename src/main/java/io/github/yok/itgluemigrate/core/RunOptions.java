package io.github.yok.itgluemigrate.core;

import java.nio.file.Path;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Options of one migration run.
 *
 * @author Yasuharu.Okawauchi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RunOptions {

    // Organization name to migrate; null migrates every organization.
    private String targetOrg;

    // Register placeholder ids instead of calling the destination.
    private boolean dryRun;

    // Where the state is persisted after each phase; null disables persistence.
    private Path stateFile;
}
