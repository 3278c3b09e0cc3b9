package io.github.yok.itgluemigrate.state;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Completed and failed counts of one phase.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public class PhaseStats {

    private final int completedCount;

    private final int failedCount;

    public int getTotalProcessed() {
        return completedCount + failedCount;
    }
}
