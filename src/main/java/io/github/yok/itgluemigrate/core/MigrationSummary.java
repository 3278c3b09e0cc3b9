package io.github.yok.itgluemigrate.core;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * Phase results, warnings and errors collected over one run.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class MigrationSummary {

    private final List<PhaseResult> phases = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final Instant startTime = Instant.now();

    @Setter
    private Instant endTime;

    public double getTotalDurationSeconds() {
        Instant end = endTime != null ? endTime : Instant.now();
        return Duration.between(startTime, end).toMillis() / 1000.0;
    }

    public int getTotalItems() {
        return phases.stream().mapToInt(PhaseResult::getTotal).sum();
    }

    public int getTotalSucceeded() {
        return phases.stream().mapToInt(PhaseResult::getSucceeded).sum();
    }

    public int getTotalFailed() {
        return phases.stream().mapToInt(PhaseResult::getFailed).sum();
    }

    public int getTotalSkipped() {
        return phases.stream().mapToInt(PhaseResult::getSkipped).sum();
    }
}
