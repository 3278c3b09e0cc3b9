package io.github.yok.itgluemigrate.core;

import com.google.common.base.Preconditions;
import io.github.yok.itgluemigrate.state.Phase;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link ProgressReporter} that writes through SLF4J.
 *
 * <p>
 * Item-level progress is logged at INFO when verbose and at DEBUG otherwise.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class LoggingProgressReporter implements ProgressReporter {

    private static final int MAX_LISTED_MESSAGES = 10;

    private final boolean verbose;
    private final MigrationSummary summary = new MigrationSummary();

    private Phase currentPhase;
    private int total;
    private int succeeded;
    private int failed;
    private int skipped;
    private int disabled;
    private long phaseStartNanos;
    private String currentItem = "";

    public LoggingProgressReporter(boolean verbose) {
        this.verbose = verbose;
    }

    @Override
    public void startPhase(Phase phase, int total) {
        Preconditions.checkNotNull(phase, "phase must not be null");
        this.currentPhase = phase;
        this.total = total;
        this.succeeded = 0;
        this.failed = 0;
        this.skipped = 0;
        this.disabled = 0;
        this.currentItem = "";
        this.phaseStartNanos = System.nanoTime();
        log.info("[{}/{}] Starting phase: {} ({} items)", Phase.ORDER.indexOf(phase) + 1,
                Phase.ORDER.size(), phase.getDisplayName(), total);
    }

    @Override
    public void updateProgress(int succeeded, int failed, int skipped, int disabled,
            String currentItem) {
        this.succeeded += succeeded;
        this.failed += failed;
        this.skipped += skipped;
        this.disabled += disabled;
        if (StringUtils.isNotEmpty(currentItem)) {
            this.currentItem = currentItem;
            if (verbose) {
                log.info("Processing: {}", currentItem);
            } else {
                log.debug("Processing: {}", currentItem);
            }
        }
    }

    @Override
    public void setCurrentItem(String item) {
        this.currentItem = StringUtils.defaultString(item);
    }

    @Override
    public PhaseResult completePhase() {
        Preconditions.checkState(currentPhase != null, "No phase in progress");
        double duration = (System.nanoTime() - phaseStartNanos) / 1_000_000_000.0;
        PhaseResult result = new PhaseResult(currentPhase, total, succeeded, failed, skipped,
                disabled, duration);
        summary.getPhases().add(result);
        String disabledInfo = disabled > 0 ? ", " + disabled + " disabled" : "";
        log.info("Completed phase: {} - {}/{} succeeded, {} failed, {} skipped{} ({})",
                currentPhase.getValue(), succeeded, total, failed, skipped, disabledInfo,
                PhaseResult.formatDuration(duration));
        currentPhase = null;
        currentItem = "";
        return result;
    }

    @Override
    public void warning(String message) {
        summary.getWarnings().add(message);
        log.warn("Warning: {}", message);
    }

    @Override
    public void error(String message) {
        summary.getErrors().add(message);
        log.error("Error: {}", message);
    }

    @Override
    public void info(String message) {
        log.info(message);
    }

    @Override
    public MigrationSummary getSummary() {
        return summary;
    }

    @Override
    public void printFinalSummary() {
        summary.setEndTime(Instant.now());
        log.info("Migration Summary");
        log.info(String.format(Locale.ROOT, "%-22s %7s %9s %7s %7s %8s %9s", "Phase", "Total",
                "Succeeded", "Failed", "Skipped", "Disabled", "Duration"));
        for (PhaseResult r : summary.getPhases()) {
            log.info(String.format(Locale.ROOT, "%-22s %7d %9d %7d %7d %8d %9s",
                    r.getPhase().getDisplayName(), r.getTotal(), r.getSucceeded(), r.getFailed(),
                    r.getSkipped(), r.getDisabled(),
                    PhaseResult.formatDuration(r.getDurationSeconds())));
        }
        log.info(String.format(Locale.ROOT, "%-22s %7d %9d %7d %7d %8s %9s", "Total",
                summary.getTotalItems(), summary.getTotalSucceeded(), summary.getTotalFailed(),
                summary.getTotalSkipped(), "",
                PhaseResult.formatDuration(summary.getTotalDurationSeconds())));
        logMessages("Warnings", summary.getWarnings());
        logMessages("Errors", summary.getErrors());
    }

    String getCurrentItem() {
        return currentItem;
    }

    private static void logMessages(String title, List<String> messages) {
        if (messages.isEmpty()) {
            return;
        }
        log.info("{} ({}):", title, messages.size());
        messages.stream().limit(MAX_LISTED_MESSAGES).forEach(m -> log.info("  - {}", m));
        if (messages.size() > MAX_LISTED_MESSAGES) {
            log.info("  ... and {} more", messages.size() - MAX_LISTED_MESSAGES);
        }
    }
}
