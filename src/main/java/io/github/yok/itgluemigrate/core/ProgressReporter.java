package io.github.yok.itgluemigrate.core;

import io.github.yok.itgluemigrate.state.Phase;

/**
 * Receives progress of a migration run.
 *
 * <p>
 * The orchestrator calls {@link #startPhase}, then {@link #updateProgress} once per item, then
 * {@link #completePhase}. Implementations need not be thread-safe.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface ProgressReporter {

    void startPhase(Phase phase, int total);

    /**
     * Adds to the counters of the current phase.
     *
     * @param succeeded newly succeeded items
     * @param failed newly failed items
     * @param skipped newly skipped items
     * @param disabled newly created disabled items
     * @param currentItem description of the item, may be empty
     */
    void updateProgress(int succeeded, int failed, int skipped, int disabled,
            String currentItem);

    void setCurrentItem(String item);

    /**
     * Closes the current phase.
     *
     * @return counters of the phase
     * @throws IllegalStateException if no phase is in progress
     */
    PhaseResult completePhase();

    void warning(String message);

    void error(String message);

    void info(String message);

    MigrationSummary getSummary();

    void printFinalSummary();
}
