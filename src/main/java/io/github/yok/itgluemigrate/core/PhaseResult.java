package io.github.yok.itgluemigrate.core;

import io.github.yok.itgluemigrate.state.Phase;
import java.util.Locale;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Counters of one finished phase.
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@AllArgsConstructor
public class PhaseResult {

    private final Phase phase;
    private final int total;
    private final int succeeded;
    private final int failed;
    private final int skipped;
    // created with enabled = false
    private final int disabled;
    private final double durationSeconds;

    /**
     * Returns the share of succeeded items; an empty phase counts as fully successful.
     *
     * @return percentage between 0 and 100
     */
    public double getSuccessRate() {
        if (total == 0) {
            return 100.0;
        }
        return succeeded * 100.0 / total;
    }

    /**
     * Formats a duration as {@code 12.3s}, {@code 4m 5s} or {@code 1h 2m}.
     *
     * @param seconds duration in seconds
     * @return formatted duration
     */
    public static String formatDuration(double seconds) {
        if (seconds < 60) {
            return String.format(Locale.ROOT, "%.1fs", seconds);
        }
        long whole = (long) seconds;
        if (seconds < 3600) {
            return (whole / 60) + "m " + (whole % 60) + "s";
        }
        return (whole / 3600) + "h " + ((whole % 3600) / 60) + "m";
    }
}
