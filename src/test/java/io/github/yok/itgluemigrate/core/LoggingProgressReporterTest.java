package io.github.yok.itgluemigrate.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.yok.itgluemigrate.state.Phase;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link LoggingProgressReporter} and {@link PhaseResult}. */
class LoggingProgressReporterTest {

    @Test
    void completePhase_正常ケース_カウンタを集計してサマリーに追加すること() {
        LoggingProgressReporter reporter = new LoggingProgressReporter(true);
        reporter.startPhase(Phase.CONFIGURATIONS, 4);
        reporter.updateProgress(1, 0, 0, 0, "Created: srv1");
        reporter.updateProgress(1, 0, 0, 1, "Created: srv2");
        reporter.updateProgress(0, 1, 0, 0, "Failed: srv3");
        reporter.updateProgress(0, 0, 1, 0, "");

        PhaseResult result = reporter.completePhase();

        assertEquals(Phase.CONFIGURATIONS, result.getPhase());
        assertEquals(4, result.getTotal());
        assertEquals(2, result.getSucceeded());
        assertEquals(1, result.getFailed());
        assertEquals(1, result.getSkipped());
        assertEquals(1, result.getDisabled());
        assertEquals(50.0, result.getSuccessRate(), 0.001);
        assertEquals(1, reporter.getSummary().getPhases().size());
        assertEquals(1, reporter.getSummary().getTotalFailed());
    }

    @Test
    void startPhase_正常ケース_前フェーズのカウンタがリセットされること() {
        LoggingProgressReporter reporter = new LoggingProgressReporter(false);
        reporter.startPhase(Phase.ORGANIZATIONS, 1);
        reporter.updateProgress(1, 0, 0, 0, "Created: Acme");
        reporter.completePhase();
        reporter.startPhase(Phase.LOCATIONS, 0);

        PhaseResult result = reporter.completePhase();

        assertEquals(0, result.getSucceeded());
        assertEquals(100.0, result.getSuccessRate(), 0.001);
        assertEquals("", reporter.getCurrentItem());
    }

    @Test
    void completePhase_異常ケース_フェーズ開始前はIllegalStateExceptionとなること() {
        LoggingProgressReporter reporter = new LoggingProgressReporter(false);
        assertThrows(IllegalStateException.class, reporter::completePhase);
    }

    @Test
    void printFinalSummary_正常ケース_警告とエラーを保持し終了時刻を記録すること() {
        LoggingProgressReporter reporter = new LoggingProgressReporter(false);
        for (int i = 0; i < 12; i++) {
            reporter.warning("w" + i);
        }
        reporter.error("Failed to create org Acme: API Error 500: boom");

        reporter.printFinalSummary();

        assertEquals(12, reporter.getSummary().getWarnings().size());
        assertEquals(1, reporter.getSummary().getErrors().size());
        assertNotNull(reporter.getSummary().getEndTime());
    }

    @Test
    void formatDuration_正常ケース_秒分時の書式になること() {
        assertEquals("12.3s", PhaseResult.formatDuration(12.34));
        assertEquals("4m 5s", PhaseResult.formatDuration(245));
        assertEquals("1h 2m", PhaseResult.formatDuration(3725));
    }
}
