package de.bsommerfeld.scalatest.launcher;

import de.bsommerfeld.scalatest.core.config.ReportSettings;
import de.bsommerfeld.scalatest.core.domain.Outcome;
import de.bsommerfeld.scalatest.core.util.ConsoleLinks;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeEvaluatorTest {

    @TempDir
    Path tempDir;

    private final OutcomeEvaluator evaluator = new OutcomeEvaluator();

    @Test
    void evaluate_shouldSucceedOnZeroExit() {
        Outcome outcome = evaluator.evaluate(0, false, ReportSettings.none());

        assertEquals(Outcome.Status.SUCCESS, outcome.status());
        assertTrue(outcome.isSuccessful());
    }

    @Test
    void evaluate_shouldSucceedOnZeroExitEvenWhenIgnoringFailures() {
        assertEquals(Outcome.Status.SUCCESS, evaluator.evaluate(0, true, ReportSettings.none()).status());
    }

    @Test
    void evaluate_shouldFailOnNonZeroExit() {
        Outcome outcome = evaluator.evaluate(1, false, ReportSettings.none());

        assertEquals(Outcome.Status.FAILED, outcome.status());
        assertEquals("There were failing tests", outcome.message());
        assertFalse(outcome.isSuccessful());
    }

    @Test
    void evaluate_shouldTreatAllNonZeroCodesAlike() {
        for (int code : new int[] { 1, 2, 137, -1 }) {
            assertTrue(evaluator.evaluate(code, false, ReportSettings.none()).isFailed(), "code " + code);
        }
    }

    @Test
    void evaluate_shouldWarnWhenIgnoringFailures() {
        Outcome outcome = evaluator.evaluate(1, true, ReportSettings.none());

        assertEquals(Outcome.Status.WARNED, outcome.status());
        assertTrue(outcome.message().startsWith("There were failing tests"));
        assertTrue(outcome.isSuccessful());
    }

    @Test
    void evaluate_shouldLinkHtmlReportWhenEnabled() {
        Path html = tempDir.resolve("html");
        ReportSettings reports = new ReportSettings(
                ReportSettings.junitXml(tempDir.resolve("junit")), ReportSettings.html(html));

        Outcome outcome = evaluator.evaluate(1, false, reports);

        assertEquals("There were failing tests. See the report at: "
                + ConsoleLinks.asClickableFileUrl(html.resolve("index.html")), outcome.message());
    }

    @Test
    void evaluate_shouldLinkJUnitResultsWhenHtmlDisabled() {
        Path junit = tempDir.resolve("junit");
        ReportSettings reports = new ReportSettings(ReportSettings.junitXml(junit), null);

        Outcome outcome = evaluator.evaluate(3, true, reports);

        assertEquals(Outcome.Status.WARNED, outcome.status());
        assertTrue(outcome.message().contains("See the results at: "));
        assertTrue(outcome.message().contains("junit"));
    }
}
