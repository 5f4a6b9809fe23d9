package de.bsommerfeld.scalatest.launcher;

import de.bsommerfeld.scalatest.core.config.ReportSettings;
import de.bsommerfeld.scalatest.core.domain.Outcome;
import de.bsommerfeld.scalatest.core.util.ConsoleLinks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides what a finished run means for the build. Only zero versus nonzero
 * matters; the runner uses any nonzero code both for failing tests and for its
 * own errors.
 *
 * <p>
 * A failing run points the user at the most useful report that was produced:
 * the HTML report if enabled, otherwise the JUnit XML results.
 */
public class OutcomeEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(OutcomeEvaluator.class);

    static final String FAILURE_MESSAGE = "There were failing tests";

    public Outcome evaluate(int exitCode, boolean ignoreFailures, ReportSettings reports) {
        if (exitCode == 0) {
            return Outcome.success();
        }

        String message = failureMessage(reports);
        if (ignoreFailures) {
            LOG.warn(message);
            return Outcome.warned(message);
        }
        return Outcome.failed(message);
    }

    private String failureMessage(ReportSettings reports) {
        String message = FAILURE_MESSAGE;
        if (reports.html().enabled()) {
            message = message + ". See the report at: "
                    + ConsoleLinks.asClickableFileUrl(reports.html().entryPoint());
        } else if (reports.junitXml().enabled()) {
            message = message + ". See the results at: "
                    + ConsoleLinks.asClickableFileUrl(reports.junitXml().entryPoint());
        }
        return message;
    }
}
