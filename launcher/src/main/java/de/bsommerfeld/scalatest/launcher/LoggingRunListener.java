package de.bsommerfeld.scalatest.launcher;

import de.bsommerfeld.scalatest.core.domain.Outcome;
import de.bsommerfeld.scalatest.core.domain.ProcessOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Default listener that reports run progress through SLF4J.
 */
public class LoggingRunListener implements RunListener {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingRunListener.class);

    @Override
    public void onLaunch(List<String> command) {
        LOG.info("Launching test runner {}", command.isEmpty() ? "" : command.get(0));
        LOG.debug("Command line: {}", command);
    }

    @Override
    public void onCompleted(ProcessOutcome processOutcome) {
        LOG.info("Test runner finished with exit code {}", processOutcome.exitCode());
        processOutcome.capturedOutput().ifPresent(file -> LOG.info("Standard output captured to {}", file));
        processOutcome.capturedError().ifPresent(file -> LOG.info("Standard error captured to {}", file));
    }

    @Override
    public void onOutcome(Outcome outcome) {
        if (outcome.isFailed()) {
            LOG.error(outcome.message());
        } else if (outcome.isWarned()) {
            LOG.info("Test failures ignored, continuing");
        } else {
            LOG.info("All tests passed");
        }
    }
}
