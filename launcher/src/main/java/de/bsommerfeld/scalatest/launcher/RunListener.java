package de.bsommerfeld.scalatest.launcher;

import de.bsommerfeld.scalatest.core.domain.Outcome;
import de.bsommerfeld.scalatest.core.domain.ProcessOutcome;

import java.util.List;

/**
 * Callback for the stages of one {@link ScalaTestExecutor#execute} call.
 * Invoked on the executing thread, in declaration order. A launch failure
 * ends the sequence after {@link #onLaunch}.
 */
public interface RunListener {

    /**
     * The full command line, right before the process is started.
     */
    default void onLaunch(List<String> command) {
    }

    default void onCompleted(ProcessOutcome processOutcome) {
    }

    /**
     * Receives every outcome, including warnings for ignored failures.
     */
    void onOutcome(Outcome outcome);
}
