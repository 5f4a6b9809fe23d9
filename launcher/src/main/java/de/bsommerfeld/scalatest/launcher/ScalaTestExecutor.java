package de.bsommerfeld.scalatest.launcher;

import com.google.inject.Inject;
import de.bsommerfeld.scalatest.core.config.RunConfiguration;
import de.bsommerfeld.scalatest.core.domain.Outcome;
import de.bsommerfeld.scalatest.core.domain.ProcessOutcome;

import java.io.IOException;
import java.util.List;

/**
 * Runs one ScalaTest invocation end to end:
 * <strong>prepare reports → build arguments → launch → evaluate</strong>.
 *
 * <h3>Error handling</h3>
 * A runner that cannot be started surfaces as the {@link IOException} thrown
 * by {@link ProcessLauncher}; {@code ignoreFailures} never downgrades it.
 * Failing tests are not exceptions here. They come back as a
 * {@link Outcome.Status#WARNED} or {@link Outcome.Status#FAILED} outcome, and
 * callers that want to abort use {@link Outcome#orThrow()}.
 */
public class ScalaTestExecutor {

    private final ReportDirectoryPreparer reportDirectoryPreparer;
    private final ArgumentBuilder argumentBuilder;
    private final ProcessLauncher processLauncher;
    private final OutcomeEvaluator outcomeEvaluator;
    private final RunListener listener;

    @Inject
    public ScalaTestExecutor(ReportDirectoryPreparer reportDirectoryPreparer,
            ArgumentBuilder argumentBuilder,
            ProcessLauncher processLauncher,
            OutcomeEvaluator outcomeEvaluator,
            RunListener listener) {
        this.reportDirectoryPreparer = reportDirectoryPreparer;
        this.argumentBuilder = argumentBuilder;
        this.processLauncher = processLauncher;
        this.outcomeEvaluator = outcomeEvaluator;
        this.listener = listener;
    }

    /**
     * Executor with the default collaborators, reporting through SLF4J.
     */
    public static ScalaTestExecutor createDefault() {
        return new ScalaTestExecutor(new ReportDirectoryPreparer(), new ArgumentBuilder(),
                new ProcessLauncher(), new OutcomeEvaluator(), new LoggingRunListener());
    }

    /**
     * Runs the configured tests and blocks until the runner exits.
     *
     * @throws IOException          if a report directory cannot be created or the
     *                              runner process cannot be started
     * @throws InterruptedException if interrupted while waiting for the runner
     */
    public Outcome execute(RunConfiguration config) throws IOException, InterruptedException {
        List<String> arguments = buildArguments(config);

        listener.onLaunch(processLauncher.buildCommand(config, arguments));
        ProcessOutcome processOutcome = processLauncher.launch(config, arguments);
        listener.onCompleted(processOutcome);

        Outcome outcome = outcomeEvaluator.evaluate(
                processOutcome.exitCode(), config.ignoreFailures(), config.reportSettings());
        listener.onOutcome(outcome);
        return outcome;
    }

    /**
     * Returns the runner arguments for the configuration without starting a
     * process. Report directories are created as they would be for a real run.
     *
     * @throws IOException if a report directory cannot be created
     */
    public List<String> buildArguments(RunConfiguration config) throws IOException {
        reportDirectoryPreparer.prepare(config);
        return argumentBuilder.build(config);
    }
}
