package de.bsommerfeld.scalatest.launcher;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.scalatest.core.config.RunConfiguration;
import de.bsommerfeld.scalatest.core.config.RunConfigurationLoader;
import de.bsommerfeld.scalatest.core.domain.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Command-line entry point: {@code scalatest-launcher <run-config.json>}.
 *
 * <h3>Exit status</h3>
 * <ul>
 * <li>{@code 0}: tests passed, or failed with {@code ignoreFailures}</li>
 * <li>{@code 1}: tests failed</li>
 * <li>{@code 2}: bad usage, unreadable configuration, or the runner could
 * not be started</li>
 * </ul>
 */
public final class LauncherMain {

    private static final Logger LOG = LoggerFactory.getLogger(LauncherMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_TESTS_FAILED = 1;
    static final int EXIT_ERROR = 2;

    private LauncherMain() {
    }

    public static void main(String[] args) {
        Injector injector = Guice.createInjector(new LauncherModule());
        int status = run(args, new RunConfigurationLoader(), injector.getInstance(ScalaTestExecutor.class));
        System.exit(status);
    }

    static int run(String[] args, RunConfigurationLoader loader, ScalaTestExecutor executor) {
        if (args.length != 1) {
            System.err.println("Usage: scalatest-launcher <run-config.json>");
            return EXIT_ERROR;
        }

        RunConfiguration config;
        try {
            config = loader.load(Path.of(args[0]));
        } catch (IOException e) {
            LOG.error("Could not load run configuration: {}", e.getMessage());
            return EXIT_ERROR;
        }

        try {
            Outcome outcome = executor.execute(config);
            return outcome.isSuccessful() ? EXIT_OK : EXIT_TESTS_FAILED;
        } catch (IOException e) {
            LOG.error("Could not launch test runner", e);
            return EXIT_ERROR;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("Interrupted while waiting for test runner");
            return EXIT_ERROR;
        }
    }
}
