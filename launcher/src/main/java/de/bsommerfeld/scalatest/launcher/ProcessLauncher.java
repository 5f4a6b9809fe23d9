package de.bsommerfeld.scalatest.launcher;

import com.google.common.util.concurrent.Futures;
import de.bsommerfeld.scalatest.core.config.RunConfiguration;
import de.bsommerfeld.scalatest.core.domain.ProcessOutcome;
import de.bsommerfeld.scalatest.core.util.JavaExecutables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs the test runner in a child JVM and waits for it to exit.
 *
 * <h3>Process contract</h3>
 * <ul>
 * <li>The environment contains exactly the variables of the
 * {@link RunConfiguration}; nothing is inherited from this process.</li>
 * <li>Standard output and error go to the configured files (truncated and
 * created) or, if unset, to this process's own streams.</li>
 * <li>A nonzero exit code is returned, never thrown. Only a process that
 * cannot be started at all raises an {@link IOException}.</li>
 * </ul>
 *
 * <h3>Redirect ownership</h3>
 * Redirect targets are opened by the child, not by this class. When
 * {@link #launch} returns the child has exited and no handle to the files
 * remains open, so their content is complete for whoever reads them next.
 */
public class ProcessLauncher {

    private static final Logger LOG = LoggerFactory.getLogger(ProcessLauncher.class);

    /**
     * Starts the runner and blocks until it exits.
     *
     * @param config    run configuration supplying JVM, environment and redirects
     * @param arguments runner arguments, usually from {@link ArgumentBuilder}
     * @return the exit code together with the files output was captured to
     * @throws IOException          if the process cannot be started (missing
     *                              executable, bad working directory, permissions)
     * @throws InterruptedException if the calling thread is interrupted while
     *                              waiting; the child is destroyed and has
     *                              exited before this is thrown
     */
    public ProcessOutcome launch(RunConfiguration config, List<String> arguments)
            throws IOException, InterruptedException {
        List<String> command = buildCommand(config, arguments);
        ProcessBuilder pb = createProcessBuilder(config, command);

        LOG.debug("Starting runner: {}", String.join(" ", command));
        Process process = pb.start();

        int exitCode = awaitCompletion(process);
        LOG.debug("Runner exited with code {}", exitCode);

        return new ProcessOutcome(exitCode,
                config.outputFile().orElse(null),
                config.errorFile().orElse(null));
    }

    /**
     * Assembles the full JVM command line without starting anything:
     * executable, JVM flags, classpath, main class, runner arguments.
     */
    public List<String> buildCommand(RunConfiguration config, List<String> arguments) {
        List<String> cmd = new ArrayList<>();
        cmd.add(config.executable().map(Path::toString).orElseGet(JavaExecutables::resolve));

        cmd.addAll(allJvmArgs(config));

        if (!config.classpath().isEmpty()) {
            cmd.add("-cp");
            cmd.add(config.classpath().stream()
                    .map(Path::toString)
                    .collect(Collectors.joining(File.pathSeparator)));
        }

        cmd.add(config.mainClass());
        cmd.addAll(arguments);
        return cmd;
    }

    /**
     * Explicit JVM args first, then system properties and heap bounds, the
     * same order a build tool's test task hands them to a forked JVM.
     */
    private List<String> allJvmArgs(RunConfiguration config) {
        List<String> jvmArgs = new ArrayList<>(config.jvmArgs());
        for (Map.Entry<String, Object> property : config.systemProperties().entrySet()) {
            jvmArgs.add("-D" + property.getKey() + "=" + property.getValue());
        }
        config.minHeapSize().ifPresent(size -> jvmArgs.add("-Xms" + size));
        config.maxHeapSize().ifPresent(size -> jvmArgs.add("-Xmx" + size));
        return jvmArgs;
    }

    private ProcessBuilder createProcessBuilder(RunConfiguration config, List<String> command) {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(config.workingDirectory().toFile());

        pb.environment().clear();
        pb.environment().putAll(config.environment());

        pb.redirectOutput(config.outputFile()
                .map(file -> ProcessBuilder.Redirect.to(file.toFile()))
                .orElse(ProcessBuilder.Redirect.INHERIT));
        pb.redirectError(config.errorFile()
                .map(file -> ProcessBuilder.Redirect.to(file.toFile()))
                .orElse(ProcessBuilder.Redirect.INHERIT));

        return pb;
    }

    private int awaitCompletion(Process process) throws InterruptedException {
        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            LOG.warn("Interrupted while waiting for runner, destroying process {}", process.pid());
            process.destroyForcibly();
            // Redirect targets stay open until the child is gone
            Futures.getUnchecked(process.onExit());
            throw e;
        }
    }
}
