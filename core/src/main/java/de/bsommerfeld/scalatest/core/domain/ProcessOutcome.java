package de.bsommerfeld.scalatest.core.domain;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Raw result of a finished runner process. Only the exit status carries
 * meaning; interpretation happens later.
 *
 * @param exitCode   the process exit value
 * @param outputFile file standard output was written to, {@code null} if inherited
 * @param errorFile  file standard error was written to, {@code null} if inherited
 */
public record ProcessOutcome(int exitCode, Path outputFile, Path errorFile) {

    public ProcessOutcome(int exitCode) {
        this(exitCode, null, null);
    }

    public boolean exitedNormally() {
        return exitCode == 0;
    }

    public Optional<Path> capturedOutput() {
        return Optional.ofNullable(outputFile);
    }

    public Optional<Path> capturedError() {
        return Optional.ofNullable(errorFile);
    }
}
