package de.bsommerfeld.scalatest.launcher;

import com.google.inject.Guice;
import de.bsommerfeld.scalatest.core.config.RunConfiguration;
import de.bsommerfeld.scalatest.core.config.RunConfigurationLoader;
import de.bsommerfeld.scalatest.core.domain.Outcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class LauncherMainTest {

    @TempDir
    Path tempDir;

    private final ScalaTestExecutor executor = mock(ScalaTestExecutor.class);

    private String[] writeConfig() throws IOException {
        Path file = tempDir.resolve("run.json");
        Files.writeString(file, "{ \"testRoot\": \"classes\" }");
        return new String[] { file.toString() };
    }

    @Test
    void run_shouldRejectMissingArgument() {
        assertEquals(LauncherMain.EXIT_ERROR, LauncherMain.run(new String[0], new RunConfigurationLoader(), executor));
        verifyNoInteractions(executor);
    }

    @Test
    void run_shouldReportUnreadableConfiguration() {
        String[] args = { tempDir.resolve("missing.json").toString() };

        assertEquals(LauncherMain.EXIT_ERROR, LauncherMain.run(args, new RunConfigurationLoader(), executor));
        verifyNoInteractions(executor);
    }

    @Test
    void run_shouldExitZeroForSuccessAndWarning() throws Exception {
        when(executor.execute(any(RunConfiguration.class)))
                .thenReturn(Outcome.success())
                .thenReturn(Outcome.warned("There were failing tests"));

        assertEquals(LauncherMain.EXIT_OK, LauncherMain.run(writeConfig(), new RunConfigurationLoader(), executor));
        assertEquals(LauncherMain.EXIT_OK, LauncherMain.run(writeConfig(), new RunConfigurationLoader(), executor));
    }

    @Test
    void run_shouldExitOneForFailedTests() throws Exception {
        when(executor.execute(any(RunConfiguration.class))).thenReturn(Outcome.failed("There were failing tests"));

        assertEquals(LauncherMain.EXIT_TESTS_FAILED,
                LauncherMain.run(writeConfig(), new RunConfigurationLoader(), executor));
    }

    @Test
    void run_shouldExitTwoForLaunchFailure() throws Exception {
        when(executor.execute(any(RunConfiguration.class))).thenThrow(new IOException("Cannot run program"));

        assertEquals(LauncherMain.EXIT_ERROR, LauncherMain.run(writeConfig(), new RunConfigurationLoader(), executor));
    }

    @Test
    void launcherModule_shouldWireExecutor() {
        var injector = Guice.createInjector(new LauncherModule());

        assertNotNull(injector.getInstance(ScalaTestExecutor.class));
        assertInstanceOf(LoggingRunListener.class, injector.getInstance(RunListener.class));
    }
}
