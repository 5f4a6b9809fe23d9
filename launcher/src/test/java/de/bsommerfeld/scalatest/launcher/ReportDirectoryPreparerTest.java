package de.bsommerfeld.scalatest.launcher;

import de.bsommerfeld.scalatest.core.config.ReportSettings;
import de.bsommerfeld.scalatest.core.config.RunConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ReportDirectoryPreparerTest {

    @TempDir
    Path tempDir;

    private final ReportDirectoryPreparer preparer = new ReportDirectoryPreparer();

    @Test
    void prepare_shouldCreateHtmlDestinationRecursively() throws Exception {
        Path html = tempDir.resolve("build/reports/tests/html");

        preparer.prepare(RunConfiguration.builder()
                .testRoot(tempDir)
                .reportSettings(new ReportSettings(null, ReportSettings.html(html)))
                .build());

        assertTrue(Files.isDirectory(html));
    }

    @Test
    void prepare_shouldBeIdempotent() throws Exception {
        Path html = tempDir.resolve("html");
        Files.createDirectories(html);
        Files.writeString(html.resolve("keep.txt"), "x");

        preparer.prepare(RunConfiguration.builder()
                .testRoot(tempDir)
                .reportSettings(new ReportSettings(null, ReportSettings.html(html)))
                .build());

        assertTrue(Files.exists(html.resolve("keep.txt")));
    }

    @Test
    void prepare_shouldNotCreateJUnitDirectory() throws Exception {
        Path junit = tempDir.resolve("junit");

        preparer.prepare(RunConfiguration.builder()
                .testRoot(tempDir)
                .reportSettings(new ReportSettings(ReportSettings.junitXml(junit), null))
                .build());

        assertFalse(Files.exists(junit));
    }

    @Test
    void prepare_shouldFailWhenDestinationIsAFile() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        RunConfiguration config = RunConfiguration.builder()
                .testRoot(tempDir)
                .reportSettings(new ReportSettings(null, ReportSettings.html(blocker.resolve("html"))))
                .build();

        assertThrows(java.io.IOException.class, () -> preparer.prepare(config));
    }
}
