package de.bsommerfeld.scalatest.launcher;

import de.bsommerfeld.scalatest.core.config.ReportSettings;
import de.bsommerfeld.scalatest.core.config.RunConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates report directories the runner assumes to exist. The HTML reporter
 * writes into its destination without creating it, so the directory has to be
 * there before the process starts.
 */
public class ReportDirectoryPreparer {

    private static final Logger LOG = LoggerFactory.getLogger(ReportDirectoryPreparer.class);

    /**
     * Recursively creates the HTML destination if the HTML report is enabled.
     * Existing directories are left untouched.
     *
     * @throws IOException if the directory cannot be created
     */
    public void prepare(RunConfiguration config) throws IOException {
        ReportSettings.Report html = config.reportSettings().html();
        if (!html.enabled()) {
            return;
        }
        Path destination = html.destination().toAbsolutePath();
        if (!Files.isDirectory(destination)) {
            LOG.debug("Creating HTML report directory {}", destination);
            Files.createDirectories(destination);
        }
    }
}
