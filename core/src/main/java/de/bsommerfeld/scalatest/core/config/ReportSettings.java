package de.bsommerfeld.scalatest.core.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Report locations handed to the runner. The JUnit XML report is a directory
 * whose entry point is the directory itself; the HTML report's entry point is
 * the {@code index.html} inside its destination unless stated otherwise.
 *
 * @param junitXml JUnit-style XML report written with {@code -u}
 * @param html     HTML report written with {@code -h}
 */
public record ReportSettings(Report junitXml, Report html) {

    private static final String HTML_INDEX = "index.html";

    public ReportSettings {
        junitXml = junitXml != null ? junitXml : Report.disabled();
        html = html != null ? html : Report.disabled();
    }

    /**
     * Both reports disabled.
     */
    public static ReportSettings none() {
        return new ReportSettings(Report.disabled(), Report.disabled());
    }

    public static Report junitXml(Path destination) {
        return Report.enabled(destination, destination);
    }

    public static Report html(Path destination) {
        return Report.enabled(destination, destination.resolve(HTML_INDEX));
    }

    /**
     * A single report target.
     *
     * @param enabled     whether the runner should produce this report
     * @param destination directory the report is written to, {@code null} when disabled
     * @param entryPoint  file or directory a human should open first, {@code null} when disabled
     */
    public record Report(boolean enabled, Path destination, Path entryPoint) {

        public Report {
            if (enabled) {
                Objects.requireNonNull(destination, "enabled report requires a destination");
                entryPoint = entryPoint != null ? entryPoint : destination;
            }
        }

        public static Report disabled() {
            return new Report(false, null, null);
        }

        public static Report enabled(Path destination, Path entryPoint) {
            return new Report(true, destination, entryPoint);
        }
    }
}
