package de.bsommerfeld.scalatest.core.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ReportSettingsTest {

    @Test
    void html_shouldPointAtIndexFile() {
        ReportSettings.Report html = ReportSettings.html(Path.of("reports/html"));

        assertTrue(html.enabled());
        assertEquals(Path.of("reports/html"), html.destination());
        assertEquals(Path.of("reports/html/index.html"), html.entryPoint());
    }

    @Test
    void junitXml_shouldUseDirectoryAsEntryPoint() {
        ReportSettings.Report junit = ReportSettings.junitXml(Path.of("reports/junit"));

        assertEquals(junit.destination(), junit.entryPoint());
    }

    @Test
    void constructor_shouldReplaceNullWithDisabled() {
        ReportSettings settings = new ReportSettings(null, null);

        assertFalse(settings.junitXml().enabled());
        assertFalse(settings.html().enabled());
    }

    @Test
    void enabledReport_shouldRequireDestination() {
        assertThrows(NullPointerException.class, () -> new ReportSettings.Report(true, null, null));
    }
}
