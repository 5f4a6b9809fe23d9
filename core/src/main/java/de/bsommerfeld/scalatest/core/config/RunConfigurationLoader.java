package de.bsommerfeld.scalatest.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a {@link RunConfiguration} from a JSON file.
 *
 * <p>
 * The file layout mirrors the builder: flat keys for the JVM and selection
 * settings, a {@code tags} object with {@code includes}/{@code excludes}, and a
 * {@code reports} object with {@code junitXml} and {@code html} entries.
 * Relative paths are resolved against the directory containing the file, so a
 * configuration can be checked in next to the project it describes. The one
 * exception is an {@code executable} given as a bare command name, which is
 * left for the {@code PATH} lookup.
 *
 * <pre>
 * {
 *   "testRoot": "target/test-classes",
 *   "classpath": ["target/test-classes", "lib/scalatest.jar"],
 *   "maxParallelForks": 4,
 *   "tags": { "includes": ["Fast"], "excludes": ["Slow"] },
 *   "reports": { "html": { "enabled": true, "destination": "build/reports/tests" } },
 *   "testOutput": "build/test-output.txt"
 * }
 * </pre>
 *
 * Unknown keys are rejected instead of silently ignored.
 */
public final class RunConfigurationLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RunConfigurationLoader.class);

    /**
     * Single shared mapper. {@link ObjectMapper} is thread-safe once configured.
     */
    private final ObjectMapper mapper;

    public RunConfigurationLoader() {
        this.mapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Parses the file and builds a validated configuration.
     *
     * @throws IOException if the file cannot be read, is not valid JSON, or
     *                     describes an invalid configuration
     */
    public RunConfiguration load(Path file) throws IOException {
        LOG.info("Loading run configuration from: {}", file.toAbsolutePath());
        Path baseDir = file.toAbsolutePath().getParent();

        RunFile runFile;
        try {
            runFile = mapper.readValue(Files.readString(file), RunFile.class);
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed run configuration " + file + ": " + e.getOriginalMessage(), e);
        }

        try {
            return toConfiguration(runFile, baseDir);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new IOException("Invalid run configuration " + file + ": " + e.getMessage(), e);
        }
    }

    private RunConfiguration toConfiguration(RunFile file, Path baseDir) {
        RunConfiguration.Builder builder = RunConfiguration.builder()
                .jvmArgs(file.jvmArgs)
                .systemProperties(file.systemProperties)
                .minHeapSize(file.minHeapSize)
                .maxHeapSize(file.maxHeapSize)
                .environment(file.environment)
                .maxParallelForks(file.maxParallelForks)
                .colorOutput(file.colorOutput)
                .includePatterns(file.includePatterns)
                .tagIncludes(file.tags.includes)
                .tagExcludes(file.tags.excludes)
                .suites(file.suites)
                .configEntries(file.config)
                .resultFile(resolveOptional(baseDir, file.testResult))
                .outputFile(resolveOptional(baseDir, file.testOutput))
                .errorFile(resolveOptional(baseDir, file.testError))
                .reportSettings(toReportSettings(file.reports, baseDir))
                .ignoreFailures(file.ignoreFailures);

        for (String entry : file.classpath) {
            builder.classpathEntry(baseDir.resolve(entry));
        }
        if (file.testRoot != null) {
            builder.testRoot(baseDir.resolve(file.testRoot));
        }
        if (file.workingDirectory != null) {
            builder.workingDirectory(baseDir.resolve(file.workingDirectory));
        }
        if (file.executable != null && !file.executable.isEmpty()) {
            builder.executable(resolveExecutable(baseDir, file.executable));
        }
        if (file.mainClass != null) {
            builder.mainClass(file.mainClass);
        }
        return builder.build();
    }

    private ReportSettings toReportSettings(ReportsSection reports, Path baseDir) {
        ReportSettings.Report junitXml = ReportSettings.Report.disabled();
        if (reports.junitXml.enabled) {
            junitXml = ReportSettings.junitXml(requireDestination(reports.junitXml, "junitXml", baseDir));
        }

        ReportSettings.Report html = ReportSettings.Report.disabled();
        if (reports.html.enabled) {
            Path destination = requireDestination(reports.html, "html", baseDir);
            html = reports.html.entryPoint != null
                    ? ReportSettings.Report.enabled(destination, baseDir.resolve(reports.html.entryPoint))
                    : ReportSettings.html(destination);
        }
        return new ReportSettings(junitXml, html);
    }

    private Path requireDestination(ReportSection section, String name, Path baseDir) {
        if (section.destination == null || section.destination.isEmpty()) {
            throw new IllegalArgumentException("reports." + name + " is enabled but has no destination");
        }
        return baseDir.resolve(section.destination);
    }

    /**
     * A bare command name such as {@code java} stays as is and is looked up on
     * the {@code PATH}; anything with a directory part resolves like every
     * other path.
     */
    private Path resolveExecutable(Path baseDir, String executable) {
        Path path = Path.of(executable);
        return path.getParent() == null ? path : baseDir.resolve(path);
    }

    /**
     * Keeps "unset" as the empty string so the builder treats it uniformly.
     */
    private String resolveOptional(Path baseDir, String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        return baseDir.resolve(path).toString();
    }

    // =====================================================================
    // JSON shape
    // =====================================================================

    static final class RunFile {
        public String testRoot;
        public List<String> classpath = new ArrayList<>();
        public List<String> jvmArgs = new ArrayList<>();
        public Map<String, Object> systemProperties = new LinkedHashMap<>();
        public String minHeapSize;
        public String maxHeapSize;
        public Map<String, String> environment = new LinkedHashMap<>();
        public String workingDirectory;
        public String executable;
        public String mainClass;
        public int maxParallelForks;
        public boolean colorOutput;
        public List<String> includePatterns = new ArrayList<>();
        public TagsSection tags = new TagsSection();
        public List<String> suites = new ArrayList<>();
        public Map<String, Object> config = new LinkedHashMap<>();
        public String testResult;
        public String testOutput;
        public String testError;
        public ReportsSection reports = new ReportsSection();
        public boolean ignoreFailures;
    }

    static final class TagsSection {
        public List<String> includes = new ArrayList<>();
        public List<String> excludes = new ArrayList<>();
    }

    static final class ReportsSection {
        public ReportSection junitXml = new ReportSection();
        public ReportSection html = new ReportSection();
    }

    static final class ReportSection {
        public boolean enabled;
        public String destination;
        public String entryPoint;
    }
}
