package de.bsommerfeld.scalatest.core.config;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable description of a single ScalaTest run: what to put on the
 * runner's classpath and JVM command line, which tests to select, where
 * reports and captured output go, and whether failing tests should fail
 * the build.
 *
 * <p>
 * Instances are created through {@link #builder()}. All invariants are checked
 * once in {@link Builder#build()}; consumers never need to re-validate.
 *
 * <h3>Unset values</h3>
 * Optional paths accept {@code null} or an empty string, both of which mean
 * "not configured". Empty collections disable the corresponding runner
 * option.
 *
 * <h3>Suites</h3>
 * Suite names are collapsed to a set on construction. The iteration order of
 * {@link #suites()} is not specified.
 */
public final class RunConfiguration {

    public static final String DEFAULT_MAIN_CLASS = "org.scalatest.tools.Runner";

    private final List<Path> classpath;
    private final List<String> jvmArgs;
    private final Map<String, Object> systemProperties;
    private final String minHeapSize;
    private final String maxHeapSize;
    private final Map<String, String> environment;
    private final Path workingDirectory;
    private final Path executable;
    private final String mainClass;
    private final int maxParallelForks;
    private final boolean colorOutput;
    private final Path testRoot;
    private final List<String> includePatterns;
    private final List<String> tagIncludes;
    private final List<String> tagExcludes;
    private final Set<String> suites;
    private final Map<String, Object> configEntries;
    private final Path resultFile;
    private final Path outputFile;
    private final Path errorFile;
    private final ReportSettings reportSettings;
    private final boolean ignoreFailures;

    private RunConfiguration(Builder builder) {
        this.classpath = ImmutableList.copyOf(builder.classpath);
        this.jvmArgs = ImmutableList.copyOf(builder.jvmArgs);
        this.systemProperties = ImmutableMap.copyOf(builder.systemProperties);
        this.minHeapSize = builder.minHeapSize;
        this.maxHeapSize = builder.maxHeapSize;
        this.environment = ImmutableMap.copyOf(builder.environment);
        this.workingDirectory = builder.workingDirectory;
        this.executable = builder.executable;
        this.mainClass = builder.mainClass;
        this.maxParallelForks = builder.maxParallelForks;
        this.colorOutput = builder.colorOutput;
        this.testRoot = builder.testRoot;
        this.includePatterns = ImmutableList.copyOf(builder.includePatterns);
        this.tagIncludes = ImmutableList.copyOf(builder.tagIncludes);
        this.tagExcludes = ImmutableList.copyOf(builder.tagExcludes);
        this.suites = Collections.unmodifiableSet(new HashSet<>(builder.suites));
        this.configEntries = ImmutableMap.copyOf(builder.configEntries);
        this.resultFile = builder.resultFile;
        this.outputFile = builder.outputFile;
        this.errorFile = builder.errorFile;
        this.reportSettings = builder.reportSettings;
        this.ignoreFailures = builder.ignoreFailures;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Path> classpath() {
        return classpath;
    }

    public List<String> jvmArgs() {
        return jvmArgs;
    }

    public Map<String, Object> systemProperties() {
        return systemProperties;
    }

    public Optional<String> minHeapSize() {
        return Optional.ofNullable(minHeapSize);
    }

    public Optional<String> maxHeapSize() {
        return Optional.ofNullable(maxHeapSize);
    }

    public Map<String, String> environment() {
        return environment;
    }

    public Path workingDirectory() {
        return workingDirectory;
    }

    /**
     * The java binary used to start the runner. Empty means "the JVM this
     * launcher runs on".
     */
    public Optional<Path> executable() {
        return Optional.ofNullable(executable);
    }

    public String mainClass() {
        return mainClass;
    }

    /**
     * Number of worker forks requested from the runner. {@code 0} leaves the
     * choice to the runner.
     */
    public int maxParallelForks() {
        return maxParallelForks;
    }

    public boolean colorOutput() {
        return colorOutput;
    }

    public Path testRoot() {
        return testRoot;
    }

    public List<String> includePatterns() {
        return includePatterns;
    }

    public List<String> tagIncludes() {
        return tagIncludes;
    }

    public List<String> tagExcludes() {
        return tagExcludes;
    }

    public Set<String> suites() {
        return suites;
    }

    public Map<String, Object> configEntries() {
        return configEntries;
    }

    public Optional<Path> resultFile() {
        return Optional.ofNullable(resultFile);
    }

    public Optional<Path> outputFile() {
        return Optional.ofNullable(outputFile);
    }

    public Optional<Path> errorFile() {
        return Optional.ofNullable(errorFile);
    }

    public ReportSettings reportSettings() {
        return reportSettings;
    }

    public boolean ignoreFailures() {
        return ignoreFailures;
    }

    @Override
    public String toString() {
        return "RunConfiguration{testRoot=" + testRoot
                + ", mainClass=" + mainClass
                + ", forks=" + maxParallelForks
                + ", suites=" + suites
                + ", ignoreFailures=" + ignoreFailures + '}';
    }

    /**
     * Mutable collector for {@link RunConfiguration}. Not thread-safe; build
     * once and share the result instead.
     */
    public static final class Builder {

        private final List<Path> classpath = new ArrayList<>();
        private final List<String> jvmArgs = new ArrayList<>();
        private final Map<String, Object> systemProperties = new LinkedHashMap<>();
        private String minHeapSize;
        private String maxHeapSize;
        private final Map<String, String> environment = new LinkedHashMap<>();
        private Path workingDirectory;
        private Path executable;
        private String mainClass = DEFAULT_MAIN_CLASS;
        private int maxParallelForks;
        private boolean colorOutput;
        private Path testRoot;
        private final List<String> includePatterns = new ArrayList<>();
        private final List<String> tagIncludes = new ArrayList<>();
        private final List<String> tagExcludes = new ArrayList<>();
        private final List<String> suites = new ArrayList<>();
        private final Map<String, Object> configEntries = new LinkedHashMap<>();
        private Path resultFile;
        private Path outputFile;
        private Path errorFile;
        private ReportSettings reportSettings = ReportSettings.none();
        private boolean ignoreFailures;

        private Builder() {
        }

        public Builder classpath(Collection<Path> entries) {
            classpath.addAll(entries);
            return this;
        }

        public Builder classpathEntry(Path entry) {
            classpath.add(entry);
            return this;
        }

        public Builder jvmArgs(Collection<String> args) {
            jvmArgs.addAll(args);
            return this;
        }

        public Builder jvmArg(String arg) {
            jvmArgs.add(arg);
            return this;
        }

        public Builder systemProperty(String key, Object value) {
            systemProperties.put(key, value);
            return this;
        }

        public Builder systemProperties(Map<String, ?> properties) {
            systemProperties.putAll(properties);
            return this;
        }

        public Builder minHeapSize(String size) {
            this.minHeapSize = emptyToNull(size);
            return this;
        }

        public Builder maxHeapSize(String size) {
            this.maxHeapSize = emptyToNull(size);
            return this;
        }

        /**
         * Adds variables to the runner's environment. Nothing from the
         * launching process is inherited; pass {@link System#getenv()} here
         * explicitly if that is wanted.
         */
        public Builder environment(Map<String, String> variables) {
            environment.putAll(variables);
            return this;
        }

        public Builder environment(String name, String value) {
            environment.put(name, value);
            return this;
        }

        public Builder workingDirectory(Path directory) {
            this.workingDirectory = directory;
            return this;
        }

        public Builder executable(Path executable) {
            this.executable = executable;
            return this;
        }

        public Builder mainClass(String mainClass) {
            this.mainClass = mainClass;
            return this;
        }

        public Builder maxParallelForks(int forks) {
            this.maxParallelForks = forks;
            return this;
        }

        public Builder colorOutput(boolean colorOutput) {
            this.colorOutput = colorOutput;
            return this;
        }

        public Builder testRoot(Path testRoot) {
            this.testRoot = testRoot;
            return this;
        }

        public Builder includePatterns(Collection<String> patterns) {
            includePatterns.addAll(patterns);
            return this;
        }

        public Builder includePattern(String pattern) {
            includePatterns.add(pattern);
            return this;
        }

        public Builder tagIncludes(Collection<String> tags) {
            tagIncludes.addAll(tags);
            return this;
        }

        public Builder tagExcludes(Collection<String> tags) {
            tagExcludes.addAll(tags);
            return this;
        }

        public Builder suites(Collection<String> names) {
            suites.addAll(names);
            return this;
        }

        public Builder suite(String name) {
            suites.add(name);
            return this;
        }

        public Builder config(String key, Object value) {
            configEntries.put(key, value);
            return this;
        }

        public Builder configEntries(Map<String, ?> entries) {
            configEntries.putAll(entries);
            return this;
        }

        public Builder resultFile(String path) {
            this.resultFile = toPath(path);
            return this;
        }

        public Builder resultFile(Path path) {
            this.resultFile = emptyToNull(path);
            return this;
        }

        public Builder outputFile(String path) {
            this.outputFile = toPath(path);
            return this;
        }

        public Builder outputFile(Path path) {
            this.outputFile = emptyToNull(path);
            return this;
        }

        public Builder errorFile(String path) {
            this.errorFile = toPath(path);
            return this;
        }

        public Builder errorFile(Path path) {
            this.errorFile = emptyToNull(path);
            return this;
        }

        public Builder reportSettings(ReportSettings settings) {
            this.reportSettings = settings;
            return this;
        }

        public Builder ignoreFailures(boolean ignoreFailures) {
            this.ignoreFailures = ignoreFailures;
            return this;
        }

        /**
         * Validates the collected values and freezes them.
         *
         * @throws NullPointerException     if the test root, main class or report
         *                                  settings are missing, or a collection
         *                                  contains {@code null}
         * @throws IllegalArgumentException if the fork count is negative or the
         *                                  main class is blank
         */
        public RunConfiguration build() {
            Objects.requireNonNull(testRoot, "testRoot");
            Objects.requireNonNull(mainClass, "mainClass");
            Objects.requireNonNull(reportSettings, "reportSettings");
            if (mainClass.isBlank()) {
                throw new IllegalArgumentException("mainClass must not be blank");
            }
            if (maxParallelForks < 0) {
                throw new IllegalArgumentException(
                        "maxParallelForks must be >= 0 but was " + maxParallelForks);
            }
            if (workingDirectory == null) {
                workingDirectory = Path.of("").toAbsolutePath();
            }
            for (String suite : suites) {
                Objects.requireNonNull(suite, "suite name");
            }
            return new RunConfiguration(this);
        }

        private static Path toPath(String path) {
            String value = emptyToNull(path);
            return value != null ? Path.of(value) : null;
        }

        private static Path emptyToNull(Path path) {
            return path == null || path.toString().isEmpty() ? null : path;
        }

        private static String emptyToNull(String value) {
            return value == null || value.isEmpty() ? null : value;
        }
    }
}
