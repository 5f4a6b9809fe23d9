package de.bsommerfeld.scalatest.launcher;

import de.bsommerfeld.scalatest.core.config.ReportSettings;
import de.bsommerfeld.scalatest.core.config.RunConfiguration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Translates a {@link RunConfiguration} into the argument list of the ScalaTest
 * {@code Runner}.
 *
 * <h3>Ordering</h3>
 * The runner interprets options positionally in a few places, so groups are
 * always appended in the same order: output mode, parallelism, run path,
 * filters, JUnit XML report, HTML report, result file, tag includes, tag
 * excludes, suites, config entries.
 *
 * <h3>Purity</h3>
 * Building touches no filesystem state. The HTML report directory the runner
 * expects to exist is created separately by {@link ReportDirectoryPreparer}.
 */
public class ArgumentBuilder {

    static final String STDOUT_COLOR = "-oD";
    static final String STDOUT_NO_COLOR = "-oDW";
    static final String PARALLEL = "-PS";
    static final String RUNPATH = "-R";
    static final String TEST_NAME_FILTER = "-z";
    static final String JUNIT_XML = "-u";
    static final String HTML = "-h";
    static final String RESULT_FILE = "-f";
    static final String TAG_INCLUDE = "-n";
    static final String TAG_EXCLUDE = "-l";
    static final String SUITE = "-s";
    static final String CONFIG = "-D";

    public List<String> build(RunConfiguration config) {
        List<String> args = new ArrayList<>();

        args.add(config.colorOutput() ? STDOUT_COLOR : STDOUT_NO_COLOR);

        // 0 means "let the runner decide", never a literal zero
        if (config.maxParallelForks() == 0) {
            args.add(PARALLEL);
        } else {
            args.add(PARALLEL + config.maxParallelForks());
        }

        args.add(RUNPATH);
        args.add(escapeSpaces(config.testRoot()));

        for (String pattern : config.includePatterns()) {
            args.add(TEST_NAME_FILTER);
            args.add(pattern);
        }

        ReportSettings reports = config.reportSettings();
        if (reports.junitXml().enabled()) {
            args.add(JUNIT_XML);
            args.add(reports.junitXml().entryPoint().toAbsolutePath().toString());
        }
        if (reports.html().enabled()) {
            args.add(HTML);
            args.add(reports.html().destination().toAbsolutePath().toString());
        }

        config.resultFile().ifPresent(file -> {
            args.add(RESULT_FILE);
            args.add(file.toString());
        });

        appendPairs(args, TAG_INCLUDE, config.tagIncludes());
        appendPairs(args, TAG_EXCLUDE, config.tagExcludes());
        appendPairs(args, SUITE, config.suites());

        for (Map.Entry<String, Object> entry : config.configEntries().entrySet()) {
            args.add(CONFIG + entry.getKey() + "=" + entry.getValue());
        }

        return args;
    }

    private void appendPairs(List<String> args, String option, Iterable<String> values) {
        for (String value : values) {
            args.add(option);
            args.add(value);
        }
    }

    /**
     * The runner splits its run path on spaces, so literal spaces in the
     * directory name are escaped.
     */
    private String escapeSpaces(Path testRoot) {
        return testRoot.toAbsolutePath().toString().replace(" ", "\\ ");
    }
}
