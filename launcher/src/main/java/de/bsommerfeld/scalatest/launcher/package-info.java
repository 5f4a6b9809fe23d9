/**
 * Launches the ScalaTest {@code Runner} as a child JVM and interprets its exit
 * status for a build.
 *
 * <h2>Pipeline</h2>
 * 
 * <pre>
 * ReportDirectoryPreparer : creates the HTML report directory the runner expects
 * ArgumentBuilder         : RunConfiguration → ordered runner arguments (pure)
 * ProcessLauncher         : child JVM with exact environment, optional redirects, blocking wait
 * OutcomeEvaluator        : exit code → SUCCESS / WARNED / FAILED with a report link
 * ScalaTestExecutor       : sequences the above, notifies a RunListener
 * </pre>
 *
 * <h2>Failure semantics</h2>
 * A process that cannot be started is an {@link java.io.IOException} and is
 * never softened by {@code ignoreFailures}. A process that exits nonzero is a
 * test failure and becomes an {@link de.bsommerfeld.scalatest.core.domain.Outcome}.
 *
 * <p>
 * {@code LauncherMain} and {@code LauncherModule} add a JSON-driven command
 * line on top; the build-tool integration only needs {@code ScalaTestExecutor}.
 */
package de.bsommerfeld.scalatest.launcher;
