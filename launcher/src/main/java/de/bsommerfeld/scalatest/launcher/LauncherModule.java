package de.bsommerfeld.scalatest.launcher;

import com.google.inject.AbstractModule;

/**
 * Guice wiring for the command-line launcher. Run stages are reported through
 * the log.
 */
public class LauncherModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(RunListener.class).to(LoggingRunListener.class);
    }
}
