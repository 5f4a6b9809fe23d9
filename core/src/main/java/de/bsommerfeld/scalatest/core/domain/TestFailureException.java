package de.bsommerfeld.scalatest.core.domain;

/**
 * Thrown when a completed test run failed and failures are not ignored.
 */
public class TestFailureException extends Exception {

    public TestFailureException(String message) {
        super(message);
    }
}
