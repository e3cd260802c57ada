package com.atrium.workspace.api;

/** A test-control call touched something outside the {@value TestControlController#TEST_PREFIX} namespace. */
public class TestControlViolationException extends RuntimeException {

    public TestControlViolationException(String message) {
        super(message);
    }
}
