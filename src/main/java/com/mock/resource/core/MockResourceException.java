package com.mock.resource.core;

/**
 * Base class of all failures raised by the mock resource engine.
 * Failures are never swallowed internally; they propagate to the calling test step.
 */
public class MockResourceException extends RuntimeException {

    public MockResourceException(String message) {
        super(message);
    }

    public MockResourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
