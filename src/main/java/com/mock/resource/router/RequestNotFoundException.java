package com.mock.resource.router;

import com.mock.resource.core.MockResourceException;

/**
 * Thrown when no registered route matches a simulated request.
 * Carries the literal unmatched path so the test author can add the missing mock.
 */
public class RequestNotFoundException extends MockResourceException {

    private final String verb;
    private final String path;

    public RequestNotFoundException(String verb, String path) {
        super("No mock route matches " + verb + " " + path);
        this.verb = verb;
        this.path = path;
    }

    public String getVerb() {
        return verb;
    }

    public String getPath() {
        return path;
    }
}
