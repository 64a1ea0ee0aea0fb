package com.mock.resource.factory;

import com.mock.resource.core.MockResourceException;

/**
 * Thrown when no unused value could be found for a uniquified attribute
 * within the configured number of attempts.
 */
public class UniquenessExhaustedException extends MockResourceException {

    private final String typeName;
    private final String attributeName;
    private final int attempts;

    public UniquenessExhaustedException(String typeName, String attributeName, int attempts) {
        super("Could not generate a unique value for '" + typeName + "." + attributeName
                + "' after " + attempts + " attempts");
        this.typeName = typeName;
        this.attributeName = attributeName;
        this.attempts = attempts;
    }

    public String getTypeName() {
        return typeName;
    }

    public String getAttributeName() {
        return attributeName;
    }

    public int getAttempts() {
        return attempts;
    }
}
