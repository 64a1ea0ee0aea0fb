package com.mock.resource.definition;

import com.mock.resource.core.MockResourceException;

/**
 * Thrown when a type is redefined with an attribute whose definition differs
 * from the one already registered. Redefinition is additive only.
 */
public class DefinitionConflictException extends MockResourceException {

    private final String typeName;
    private final String attributeName;

    public DefinitionConflictException(String typeName, String attributeName) {
        super("Conflicting redefinition of attribute '" + attributeName + "' on type '" + typeName
                + "'; definitions may only be extended");
        this.typeName = typeName;
        this.attributeName = attributeName;
    }

    public String getTypeName() {
        return typeName;
    }

    public String getAttributeName() {
        return attributeName;
    }
}
