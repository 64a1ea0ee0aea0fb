package com.mock.resource.query;

import com.mock.resource.core.MockResourceException;

/**
 * Thrown when an id lookup finds no record of the requested type.
 */
public class RecordNotFoundException extends MockResourceException {

    private final String typeName;
    private final int id;

    public RecordNotFoundException(String typeName, int id) {
        super("No " + typeName + " record with id " + id);
        this.typeName = typeName;
        this.id = id;
    }

    public String getTypeName() {
        return typeName;
    }

    public int getId() {
        return id;
    }
}
