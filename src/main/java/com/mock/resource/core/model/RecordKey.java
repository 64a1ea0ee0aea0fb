package com.mock.resource.core.model;

import java.util.Objects;

/**
 * Identity of a record within the store: its type name plus its per-type id.
 *
 * @param type the resource type name
 * @param id   the id, unique within the type
 */
public record RecordKey(String type, int id) {

    public RecordKey {
        Objects.requireNonNull(type, "type is required");
    }

    @Override
    public String toString() {
        return type + "#" + id;
    }
}
