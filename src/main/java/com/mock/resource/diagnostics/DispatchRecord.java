package com.mock.resource.diagnostics;

import com.mock.resource.serialize.Document;

import java.time.Instant;
import java.util.Objects;

/**
 * One dispatched request and the document it was answered with.
 *
 * @param verb      the request verb
 * @param path      the literal request path, query string included
 * @param response  the serialized response
 * @param timestamp when the request was dispatched
 */
public record DispatchRecord(String verb, String path, Document response, Instant timestamp) {

    public DispatchRecord {
        Objects.requireNonNull(verb, "verb is required");
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }
}
