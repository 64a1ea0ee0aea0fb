package com.mock.resource.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.mock.resource.definition.TypeNames;
import com.mock.resource.encoding.DocumentEncoder;
import com.mock.resource.encoding.DocumentEncoders;
import com.mock.resource.encoding.JsonDocumentEncoder;
import com.mock.resource.router.RequestDispatcher;
import com.mock.resource.serialize.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Simulated resource client used by application code under test.
 *
 * <p>Requests go through a {@link RequestDispatcher} instead of a network transport, so
 * responses are deterministic. Paths follow the collection/member convention:
 * {@code /books.json} and {@code /books/3.json}. A request no mock answers fails with
 * {@link com.mock.resource.router.RequestNotFoundException}.</p>
 */
public class ResourceClient {
    private static final Logger log = LoggerFactory.getLogger(ResourceClient.class);

    private final RequestDispatcher dispatcher;
    private final String format;

    public ResourceClient(RequestDispatcher dispatcher) {
        this(dispatcher, "json");
    }

    public ResourceClient(RequestDispatcher dispatcher, String format) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher is required");
        this.format = Objects.requireNonNull(format, "format is required");
    }

    /**
     * Fetches the whole collection of a type.
     */
    public ClientResponse findAll(String type) {
        return get("/" + TypeNames.pluralize(type) + "." + format);
    }

    /**
     * Fetches a single member of a type.
     */
    public ClientResponse find(String type, int id) {
        return get("/" + TypeNames.pluralize(type) + "/" + id + "." + format);
    }

    /**
     * Issues a GET and encodes the answer according to the path's format suffix.
     */
    public ClientResponse get(String path) {
        return send("GET", path);
    }

    /**
     * Issues a request with an arbitrary verb.
     */
    public ClientResponse send(String verb, String path) {
        Document document = dispatcher.request(verb, path);
        DocumentEncoder encoder = DocumentEncoders.forPath(path);
        String body = encoder.encode(document);
        log.debug("{} {} answered with {} bytes of {}", verb, path, body.length(), encoder.contentType());
        return new ClientResponse(path, encoder.contentType(), body);
    }

    /**
     * Issues a GET and parses the JSON answer.
     */
    public JsonNode getJson(String path) {
        Document document = dispatcher.request("GET", path);
        JsonDocumentEncoder json = DocumentEncoders.json();
        return json.decode(json.encode(document));
    }
}
