package com.mock.resource.encoding;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mock.resource.serialize.Document;

/**
 * JSON rendering of documents. The root name is not part of the output;
 * a single record renders as an object, a collection as an array.
 */
public class JsonDocumentEncoder implements DocumentEncoder {

    private final ObjectMapper objectMapper;

    public JsonDocumentEncoder() {
        this(new ObjectMapper());
    }

    public JsonDocumentEncoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String encode(Document document) {
        try {
            return objectMapper.writeValueAsString(document.content());
        } catch (JsonProcessingException e) {
            throw new DocumentEncodingException("Failed to encode document '" + document.rootName()
                    + "' as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses JSON text produced by {@link #encode(Document)}.
     */
    public JsonNode decode(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DocumentEncodingException("Failed to decode JSON response: " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public String contentType() {
        return "application/json";
    }

    @Override
    public String format() {
        return "json";
    }
}
