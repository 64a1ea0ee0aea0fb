package com.mock.resource.client;

import java.util.Objects;

/**
 * Encoded response received by the simulated client.
 *
 * @param path        the requested path
 * @param contentType the media type of the body
 * @param body        the encoded body
 */
public record ClientResponse(String path, String contentType, String body) {

    public ClientResponse {
        Objects.requireNonNull(path, "path is required");
        Objects.requireNonNull(contentType, "contentType is required");
        Objects.requireNonNull(body, "body is required");
    }
}
