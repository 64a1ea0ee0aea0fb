package com.mock.resource.router;

import com.mock.resource.serialize.Document;

/**
 * Transport strategy handed to the simulated client. The in-process implementation
 * is {@link RequestRouter}; no real network is involved.
 */
public interface RequestDispatcher {

    /**
     * Answers a simulated request.
     *
     * @throws RequestNotFoundException if no route matches the path
     */
    Document request(String verb, String path);
}
