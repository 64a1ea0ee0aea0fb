package com.mock.resource.router;

/**
 * Produces the response of a matched route.
 *
 * <p>The handler receives the pattern's captured groups positionally and returns a
 * {@link com.mock.resource.core.model.Record}, a collection of records, a ready
 * {@link com.mock.resource.serialize.Document}, or any other raw value that is passed
 * through unchanged.</p>
 */
@FunctionalInterface
public interface RouteHandler {

    Object handle(String... groups);
}
