package com.mock.resource.router;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A verb + path-pattern binding to a handler.
 *
 * @param verb       upper-case request verb
 * @param pattern    pattern matched against the full path and query string
 * @param handler    the handler invoked with the captured groups
 * @param routeClass whether the route was registered by the test author or derived
 */
public record RouteRegistration(String verb, Pattern pattern, RouteHandler handler, RouteClass routeClass) {

    public RouteRegistration {
        Objects.requireNonNull(verb, "verb is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(handler, "handler is required");
        Objects.requireNonNull(routeClass, "routeClass is required");
    }

    @Override
    public String toString() {
        return routeClass + " " + verb + " " + pattern.pattern();
    }
}
