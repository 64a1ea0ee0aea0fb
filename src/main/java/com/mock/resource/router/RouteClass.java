package com.mock.resource.router;

/**
 * Precedence class of a route. Custom routes are always evaluated before default ones.
 */
public enum RouteClass {
    CUSTOM,
    DEFAULT
}
