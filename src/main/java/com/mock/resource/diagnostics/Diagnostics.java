package com.mock.resource.diagnostics;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide diagnostics toggle.
 *
 * <p>When enabled, every dispatched request is recorded together with its serialized
 * response for inspection at the end of a scenario. Recording is purely observational.
 * The initial state is read from the {@code mockresource.diagnostics} system property.</p>
 */
public final class Diagnostics {

    public static final String SYSTEM_PROPERTY = "mockresource.diagnostics";

    private static final AtomicBoolean ENABLED =
            new AtomicBoolean(Boolean.getBoolean(SYSTEM_PROPERTY));

    private Diagnostics() {
    }

    public static void enable() {
        ENABLED.set(true);
    }

    public static void disable() {
        ENABLED.set(false);
    }

    public static boolean isEnabled() {
        return ENABLED.get();
    }
}
