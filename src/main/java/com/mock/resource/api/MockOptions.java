package com.mock.resource.api;

/**
 * Options for a {@link MockContext}.
 * Configures uniqueness generation, default routes, the client format and diagnostics.
 */
public class MockOptions {

    private static final int DEFAULT_MAX_UNIQUENESS_ATTEMPTS = 1_000;
    private static final String DEFAULT_FORMAT = "json";

    private final int maxUniquenessAttempts;
    private final boolean defaultRoutesEnabled;
    private final String defaultFormat;
    private final boolean diagnosticsEnabled;

    private MockOptions(Builder builder) {
        this.maxUniquenessAttempts = builder.maxUniquenessAttempts;
        this.defaultRoutesEnabled = builder.defaultRoutesEnabled;
        this.defaultFormat = builder.defaultFormat;
        this.diagnosticsEnabled = builder.diagnosticsEnabled;
    }

    public int getMaxUniquenessAttempts() {
        return maxUniquenessAttempts;
    }

    public boolean isDefaultRoutesEnabled() {
        return defaultRoutesEnabled;
    }

    public String getDefaultFormat() {
        return defaultFormat;
    }

    public boolean isDiagnosticsEnabled() {
        return diagnosticsEnabled;
    }

    /**
     * Creates default options.
     */
    public static MockOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxUniquenessAttempts = DEFAULT_MAX_UNIQUENESS_ATTEMPTS;
        private boolean defaultRoutesEnabled = true;
        private String defaultFormat = DEFAULT_FORMAT;
        private boolean diagnosticsEnabled = false;

        public Builder maxUniquenessAttempts(int maxUniquenessAttempts) {
            if (maxUniquenessAttempts <= 0) {
                throw new IllegalArgumentException("maxUniquenessAttempts must be > 0");
            }
            this.maxUniquenessAttempts = maxUniquenessAttempts;
            return this;
        }

        public Builder defaultRoutesEnabled(boolean defaultRoutesEnabled) {
            this.defaultRoutesEnabled = defaultRoutesEnabled;
            return this;
        }

        public Builder defaultFormat(String defaultFormat) {
            if (!"json".equals(defaultFormat) && !"xml".equals(defaultFormat)) {
                throw new IllegalArgumentException("defaultFormat must be 'json' or 'xml', got: " + defaultFormat);
            }
            this.defaultFormat = defaultFormat;
            return this;
        }

        /**
         * Records dispatches for this context regardless of the process-wide toggle.
         */
        public Builder diagnosticsEnabled(boolean diagnosticsEnabled) {
            this.diagnosticsEnabled = diagnosticsEnabled;
            return this;
        }

        public MockOptions build() {
            return new MockOptions(this);
        }
    }
}
