package com.mock.resource.metrics;

import com.mock.resource.router.RouteClass;

/**
 * No-op implementation of {@link MetricsService}.
 * Used as the default when no metrics backend is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementRecordCreated(String type) {
    }

    @Override
    public void incrementRequestDispatched(String verb, RouteClass routeClass) {
    }

    @Override
    public void incrementRequestUnmatched(String verb) {
    }
}
