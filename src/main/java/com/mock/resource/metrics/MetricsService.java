package com.mock.resource.metrics;

import com.mock.resource.router.RouteClass;

/**
 * Interface for recording mock engine metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics backend configured.
 */
public interface MetricsService {

    void incrementRecordCreated(String type);

    void incrementRequestDispatched(String verb, RouteClass routeClass);

    void incrementRequestUnmatched(String verb);
}
