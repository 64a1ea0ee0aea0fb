package com.mock.resource.metrics;

import com.mock.resource.router.RouteClass;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code mock.records.created}: counter (tag: type)</li>
 *   <li>{@code mock.requests.dispatched}: counter (tags: verb, routeClass)</li>
 *   <li>{@code mock.requests.unmatched}: counter (tag: verb)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void incrementRecordCreated(String type) {
        String key = "created:" + type;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("mock.records.created")
                        .description("Number of mock records created")
                        .tag("type", type)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementRequestDispatched(String verb, RouteClass routeClass) {
        String key = "dispatched:" + verb + ":" + routeClass.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("mock.requests.dispatched")
                        .description("Number of simulated requests answered by a route")
                        .tag("verb", verb)
                        .tag("routeClass", routeClass.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementRequestUnmatched(String verb) {
        String key = "unmatched:" + verb;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("mock.requests.unmatched")
                        .description("Number of simulated requests no route matched")
                        .tag("verb", verb)
                        .register(registry));
        counter.increment();
    }
}
