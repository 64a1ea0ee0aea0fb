package com.mock.resource.router;

import com.mock.resource.core.model.Record;
import com.mock.resource.definition.DefinitionRegistry;
import com.mock.resource.definition.TypeNames;
import com.mock.resource.diagnostics.DispatchRecorder;
import com.mock.resource.logging.LogContext;
import com.mock.resource.metrics.MetricsService;
import com.mock.resource.metrics.NoOpMetricsService;
import com.mock.resource.query.QueryEngine;
import com.mock.resource.serialize.Document;
import com.mock.resource.serialize.GraphSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * In-process stand-in for a remote endpoint.
 *
 * <p>Routes come in two classes. Custom routes are registered by the test author through
 * {@link #register}. Default routes are derived from the {@link DefinitionRegistry} for every
 * defined type using the collection/member convention. Dispatch evaluates custom routes before
 * default ones; within a class the first registered match wins. The handler result is passed
 * through the {@link GraphSerializer}.</p>
 *
 * <p>A request no route matches fails with {@link RequestNotFoundException}.</p>
 *
 * <p>Custom routes are scenario-scoped: {@link #reset()} drops them.</p>
 */
public class RequestRouter implements RequestDispatcher {
    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    private final DefinitionRegistry registry;
    private final QueryEngine queryEngine;
    private final GraphSerializer serializer;
    private final MetricsService metricsService;
    private final DispatchRecorder recorder;
    private final boolean defaultRoutesEnabled;

    private final List<RouteRegistration> customRoutes = new ArrayList<>();
    private final Map<String, List<RouteRegistration>> defaultRoutes = new HashMap<>();

    public RequestRouter(DefinitionRegistry registry, QueryEngine queryEngine, GraphSerializer serializer) {
        this(registry, queryEngine, serializer, new NoOpMetricsService(), new DispatchRecorder(), true);
    }

    public RequestRouter(DefinitionRegistry registry, QueryEngine queryEngine, GraphSerializer serializer,
                         MetricsService metricsService, DispatchRecorder recorder, boolean defaultRoutesEnabled) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.queryEngine = Objects.requireNonNull(queryEngine, "queryEngine is required");
        this.serializer = Objects.requireNonNull(serializer, "serializer is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.recorder = recorder != null ? recorder : new DispatchRecorder();
        this.defaultRoutesEnabled = defaultRoutesEnabled;
    }

    /**
     * Registers a custom route.
     *
     * @param verb        request verb, case-insensitive
     * @param pathPattern regular expression matched against the whole path and query string
     * @param handler     receives the captured groups positionally
     * @throws IllegalArgumentException if the pattern is not a valid regular expression
     */
    public RouteRegistration register(String verb, String pathPattern, RouteHandler handler) {
        Objects.requireNonNull(pathPattern, "pathPattern is required");
        Pattern pattern;
        try {
            pattern = Pattern.compile(pathPattern);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid route pattern: " + pathPattern, e);
        }
        RouteRegistration registration = new RouteRegistration(normalizeVerb(verb), pattern, handler,
                RouteClass.CUSTOM);
        customRoutes.add(registration);
        log.debug("Registered route {}", registration);
        return registration;
    }

    @Override
    public Document request(String verb, String path) {
        return dispatch(verb, path);
    }

    /**
     * Resolves a simulated request to a handler and returns its serialized result.
     *
     * @throws RequestNotFoundException if no route matches
     */
    public Document dispatch(String verb, String path) {
        Objects.requireNonNull(path, "path is required");
        String method = normalizeVerb(verb);

        try (LogContext ctx = LogContext.forDispatch(method, path)) {
            Optional<RouteMatch> match = match(method, path);
            if (match.isEmpty()) {
                metricsService.incrementRequestUnmatched(method);
                log.warn("No mock route matches {} {}", method, path);
                throw new RequestNotFoundException(method, path);
            }

            RouteRegistration route = match.get().route();
            ctx.with("routeClass", route.routeClass().name())
                    .with("route", route.pattern().pattern());
            log.debug("Dispatching {} {} to {}", method, path, route);
            Object result = route.handler().handle(match.get().groups());
            Document document = toDocument(result);

            metricsService.incrementRequestDispatched(method, route.routeClass());
            recorder.record(method, path, document);
            return document;
        }
    }

    /**
     * Custom routes first, then default routes, each in registration order.
     */
    public List<RouteRegistration> routes() {
        List<RouteRegistration> all = new ArrayList<>(customRoutes);
        all.addAll(currentDefaultRoutes());
        return all;
    }

    public List<RouteRegistration> customRoutes() {
        return List.copyOf(customRoutes);
    }

    /**
     * Drops every custom route. Default routes follow the registry and are kept.
     */
    public void reset() {
        int dropped = customRoutes.size();
        customRoutes.clear();
        defaultRoutes.clear();
        log.debug("Router reset ({} custom routes dropped)", dropped);
    }

    private Optional<RouteMatch> match(String method, String path) {
        Optional<RouteMatch> custom = firstMatch(customRoutes, method, path);
        if (custom.isPresent()) {
            return custom;
        }
        return firstMatch(currentDefaultRoutes(), method, path);
    }

    private Optional<RouteMatch> firstMatch(List<RouteRegistration> routes, String method, String path) {
        for (RouteRegistration route : routes) {
            if (!route.verb().equals(method)) {
                continue;
            }
            Matcher matcher = route.pattern().matcher(path);
            if (matcher.matches()) {
                String[] groups = new String[matcher.groupCount()];
                for (int i = 0; i < groups.length; i++) {
                    groups[i] = matcher.group(i + 1);
                }
                return Optional.of(new RouteMatch(route, groups));
            }
        }
        return Optional.empty();
    }

    private List<RouteRegistration> currentDefaultRoutes() {
        if (!defaultRoutesEnabled) {
            return List.of();
        }
        List<RouteRegistration> routes = new ArrayList<>();
        for (String type : registry.definedTypes()) {
            routes.addAll(defaultRoutes.computeIfAbsent(type,
                    t -> DefaultRoutes.forType(t, queryEngine, serializer)));
        }
        return routes;
    }

    private Document toDocument(Object result) {
        if (result == null) {
            return Document.empty();
        }
        if (result instanceof Document document) {
            return document;
        }
        if (result instanceof Record record) {
            return serializer.serialize(record);
        }
        if (result instanceof Collection<?> collection && isRecordCollection(collection)) {
            List<Record> records = new ArrayList<>(collection.size());
            for (Object element : collection) {
                records.add((Record) element);
            }
            String rootName = records.isEmpty() ? null : TypeNames.pluralize(records.get(0).getType());
            return serializer.serialize(records, rootName);
        }
        return Document.raw(result);
    }

    private static boolean isRecordCollection(Collection<?> collection) {
        for (Object element : collection) {
            if (!(element instanceof Record)) {
                return false;
            }
        }
        return true;
    }

    private static String normalizeVerb(String verb) {
        Objects.requireNonNull(verb, "verb is required");
        if (verb.isBlank()) {
            throw new IllegalArgumentException("verb must not be blank");
        }
        return verb.trim().toUpperCase(Locale.ROOT);
    }

    private record RouteMatch(RouteRegistration route, String[] groups) {
    }
}
