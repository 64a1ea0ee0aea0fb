package com.mock.resource.api;

import com.mock.resource.client.ResourceClient;
import com.mock.resource.core.model.Record;
import com.mock.resource.definition.DefinitionRegistry;
import com.mock.resource.definition.ResourceSchema;
import com.mock.resource.definition.SchemaBuilder;
import com.mock.resource.diagnostics.DispatchRecord;
import com.mock.resource.diagnostics.DispatchRecorder;
import com.mock.resource.factory.ResourceFactory;
import com.mock.resource.factory.UniquenessStrategy;
import com.mock.resource.logging.LogContext;
import com.mock.resource.metrics.MetricsService;
import com.mock.resource.metrics.NoOpMetricsService;
import com.mock.resource.query.QueryEngine;
import com.mock.resource.router.RequestRouter;
import com.mock.resource.router.RouteHandler;
import com.mock.resource.router.RouteRegistration;
import com.mock.resource.serialize.Document;
import com.mock.resource.serialize.GraphSerializer;
import com.mock.resource.store.ResourceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.IntFunction;
import java.util.function.Predicate;

/**
 * Main entry point for the mock resource engine.
 * Owns the scenario-scoped state (store, custom routes, dispatch log) and the
 * definitions, and exposes definition, creation, query and interception in one place.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * MockContext mock = MockContext.builder().build();
 *
 * mock.define("author", a -&gt; a.uniquify("name"));
 * mock.define("book", b -&gt; b
 *     .uniquify("name")
 *     .plain("author", () -&gt; mock.create("author")));
 *
 * // at the start of every scenario
 * mock.startScenario("Listing books");
 *
 * Record book = mock.create("book");
 * mock.register("GET", "/books/recent\\.xml", groups -&gt; mock.find("books"));
 *
 * Document document = mock.request("GET", "/books/" + book.getId() + ".xml");
 * </pre>
 *
 * <p>A context is not thread-safe. Scenarios running in parallel each need their own context.</p>
 */
public class MockContext {
    private static final Logger log = LoggerFactory.getLogger(MockContext.class);

    private final MockOptions options;
    private final DefinitionRegistry registry;
    private final ResourceStore store;
    private final ResourceFactory factory;
    private final QueryEngine queryEngine;
    private final GraphSerializer serializer;
    private final RequestRouter router;
    private final DispatchRecorder recorder;
    private String currentScenario;

    private MockContext(Builder builder) {
        this.options = builder.options;
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        this.registry = builder.registry != null ? builder.registry : new DefinitionRegistry();
        this.store = new ResourceStore();
        this.factory = new ResourceFactory(registry, store,
                new UniquenessStrategy(options.getMaxUniquenessAttempts()), metricsService);
        this.queryEngine = new QueryEngine(registry, store);
        this.serializer = new GraphSerializer(registry);
        this.recorder = new DispatchRecorder(options.isDiagnosticsEnabled());
        this.router = new RequestRouter(registry, queryEngine, serializer, metricsService, recorder,
                options.isDefaultRoutesEnabled());

        log.info("MockContext initialized (defaultRoutes={}, diagnostics={})",
                options.isDefaultRoutesEnabled(), options.isDiagnosticsEnabled());
    }

    // ========== Scenario lifecycle ==========

    /**
     * Resets scenario-scoped state: the store, custom routes and the dispatch log.
     * Call at the start of every scenario. Definitions are kept.
     */
    public void startScenario(String scenarioName) {
        try (LogContext ctx = LogContext.forScenario(LogContext.generateScenarioId(), scenarioName)) {
            store.clear();
            router.reset();
            recorder.clear();
            this.currentScenario = scenarioName;
            log.info("Scenario started: {}", scenarioName);
        }
    }

    /**
     * Drops all definitions. Default routes disappear with them since they are derived from
     * the registry on every dispatch. Custom routes and stored records are kept.
     */
    public void resetDefinitions() {
        registry.clear();
    }

    public String getCurrentScenario() {
        return currentScenario;
    }

    // ========== Definitions ==========

    public ResourceSchema define(String typeName, Consumer<SchemaBuilder> schema) {
        return registry.define(typeName, schema);
    }

    public ResourceSchema define(String typeName) {
        return registry.define(typeName);
    }

    public ResourceSchema schemaFor(String typeName) {
        return registry.schemaFor(typeName);
    }

    // ========== Creation ==========

    public Record create(String typeName) {
        return factory.create(typeName);
    }

    public Record create(String typeName, Map<String, ?> attributes) {
        return factory.create(typeName, attributes);
    }

    public List<Record> create(String typePlural, List<? extends Map<String, ?>> rows) {
        return factory.create(typePlural, rows);
    }

    public List<Record> stub(int count, String typePlural, Map<String, ?> like) {
        return factory.stub(count, typePlural, like);
    }

    public List<Record> stub(int count, String typePlural, Map<String, ?> like,
                             IntFunction<? extends Map<String, ?>> perRecord) {
        return factory.stub(count, typePlural, like, perRecord);
    }

    /**
     * Removes a single record without touching records that reference it.
     */
    public boolean remove(Record record) {
        return store.remove(record);
    }

    // ========== Query ==========

    public List<Record> find(String typeOrPlural) {
        return queryEngine.find(typeOrPlural);
    }

    public List<Record> find(String typeOrPlural, Predicate<Record> predicate) {
        return queryEngine.find(typeOrPlural, predicate);
    }

    public Record find(String typeOrPlural, int id) {
        return queryEngine.find(typeOrPlural, id);
    }

    public Optional<Record> findFirst(String typeOrPlural, Predicate<Record> predicate) {
        return queryEngine.findFirst(typeOrPlural, predicate);
    }

    // ========== Serialization ==========

    public Document serialize(Record record) {
        return serializer.serialize(record);
    }

    public Document serialize(Collection<Record> records, String rootName) {
        return serializer.serialize(records, rootName);
    }

    // ========== Interception ==========

    public RouteRegistration register(String verb, String pathPattern, RouteHandler handler) {
        return router.register(verb, pathPattern, handler);
    }

    /**
     * Dispatches a simulated request through the router.
     *
     * @throws com.mock.resource.router.RequestNotFoundException if no route matches
     */
    public Document request(String verb, String path) {
        return router.dispatch(verb, path);
    }

    /**
     * A simulated client bound to this context's router.
     */
    public ResourceClient client() {
        return new ResourceClient(router, options.getDefaultFormat());
    }

    // ========== Diagnostics ==========

    public List<DispatchRecord> dispatchLog() {
        return recorder.records();
    }

    // ========== Accessors ==========

    public MockOptions getOptions() {
        return options;
    }

    public DefinitionRegistry getRegistry() {
        return registry;
    }

    public ResourceStore getStore() {
        return store;
    }

    public RequestRouter getRouter() {
        return router;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private MockOptions options = MockOptions.defaults();
        private MetricsService metricsService;
        private DefinitionRegistry registry;

        public Builder options(MockOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Shares a registry set up once per process between contexts.
         */
        public Builder registry(DefinitionRegistry registry) {
            this.registry = registry;
            return this;
        }

        public MockContext build() {
            if (options == null) {
                throw new IllegalStateException("options must not be null");
            }
            return new MockContext(this);
        }
    }
}
