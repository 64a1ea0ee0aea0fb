package com.mock.resource.factory;

import com.mock.resource.core.model.Record;
import com.mock.resource.definition.AttributeDefinition;
import com.mock.resource.definition.DefinitionRegistry;
import com.mock.resource.definition.ResourceSchema;
import com.mock.resource.metrics.MetricsService;
import com.mock.resource.metrics.NoOpMetricsService;
import com.mock.resource.store.ResourceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.IntFunction;

/**
 * Creates records by resolving schema defaults against caller overrides and
 * writing them into the {@link ResourceStore}.
 *
 * <p>Resolution of a single record:</p>
 * <ol>
 *   <li>Overrides are set on the record under construction, so dependent generators can read them.</li>
 *   <li>Every schema attribute absent from the overrides is resolved in declaration order.
 *       Generators may read earlier attributes and may create nested records.</li>
 *   <li>Uniquified attributes are passed through the {@link UniquenessStrategy}, and checked
 *       again just before storing, since later generators may have created records of the same type.</li>
 *   <li>Overrides always win, an explicit {@code null} included, and are stored as given.</li>
 *   <li>The record receives the next id of its type and is appended to the store.</li>
 * </ol>
 *
 * <p>Relation values are not type-checked.</p>
 */
public class ResourceFactory {
    private static final Logger log = LoggerFactory.getLogger(ResourceFactory.class);

    private final DefinitionRegistry registry;
    private final ResourceStore store;
    private final UniquenessStrategy uniqueness;
    private final MetricsService metricsService;

    public ResourceFactory(DefinitionRegistry registry, ResourceStore store, UniquenessStrategy uniqueness) {
        this(registry, store, uniqueness, new NoOpMetricsService());
    }

    public ResourceFactory(DefinitionRegistry registry, ResourceStore store, UniquenessStrategy uniqueness,
                           MetricsService metricsService) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.store = Objects.requireNonNull(store, "store is required");
        this.uniqueness = Objects.requireNonNull(uniqueness, "uniqueness is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Creates a record populated from schema defaults only.
     */
    public Record create(String typeName) {
        return create(typeName, Map.of());
    }

    /**
     * Creates a record, letting {@code overrides} win over schema defaults.
     */
    public Record create(String typeName, Map<String, ?> overrides) {
        Objects.requireNonNull(typeName, "typeName is required");
        Map<String, ?> given = overrides != null ? overrides : Map.of();
        ResourceSchema schema = registry.schemaFor(typeName);

        Record record = new Record(typeName);
        for (Map.Entry<String, ?> entry : given.entrySet()) {
            record.set(entry.getKey(), entry.getValue());
        }

        Map<AttributeDefinition, Object> uniqueCandidates = new LinkedHashMap<>();
        for (AttributeDefinition attribute : schema.attributes()) {
            if (given.containsKey(attribute.name())) {
                continue;
            }
            Object value = attribute.provider().resolve(record);
            if (attribute.unique()) {
                uniqueCandidates.put(attribute, value);
                value = uniqueness.ensureUnique(attribute, value, record, store.all(typeName));
            }
            if (value != null || attribute.provider().hasDefault()) {
                record.set(attribute.name(), value);
            }
        }
        recheckUnique(record, uniqueCandidates);
        record.orderAttributes(schema.attributeNames());

        store.add(record);
        metricsService.incrementRecordCreated(typeName);
        log.debug("Created {} with attributes {}", record.key(), record.attributeNames());
        return record;
    }

    /**
     * Creates one record per attribute map, preserving input order.
     * Accepts the plural collection name or the type name.
     */
    public List<Record> create(String typePlural, List<? extends Map<String, ?>> rows) {
        Objects.requireNonNull(rows, "rows is required");
        String typeName = resolveType(typePlural);
        List<Record> created = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            created.add(create(typeName, row));
        }
        return created;
    }

    /**
     * Creates {@code count} records sharing the {@code like} template.
     */
    public List<Record> stub(int count, String typePlural, Map<String, ?> like) {
        return stub(count, typePlural, like, index -> Map.of());
    }

    /**
     * Creates {@code count} records. For record {@code i} the per-record overrides win over
     * the {@code like} template, which wins over schema defaults.
     */
    public List<Record> stub(int count, String typePlural, Map<String, ?> like,
                             IntFunction<? extends Map<String, ?>> perRecord) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        Objects.requireNonNull(perRecord, "perRecord is required");
        String typeName = resolveType(typePlural);
        Map<String, ?> template = like != null ? like : Map.of();

        List<Record> created = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Map<String, Object> merged = new LinkedHashMap<>(template);
            Map<String, ?> specific = perRecord.apply(i);
            if (specific != null) {
                merged.putAll(specific);
            }
            created.add(create(typeName, merged));
        }
        log.debug("Stubbed {} records of type '{}'", count, typeName);
        return created;
    }

    /**
     * Generators resolved after a uniquified attribute may have stored records of the same
     * type, so values chosen earlier are checked again against the store as it is now.
     */
    private void recheckUnique(Record record, Map<AttributeDefinition, Object> uniqueCandidates) {
        if (uniqueCandidates.isEmpty()) {
            return;
        }
        List<Record> existing = store.all(record.getType());
        for (Map.Entry<AttributeDefinition, Object> entry : uniqueCandidates.entrySet()) {
            AttributeDefinition attribute = entry.getKey();
            Object current = record.get(attribute.name());
            if (!uniqueness.isTaken(attribute, current, existing)) {
                continue;
            }
            Object value = uniqueness.ensureUnique(attribute, entry.getValue(), record, existing);
            log.debug("{}.{} was taken by a nested record, replaced {} with {}",
                    record.getType(), attribute.name(), current, value);
            record.set(attribute.name(), value);
        }
    }

    private String resolveType(String typeOrPlural) {
        return registry.resolveTypeName(typeOrPlural, store.types());
    }
}
