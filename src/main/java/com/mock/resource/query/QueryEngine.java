package com.mock.resource.query;

import com.mock.resource.core.model.Record;
import com.mock.resource.definition.DefinitionRegistry;
import com.mock.resource.store.ResourceStore;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Predicate- and id-based lookup over the {@link ResourceStore}.
 * Every lookup accepts either the type name or its plural collection name.
 * Lookups are linear scans in creation order.
 */
public class QueryEngine {

    private final DefinitionRegistry registry;
    private final ResourceStore store;

    public QueryEngine(DefinitionRegistry registry, ResourceStore store) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
        this.store = Objects.requireNonNull(store, "store is required");
    }

    /**
     * All records of a type, in creation order.
     */
    public List<Record> find(String typeOrPlural) {
        return store.all(resolveType(typeOrPlural));
    }

    /**
     * Records of a type matching the predicate, in creation order.
     */
    public List<Record> find(String typeOrPlural, Predicate<Record> predicate) {
        Objects.requireNonNull(predicate, "predicate is required");
        return find(typeOrPlural).stream()
                .filter(predicate)
                .toList();
    }

    /**
     * The record with the given id.
     *
     * @throws RecordNotFoundException if the type has no record with that id
     */
    public Record find(String typeOrPlural, int id) {
        String type = resolveType(typeOrPlural);
        return store.get(type, id)
                .orElseThrow(() -> new RecordNotFoundException(type, id));
    }

    /**
     * The first record of a type matching the predicate.
     */
    public Optional<Record> findFirst(String typeOrPlural, Predicate<Record> predicate) {
        Objects.requireNonNull(predicate, "predicate is required");
        return find(typeOrPlural).stream()
                .filter(predicate)
                .findFirst();
    }

    public int count(String typeOrPlural) {
        return store.count(resolveType(typeOrPlural));
    }

    /**
     * Resolves a singular or plural name against defined and stored types.
     */
    public String resolveType(String typeOrPlural) {
        Objects.requireNonNull(typeOrPlural, "typeOrPlural is required");
        return registry.resolveTypeName(typeOrPlural, store.types());
    }
}
