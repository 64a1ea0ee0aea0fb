package com.mock.resource.serialize;

import com.mock.resource.core.model.Record;
import com.mock.resource.core.model.RecordKey;
import com.mock.resource.definition.DefinitionRegistry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Converts rooted record graphs, possibly cyclic, into acyclic tree-shaped documents.
 *
 * <p>Traversal is depth-first per root and keeps the set of records on the active
 * path (keyed by {@link RecordKey}):</p>
 * <ul>
 *   <li>scalars are emitted as is</li>
 *   <li>a reference off the path is pushed, fully expanded and popped</li>
 *   <li>a reference already on the path is emitted without the attributes that would
 *       re-enter the path; its scalars and its other relations are kept</li>
 *   <li>collections are expanded element by element under the same rules</li>
 * </ul>
 *
 * <p>Each record emits {@code id} first, then its declared attributes in schema order,
 * then any undeclared attributes in insertion order. Output is deterministic for an
 * unchanged graph.</p>
 */
public class GraphSerializer {

    static final String ID_ATTRIBUTE = "id";

    private final DefinitionRegistry registry;

    public GraphSerializer(DefinitionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry is required");
    }

    /**
     * Serializes a single root record. The root element is named after its type.
     */
    public Document serialize(Record root) {
        Objects.requireNonNull(root, "root is required");
        return new Document(root.getType(), toTree(root));
    }

    /**
     * Serializes several roots into a list; every root is traversed with a fresh path.
     */
    public Document serialize(Collection<Record> roots, String rootName) {
        Objects.requireNonNull(roots, "roots is required");
        List<Object> content = new ArrayList<>(roots.size());
        for (Record root : roots) {
            content.add(toTree(root));
        }
        return new Document(rootName, content);
    }

    /**
     * Expands one root record into a tree of maps, lists and scalars.
     */
    public Map<String, Object> toTree(Record root) {
        Set<RecordKey> path = new HashSet<>();
        return expand(root, path);
    }

    private Map<String, Object> expand(Record record, Set<RecordKey> path) {
        RecordKey key = record.key();
        if (path.contains(key)) {
            return expandRevisited(record, path);
        }
        path.add(key);
        try {
            Map<String, Object> node = new LinkedHashMap<>();
            node.put(ID_ATTRIBUTE, record.getId());
            for (String name : orderedAttributes(record)) {
                node.put(name, value(record.get(name), path));
            }
            return node;
        } finally {
            path.remove(key);
        }
    }

    /**
     * Emits a record that is already on the active path, dropping the back-edges.
     */
    private Map<String, Object> expandRevisited(Record record, Set<RecordKey> path) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put(ID_ATTRIBUTE, record.getId());
        for (String name : orderedAttributes(record)) {
            Object value = record.get(name);
            if (reentersPath(value, path)) {
                continue;
            }
            node.put(name, value(value, path));
        }
        return node;
    }

    private Object value(Object value, Set<RecordKey> path) {
        if (value instanceof Record reference) {
            return expand(reference, path);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> elements = new ArrayList<>(collection.size());
            for (Object element : collection) {
                elements.add(value(element, path));
            }
            return elements;
        }
        return value;
    }

    private boolean reentersPath(Object value, Set<RecordKey> path) {
        if (value instanceof Record reference) {
            return path.contains(reference.key());
        }
        if (value instanceof Collection<?> collection) {
            for (Object element : collection) {
                if (element instanceof Record reference && path.contains(reference.key())) {
                    return true;
                }
            }
        }
        return false;
    }

    private List<String> orderedAttributes(Record record) {
        List<String> declared = registry.schemaFor(record.getType()).attributeNames();
        List<String> ordered = new ArrayList<>(record.attributeNames().size());
        for (String name : declared) {
            if (record.has(name) && !ID_ATTRIBUTE.equals(name)) {
                ordered.add(name);
            }
        }
        for (String name : record.attributeNames()) {
            if (!ordered.contains(name) && !ID_ATTRIBUTE.equals(name)) {
                ordered.add(name);
            }
        }
        return ordered;
    }
}
