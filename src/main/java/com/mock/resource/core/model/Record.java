package com.mock.resource.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single mock resource instance.
 *
 * <p>A record carries a type tag, an id unique within its type, and an ordered
 * mapping from attribute name to value. A value is either a scalar, a reference
 * to another {@link Record}, or a collection of records. References are plain
 * associations: the referenced record is owned by the store, not by this record.</p>
 *
 * <p>Records are created by the factory. Afterwards test code may mutate
 * attributes directly through {@link #set(String, Object)}. Equality and hash code
 * depend on the id, see {@link #equals(Object)}.</p>
 */
public class Record {
    private final String type;
    private int id;
    private final Map<String, Object> attributes;

    public Record(String type) {
        this(type, 0, new LinkedHashMap<>());
    }

    public Record(String type, int id, Map<String, Object> attributes) {
        this.type = Objects.requireNonNull(type, "type is required");
        this.id = id;
        this.attributes = new LinkedHashMap<>(attributes);
    }

    public String getType() {
        return type;
    }

    public int getId() {
        return id;
    }

    /**
     * Assigns the id. Only the store calls this, once, when the record is appended.
     */
    public void assignId(int id) {
        if (this.id != 0) {
            throw new IllegalStateException("Record " + key() + " already has an id");
        }
        if (id <= 0) {
            throw new IllegalArgumentException("id must be > 0");
        }
        this.id = id;
    }

    public boolean isPersisted() {
        return id > 0;
    }

    public RecordKey key() {
        return new RecordKey(type, id);
    }

    public Object get(String name) {
        return attributes.get(name);
    }

    public boolean has(String name) {
        return attributes.containsKey(name);
    }

    public Record set(String name, Object value) {
        Objects.requireNonNull(name, "name is required");
        attributes.put(name, value);
        return this;
    }

    /**
     * Moves the named attributes to the front, in the given order. Names that are
     * not set are skipped; remaining attributes keep their insertion order.
     */
    public void orderAttributes(List<String> leadingNames) {
        Map<String, Object> ordered = new LinkedHashMap<>();
        for (String name : leadingNames) {
            if (attributes.containsKey(name)) {
                ordered.put(name, attributes.get(name));
            }
        }
        for (Map.Entry<String, Object> entry : attributes.entrySet()) {
            ordered.putIfAbsent(entry.getKey(), entry.getValue());
        }
        attributes.clear();
        attributes.putAll(ordered);
    }

    public String getString(String name) {
        Object value = attributes.get(name);
        return value != null ? value.toString() : null;
    }

    public Number getNumber(String name) {
        Object value = attributes.get(name);
        if (value == null || value instanceof Number) {
            return (Number) value;
        }
        throw new IllegalStateException("Attribute '" + name + "' of " + key() + " is not a number");
    }

    /**
     * Dereferences a single-valued relation.
     */
    public Record getRecord(String name) {
        Object value = attributes.get(name);
        if (value == null || value instanceof Record) {
            return (Record) value;
        }
        throw new IllegalStateException("Attribute '" + name + "' of " + key() + " is not a record reference");
    }

    /**
     * Dereferences a to-many relation. Returns an empty list when the attribute is unset.
     */
    public List<Record> getRecords(String name) {
        Object value = attributes.get(name);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            List<Record> records = new ArrayList<>(collection.size());
            for (Object element : collection) {
                if (!(element instanceof Record record)) {
                    throw new IllegalStateException("Attribute '" + name + "' of " + key()
                            + " contains a non-record element");
                }
                records.add(record);
            }
            return records;
        }
        throw new IllegalStateException("Attribute '" + name + "' of " + key() + " is not a record collection");
    }

    /**
     * Attribute names in insertion order.
     */
    public List<String> attributeNames() {
        return List.copyOf(attributes.keySet());
    }

    /**
     * Read-only view of the attributes in insertion order.
     */
    public Map<String, Object> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Persisted records are equal when type and id match. A record without an id is only
     * equal to itself.
     *
     * <p>The hash code follows the same rule, so it changes once the store assigns the id.
     * A record placed in a hash-based collection before it is stored (for example by a
     * generator) is no longer found there afterwards. Key such lookups by {@link #key()}
     * after storing, or use identity-based collections while the record is being built.</p>
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Record record = (Record) o;
        if (id == 0 || record.id == 0) {
            return false;
        }
        return id == record.id && type.equals(record.type);
    }

    @Override
    public int hashCode() {
        return id == 0 ? System.identityHashCode(this) : Objects.hash(type, id);
    }

    @Override
    public String toString() {
        return "Record{" +
                "type='" + type + '\'' +
                ", id=" + id +
                ", attributes=" + attributes.keySet() +
                '}';
    }
}
