package com.mock.resource.store;

import com.mock.resource.core.model.Record;
import com.mock.resource.core.model.RecordKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory store of created records.
 *
 * <p>Records are kept per type in creation order, together with a flat index keyed
 * by {@link RecordKey}. Each type has its own id sequence starting at 1; ids are
 * never reused, even after a record is removed. The store is cleared wholesale at
 * the start of a scenario.</p>
 *
 * <p>Not thread-safe: one store belongs to one running scenario.</p>
 */
public class ResourceStore {
    private static final Logger log = LoggerFactory.getLogger(ResourceStore.class);

    private final Map<String, List<Record>> recordsByType = new LinkedHashMap<>();
    private final Map<String, Integer> nextIds = new HashMap<>();
    private final Map<RecordKey, Record> index = new HashMap<>();

    /**
     * Assigns the next id of the record's type and appends it.
     */
    public Record add(Record record) {
        Objects.requireNonNull(record, "record is required");
        String type = record.getType();
        int id = nextIds.getOrDefault(type, 1);
        record.assignId(id);
        nextIds.put(type, id + 1);
        recordsByType.computeIfAbsent(type, t -> new ArrayList<>()).add(record);
        index.put(record.key(), record);
        log.trace("Stored {}", record.key());
        return record;
    }

    /**
     * All records of a type, in creation order.
     */
    public List<Record> all(String type) {
        List<Record> records = recordsByType.get(type);
        return records == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(records));
    }

    public Optional<Record> get(RecordKey key) {
        return Optional.ofNullable(index.get(key));
    }

    public Optional<Record> get(String type, int id) {
        return get(new RecordKey(type, id));
    }

    /**
     * Removes a single record. Records referencing it are left untouched.
     */
    public boolean remove(Record record) {
        Objects.requireNonNull(record, "record is required");
        Record removed = index.remove(record.key());
        if (removed == null) {
            return false;
        }
        recordsByType.get(record.getType()).remove(removed);
        log.trace("Removed {}", record.key());
        return true;
    }

    public int count(String type) {
        List<Record> records = recordsByType.get(type);
        return records == null ? 0 : records.size();
    }

    public int size() {
        return index.size();
    }

    /**
     * Types that have ever held a record since the last clear, in first-use order.
     */
    public List<String> types() {
        return List.copyOf(recordsByType.keySet());
    }

    /**
     * The id the next record of the type will receive.
     */
    public int peekNextId(String type) {
        return nextIds.getOrDefault(type, 1);
    }

    /**
     * Drops every record and resets all id sequences.
     */
    public void clear() {
        int dropped = index.size();
        recordsByType.clear();
        nextIds.clear();
        index.clear();
        log.debug("Cleared resource store ({} records dropped)", dropped);
    }
}
