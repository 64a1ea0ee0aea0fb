package com.mock.resource.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RecordTest {

    @Test
    @DisplayName("Should assign id exactly once")
    void testAssignIdOnce() {
        Record record = new Record("book");
        assertFalse(record.isPersisted());

        record.assignId(1);

        assertTrue(record.isPersisted());
        assertEquals(new RecordKey("book", 1), record.key());
        assertThrows(IllegalStateException.class, () -> record.assignId(2));
    }

    @Test
    @DisplayName("Should reject non-positive ids")
    void testRejectInvalidId() {
        Record record = new Record("book");
        assertThrows(IllegalArgumentException.class, () -> record.assignId(0));
    }

    @Test
    @DisplayName("Should dereference single and to-many relations")
    void testDereference() {
        Record author = new Record("author", 1, Map.of("name", "Le Guin"));
        Record book = new Record("book", 1, Map.of("title", "Earthsea"));
        author.set("books", List.of(book));
        book.set("author", author);

        assertSame(author, book.getRecord("author"));
        assertEquals(List.of(book), author.getRecords("books"));
        assertEquals(List.of(), book.getRecords("reviews"));
        assertThrows(IllegalStateException.class, () -> book.getRecord("title"));
        assertThrows(IllegalStateException.class, () -> book.getNumber("title"));
    }

    @Test
    @DisplayName("Should order leading attributes and keep the rest in insertion order")
    void testOrderAttributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("extra", 1);
        attributes.put("title", "Dune");
        attributes.put("pages", 412);
        Record record = new Record("book", 1, attributes);

        record.orderAttributes(List.of("title", "pages", "missing"));

        assertEquals(List.of("title", "pages", "extra"), record.attributeNames());
    }

    @Test
    @DisplayName("Equality should be based on type and id")
    void testEquality() {
        Record a = new Record("book", 1, Map.of("title", "A"));
        Record b = new Record("book", 1, Map.of("title", "B"));
        Record c = new Record("author", 1, Map.of());

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, c);
        assertNotEquals(new Record("book"), new Record("book"));
    }

    @Test
    @DisplayName("Hash code should switch to the key once the id is assigned")
    void testHashCodeFollowsKey() {
        Record record = new Record("book");
        Set<Record> byIdentity = Collections.newSetFromMap(new IdentityHashMap<>());
        byIdentity.add(record);

        record.assignId(4);

        assertEquals(new Record("book", 4, Map.of()), record);
        assertEquals(new Record("book", 4, Map.of()).hashCode(), record.hashCode());
        assertEquals(new RecordKey("book", 4), record.key());
        assertTrue(byIdentity.contains(record));
    }
}
