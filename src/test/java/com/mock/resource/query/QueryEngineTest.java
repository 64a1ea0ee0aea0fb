package com.mock.resource.query;

import com.mock.resource.core.model.Record;
import com.mock.resource.definition.DefinitionRegistry;
import com.mock.resource.factory.ResourceFactory;
import com.mock.resource.factory.UniquenessStrategy;
import com.mock.resource.store.ResourceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryEngineTest {

    private ResourceFactory factory;
    private QueryEngine queryEngine;
    private Record leGuin;
    private Record herbert;

    @BeforeEach
    void setUp() {
        DefinitionRegistry registry = new DefinitionRegistry();
        ResourceStore store = new ResourceStore();
        factory = new ResourceFactory(registry, store, new UniquenessStrategy(10));
        queryEngine = new QueryEngine(registry, store);

        registry.define("author", a -> a.uniquify("name"));
        registry.define("book", b -> b.plain("pages", 300));

        leGuin = factory.create("author", Map.of("name", "Ursula K. Le Guin"));
        herbert = factory.create("author", Map.of("name", "Frank Herbert"));
        factory.create("book", Map.of("title", "The Dispossessed", "pages", 387, "author", leGuin));
        factory.create("book", Map.of("title", "Dune", "pages", 412, "author", herbert));
        factory.create("book", Map.of("title", "The Lathe of Heaven", "pages", 184, "author", leGuin));
    }

    @Test
    @DisplayName("find should return all records in creation order, by type or plural")
    void testFindAll() {
        List<Record> books = queryEngine.find("books");

        assertEquals(3, books.size());
        assertEquals("The Dispossessed", books.get(0).get("title"));
        assertEquals(books, queryEngine.find("book"));
        assertEquals(3, queryEngine.count("books"));
    }

    @Test
    @DisplayName("Predicates should compose substring, numeric and relational conditions")
    void testPredicate() {
        List<Record> result = queryEngine.find("books", book ->
                book.getString("title").contains("The")
                        && book.getNumber("pages").intValue() > 200
                        && book.getRecord("author").getString("name").startsWith("Ursula"));

        assertEquals(1, result.size());
        assertEquals("The Dispossessed", result.get(0).get("title"));
    }

    @Test
    @DisplayName("find by id should return the record or fail with RecordNotFoundException")
    void testFindById() {
        assertSame(herbert, queryEngine.find("authors", 2));

        RecordNotFoundException e = assertThrows(RecordNotFoundException.class,
                () -> queryEngine.find("authors", 42));
        assertEquals("author", e.getTypeName());
        assertEquals(42, e.getId());
        assertTrue(e.getMessage().contains("author"));
    }

    @Test
    @DisplayName("findFirst should return the earliest match")
    void testFindFirst() {
        assertEquals("The Dispossessed",
                queryEngine.findFirst("books", b -> b.getRecord("author") == leGuin).orElseThrow().get("title"));
        assertTrue(queryEngine.findFirst("books", b -> b.getNumber("pages").intValue() > 1000).isEmpty());
    }

    @Test
    @DisplayName("Types without records should yield empty lists")
    void testEmptyType() {
        assertTrue(queryEngine.find("reviews").isEmpty());
        assertTrue(queryEngine.find("reviews", r -> true).isEmpty());
    }
}
