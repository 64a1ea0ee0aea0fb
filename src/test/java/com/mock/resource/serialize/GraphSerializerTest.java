package com.mock.resource.serialize;

import com.mock.resource.core.model.Record;
import com.mock.resource.definition.DefinitionRegistry;
import com.mock.resource.factory.ResourceFactory;
import com.mock.resource.factory.UniquenessStrategy;
import com.mock.resource.store.ResourceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GraphSerializer Tests")
class GraphSerializerTest {

    private DefinitionRegistry registry;
    private ResourceFactory factory;
    private GraphSerializer serializer;

    @BeforeEach
    void setUp() {
        registry = new DefinitionRegistry();
        factory = new ResourceFactory(registry, new ResourceStore(), new UniquenessStrategy(10));
        serializer = new GraphSerializer(registry);
    }

    @Nested
    @DisplayName("Tree shape")
    class TreeShape {

        @Test
        @DisplayName("Scalars should be emitted with id first")
        void scalars() {
            Record book = factory.create("book", Map.of("title", "Dune"));

            Document document = serializer.serialize(book);

            assertEquals("book", document.rootName());
            assertEquals(Map.of("id", 1, "title", "Dune"), document.content());
            assertEquals(List.of("id", "title"), new ArrayList<>(serializer.toTree(book).keySet()));
        }

        @Test
        @DisplayName("Acyclic references should be fully expanded")
        void acyclicReferences() {
            Record publisher = factory.create("publisher", Map.of("name", "Ace"));
            Record author = factory.create("author", Map.of("name", "Herbert", "publisher", publisher));
            Record book = factory.create("book", Map.of("title", "Dune", "author", author));

            Map<String, Object> tree = serializer.toTree(book);

            @SuppressWarnings("unchecked")
            Map<String, Object> authorNode = (Map<String, Object>) tree.get("author");
            assertEquals("Herbert", authorNode.get("name"));
            assertEquals(Map.of("id", 1, "name", "Ace"), authorNode.get("publisher"));
        }

        @Test
        @DisplayName("Null values and scalar collections should be emitted as is")
        void nullsAndScalarCollections() {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("subtitle", null);
            attributes.put("tags", List.of("sf", "classic"));
            Record book = factory.create("book", attributes);

            Map<String, Object> tree = serializer.toTree(book);

            assertTrue(tree.containsKey("subtitle"));
            assertNull(tree.get("subtitle"));
            assertEquals(List.of("sf", "classic"), tree.get("tags"));
        }

        @Test
        @DisplayName("Declared attributes should follow schema order, undeclared follow insertion order")
        void attributeOrder() {
            registry.define("book", b -> b.plain("title", "Dune").plain("pages", 412));
            Record book = factory.create("book", Map.of("genre", "sf"));
            book.set("rating", 5);
            book.set("pages", 500);

            assertEquals(List.of("id", "title", "pages", "genre", "rating"),
                    new ArrayList<>(serializer.toTree(book).keySet()));
        }

        @Test
        @DisplayName("Several roots should serialize into a list under the given root name")
        void severalRoots() {
            List<Record> books = factory.stub(2, "books", Map.of("title", "Dune"));

            Document document = serializer.serialize(books, "books");

            assertEquals("books", document.rootName());
            assertEquals(List.of(Map.of("id", 1, "title", "Dune"), Map.of("id", 2, "title", "Dune")),
                    document.content());
        }
    }

    @Nested
    @DisplayName("Cycle pruning")
    class CyclePruning {

        @Test
        @DisplayName("Author and books should prune the back-edge and terminate")
        void authorBooksCycle() {
            Record author = factory.create("author", Map.of("name", "Le Guin"));
            Record first = factory.create("book", Map.of("title", "Earthsea", "author", author));
            Record second = factory.create("book", Map.of("title", "The Dispossessed", "author", author));
            author.set("books", List.of(first, second));

            Map<String, Object> tree = serializer.toTree(author);

            @SuppressWarnings("unchecked")
            List<Map<String, Object>> books = (List<Map<String, Object>>) tree.get("books");
            assertEquals(2, books.size());
            Map<String, Object> firstBook = books.get(0);
            assertEquals("Earthsea", firstBook.get("title"));
            assertEquals(Map.of("id", 1, "name", "Le Guin"), firstBook.get("author"));
        }

        @Test
        @DisplayName("Serializing from the other side should prune the collection back-edge")
        void bookSideCycle() {
            Record author = factory.create("author", Map.of("name", "Le Guin"));
            Record book = factory.create("book", Map.of("title", "Earthsea", "author", author));
            Record other = factory.create("book", Map.of("title", "Lathe", "author", author));
            author.set("books", List.of(book, other));

            Map<String, Object> tree = serializer.toTree(book);

            @SuppressWarnings("unchecked")
            Map<String, Object> authorNode = (Map<String, Object>) tree.get("author");
            assertEquals("Le Guin", authorNode.get("name"));
            @SuppressWarnings("unchecked")
            List<Map<String, Object>> authorBooks = (List<Map<String, Object>>) authorNode.get("books");
            assertEquals(2, authorBooks.size());
            assertEquals(Map.of("id", 1, "title", "Earthsea"), authorBooks.get(0));
            assertEquals(Map.of("id", 2, "title", "Lathe", "author", Map.of("id", 1, "name", "Le Guin")),
                    authorBooks.get(1));
        }

        @Test
        @DisplayName("A self reference should be emitted once without the back-edge")
        void selfReference() {
            Record person = factory.create("person", Map.of("name", "Narcissus"));
            person.set("admires", person);

            Map<String, Object> tree = serializer.toTree(person);

            assertEquals(Map.of("id", 1, "name", "Narcissus"), tree.get("admires"));
        }

        @Test
        @DisplayName("Revisited records should keep relations that leave the path")
        void revisitedKeepsOtherRelations() {
            Record publisher = factory.create("publisher", Map.of("name", "Ace"));
            Record author = factory.create("author", Map.of("name", "Herbert", "publisher", publisher));
            Record book = factory.create("book", Map.of("title", "Dune", "author", author));
            author.set("latest", book);

            Map<String, Object> tree = serializer.toTree(author);

            @SuppressWarnings("unchecked")
            Map<String, Object> latest = (Map<String, Object>) tree.get("latest");
            @SuppressWarnings("unchecked")
            Map<String, Object> revisited = (Map<String, Object>) latest.get("author");
            assertEquals("Herbert", revisited.get("name"));
            assertFalse(revisited.containsKey("latest"));
            assertEquals(Map.of("id", 1, "name", "Ace"), revisited.get("publisher"));
        }

        @Test
        @DisplayName("Serializing an unchanged graph twice should yield identical output")
        void deterministic() {
            Record author = factory.create("author", Map.of("name", "Le Guin"));
            Record book = factory.create("book", Map.of("title", "Earthsea", "author", author));
            author.set("books", List.of(book));

            assertEquals(serializer.serialize(author), serializer.serialize(author));
            assertEquals(serializer.toTree(book).toString(), serializer.toTree(book).toString());
        }
    }
}
