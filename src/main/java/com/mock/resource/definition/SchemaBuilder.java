package com.mock.resource.definition;

import com.mock.resource.core.model.Record;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Collects attribute declarations for {@link DefinitionRegistry#define}.
 *
 * <pre>
 * registry.define("book", b -&gt; b
 *     .uniquify("name")
 *     .plain("pages", 320)
 *     .plain("author", () -&gt; factory.create("author"))
 *     .dependent("slug", book -&gt; book.getString("name").toLowerCase()));
 * </pre>
 */
public class SchemaBuilder {

    private final List<AttributeDefinition> definitions = new ArrayList<>();

    /**
     * Declares an attribute without a default.
     */
    public SchemaBuilder plain(String name) {
        return add(new AttributeDefinition(name, DefaultProvider.none(), false));
    }

    /**
     * Declares an attribute with a literal default.
     */
    public SchemaBuilder plain(String name, Object literal) {
        return add(new AttributeDefinition(name, DefaultProvider.literal(literal), false));
    }

    /**
     * Declares an attribute whose default is generated on every creation.
     */
    public SchemaBuilder plain(String name, Supplier<?> generator) {
        return add(new AttributeDefinition(name, DefaultProvider.generator(generator), false));
    }

    /**
     * Declares an attribute whose default is computed from the partially built record.
     */
    public SchemaBuilder dependent(String name, Function<Record, ?> generator) {
        return add(new AttributeDefinition(name, DefaultProvider.dependent(generator), false));
    }

    /**
     * Declares a unique attribute with a generated "&lt;type&gt; &lt;name&gt; &lt;n&gt;" default.
     */
    public SchemaBuilder uniquify(String name) {
        return add(new AttributeDefinition(name, DefaultProvider.none(), true));
    }

    public SchemaBuilder uniquify(String name, Supplier<?> generator) {
        return add(new AttributeDefinition(name, DefaultProvider.generator(generator), true));
    }

    public SchemaBuilder uniquify(String name, Function<Record, ?> generator) {
        return add(new AttributeDefinition(name, DefaultProvider.dependent(generator), true));
    }

    List<AttributeDefinition> build() {
        return List.copyOf(definitions);
    }

    private SchemaBuilder add(AttributeDefinition definition) {
        definitions.add(definition);
        return this;
    }
}
