package com.mock.resource.definition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Holds per-type attribute schemas and their default-generation rules.
 *
 * <p>Definitions are additive: defining a type again appends attributes to the
 * existing schema. A type that was never defined still resolves to an empty
 * schema, so ad-hoc types can be created without a definition.</p>
 */
public class DefinitionRegistry {
    private static final Logger log = LoggerFactory.getLogger(DefinitionRegistry.class);

    private final Map<String, ResourceSchema> schemas = new LinkedHashMap<>();

    /**
     * Registers a type without attributes. The type still receives default routes.
     */
    public ResourceSchema define(String typeName) {
        return define(typeName, builder -> { });
    }

    /**
     * Registers or extends a type.
     *
     * @throws DefinitionConflictException if an existing attribute is redeclared differently
     */
    public ResourceSchema define(String typeName, Consumer<SchemaBuilder> schema) {
        Objects.requireNonNull(typeName, "typeName is required");
        Objects.requireNonNull(schema, "schema is required");
        if (typeName.isBlank()) {
            throw new IllegalArgumentException("typeName must not be blank");
        }

        SchemaBuilder builder = new SchemaBuilder();
        schema.accept(builder);
        List<AttributeDefinition> additions = builder.build();

        ResourceSchema current = schemas.getOrDefault(typeName, ResourceSchema.empty(typeName));
        ResourceSchema extended = current.extend(additions);
        schemas.put(typeName, extended);

        log.debug("Defined type '{}' with attributes {}", typeName, extended.attributeNames());
        return extended;
    }

    /**
     * Returns the accumulated schema, or an empty schema for an undefined type.
     */
    public ResourceSchema schemaFor(String typeName) {
        ResourceSchema schema = schemas.get(typeName);
        if (schema == null) {
            log.trace("Type '{}' has no definition, using empty schema", typeName);
            return ResourceSchema.empty(typeName);
        }
        return schema;
    }

    public boolean isDefined(String typeName) {
        return schemas.containsKey(typeName);
    }

    /**
     * Defined type names in first-definition order.
     */
    public List<String> definedTypes() {
        return List.copyOf(schemas.keySet());
    }

    /**
     * Maps a singular or plural name to a type name, considering defined types
     * plus any additional known types (for example types present only in the store).
     */
    public String resolveTypeName(String typeOrPlural, Collection<String> additionalTypes) {
        Set<String> known = new LinkedHashSet<>(schemas.keySet());
        known.addAll(additionalTypes);
        return TypeNames.singularize(typeOrPlural, known);
    }

    public String resolveTypeName(String typeOrPlural) {
        return resolveTypeName(typeOrPlural, List.of());
    }

    /**
     * Drops every definition.
     */
    public void clear() {
        schemas.clear();
        log.debug("Cleared all type definitions");
    }
}
