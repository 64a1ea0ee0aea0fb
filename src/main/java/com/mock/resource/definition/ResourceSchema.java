package com.mock.resource.definition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, ordered attribute schema of a resource type.
 * Extending a schema returns a new instance; declaration order is preserved.
 */
public final class ResourceSchema {

    private final String typeName;
    private final Map<String, AttributeDefinition> attributes;

    private ResourceSchema(String typeName, Map<String, AttributeDefinition> attributes) {
        this.typeName = Objects.requireNonNull(typeName, "typeName is required");
        this.attributes = attributes;
    }

    public static ResourceSchema empty(String typeName) {
        return new ResourceSchema(typeName, Map.of());
    }

    public String getTypeName() {
        return typeName;
    }

    public List<AttributeDefinition> attributes() {
        return List.copyOf(attributes.values());
    }

    public List<String> attributeNames() {
        return List.copyOf(attributes.keySet());
    }

    public Optional<AttributeDefinition> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    public int size() {
        return attributes.size();
    }

    /**
     * Returns a schema with the given definitions appended.
     * Redeclaring an attribute with an identical definition keeps its original position.
     *
     * @throws DefinitionConflictException if an attribute is redeclared with a different definition
     */
    public ResourceSchema extend(List<AttributeDefinition> additions) {
        Map<String, AttributeDefinition> merged = new LinkedHashMap<>(attributes);
        for (AttributeDefinition addition : additions) {
            AttributeDefinition existing = merged.get(addition.name());
            if (existing == null) {
                merged.put(addition.name(), addition);
            } else if (!existing.equals(addition)) {
                throw new DefinitionConflictException(typeName, addition.name());
            }
        }
        return new ResourceSchema(typeName, merged);
    }

    @Override
    public String toString() {
        return "ResourceSchema{" +
                "typeName='" + typeName + '\'' +
                ", attributes=" + attributes.keySet() +
                '}';
    }
}
