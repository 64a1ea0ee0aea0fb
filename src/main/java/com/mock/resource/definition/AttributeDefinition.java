package com.mock.resource.definition;

import java.util.Objects;

/**
 * Declared attribute of a resource type.
 *
 * @param name     the attribute name
 * @param provider the default-generation rule
 * @param unique   whether generated values must be distinct within the type
 */
public record AttributeDefinition(String name, DefaultProvider provider, boolean unique) {

    public AttributeDefinition {
        Objects.requireNonNull(name, "name is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("attribute name must not be blank");
        }
        provider = provider != null ? provider : DefaultProvider.none();
    }

    public static AttributeDefinition plain(String name) {
        return new AttributeDefinition(name, DefaultProvider.none(), false);
    }
}
