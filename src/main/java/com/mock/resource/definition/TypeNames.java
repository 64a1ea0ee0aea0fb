package com.mock.resource.definition;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Collection/member naming convention shared by the factory, query engine and router.
 * A type {@code book} is addressed by the collection name {@code books}.
 */
public final class TypeNames {

    private static final List<String> SIBILANT_PLURALS = List.of("sses", "xes", "ches", "shes");

    private TypeNames() {
    }

    /**
     * Collection name of a type.
     */
    public static String pluralize(String typeName) {
        Objects.requireNonNull(typeName, "typeName is required");
        return typeName + "s";
    }

    /**
     * Resolves a singular or plural name to a type name.
     *
     * <p>Known types win: a name that is itself known is returned as is, then the
     * {@code s}, {@code es} and {@code ies} suffixes are tried against the known types.
     * Unknown names lose a trailing {@code s} so ad-hoc plurals still map to one type.</p>
     */
    public static String singularize(String name, Collection<String> knownTypes) {
        Objects.requireNonNull(name, "name is required");
        if (knownTypes.contains(name)) {
            return name;
        }
        if (name.endsWith("ies")) {
            String candidate = name.substring(0, name.length() - 3) + "y";
            if (knownTypes.contains(candidate)) {
                return candidate;
            }
        }
        if (name.endsWith("es")) {
            String candidate = name.substring(0, name.length() - 2);
            if (knownTypes.contains(candidate)) {
                return candidate;
            }
        }
        if (name.endsWith("s") && name.length() > 1) {
            return name.substring(0, name.length() - 1);
        }
        return name;
    }

    /**
     * Element name of one member of a collection, for example {@code book} for {@code books}
     * and {@code category} for {@code categories}. Names without a plural suffix are returned as is.
     */
    public static String elementName(String collectionName) {
        Objects.requireNonNull(collectionName, "collectionName is required");
        if (collectionName.endsWith("ies") && collectionName.length() > 3) {
            return collectionName.substring(0, collectionName.length() - 3) + "y";
        }
        for (String suffix : SIBILANT_PLURALS) {
            if (collectionName.endsWith(suffix) && collectionName.length() > suffix.length()) {
                return collectionName.substring(0, collectionName.length() - 2);
            }
        }
        if (collectionName.endsWith("s") && !collectionName.endsWith("ss") && collectionName.length() > 1) {
            return collectionName.substring(0, collectionName.length() - 1);
        }
        return collectionName;
    }
}
