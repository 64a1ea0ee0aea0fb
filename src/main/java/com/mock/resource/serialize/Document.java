package com.mock.resource.serialize;

/**
 * A serialized response document: a generic hierarchical value made of
 * {@link java.util.Map}s, {@link java.util.List}s and scalars, plus the name of its
 * root element. Textual encoding is left to {@link com.mock.resource.encoding.DocumentEncoder}s.
 *
 * @param rootName the root element name (type name for a single record, collection
 *                 name for a list), or {@code null} when unknown
 * @param content  the hierarchical content, may be {@code null}
 */
public record Document(String rootName, Object content) {

    private static final Document EMPTY = new Document(null, null);

    public static Document empty() {
        return EMPTY;
    }

    /**
     * Wraps a handler-supplied value that is passed through without serialization.
     */
    public static Document raw(Object content) {
        return new Document(null, content);
    }

    public boolean isEmpty() {
        return content == null;
    }
}
