package com.mock.resource.encoding;

import java.util.Locale;

/**
 * Picks the encoder matching the format suffix of a request path.
 */
public final class DocumentEncoders {

    private static final JsonDocumentEncoder JSON = new JsonDocumentEncoder();
    private static final XmlDocumentEncoder XML = new XmlDocumentEncoder();

    private DocumentEncoders() {
    }

    public static JsonDocumentEncoder json() {
        return JSON;
    }

    public static XmlDocumentEncoder xml() {
        return XML;
    }

    /**
     * XML for {@code .xml} paths, JSON otherwise. The query string is ignored.
     */
    public static DocumentEncoder forPath(String path) {
        String withoutQuery = path;
        int query = path.indexOf('?');
        if (query >= 0) {
            withoutQuery = path.substring(0, query);
        }
        return withoutQuery.toLowerCase(Locale.ROOT).endsWith(".xml") ? XML : JSON;
    }

    /**
     * Encoder for a format name such as {@code json} or {@code xml}.
     */
    public static DocumentEncoder forFormat(String format) {
        return "xml".equalsIgnoreCase(format) ? XML : JSON;
    }
}
