package com.mock.resource.encoding;

import com.mock.resource.serialize.Document;

/**
 * Renders a serialized {@link Document} as text for the simulated client.
 */
public interface DocumentEncoder {

    /**
     * @throws DocumentEncodingException if the content cannot be rendered
     */
    String encode(Document document);

    String contentType();

    /**
     * Format suffix used in request paths, e.g. {@code json} for {@code /books.json}.
     */
    String format();
}
