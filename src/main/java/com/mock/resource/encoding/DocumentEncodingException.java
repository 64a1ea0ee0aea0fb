package com.mock.resource.encoding;

import com.mock.resource.core.MockResourceException;

/**
 * Runtime exception thrown when a document cannot be encoded or decoded.
 */
public class DocumentEncodingException extends MockResourceException {

    public DocumentEncodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
