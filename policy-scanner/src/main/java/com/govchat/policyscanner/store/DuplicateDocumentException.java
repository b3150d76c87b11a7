package com.govchat.policyscanner.store;

/**
 * A document with the same content hash, or the same source and external id,
 * is already stored.
 */
public class DuplicateDocumentException extends RuntimeException {

    public DuplicateDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
