package com.govchat.policyscanner.search;

/**
 * The search index could not be reached or rejected a request.
 */
public class SearchIndexException extends RuntimeException {

    public SearchIndexException(String message) {
        super(message);
    }

    public SearchIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
