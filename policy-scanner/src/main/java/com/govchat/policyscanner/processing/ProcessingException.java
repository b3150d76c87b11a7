package com.govchat.policyscanner.processing;

/**
 * A single document could not be turned into text: missing or unreadable
 * file, unsupported type, or nothing extractable.
 */
public class ProcessingException extends RuntimeException {

    public ProcessingException(String message) {
        super(message);
    }

    public ProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
