package com.govchat.policyscanner.scraper.validation;

/**
 * Malformed URL, date, identifier or configuration value. Raised when a value
 * object is constructed and never retried.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
