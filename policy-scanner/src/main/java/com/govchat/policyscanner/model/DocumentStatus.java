package com.govchat.policyscanner.model;

import java.util.Locale;

/**
 * Lifecycle of a persisted document.
 *
 * pending → processing → indexed | failed. A forced reindex moves indexed or
 * failed documents back into processing. archived is terminal: duplicates end
 * up there, and indexing runs skip it unless asked for it explicitly.
 */
public enum DocumentStatus {
    PENDING,
    PROCESSING,
    INDEXED,
    FAILED,
    ARCHIVED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static DocumentStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return PENDING;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown document status: " + value, e);
        }
    }

    @Override
    public String toString() {
        return value();
    }
}
