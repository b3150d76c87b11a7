package com.govchat.policyscanner.model;

import java.util.Locale;

/**
 * File formats a discovered document can have. Only PDF, HTML and DOCX
 * can be turned into text; the others are stored but never indexed.
 */
public enum DocumentType {
    PDF("pdf"),
    HTML("html"),
    DOCX("docx"),
    XLSX("xlsx"),
    UNKNOWN("unknown");

    private final String value;

    DocumentType(String value) {
        this.value = value;
    }

    /** Lowercase wire/database form, also used as the stored file extension. */
    public String value() {
        return value;
    }

    public static DocumentType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String normalised = value.trim().toLowerCase(Locale.ROOT);
        for (DocumentType type : values()) {
            if (type.value.equals(normalised)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return value;
    }
}
