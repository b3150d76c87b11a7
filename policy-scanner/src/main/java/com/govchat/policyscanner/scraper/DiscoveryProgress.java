package com.govchat.policyscanner.scraper;

import com.govchat.policyscanner.model.DocumentMetadata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates the outcome of one discovery run as it happens, so that
 * documents found before a failure are not lost.
 */
public class DiscoveryProgress {

    private final List<DocumentMetadata> documents = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private int pagesScraped;

    public void addDocuments(List<DocumentMetadata> pageDocuments) {
        documents.addAll(pageDocuments);
    }

    public void addError(String error) {
        errors.add(error);
    }

    public void pageScraped() {
        pagesScraped++;
    }

    public List<DocumentMetadata> getDocuments() {
        return Collections.unmodifiableList(documents);
    }

    public List<String> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public int getPagesScraped() {
        return pagesScraped;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
