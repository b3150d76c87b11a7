package com.govchat.policyscanner.scraper;

public class PluginNotFoundException extends RuntimeException {

    public PluginNotFoundException(String message) {
        super(message);
    }
}
