package com.govchat.policyscanner.scraper;

import java.io.IOException;

/**
 * The target path is excluded by the site's robots.txt; the request was not sent.
 */
public class RobotsDisallowedException extends IOException {

    public RobotsDisallowedException(String url) {
        super("Disallowed by robots.txt: " + url);
    }
}
