package com.govchat.policyscanner.scraper.middleware;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Cycles through a fixed pool of desktop browser User-Agent strings.
 */
public class UserAgentRotator {

    public static final List<String> DEFAULT_USER_AGENTS = List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:121.0) Gecko/20100101 Firefox/121.0",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10.15; rv:121.0) Gecko/20100101 Firefox/121.0",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36 Edg/120.0.0.0",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/17.2 Safari/605.1.15"
    );

    private final List<String> userAgents;
    private int currentIndex;

    public UserAgentRotator() {
        this(DEFAULT_USER_AGENTS);
    }

    public UserAgentRotator(List<String> userAgents) {
        if (userAgents == null || userAgents.isEmpty()) {
            throw new IllegalArgumentException("userAgents must not be empty");
        }
        this.userAgents = List.copyOf(userAgents);
    }

    /** Next agent in round-robin order. */
    public synchronized String getNext() {
        String agent = userAgents.get(currentIndex);
        currentIndex = (currentIndex + 1) % userAgents.size();
        return agent;
    }

    public String getRandom() {
        return userAgents.get(ThreadLocalRandom.current().nextInt(userAgents.size()));
    }

    public List<String> getUserAgents() {
        return userAgents;
    }
}
