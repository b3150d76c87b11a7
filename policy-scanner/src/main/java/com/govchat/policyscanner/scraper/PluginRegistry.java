package com.govchat.policyscanner.scraper;

import com.govchat.policyscanner.model.ScraperConfig;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Maps plugin names to factories. One instance is created by the application
 * config and injected wherever plugins are needed.
 */
@Slf4j
public class PluginRegistry {

    private final Map<String, Registration> plugins = new ConcurrentHashMap<>();

    /**
     * Read-only view of one registration.
     *
     * @param name        registered name
     * @param className   simple name of the plugin class
     * @param packageName package of the plugin class
     * @param description free text shown to operators
     */
    public record PluginInfo(String name, String className, String packageName, String description) {
    }

    private record Registration(Class<? extends ScraperPlugin> type,
                                Function<ScraperConfig, ? extends ScraperPlugin> factory,
                                String description) {
    }

    public <T extends ScraperPlugin> void register(String name, Class<T> type,
                                                   Function<ScraperConfig, T> factory) {
        register(name, type, factory, null);
    }

    /**
     * Registers a plugin. An existing registration under the same name is
     * replaced, with a warning.
     */
    public <T extends ScraperPlugin> void register(String name, Class<T> type,
                                                   Function<ScraperConfig, T> factory, String description) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Plugin name must not be blank");
        }
        Registration previous = plugins.put(name, new Registration(type, factory, description));
        if (previous != null) {
            log.warn("Overwriting existing plugin: {}", name);
        }
        log.info("Registered plugin: {} -> {}", name, type.getSimpleName());
    }

    /**
     * Creates a new plugin instance for {@code config}.
     *
     * @throws PluginNotFoundException when nothing is registered under {@code name}
     */
    public ScraperPlugin get(String name, ScraperConfig config) {
        Registration registration = plugins.get(name);
        if (registration == null) {
            throw new PluginNotFoundException(
                    "Plugin '" + name + "' not found. Available plugins: " + String.join(", ", list()));
        }
        log.debug("Creating plugin instance: {}", name);
        try {
            return registration.factory().apply(config);
        } catch (RuntimeException e) {
            log.error("Failed to create plugin '{}': {}", name, e.getMessage());
            throw e;
        }
    }

    /** Registered names, sorted. */
    public List<String> list() {
        List<String> names = new ArrayList<>(plugins.keySet());
        names.sort(null);
        return names;
    }

    public Optional<PluginInfo> info(String name) {
        Registration registration = plugins.get(name);
        if (registration == null) {
            return Optional.empty();
        }
        Class<? extends ScraperPlugin> type = registration.type();
        String description = registration.description() != null
                ? registration.description()
                : "No documentation available";
        return Optional.of(new PluginInfo(name, type.getSimpleName(), type.getPackageName(), description));
    }

    public boolean unregister(String name) {
        if (plugins.remove(name) != null) {
            log.info("Unregistered plugin: {}", name);
            return true;
        }
        return false;
    }
}
