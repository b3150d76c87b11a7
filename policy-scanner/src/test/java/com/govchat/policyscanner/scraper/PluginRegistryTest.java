package com.govchat.policyscanner.scraper;

import com.govchat.policyscanner.model.ScraperConfig;
import com.govchat.policyscanner.scraper.plugin.GemeentebladPlugin;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PluginRegistryTest {

    private PluginRegistry registry;
    private ScraperConfig config;

    @BeforeEach
    void setUp() {
        registry = new PluginRegistry();
        config = ScraperConfig.builder()
                .baseUrl("https://zoek.example.nl")
                .selectors(Map.of(
                        "item", "div.result-item",
                        "title", "h2 a",
                        "url", "h2 a",
                        "date", "span.date"))
                .build();
    }

    @Test
    void get_RegisteredPlugin_CreatesNewInstanceEachTime() {
        // Given
        registry.register(GemeentebladPlugin.NAME, GemeentebladPlugin.class, GemeentebladPlugin::new);

        // When
        ScraperPlugin first = registry.get(GemeentebladPlugin.NAME, config);
        ScraperPlugin second = registry.get(GemeentebladPlugin.NAME, config);

        // Then
        assertInstanceOf(GemeentebladPlugin.class, first);
        assertNotSame(first, second);
        assertSame(config, first.getConfig());
    }

    @Test
    void get_UnknownPlugin_ListsAvailablePlugins() {
        // Given
        registry.register("zeta", GemeentebladPlugin.class, GemeentebladPlugin::new);
        registry.register("alpha", GemeentebladPlugin.class, GemeentebladPlugin::new);

        // When
        PluginNotFoundException e = assertThrows(PluginNotFoundException.class,
                () -> registry.get("officielebekendmakingen", config));

        // Then
        assertEquals("Plugin 'officielebekendmakingen' not found. Available plugins: alpha, zeta", e.getMessage());
    }

    @Test
    void list_IsSorted() {
        registry.register("b", GemeentebladPlugin.class, GemeentebladPlugin::new);
        registry.register("a", GemeentebladPlugin.class, GemeentebladPlugin::new);

        assertEquals(List.of("a", "b"), registry.list());
    }

    @Test
    void register_SameNameTwice_ReplacesRegistration() {
        // Given
        registry.register("gemeenteblad", GemeentebladPlugin.class, GemeentebladPlugin::new, "first");

        // When
        registry.register("gemeenteblad", GemeentebladPlugin.class, GemeentebladPlugin::new, "second");

        // Then
        assertEquals(List.of("gemeenteblad"), registry.list());
        assertEquals("second", registry.info("gemeenteblad").orElseThrow().description());
    }

    @Test
    void info_DescribesPluginClass() {
        // Given
        registry.register(GemeentebladPlugin.NAME, GemeentebladPlugin.class, GemeentebladPlugin::new);

        // When
        Optional<PluginRegistry.PluginInfo> info = registry.info(GemeentebladPlugin.NAME);

        // Then
        assertTrue(info.isPresent());
        assertEquals("GemeentebladPlugin", info.get().className());
        assertEquals("com.govchat.policyscanner.scraper.plugin", info.get().packageName());
        assertEquals("No documentation available", info.get().description());
        assertTrue(registry.info("missing").isEmpty());
    }

    @Test
    void unregister_RemovesPlugin() {
        registry.register(GemeentebladPlugin.NAME, GemeentebladPlugin.class, GemeentebladPlugin::new);

        assertTrue(registry.unregister(GemeentebladPlugin.NAME));
        assertFalse(registry.unregister(GemeentebladPlugin.NAME));
        assertThrows(PluginNotFoundException.class, () -> registry.get(GemeentebladPlugin.NAME, config));
    }

    @Test
    void register_BlankName_Throws() {
        assertThrows(IllegalArgumentException.class,
                () -> registry.register(" ", GemeentebladPlugin.class, GemeentebladPlugin::new));
    }
}
