package com.govchat.policyscanner.config;

import com.govchat.policyscanner.processing.DocumentProcessor;
import com.govchat.policyscanner.scraper.PluginRegistry;
import com.govchat.policyscanner.scraper.plugin.GemeentebladPlugin;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class PolicyScannerConfig {

    /**
     * RestTemplate for the search index. Backed by the JDK client because the
     * settings endpoint needs PATCH.
     */
    @Bean
    public RestTemplate searchRestTemplate(RestTemplateBuilder builder) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(Duration.ofSeconds(30));
        return builder.requestFactory(() -> factory).build();
    }

    @Bean
    public PluginRegistry pluginRegistry() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(GemeentebladPlugin.NAME, GemeentebladPlugin.class, GemeentebladPlugin::new,
                "Municipal gazettes (gemeentebladen) published through a searchable listing page");
        return registry;
    }

    @Bean
    public DocumentProcessor documentProcessor(PolicyScannerProperties properties) {
        PolicyScannerProperties.Processing processing = properties.getProcessing();
        return new DocumentProcessor(processing.getMaxChunkSize(), processing.getOverlapSize(),
                processing.getSummaryLength());
    }
}
