package com.vidnyan.depscope.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.depscope.application.port.out.GraphExporter;
import com.vidnyan.depscope.application.port.out.ReferenceExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration for depscope components.
 * Wires together the clean architecture components.
 */
@Slf4j
@Configuration
public class DepscopeConfiguration {

    /**
     * ObjectMapper for the JSON interchange document.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    /**
     * Log available strategies on startup.
     */
    @Bean
    public String logStrategies(List<ReferenceExtractor> extractors, List<GraphExporter> exporters) {
        log.info("Registered {} reference extractors:", extractors.size());
        extractors.forEach(e -> log.info("  - {} ({})", e.getName(), e.family()));
        log.info("Registered {} graph exporters:", exporters.size());
        exporters.forEach(e -> log.info("  - {}", e.format()));
        return "strategies-logged";
    }
}
