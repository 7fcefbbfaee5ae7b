package com.vidnyan.attackgraph.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.vidnyan.attackgraph.domain.graph.ReachabilityCalculator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Spring configuration for the attack graph engine.
 * Wires the domain services that carry no Spring annotations.
 */
@Configuration
public class AttackGraphConfiguration {

    /**
     * ObjectMapper for JSON.
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return jsonObjectMapper();
    }

    /**
     * ObjectMapper for YAML.
     */
    @Bean
    public ObjectMapper yamlObjectMapper() {
        return yamlMapper();
    }

    @Bean
    public ReachabilityCalculator reachabilityCalculator() {
        return new ReachabilityCalculator();
    }

    public static ObjectMapper jsonObjectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    public static ObjectMapper yamlMapper() {
        return new ObjectMapper(new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER))
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
