package com.example.mathverify.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared beans of the verification engine.
 */
@Configuration
public class EngineConfig {

    /**
     * Tunes Boot's ObjectMapper used to serialize reports: null properties are omitted.
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer reportJsonCustomizer() {
        return builder -> builder
                .serializationInclusion(JsonInclude.Include.NON_NULL)
                .featuresToDisable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    }
}
