package com.comanda.common.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Adjusts the Boot-managed ObjectMapper, which serves both the REST layer and
 * the AMQP message converter. Timestamps go out as ISO-8601 strings and money
 * amounts never in exponent form.
 */
@Configuration
public class EngineJsonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer engineJsonCustomizer() {
        return builder -> builder
                .modulesToInstall(JavaTimeModule.class)
                // catalog publishers add event fields without coordinating releases
                .featuresToDisable(
                        SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                        DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .featuresToEnable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
    }
}
