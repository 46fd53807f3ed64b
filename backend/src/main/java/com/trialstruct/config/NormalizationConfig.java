package com.trialstruct.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.trialstruct.service.normalize.UcumUnitNormalizer;
import com.trialstruct.service.normalize.UnitNormalizer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Unit, categorical value and ordinal scale tables.
 */
@Configuration
public class NormalizationConfig {

    @Bean
    public UnitNormalizer unitNormalizer(
            ObjectMapper objectMapper,
            @Value("${structure.unit-mappings:unit-mappings.json}") String resource) {
        return UcumUnitNormalizer.fromClasspath(objectMapper, resource);
    }
}
