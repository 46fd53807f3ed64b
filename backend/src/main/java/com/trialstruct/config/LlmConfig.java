package com.trialstruct.config;

import dev.langchain4j.model.chat.Capability;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Chat model used for logic detection.
 * The bean only exists when structure.llm.enabled is true and an API key is set;
 * without it every criterion gets the fallback structure.
 */
@Slf4j
@Configuration
@ConditionalOnExpression("${structure.llm.enabled:false} and '${structure.llm.api-key:}' != ''")
public class LlmConfig {

    @Bean
    public ChatModel logicDetectionChatModel(
            @Value("${structure.llm.api-key}") String apiKey,
            @Value("${structure.llm.base-url:https://api.openai.com/v1}") String baseUrl,
            @Value("${structure.llm.model-name:gpt-4o-mini}") String modelName,
            @Value("${structure.llm.timeout:60s}") Duration timeout) {
        log.info("Logic detection enabled with model {} at {}", modelName, baseUrl);
        return OpenAiChatModel.builder()
            .apiKey(apiKey)
            .baseUrl(baseUrl)
            .modelName(modelName)
            .timeout(timeout)
            .temperature(0.0)
            .supportedCapabilities(Capability.RESPONSE_FORMAT_JSON_SCHEMA)
            .build();
    }
}
