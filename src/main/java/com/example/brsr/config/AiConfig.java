package com.example.brsr.config;

import com.example.brsr.service.RetryExecutor;
import com.example.brsr.service.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Model client and retry setup.
 * <p>
 * - extractionChatClient: OpenAI by default, Anthropic when {@code esg.llm.provider=anthropic}
 */
@Configuration
public class AiConfig {

    private static final Logger log = LoggerFactory.getLogger(AiConfig.class);

    /**
     * ChatClient used by the extraction chain.
     */
    @Bean("extractionChatClient")
    public ChatClient extractionChatClient(ExtractionProperties properties,
                                           ObjectProvider<OpenAiChatModel> openAiChatModel,
                                           ObjectProvider<AnthropicChatModel> anthropicChatModel) {
        String provider = properties.llm().provider().toLowerCase();
        log.info("Extraction model provider: {}", provider);
        return switch (provider) {
            case "anthropic" -> ChatClient.builder(anthropicChatModel.getObject()).build();
            case "openai" -> ChatClient.builder(openAiChatModel.getObject()).build();
            default -> throw new IllegalStateException("Unsupported esg.llm.provider: " + provider);
        };
    }

    @Bean
    public RetryPolicy retryPolicy(ExtractionProperties properties) {
        ExtractionProperties.Retry retry = properties.retry();
        return new RetryPolicy(retry.maxAttempts(), retry.baseDelay(), retry.multiplier(),
                retry.jitter(), retry.rateLimitMultiplier());
    }

    @Bean
    public RetryExecutor retryExecutor(RetryPolicy retryPolicy) {
        return new RetryExecutor(retryPolicy);
    }

    /**
     * Shared ObjectMapper for seed files and task payloads.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
