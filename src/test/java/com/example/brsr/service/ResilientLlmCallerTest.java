package com.example.brsr.service;

import com.example.brsr.exception.IndicatorExtractionException;
import com.example.brsr.exception.MalformedModelOutputException;
import com.example.brsr.model.IndicatorExtractionOutput;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.metadata.ChatResponseMetadata;
import org.springframework.ai.chat.metadata.DefaultUsage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ResilientLlmCallerTest {

    private static final String VALID = """
            {"indicatorCode": "GHG_SCOPE1_TOTAL", "value": "1250 MT CO2e", "numericValue": 1250.0,
             "unit": "MT CO2e", "confidence": 1.0, "sourcePages": [45, 45],}
            """;

    private ChatClient chatClient;
    private ResilientLlmCaller caller;

    @BeforeEach
    void setUp() {
        chatClient = mock(ChatClient.class, RETURNS_DEEP_STUBS);
        caller = new ResilientLlmCaller(new RetryExecutor(RetryPolicy.defaults(), d -> { }, () -> 0.5));
    }

    @AfterEach
    void tearDown() {
        TokenUsageAccumulator.clear();
    }

    private void modelAnswers(ChatResponse first, ChatResponse... rest) {
        when(chatClient.prompt().system(anyString()).user(anyString()).call().chatResponse())
                .thenReturn(first, rest);
    }

    private static ChatResponse answer(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Test
    void parsesLenientJson() {
        modelAnswers(answer(VALID));

        IndicatorExtractionOutput output = caller.callEntity(chatClient, "system", "user",
                IndicatorExtractionOutput.class, "Extraction GHG_SCOPE1_TOTAL");

        assertThat(output.value()).isEqualTo("1250 MT CO2e");
        assertThat(output.numericValue()).isEqualTo(1250.0);
        assertThat(output.sourcePages()).containsExactly(45);
    }

    @Test
    @DisplayName("a confidence outside [0,1] is rejected and the call retried")
    void schemaViolationIsRetried() {
        String outOfRange = VALID.replace("\"confidence\": 1.0", "\"confidence\": 1.7");
        modelAnswers(answer(outOfRange), answer(VALID));

        IndicatorExtractionOutput output = caller.callEntity(chatClient, "system", "user",
                IndicatorExtractionOutput.class, "Extraction GHG_SCOPE1_TOTAL");

        assertThat(output.confidence()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("an answer without a confidence is rejected and the call retried")
    void missingConfidenceIsRetried() {
        String noConfidence = VALID.replace("\"confidence\": 1.0, ", "");
        modelAnswers(answer(noConfidence), answer(VALID));

        IndicatorExtractionOutput output = caller.callEntity(chatClient, "system", "user",
                IndicatorExtractionOutput.class, "Extraction GHG_SCOPE1_TOTAL");

        assertThat(output.confidence()).isEqualTo(1.0);
    }

    @Test
    void emptyContentExhaustsRetries() {
        modelAnswers(answer(""));

        assertThatThrownBy(() -> caller.callEntity(chatClient, "system", "user",
                IndicatorExtractionOutput.class, "Extraction WATER_CONSUMPTION_TOTAL"))
                .isInstanceOf(IndicatorExtractionException.class)
                .hasMessageContaining("Extraction WATER_CONSUMPTION_TOTAL")
                .hasRootCauseInstanceOf(MalformedModelOutputException.class);
    }

    @Test
    void recordsTokenUsageByProvider() {
        ChatResponse withUsage = new ChatResponse(
                List.of(new Generation(new AssistantMessage(VALID))),
                ChatResponseMetadata.builder().model("claude-sonnet-4").usage(new DefaultUsage(900, 120)).build());
        modelAnswers(withUsage);
        TokenUsageAccumulator usage = TokenUsageAccumulator.start();

        caller.callEntity(chatClient, "system", "user", IndicatorExtractionOutput.class, "Extraction");

        assertThat(usage.getAnthropicInputTokens()).isEqualTo(900);
        assertThat(usage.getAnthropicOutputTokens()).isEqualTo(120);
        assertThat(usage.getOpenAiInputTokens()).isZero();
        assertThat(usage.getModelCalls()).isEqualTo(1);
    }
}
