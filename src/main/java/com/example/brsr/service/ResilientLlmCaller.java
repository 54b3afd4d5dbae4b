package com.example.brsr.service;

import com.example.brsr.exception.MalformedModelOutputException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Component;

/**
 * Structured model calls with lenient JSON parsing, run under the shared retry policy.
 * <p>
 * Tolerated in model output:
 * <ul>
 *   <li>Trailing commas ({@code [{"a":1},]})</li>
 *   <li>Java-style comments in JSON</li>
 *   <li>Single quotes instead of double quotes</li>
 *   <li>Unexpected fields (ignoreUnknown)</li>
 * </ul>
 * Anything else that does not fit the target type becomes a {@link MalformedModelOutputException},
 * which the retry policy treats as transient.
 */
@Component
public class ResilientLlmCaller {

    private static final Logger log = LoggerFactory.getLogger(ResilientLlmCaller.class);

    /** Lenient ObjectMapper that tolerates trailing commas, comments, and single quotes. */
    static final ObjectMapper LENIENT_MAPPER = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
            .build()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final RetryExecutor retryExecutor;

    public ResilientLlmCaller(RetryExecutor retryExecutor) {
        this.retryExecutor = retryExecutor;
    }

    /**
     * Calls the model and converts its answer into {@code type}.
     * <p>
     * Format instructions from {@link BeanOutputConverter} are appended to the user prompt.
     *
     * @param chatClient   the model client to use
     * @param systemPrompt the system prompt
     * @param userPrompt   the user prompt, without format instructions
     * @param type         the target class for parsing
     * @param callerName   label for logs and errors
     * @return the parsed response
     * @throws com.example.brsr.exception.IndicatorExtractionException if all attempts fail
     */
    public <T> T callEntity(ChatClient chatClient, String systemPrompt, String userPrompt,
                            Class<T> type, String callerName) {
        var converter = new BeanOutputConverter<>(type, LENIENT_MAPPER);
        String fullUserPrompt = userPrompt + "\n\n" + converter.getFormat();
        return retryExecutor.execute(callerName,
                () -> callOnce(chatClient, systemPrompt, fullUserPrompt, converter, callerName));
    }

    private <T> T callOnce(ChatClient chatClient, String systemPrompt, String fullUserPrompt,
                           BeanOutputConverter<T> converter, String callerName) {
        ChatResponse chatResponse = chatClient.prompt()
                .system(systemPrompt)
                .user(fullUserPrompt)
                .call()
                .chatResponse();

        captureTokenUsage(chatResponse, callerName);

        String content = (chatResponse != null && chatResponse.getResult() != null)
                ? chatResponse.getResult().getOutput().getText()
                : null;
        if (content == null || content.isBlank()) {
            throw new MalformedModelOutputException("Empty or null content in model response");
        }

        T result;
        try {
            result = converter.convert(content);
        } catch (RuntimeException e) {
            MalformedModelOutputException schemaViolation = findCause(e);
            if (schemaViolation != null) {
                throw schemaViolation;
            }
            throw new MalformedModelOutputException(
                    "Unparseable model output: " + RetryExecutor.rootCauseMessage(e), e);
        }
        if (result == null) {
            throw new MalformedModelOutputException("Model output converted to null");
        }
        return result;
    }

    private static MalformedModelOutputException findCause(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof MalformedModelOutputException m) {
                return m;
            }
            if (t.getCause() == t) break;
        }
        return null;
    }

    private static void captureTokenUsage(ChatResponse chatResponse, String callerName) {
        if (chatResponse == null) return;
        try {
            var metadata = chatResponse.getMetadata();
            if (metadata == null) return;
            Usage usage = metadata.getUsage();
            if (usage == null) return;

            long input = usage.getPromptTokens() != null ? usage.getPromptTokens().longValue() : 0L;
            long output = usage.getCompletionTokens() != null ? usage.getCompletionTokens().longValue() : 0L;
            if (input + output == 0) return;

            TokenUsageAccumulator acc = TokenUsageAccumulator.current();
            if (acc == null) return;

            // Anthropic model names contain "claude"
            String model = metadata.getModel() != null ? metadata.getModel().toLowerCase() : "";
            if (model.contains("claude")) {
                acc.addAnthropic(input, output);
            } else {
                acc.addOpenAi(input, output);
            }
            log.debug("{}: +{}/{} tokens (model={})", callerName, input, output, metadata.getModel());
        } catch (RuntimeException e) {
            log.debug("{}: failed to capture token usage: {}", callerName, e.getMessage());
        }
    }
}
