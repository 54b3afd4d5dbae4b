package com.example.brsr.service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-document token-usage accumulator bound to the worker thread.
 *
 * <p>Usage pattern:
 * <pre>
 *   TokenUsageAccumulator usage = TokenUsageAccumulator.start();
 *   try {
 *       ... extraction ...
 *   } finally {
 *       TokenUsageAccumulator.clear();
 *   }
 * </pre>
 *
 * <p>Calls made outside a started run are not counted.
 */
public final class TokenUsageAccumulator {

    private static final ThreadLocal<TokenUsageAccumulator> CONTEXT = new ThreadLocal<>();

    private final AtomicLong openAiInputTokens = new AtomicLong();
    private final AtomicLong openAiOutputTokens = new AtomicLong();
    private final AtomicLong anthropicInputTokens = new AtomicLong();
    private final AtomicLong anthropicOutputTokens = new AtomicLong();
    private final AtomicLong modelCalls = new AtomicLong();

    private TokenUsageAccumulator() {}

    // ── Lifecycle ────────────────────────────────────────────────────────────

    public static TokenUsageAccumulator start() {
        TokenUsageAccumulator acc = new TokenUsageAccumulator();
        CONTEXT.set(acc);
        return acc;
    }

    public static void clear() {
        CONTEXT.remove();
    }

    /** The accumulator of the current run, or {@code null} outside a run. */
    public static TokenUsageAccumulator current() {
        return CONTEXT.get();
    }

    // ── Accumulation ─────────────────────────────────────────────────────────

    public void addOpenAi(long input, long output) {
        openAiInputTokens.addAndGet(input);
        openAiOutputTokens.addAndGet(output);
        modelCalls.incrementAndGet();
    }

    public void addAnthropic(long input, long output) {
        anthropicInputTokens.addAndGet(input);
        anthropicOutputTokens.addAndGet(output);
        modelCalls.incrementAndGet();
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    public long getOpenAiInputTokens() {
        return openAiInputTokens.get();
    }

    public long getOpenAiOutputTokens() {
        return openAiOutputTokens.get();
    }

    public long getAnthropicInputTokens() {
        return anthropicInputTokens.get();
    }

    public long getAnthropicOutputTokens() {
        return anthropicOutputTokens.get();
    }

    public long getInputTokens() {
        return openAiInputTokens.get() + anthropicInputTokens.get();
    }

    public long getOutputTokens() {
        return openAiOutputTokens.get() + anthropicOutputTokens.get();
    }

    public long getModelCalls() {
        return modelCalls.get();
    }
}
