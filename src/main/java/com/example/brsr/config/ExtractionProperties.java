package com.example.brsr.config;

import com.example.brsr.model.Pillar;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the extraction pipeline ({@code esg.*}).
 */
@ConfigurationProperties(prefix = "esg")
public record ExtractionProperties(
        Retrieval retrieval,
        Llm llm,
        Retry retry,
        Scoring scoring,
        Validation validation,
        Catalog catalog,
        Delivery delivery,
        Vector vector,
        Batch batch
) {
    public ExtractionProperties {
        if (retrieval == null) retrieval = new Retrieval(0, null);
        if (llm == null) llm = new Llm(null);
        if (retry == null) retry = new Retry(0, null, 0, 0, 0);
        if (scoring == null) scoring = new Scoring(null);
        if (validation == null) validation = new Validation(null);
        if (catalog == null) catalog = new Catalog(null, true);
        if (delivery == null) delivery = new Delivery(0, 0);
        if (vector == null) vector = new Vector(null);
        if (batch == null) batch = new Batch(null);
    }

    /**
     * @param topK              chunks per query, clamped to [5, 10]
     * @param distanceThreshold drop chunks farther than this, {@code null} keeps all
     */
    public record Retrieval(int topK, Double distanceThreshold) {
        public Retrieval {
            if (topK <= 0) topK = 10;
        }
    }

    /**
     * @param provider {@code openai} or {@code anthropic}
     */
    public record Llm(String provider) {
        public Llm {
            if (provider == null || provider.isBlank()) provider = "openai";
        }
    }

    /**
     * Backoff for retrieval and model calls: {@code baseDelay * multiplier^(attempt-1)},
     * multiplied again by {@code rateLimitMultiplier} when the error looks like a rate limit.
     */
    public record Retry(int maxAttempts, Duration baseDelay, double multiplier, double jitter,
                        double rateLimitMultiplier) {
        public Retry {
            if (maxAttempts <= 0) maxAttempts = 3;
            if (baseDelay == null) baseDelay = Duration.ofSeconds(1);
            if (multiplier <= 0) multiplier = 2.0;
            if (jitter < 0) jitter = 0.0;
            if (rateLimitMultiplier <= 0) rateLimitMultiplier = 2.0;
        }
    }

    public record Scoring(PillarWeights pillarWeights) {
        public Scoring {
            if (pillarWeights == null) pillarWeights = PillarWeights.EQUAL;
        }
    }

    /**
     * Weight of each pillar in the overall score. Must be non-negative and sum to 1.
     */
    public record PillarWeights(double environmental, double social, double governance) {

        public static final PillarWeights EQUAL = new PillarWeights(1.0 / 3, 1.0 / 3, 1.0 / 3);

        public PillarWeights {
            if (environmental < 0 || social < 0 || governance < 0) {
                throw new IllegalArgumentException("Pillar weights must be non-negative");
            }
            double sum = environmental + social + governance;
            if (Math.abs(sum - 1.0) > 0.01) {
                throw new IllegalArgumentException("Pillar weights must sum to 1.0, got " + sum);
            }
        }

        public double weightFor(Pillar pillar) {
            return switch (pillar) {
                case ENVIRONMENTAL -> environmental;
                case SOCIAL -> social;
                case GOVERNANCE -> governance;
            };
        }
    }

    /**
     * @param rangeTable resource location of the numeric range table
     */
    public record Validation(String rangeTable) {
        public Validation {
            if (rangeTable == null || rangeTable.isBlank()) rangeTable = "classpath:brsr/numeric-ranges.json";
        }
    }

    /**
     * @param seedLocation  resource location of the indicator catalog seed
     * @param seedOnStartup load the seed when the catalog collection is empty
     */
    public record Catalog(String seedLocation, boolean seedOnStartup) {
        public Catalog {
            if (seedLocation == null || seedLocation.isBlank()) seedLocation = "classpath:brsr/indicator-catalog.json";
        }
    }

    /**
     * @param maxRedeliveries    failed deliveries before a task is parked
     * @param maxEmbeddingChecks requeues while waiting for embeddings before a task is parked
     */
    public record Delivery(int maxRedeliveries, int maxEmbeddingChecks) {
        public Delivery {
            if (maxRedeliveries <= 0) maxRedeliveries = 3;
            if (maxEmbeddingChecks <= 0) maxEmbeddingChecks = 10;
        }
    }

    /**
     * @param collection collection holding the embedded chunks
     */
    public record Vector(String collection) {
        public Vector {
            if (collection == null || collection.isBlank()) collection = "document_embeddings";
        }
    }

    /**
     * @param documents comma-separated object keys processed once at startup
     */
    public record Batch(String documents) {}
}
