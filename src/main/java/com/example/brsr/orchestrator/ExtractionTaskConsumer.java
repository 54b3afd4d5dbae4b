package com.example.brsr.orchestrator;

import com.example.brsr.config.ExtractionProperties;
import com.example.brsr.exception.PreconditionFailedException;
import com.example.brsr.model.DeliveryDecision;
import com.example.brsr.model.DocumentStatus;
import com.example.brsr.model.DocumentKey;
import com.example.brsr.model.DocumentRunSummary;
import com.example.brsr.model.ExtractionTask;
import com.example.brsr.repository.ChunkCitationRepository;
import com.example.brsr.repository.ExtractionStore;
import com.example.brsr.service.DocumentKeyParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Task contract between the queue transport and the pipeline.
 * <p>
 * Decides what happens to a delivery:
 * <ul>
 *   <li>embeddings not stored yet: requeue, park after too many checks</li>
 *   <li>precondition failure: park at once, a redelivery would fail the same way</li>
 *   <li>any other failure: requeue until the redelivery ceiling, then park</li>
 * </ul>
 * Every parked document is marked FAILED with the park reason.
 */
@Service
public class ExtractionTaskConsumer {

    private static final Logger log = LoggerFactory.getLogger(ExtractionTaskConsumer.class);

    private final ExtractionPipeline pipeline;
    private final ChunkCitationRepository citationRepository;
    private final ExtractionStore store;
    private final ObjectMapper objectMapper;
    private final int maxRedeliveries;
    private final int maxEmbeddingChecks;

    public ExtractionTaskConsumer(ExtractionPipeline pipeline,
                                  ChunkCitationRepository citationRepository,
                                  ExtractionStore store,
                                  ObjectMapper objectMapper,
                                  ExtractionProperties properties) {
        this.pipeline = pipeline;
        this.citationRepository = citationRepository;
        this.store = store;
        this.objectMapper = objectMapper;
        this.maxRedeliveries = properties.delivery().maxRedeliveries();
        this.maxEmbeddingChecks = properties.delivery().maxEmbeddingChecks();
    }

    /**
     * Reads a task payload: either the bare object key or {@code {"object_key": "..."}}.
     */
    public ExtractionTask parse(String payload, int deliveryAttempt, int embeddingChecks) {
        String body = payload == null ? "" : payload.trim();
        if (body.startsWith("{")) {
            try {
                JsonNode node = objectMapper.readTree(body);
                JsonNode key = node.hasNonNull("object_key") ? node.get("object_key") : node.get("documentKey");
                body = key != null && !key.isNull() ? key.asText() : "";
            } catch (JsonProcessingException e) {
                log.warn("Task payload is not valid JSON, using it as a raw key: {}", e.getOriginalMessage());
            }
        }
        return new ExtractionTask(body, deliveryAttempt, embeddingChecks);
    }

    public DeliveryDecision handle(ExtractionTask task) {
        String documentKey = task.documentKey();
        log.info("Received extraction task for '{}' (delivery {}, embedding check {})",
                documentKey, task.deliveryAttempt(), task.embeddingChecks());

        DocumentKey key;
        try {
            key = DocumentKeyParser.parse(documentKey);
        } catch (PreconditionFailedException e) {
            log.error("Parking task: {}", e.getMessage());
            return park(documentKey, e.getMessage());
        }

        boolean embeddingsReady;
        try {
            embeddingsReady = citationRepository.embeddingsExist(key.companyName(), key.reportYear());
        } catch (RuntimeException e) {
            log.warn("Embedding check failed for '{}': {}", documentKey, e.getMessage());
            return retryOrPark(task, "Embedding check failed: " + e.getMessage());
        }
        if (!embeddingsReady) {
            if (task.embeddingChecks() >= maxEmbeddingChecks) {
                log.error("Embeddings for '{}' still missing after {} checks, parking task",
                        documentKey, task.embeddingChecks());
                return park(documentKey, "Embeddings not available after " + maxEmbeddingChecks + " checks");
            }
            log.info("Embeddings for '{}' not ready yet, requeueing (check {}/{})",
                    documentKey, task.embeddingChecks() + 1, maxEmbeddingChecks);
            return DeliveryDecision.requeue("Embeddings not ready");
        }

        try {
            DocumentRunSummary summary = pipeline.process(documentKey);
            return DeliveryDecision.ack(summary);
        } catch (PreconditionFailedException e) {
            log.error("Parking task for '{}': {}", documentKey, e.getMessage());
            return park(documentKey, e.getMessage());
        } catch (RuntimeException e) {
            return retryOrPark(task, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private DeliveryDecision retryOrPark(ExtractionTask task, String reason) {
        if (task.deliveryAttempt() < maxRedeliveries) {
            log.warn("Requeueing '{}' (retry {}/{}): {}",
                    task.documentKey(), task.deliveryAttempt() + 1, maxRedeliveries, reason);
            return DeliveryDecision.requeue(reason);
        }
        log.error("'{}' failed after {} redeliveries, parking task: {}", task.documentKey(), maxRedeliveries, reason);
        return park(task.documentKey(), reason);
    }

    private DeliveryDecision park(String documentKey, String reason) {
        if (documentKey != null && !documentKey.isBlank()) {
            try {
                store.updateStatus(documentKey, DocumentStatus.FAILED, reason);
            } catch (RuntimeException e) {
                log.warn("Could not record FAILED status for '{}': {}", documentKey, e.getMessage());
            }
        }
        return DeliveryDecision.park(reason);
    }
}
