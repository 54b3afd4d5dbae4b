package com.example.brsr.controller;

import com.example.brsr.model.DeliveryDecision;
import com.example.brsr.model.DocumentStatusRecord;
import com.example.brsr.model.ExtractionTask;
import com.example.brsr.model.IndicatorCatalog;
import com.example.brsr.orchestrator.ExtractionTaskConsumer;
import com.example.brsr.repository.ExtractionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.Optional;

/**
 * HTTP intake for extraction tasks, for manual runs and the status layer.
 */
@RestController
@RequestMapping("/api")
public class ExtractionTaskController {

    private static final Logger log = LoggerFactory.getLogger(ExtractionTaskController.class);

    private final ExtractionTaskConsumer consumer;
    private final ExtractionStore store;
    private final IndicatorCatalog catalog;

    public ExtractionTaskController(ExtractionTaskConsumer consumer,
                                    ExtractionStore store,
                                    IndicatorCatalog catalog) {
        this.consumer = consumer;
        this.store = store;
        this.catalog = catalog;
    }

    public record TaskRequest(String documentKey, Integer deliveryAttempt, Integer embeddingChecks) {}

    /**
     * Runs one task synchronously and returns the delivery decision.
     *
     * <p>Endpoint: POST /api/extraction-tasks
     * <p>Body: {@code {"documentKey": "RELIANCE/2024_BRSR.pdf"}}
     */
    @PostMapping("/extraction-tasks")
    public ResponseEntity<?> submit(@RequestBody TaskRequest request) {
        if (request == null || request.documentKey() == null || request.documentKey().isBlank()) {
            return badRequest("documentKey is required");
        }
        log.info("Received extraction request for '{}'", request.documentKey());

        DeliveryDecision decision = consumer.handle(new ExtractionTask(
                request.documentKey().trim(),
                request.deliveryAttempt() != null ? request.deliveryAttempt() : 0,
                request.embeddingChecks() != null ? request.embeddingChecks() : 0));

        return switch (decision.action()) {
            case ACK -> ResponseEntity.ok(decision);
            case REQUEUE -> ResponseEntity.accepted().body(decision);
            case PARK -> ResponseEntity.unprocessableEntity().body(decision);
        };
    }

    /**
     * Lifecycle status of a document.
     *
     * <p>Endpoint: GET /api/extraction-tasks/status?documentKey=...
     */
    @GetMapping("/extraction-tasks/status")
    public ResponseEntity<?> status(@RequestParam("documentKey") String documentKey) {
        Optional<DocumentStatusRecord> status = store.findStatus(documentKey);
        if (status.isEmpty()) {
            return ResponseEntity.status(404).body(Map.of("error", "No status for " + documentKey));
        }
        return ResponseEntity.ok(status.get());
    }

    /**
     * <p>Endpoint: GET /api/health
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean mongoUp = store.isAvailable();
        boolean catalogLoaded = !catalog.isEmpty();
        return ResponseEntity.ok(Map.of(
                "status", mongoUp && catalogLoaded ? "ok" : "degraded",
                "service", "brsr-extraction",
                "mongodb", mongoUp ? "up" : "down",
                "indicatorCatalog", catalog.size()
        ));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
