package com.example.brsr.orchestrator;

import com.example.brsr.config.ExtractionProperties;
import com.example.brsr.model.DeliveryDecision;
import com.example.brsr.model.ExtractionTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Processes the documents listed in {@code esg.batch.documents} once at startup.
 */
@Component
public class BatchExtractionRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BatchExtractionRunner.class);

    private final ExtractionTaskConsumer consumer;
    private final String documents;

    public BatchExtractionRunner(ExtractionTaskConsumer consumer, ExtractionProperties properties) {
        this.consumer = consumer;
        this.documents = properties.batch().documents();
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> keys = parseDocumentList(documents);
        if (keys.isEmpty()) {
            return;
        }
        log.info("Batch run over {} documents", keys.size());
        int succeeded = 0;
        for (String key : keys) {
            DeliveryDecision decision = consumer.handle(ExtractionTask.firstDelivery(key));
            if (decision.action() == DeliveryDecision.Action.ACK) {
                succeeded++;
            } else {
                log.warn("'{}' not processed: {} ({})", key, decision.action(), decision.reason());
            }
        }
        log.info("Batch run finished: {} succeeded, {} failed", succeeded, keys.size() - succeeded);
    }

    static List<String> parseDocumentList(String documents) {
        if (documents == null || documents.isBlank()) {
            return List.of();
        }
        return Arrays.stream(documents.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
