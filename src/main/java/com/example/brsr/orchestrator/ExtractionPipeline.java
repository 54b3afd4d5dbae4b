package com.example.brsr.orchestrator;

import com.example.brsr.model.BatchExtractionResult;
import com.example.brsr.model.DocumentRunSummary;
import com.example.brsr.model.DocumentStatus;
import com.example.brsr.model.ExtractedIndicator;
import com.example.brsr.model.IndicatorCatalog;
import com.example.brsr.model.IndicatorDefinition;
import com.example.brsr.model.PipelineTimings;
import com.example.brsr.model.ScoreRecord;
import com.example.brsr.model.ValidationResult;
import com.example.brsr.model.ValidationStatus;
import com.example.brsr.repository.ExtractionStore;
import com.example.brsr.service.IndicatorValidator;
import com.example.brsr.service.ScoreCalculator;
import com.example.brsr.service.TokenUsageAccumulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Document pipeline:
 * 1. Mark PROCESSING
 * 2. Skip documents whose indicators are already stored
 * 3. Batch extraction over the indicator catalog
 * 4. Validation of every extracted indicator
 * 5. Atomic write of the indicator set
 * 6. Score calculation and score upsert
 * 7. Mark SUCCESS (FAILED with the error message if anything above throws)
 */
@Service
public class ExtractionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ExtractionPipeline.class);

    private final ExtractionStore store;
    private final BatchExtractor batchExtractor;
    private final IndicatorValidator validator;
    private final ScoreCalculator scoreCalculator;
    private final IndicatorCatalog catalog;

    public ExtractionPipeline(ExtractionStore store,
                              BatchExtractor batchExtractor,
                              IndicatorValidator validator,
                              ScoreCalculator scoreCalculator,
                              IndicatorCatalog catalog) {
        this.store = store;
        this.batchExtractor = batchExtractor;
        this.validator = validator;
        this.scoreCalculator = scoreCalculator;
        this.catalog = catalog;
    }

    public DocumentRunSummary process(String documentKey) {
        log.info("═══════════════════════════════════════════════");
        log.info("Starting extraction pipeline for '{}'", documentKey);
        log.info("═══════════════════════════════════════════════");

        TokenUsageAccumulator usage = TokenUsageAccumulator.start();
        try {
            // ── Step 1: Status ──
            log.info("[1/7] Marking '{}' as PROCESSING", documentKey);
            updateStatus(documentKey, DocumentStatus.PROCESSING, null);

            // ── Step 2: Already processed? ──
            if (store.isAlreadyProcessed(documentKey)) {
                log.info("[2/7] '{}' already has stored indicators, skipping", documentKey);
                updateStatus(documentKey, DocumentStatus.SUCCESS, null);
                return DocumentRunSummary.skipped(documentKey);
            }

            // ── Step 3: Batch extraction ──
            log.info("[3/7] Extracting indicators...");
            long t0 = System.nanoTime();
            BatchExtractionResult batch = batchExtractor.extractAll(documentKey);
            double extractionSeconds = secondsSince(t0);
            log.info("[3/7] Extraction completed: {}/{} indicators ({} failed)",
                    batch.indicators().size(), batch.attempted(), batch.failedIndicatorCodes().size());

            if (batch.indicators().isEmpty()) {
                log.warn("No indicators extracted for '{}', nothing to store or score", documentKey);
                updateStatus(documentKey, DocumentStatus.SUCCESS, null);
                return new DocumentRunSummary(documentKey, DocumentRunSummary.Outcome.PROCESSED,
                        batch.attempted(), 0, 0, 0, 0, batch.failedIndicatorCodes(), null,
                        new PipelineTimings(extractionSeconds, 0, 0, 0),
                        usage.getInputTokens(), usage.getOutputTokens());
            }

            // ── Step 4: Validation ──
            log.info("[4/7] Validating {} indicators...", batch.indicators().size());
            t0 = System.nanoTime();
            List<ExtractedIndicator> validated = validateAll(batch.indicators());
            double validationSeconds = secondsSince(t0);
            int valid = (int) validated.stream().filter(i -> i.validationStatus() == ValidationStatus.VALID).count();
            int invalid = validated.size() - valid;
            log.info("[4/7] Validation completed: {} valid, {} invalid", valid, invalid);

            // ── Step 5: Store indicators ──
            log.info("[5/7] Storing indicators...");
            t0 = System.nanoTime();
            int persisted = store.persistExtractedIndicators(validated);
            double persistenceSeconds = secondsSince(t0);
            log.info("[5/7] {} indicators stored", persisted);

            // ── Step 6: Scoring ──
            log.info("[6/7] Calculating ESG scores...");
            t0 = System.nanoTime();
            ScoreRecord score = scoreCalculator.calculate(batch.companyId(), batch.documentKey().reportYear(),
                    validated, catalog.all());
            ScoreRecord stored = store.persistScoreRecord(score);
            double scoringSeconds = secondsSince(t0);
            log.info("[6/7] Overall score {}", Math.round(stored.overallScore() * 100.0) / 100.0);

            // ── Step 7: Status ──
            updateStatus(documentKey, DocumentStatus.SUCCESS, null);

            PipelineTimings timings = new PipelineTimings(extractionSeconds, validationSeconds,
                    persistenceSeconds, scoringSeconds);
            log.info("═══════════════════════════════════════════════");
            log.info("[7/7] Pipeline completed for '{}': {} extracted, {} valid, {} stored in {}s " +
                            "({} model calls, {}in/{}out tokens)",
                    documentKey, validated.size(), valid, persisted,
                    Math.round(timings.totalSeconds() * 10.0) / 10.0,
                    usage.getModelCalls(), usage.getInputTokens(), usage.getOutputTokens());
            log.info("═══════════════════════════════════════════════");

            return new DocumentRunSummary(documentKey, DocumentRunSummary.Outcome.PROCESSED,
                    batch.attempted(), validated.size(), valid, invalid, persisted,
                    batch.failedIndicatorCodes(), stored, timings,
                    usage.getInputTokens(), usage.getOutputTokens());

        } catch (RuntimeException e) {
            log.error("Pipeline failed for '{}': {}", documentKey, e.getMessage(), e);
            updateStatus(documentKey, DocumentStatus.FAILED, e.getMessage());
            throw e;
        } finally {
            TokenUsageAccumulator.clear();
        }
    }

    private List<ExtractedIndicator> validateAll(List<ExtractedIndicator> indicators) {
        List<ExtractedIndicator> validated = new ArrayList<>(indicators.size());
        for (ExtractedIndicator indicator : indicators) {
            Optional<IndicatorDefinition> definition = catalog.find(indicator.indicatorCode());
            if (definition.isEmpty()) {
                log.warn("No catalog definition for {}, marked INVALID", indicator.indicatorCode());
                validated.add(indicator.withValidationStatus(ValidationStatus.INVALID));
                continue;
            }
            ValidationResult result = validator.validate(indicator, definition.get());
            if (!result.warnings().isEmpty()) {
                log.debug("{} warnings: {}", indicator.indicatorCode(), result.warnings());
            }
            if (!result.isValid()) {
                log.info("{} INVALID: {}", indicator.indicatorCode(), result.errors());
            }
            validated.add(indicator.withValidationStatus(result.status()));
        }
        return validated;
    }

    private void updateStatus(String documentKey, DocumentStatus status, String errorMessage) {
        try {
            store.updateStatus(documentKey, status, errorMessage);
        } catch (RuntimeException e) {
            log.warn("Could not record status {} for '{}': {}", status, documentKey, e.getMessage());
        }
    }

    private static double secondsSince(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000.0;
    }
}
