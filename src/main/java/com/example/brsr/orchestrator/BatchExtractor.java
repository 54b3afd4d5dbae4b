package com.example.brsr.orchestrator;

import com.example.brsr.agent.IndicatorExtractionAgent;
import com.example.brsr.exception.EmptyIndicatorCatalogException;
import com.example.brsr.model.BatchExtractionResult;
import com.example.brsr.model.DocumentKey;
import com.example.brsr.model.ExtractedIndicator;
import com.example.brsr.model.IndicatorCatalog;
import com.example.brsr.model.IndicatorDefinition;
import com.example.brsr.model.IndicatorExtractionOutput;
import com.example.brsr.repository.ChunkCitationRepository;
import com.example.brsr.repository.ExtractionStore;
import com.example.brsr.service.DocumentKeyParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Extracts every indicator of a document, one attribute group after the other.
 * <p>
 * Indicators run sequentially: retrieval and model calls are rate-limited.
 * A failing indicator is logged and left out; the rest of the batch still runs.
 */
@Service
public class BatchExtractor {

    private static final Logger log = LoggerFactory.getLogger(BatchExtractor.class);

    private final ExtractionStore store;
    private final IndicatorCatalog catalog;
    private final IndicatorExtractionAgent extractionAgent;
    private final ChunkCitationRepository citationRepository;

    public BatchExtractor(ExtractionStore store,
                          IndicatorCatalog catalog,
                          IndicatorExtractionAgent extractionAgent,
                          ChunkCitationRepository citationRepository) {
        this.store = store;
        this.catalog = catalog;
        this.extractionAgent = extractionAgent;
        this.citationRepository = citationRepository;
    }

    public BatchExtractionResult extractAll(String documentKey) {
        return extractAll(documentKey, null);
    }

    /**
     * @param indicators subset to extract, {@code null} for the whole catalog
     * @throws com.example.brsr.exception.PreconditionFailedException for a malformed key,
     *         an unknown company or an empty catalog
     */
    public BatchExtractionResult extractAll(String documentKey, Collection<IndicatorDefinition> indicators) {
        DocumentKey key = DocumentKeyParser.parse(documentKey);
        long companyId = store.resolveCompanyId(key.companyName());

        Collection<IndicatorDefinition> toExtract = indicators != null ? indicators : catalog.all();
        if (toExtract.isEmpty()) {
            throw new EmptyIndicatorCatalogException();
        }

        SortedMap<Integer, List<IndicatorDefinition>> groups = IndicatorCatalog.groupByAttribute(toExtract);
        log.info("BatchExtractor: {} indicators in {} attribute groups for {} ({} {})",
                toExtract.size(), groups.size(), key, key.companyName(), key.reportYear());

        List<ExtractedIndicator> extracted = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (Map.Entry<Integer, List<IndicatorDefinition>> group : groups.entrySet()) {
            int attribute = group.getKey();
            int before = extracted.size();
            log.info("BatchExtractor: attribute {} ({} indicators)", attribute, group.getValue().size());

            for (IndicatorDefinition definition : group.getValue()) {
                try {
                    extracted.add(extractOne(key, companyId, definition));
                } catch (RuntimeException e) {
                    failed.add(definition.indicatorCode());
                    log.error("BatchExtractor: extraction failed for {} (attribute {}) of {}: {}",
                            definition.indicatorCode(), attribute, key, e.getMessage(), e);
                }
            }
            log.info("BatchExtractor: attribute {} done, {}/{} extracted",
                    attribute, extracted.size() - before, group.getValue().size());
        }

        log.info("BatchExtractor: {}/{} indicators extracted for {} ({} failed)",
                extracted.size(), toExtract.size(), key, failed.size());
        return new BatchExtractionResult(key, companyId, extracted, toExtract.size(), failed);
    }

    private ExtractedIndicator extractOne(DocumentKey key, long companyId, IndicatorDefinition definition) {
        IndicatorExtractionOutput output = extractionAgent.extract(key.companyName(), key.reportYear(), definition);
        List<String> chunkIds = resolveChunkIds(key, output.sourcePages());
        return ExtractedIndicator.pending(
                key.objectKey(), companyId, key.reportYear(), definition.indicatorCode(),
                output.value(), output.numericValue(), output.confidence(),
                output.sourcePages(), chunkIds, Instant.now());
    }

    private List<String> resolveChunkIds(DocumentKey key, List<Integer> pages) {
        if (pages.isEmpty()) {
            return List.of();
        }
        try {
            return citationRepository.findChunkIds(key.companyName(), key.reportYear(), pages);
        } catch (RuntimeException e) {
            log.warn("BatchExtractor: could not resolve chunk ids for pages {} of {}: {}",
                    pages, key, e.getMessage());
            return List.of();
        }
    }
}
