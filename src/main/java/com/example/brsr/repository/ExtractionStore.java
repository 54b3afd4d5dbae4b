package com.example.brsr.repository;

import com.example.brsr.exception.CompanyNotFoundException;
import com.example.brsr.model.Company;
import com.example.brsr.model.DocumentStatus;
import com.example.brsr.model.DocumentStatusRecord;
import com.example.brsr.model.ExtractedIndicator;
import com.example.brsr.model.IndicatorCatalog;
import com.example.brsr.model.ScoreRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.FindAndReplaceOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations used by the pipeline: company lookup, catalog, indicator
 * and score writes, document status.
 */
@Repository
public class ExtractionStore {

    private static final Logger log = LoggerFactory.getLogger(ExtractionStore.class);

    private final MongoTemplate mongoTemplate;
    private final CompanyRepository companyRepository;
    private final IndicatorDefinitionRepository indicatorDefinitionRepository;
    private final ExtractedIndicatorRepository extractedIndicatorRepository;
    private final DocumentStatusRepository documentStatusRepository;

    public ExtractionStore(MongoTemplate mongoTemplate,
                           CompanyRepository companyRepository,
                           IndicatorDefinitionRepository indicatorDefinitionRepository,
                           ExtractedIndicatorRepository extractedIndicatorRepository,
                           DocumentStatusRepository documentStatusRepository) {
        this.mongoTemplate = mongoTemplate;
        this.companyRepository = companyRepository;
        this.indicatorDefinitionRepository = indicatorDefinitionRepository;
        this.extractedIndicatorRepository = extractedIndicatorRepository;
        this.documentStatusRepository = documentStatusRepository;
    }

    /**
     * Matches the company by name or trading symbol, case-insensitively.
     *
     * @throws CompanyNotFoundException if neither matches
     */
    public long resolveCompanyId(String companyName) {
        return companyRepository.findFirstByCompanyNameIgnoreCaseOrSymbolIgnoreCase(companyName, companyName)
                .map(Company::companyId)
                .orElseThrow(() -> new CompanyNotFoundException(companyName));
    }

    public IndicatorCatalog loadIndicatorCatalog() {
        return IndicatorCatalog.of(indicatorDefinitionRepository.findAllByOrderByAttributeNumberAscIndicatorCodeAsc());
    }

    public boolean isAlreadyProcessed(String documentKey) {
        return extractedIndicatorRepository.existsByDocumentKey(documentKey);
    }

    /**
     * Upserts the indicator set of a document in one transaction, keyed by
     * document key and indicator code. Either every indicator is written or none is.
     *
     * @return number of indicators written
     */
    @Transactional
    public int persistExtractedIndicators(List<ExtractedIndicator> indicators) {
        if (indicators.isEmpty()) {
            return 0;
        }
        for (ExtractedIndicator indicator : indicators) {
            Query key = new Query(Criteria.where("documentKey").is(indicator.documentKey())
                    .and("indicatorCode").is(indicator.indicatorCode()));
            Update update = new Update()
                    .set("companyId", indicator.companyId())
                    .set("reportYear", indicator.reportYear())
                    .set("extractedValue", indicator.extractedValue())
                    .set("numericValue", indicator.numericValue())
                    .set("confidenceScore", indicator.confidenceScore())
                    .set("validationStatus", indicator.validationStatus())
                    .set("sourcePages", indicator.sourcePages())
                    .set("sourceChunkIds", indicator.sourceChunkIds())
                    .set("extractedAt", indicator.extractedAt());
            mongoTemplate.upsert(key, update, ExtractedIndicator.class);
        }
        log.info("Stored {} indicators for {}", indicators.size(), indicators.get(0).documentKey());
        return indicators.size();
    }

    /**
     * Replaces the score of the company/year, inserting it when absent.
     */
    public ScoreRecord persistScoreRecord(ScoreRecord record) {
        Query key = new Query(Criteria.where("companyId").is(record.companyId())
                .and("reportYear").is(record.reportYear()));
        ScoreRecord stored = mongoTemplate.findAndReplace(key, record,
                FindAndReplaceOptions.options().upsert().returnNew());
        log.info("Stored ESG score for company {} year {}", record.companyId(), record.reportYear());
        return stored != null ? stored : record;
    }

    public void updateStatus(String documentKey, DocumentStatus status, String errorMessage) {
        documentStatusRepository.save(new DocumentStatusRecord(documentKey, status, errorMessage, Instant.now()));
        log.debug("Status of {} set to {}", documentKey, status);
    }

    public Optional<DocumentStatusRecord> findStatus(String documentKey) {
        return documentStatusRepository.findById(documentKey);
    }

    public boolean isAvailable() {
        try {
            mongoTemplate.executeCommand("{ ping: 1 }");
            return true;
        } catch (RuntimeException e) {
            log.warn("MongoDB ping failed: {}", e.getMessage());
            return false;
        }
    }
}
