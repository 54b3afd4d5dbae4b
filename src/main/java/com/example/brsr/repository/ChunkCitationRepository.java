package com.example.brsr.repository;

import com.example.brsr.config.ExtractionProperties;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Read-only lookups on the embedded chunk collection written by the embedding service.
 * Chunk metadata lives under {@code metadata.*} as stored by the vector store.
 */
@Repository
public class ChunkCitationRepository {

    private static final Logger log = LoggerFactory.getLogger(ChunkCitationRepository.class);

    static final String COMPANY_NAME = "metadata.company_name";
    static final String REPORT_YEAR = "metadata.report_year";
    static final String PAGE_NUMBER = "metadata.page_number";
    static final String CHUNK_INDEX = "metadata.chunk_index";

    private final MongoTemplate mongoTemplate;
    private final String collection;

    public ChunkCitationRepository(MongoTemplate mongoTemplate, ExtractionProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.collection = properties.vector().collection();
    }

    /**
     * Ids of every chunk on the given pages of a company/year document,
     * ordered by page number then chunk index.
     */
    public List<String> findChunkIds(String companyName, int reportYear, Collection<Integer> pages) {
        if (pages == null || pages.isEmpty()) {
            return List.of();
        }
        Query query = new Query(companyYear(companyName, reportYear).and(PAGE_NUMBER).in(pages))
                .with(Sort.by(Sort.Order.asc(PAGE_NUMBER), Sort.Order.asc(CHUNK_INDEX)));
        query.fields().include("_id");

        List<String> ids = mongoTemplate.find(query, Document.class, collection).stream()
                .map(d -> String.valueOf(d.get("_id")))
                .toList();
        log.debug("Resolved pages {} of {} {} to {} chunk ids", pages, companyName, reportYear, ids.size());
        return ids;
    }

    /**
     * Whether the embedding service already stored chunks for this company/year.
     */
    public boolean embeddingsExist(String companyName, int reportYear) {
        return mongoTemplate.exists(new Query(companyYear(companyName, reportYear)), collection);
    }

    private static Criteria companyYear(String companyName, int reportYear) {
        return Criteria.where(COMPANY_NAME).is(companyName).and(REPORT_YEAR).is(reportYear);
    }
}
