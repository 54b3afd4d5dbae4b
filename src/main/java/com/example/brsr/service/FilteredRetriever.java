package com.example.brsr.service;

import com.example.brsr.config.ExtractionProperties;
import com.example.brsr.exception.NoResultsException;
import com.example.brsr.model.RetrievedChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;
import org.springframework.ai.vectorstore.filter.Filter;
import org.springframework.ai.vectorstore.filter.FilterExpressionBuilder;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Similarity search restricted to one company and report year.
 * <p>
 * The company/year condition is pushed into the vector query as a metadata pre-filter,
 * so ranking only ever runs over that document's chunks.
 */
@Service
public class FilteredRetriever {

    private static final Logger log = LoggerFactory.getLogger(FilteredRetriever.class);

    public static final int MIN_K = 5;
    public static final int MAX_K = 10;

    static final String COMPANY_NAME = "company_name";
    static final String REPORT_YEAR = "report_year";
    static final String PAGE_NUMBER = "page_number";
    static final String DISTANCE = "distance";

    private final VectorStore vectorStore;
    private final Double distanceThreshold;

    public FilteredRetriever(VectorStore vectorStore, ExtractionProperties properties) {
        this.vectorStore = vectorStore;
        this.distanceThreshold = properties.retrieval().distanceThreshold();
    }

    /**
     * @param k requested number of chunks, clamped to [{@value #MIN_K}, {@value #MAX_K}]
     * @return chunks ordered by ascending distance
     * @throws NoResultsException if nothing relevant is left after ranking
     */
    public List<RetrievedChunk> retrieve(String companyName, int reportYear, String query, int k) {
        if (companyName == null || companyName.isBlank()) {
            throw new IllegalArgumentException("companyName is required");
        }
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query is required");
        }
        int topK = clampTopK(k);

        SearchRequest request = SearchRequest.builder()
                .query(query)
                .topK(topK)
                .similarityThresholdAll()
                .filterExpression(companyYearFilter(companyName, reportYear))
                .build();

        List<Document> documents = vectorStore.similaritySearch(request);
        List<RetrievedChunk> chunks = (documents == null ? List.<Document>of() : documents).stream()
                .map(FilteredRetriever::toChunk)
                .filter(c -> distanceThreshold == null || c.distance() <= distanceThreshold)
                .sorted(Comparator.comparingDouble(RetrievedChunk::distance))
                .toList();

        if (chunks.isEmpty()) {
            throw new NoResultsException(companyName, reportYear, query);
        }
        log.debug("Retrieved {} chunks for {} {} (best distance {})",
                chunks.size(), companyName, reportYear, chunks.get(0).distance());
        return chunks;
    }

    public static int clampTopK(int k) {
        if (k < MIN_K || k > MAX_K) {
            int clamped = Math.max(MIN_K, Math.min(MAX_K, k));
            log.warn("k={} outside [{}, {}], using {}", k, MIN_K, MAX_K, clamped);
            return clamped;
        }
        return k;
    }

    static Filter.Expression companyYearFilter(String companyName, int reportYear) {
        FilterExpressionBuilder b = new FilterExpressionBuilder();
        return b.and(b.eq(COMPANY_NAME, companyName), b.eq(REPORT_YEAR, reportYear)).build();
    }

    static RetrievedChunk toChunk(Document document) {
        Map<String, Object> metadata = document.getMetadata();
        double distance;
        if (metadata.get(DISTANCE) instanceof Number n) {
            distance = n.doubleValue();
        } else if (document.getScore() != null) {
            distance = 1.0 - document.getScore();
        } else {
            distance = 0.0;
        }
        return new RetrievedChunk(
                document.getText() != null ? document.getText() : "",
                toInt(metadata.get(PAGE_NUMBER)),
                document.getId(),
                distance);
    }

    private static int toInt(Object value) {
        if (value instanceof Number n) {
            return n.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                log.debug("Unparseable page number '{}'", value);
            }
        }
        return 0;
    }
}
