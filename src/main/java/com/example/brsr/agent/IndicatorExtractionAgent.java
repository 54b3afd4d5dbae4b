package com.example.brsr.agent;

import com.example.brsr.config.ExtractionProperties;
import com.example.brsr.model.IndicatorDefinition;
import com.example.brsr.model.IndicatorExtractionOutput;
import com.example.brsr.model.RetrievedChunk;
import com.example.brsr.service.FilteredRetriever;
import com.example.brsr.service.ResilientLlmCaller;
import com.example.brsr.service.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Extraction chain for a single BRSR indicator: retrieve evidence for the company/year,
 * ask the model for the value with a confidence score and cited pages, parse the answer.
 * <p>
 * Retrieval and the model call are retried independently. A failure that survives the
 * retry policy is thrown to the caller.
 */
@Service
public class IndicatorExtractionAgent {

    private static final Logger log = LoggerFactory.getLogger(IndicatorExtractionAgent.class);

    private static final String SYSTEM_PROMPT = """
            You are an expert ESG analyst extracting BRSR Core indicators from company
            Business Responsibility and Sustainability Reports.

            RULES:
            - Use only the report excerpts you are given. Never use outside knowledge.
            - Extract values EXACTLY as stated in the report. Do not convert units.
            - Do not calculate or combine values unless the indicator definition requires it.
            - For qualitative indicators (Yes/No, descriptions) extract the exact text and leave numericValue null.
            - Be conservative with confidence: only use high scores when certain.
            - Return JSON only, compliant with the provided schema.
            """;

    private static final String USER_PROMPT = """
            **Company Context:**
            Company Name: %s
            Report Year: %d
            Report Type: BRSR (Business Responsibility and Sustainability Report)

            **Indicator to Extract:**
            Indicator Code: %s
            Parameter Name: %s
            Description: %s
            Expected Unit: %s
            Pillar: %s (Environmental/Social/Governance)

            **Instructions:**
            1. Read the excerpts from the company's report below
            2. Extract the EXACT value for the indicator
            3. If the value is numeric, give both the text value and its numeric representation
            4. Give the unit of measurement (the expected unit if found, otherwise the unit used in the report)
            5. Give a confidence score between 0.0 and 1.0:
               - 1.0: value explicitly stated with clear labeling
               - 0.8-0.9: value clearly stated but requires minor interpretation
               - 0.6-0.7: value found but requires moderate interpretation or calculation
               - 0.4-0.5: value inferred from related information
               - 0.0-0.3: value not found or highly uncertain
            6. List ALL page numbers the value was drawn from
            7. If the indicator is not in the excerpts, return value "Not Found", confidence 0.0 and no pages

            **Excerpts from the %s %d report:**
            %s
            """;

    private final FilteredRetriever retriever;
    private final ResilientLlmCaller llmCaller;
    private final RetryExecutor retryExecutor;
    private final ChatClient chatClient;
    private final int topK;

    public IndicatorExtractionAgent(FilteredRetriever retriever,
                                    ResilientLlmCaller llmCaller,
                                    RetryExecutor retryExecutor,
                                    @Qualifier("extractionChatClient") ChatClient chatClient,
                                    ExtractionProperties properties) {
        this.retriever = retriever;
        this.llmCaller = llmCaller;
        this.retryExecutor = retryExecutor;
        this.chatClient = chatClient;
        this.topK = FilteredRetriever.clampTopK(properties.retrieval().topK());
    }

    /**
     * Extracts one indicator from the report of the given company and year.
     *
     * @throws com.example.brsr.exception.NoResultsException if retrieval found nothing relevant
     * @throws com.example.brsr.exception.IndicatorExtractionException if retries were exhausted
     */
    public IndicatorExtractionOutput extract(String companyName, int reportYear, IndicatorDefinition definition) {
        String code = definition.indicatorCode();
        String query = buildQuery(definition);

        List<RetrievedChunk> chunks = retryExecutor.execute("Retrieval " + code,
                () -> retriever.retrieve(companyName, reportYear, query, topK));
        log.debug("IndicatorExtractionAgent: {} chunks for {} (pages {})", chunks.size(), code,
                chunks.stream().map(RetrievedChunk::pageNumber).distinct().toList());

        IndicatorExtractionOutput output = llmCaller.callEntity(
                chatClient, SYSTEM_PROMPT,
                buildUserPrompt(companyName, reportYear, definition, chunks),
                IndicatorExtractionOutput.class, "Extraction " + code);

        if (!code.equals(output.indicatorCode())) {
            log.debug("IndicatorExtractionAgent: model answered code '{}' for {}, keeping catalog code",
                    output.indicatorCode(), code);
            output = output.withIndicatorCode(code);
        }
        log.info("IndicatorExtractionAgent: {} = '{}' (confidence {}, pages {})",
                code, output.value(), output.confidence(), output.sourcePages());
        return output;
    }

    static String buildQuery(IndicatorDefinition definition) {
        StringBuilder query = new StringBuilder(definition.parameterName());
        if (definition.description() != null && !definition.description().isBlank()) {
            query.append(' ').append(definition.description());
        }
        if (definition.hasUnit()) {
            query.append(' ').append(definition.measurementUnit());
        }
        return query.toString();
    }

    static String buildUserPrompt(String companyName, int reportYear, IndicatorDefinition definition,
                                  List<RetrievedChunk> chunks) {
        return USER_PROMPT.formatted(
                companyName, reportYear,
                definition.indicatorCode(),
                definition.parameterName(),
                definition.description() != null ? definition.description() : "",
                definition.hasUnit() ? definition.measurementUnit() : "N/A",
                definition.pillar().code(),
                companyName, reportYear,
                formatContext(chunks));
    }

    static String formatContext(List<RetrievedChunk> chunks) {
        return chunks.stream()
                .map(c -> String.format(Locale.ROOT, "[Page %d | chunk %s | distance %.3f]%n%s",
                        c.pageNumber(), c.chunkId(), c.distance(), c.text()))
                .collect(Collectors.joining("\n\n---\n\n"));
    }
}
