package com.example.brsr.service;

import com.example.brsr.config.ExtractionProperties;
import com.example.brsr.exception.NoResultsException;
import com.example.brsr.model.RetrievedChunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.document.Document;
import org.springframework.ai.vectorstore.SearchRequest;
import org.springframework.ai.vectorstore.VectorStore;

import java.util.List;
import java.util.Map;

import static com.example.brsr.TestFixtures.defaultProperties;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FilteredRetrieverTest {

    @Mock
    private VectorStore vectorStore;

    private FilteredRetriever retriever;

    @BeforeEach
    void setUp() {
        retriever = new FilteredRetriever(vectorStore, defaultProperties());
    }

    private static Document chunk(String id, String text, int page, double distance) {
        return Document.builder()
                .id(id)
                .text(text)
                .metadata(Map.of("company_name", "RELIANCE", "report_year", 2024,
                        "page_number", page, "distance", distance))
                .build();
    }

    @Test
    @DisplayName("company and year are pushed into the vector query as a pre-filter")
    void filtersInsideTheQuery() {
        when(vectorStore.similaritySearch(any(SearchRequest.class)))
                .thenReturn(List.of(chunk("c-1", "Scope 1: 1250 MT CO2e", 45, 0.12)));

        retriever.retrieve("RELIANCE", 2024, "Total Scope 1 emissions", 8);

        ArgumentCaptor<SearchRequest> captor = ArgumentCaptor.forClass(SearchRequest.class);
        verify(vectorStore).similaritySearch(captor.capture());
        SearchRequest request = captor.getValue();
        assertThat(request.getQuery()).isEqualTo("Total Scope 1 emissions");
        assertThat(request.getTopK()).isEqualTo(8);
        assertThat(request.getFilterExpression())
                .isEqualTo(FilteredRetriever.companyYearFilter("RELIANCE", 2024));
    }

    @Test
    void mapsMetadataAndOrdersByDistance() {
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(
                chunk("c-2", "second", 46, 0.30),
                chunk("c-1", "first", 45, 0.12)));

        List<RetrievedChunk> chunks = retriever.retrieve("RELIANCE", 2024, "scope 1", 10);

        assertThat(chunks).containsExactly(
                new RetrievedChunk("first", 45, "c-1", 0.12),
                new RetrievedChunk("second", 46, "c-2", 0.30));
    }

    @Test
    void derivesDistanceFromScoreWhenMetadataHasNone() {
        Document scored = Document.builder().id("c-9").text("t")
                .metadata(Map.of("page_number", 3)).score(0.75).build();
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(scored));

        List<RetrievedChunk> chunks = retriever.retrieve("RELIANCE", 2024, "q", 5);

        assertThat(chunks.get(0).distance()).isEqualTo(0.25);
        assertThat(chunks.get(0).pageNumber()).isEqualTo(3);
    }

    @Test
    @DisplayName("empty ranking raises NoResultsException")
    void emptyResultFails() {
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of());

        assertThatThrownBy(() -> retriever.retrieve("RELIANCE", 2024, "water discharge", 5))
                .isInstanceOf(NoResultsException.class)
                .hasMessageContaining("RELIANCE 2024");
    }

    @Test
    void distanceThresholdDropsFarChunks() {
        FilteredRetriever strict = new FilteredRetriever(vectorStore, new ExtractionProperties(
                new ExtractionProperties.Retrieval(10, 0.2), null, null, null, null, null, null, null, null));
        when(vectorStore.similaritySearch(any(SearchRequest.class))).thenReturn(List.of(chunk("c-1", "far", 9, 0.6)));

        assertThatThrownBy(() -> strict.retrieve("RELIANCE", 2024, "q", 5)).isInstanceOf(NoResultsException.class);
    }

    @Test
    void clampsKIntoFiveToTen() {
        assertThat(FilteredRetriever.clampTopK(1)).isEqualTo(5);
        assertThat(FilteredRetriever.clampTopK(7)).isEqualTo(7);
        assertThat(FilteredRetriever.clampTopK(50)).isEqualTo(10);
    }
}
