package com.example.brsr.orchestrator;

import com.example.brsr.config.ExtractionProperties;
import com.example.brsr.exception.CompanyNotFoundException;
import com.example.brsr.exception.IndicatorExtractionException;
import com.example.brsr.model.DeliveryDecision;
import com.example.brsr.model.DeliveryDecision.Action;
import com.example.brsr.model.DocumentRunSummary;
import com.example.brsr.model.DocumentStatus;
import com.example.brsr.model.ExtractionTask;
import com.example.brsr.repository.ChunkCitationRepository;
import com.example.brsr.repository.ExtractionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static com.example.brsr.TestFixtures.DOCUMENT_KEY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExtractionTaskConsumerTest {

    @Mock
    private ExtractionPipeline pipeline;
    @Mock
    private ChunkCitationRepository citationRepository;
    @Mock
    private ExtractionStore store;

    private ExtractionTaskConsumer consumer;

    @BeforeEach
    void setUp() {
        ExtractionProperties properties = new ExtractionProperties(null, null, null, null, null, null,
                new ExtractionProperties.Delivery(3, 10), null, null);
        consumer = new ExtractionTaskConsumer(pipeline, citationRepository, store, new ObjectMapper(), properties);
    }

    @Nested
    @DisplayName("payload parsing")
    class Parsing {

        @Test
        void rawKey() {
            assertThat(consumer.parse("  RELIANCE/2024_BRSR.pdf ", 0, 0).documentKey()).isEqualTo(DOCUMENT_KEY);
        }

        @Test
        void jsonObjectKey() {
            ExtractionTask task = consumer.parse("{\"object_key\": \"RELIANCE/2024_BRSR.pdf\"}", 2, 1);

            assertThat(task).isEqualTo(new ExtractionTask(DOCUMENT_KEY, 2, 1));
        }

        @Test
        void jsonWithoutKeyGivesEmptyKey() {
            assertThat(consumer.parse("{\"bucket\": \"reports\"}", 0, 0).documentKey()).isEmpty();
        }
    }

    @Nested
    @DisplayName("delivery decisions")
    class Decisions {

        @Test
        void successIsAcked() {
            DocumentRunSummary summary = DocumentRunSummary.skipped(DOCUMENT_KEY);
            when(citationRepository.embeddingsExist("RELIANCE", 2024)).thenReturn(true);
            when(pipeline.process(DOCUMENT_KEY)).thenReturn(summary);

            DeliveryDecision decision = consumer.handle(ExtractionTask.firstDelivery(DOCUMENT_KEY));

            assertThat(decision.action()).isEqualTo(Action.ACK);
            assertThat(decision.summary()).isSameAs(summary);
        }

        @Test
        void malformedKeyIsParkedWithoutProcessing() {
            DeliveryDecision decision = consumer.handle(ExtractionTask.firstDelivery("RELIANCE/report.pdf"));

            assertThat(decision.action()).isEqualTo(Action.PARK);
            verifyNoInteractions(pipeline, citationRepository);
            verify(store).updateStatus(eq("RELIANCE/report.pdf"), eq(DocumentStatus.FAILED), anyString());
        }

        @Test
        void missingEmbeddingsAreRequeued() {
            when(citationRepository.embeddingsExist("RELIANCE", 2024)).thenReturn(false);

            DeliveryDecision decision = consumer.handle(new ExtractionTask(DOCUMENT_KEY, 0, 3));

            assertThat(decision.action()).isEqualTo(Action.REQUEUE);
            verifyNoInteractions(pipeline);
            verify(store, never()).updateStatus(anyString(), eq(DocumentStatus.FAILED), anyString());
        }

        @Test
        @DisplayName("embedding checks use the same ceiling as redeliveries")
        void missingEmbeddingsAreParkedOnceChecksReachTheCeiling() {
            when(citationRepository.embeddingsExist("RELIANCE", 2024)).thenReturn(false);

            assertThat(consumer.handle(new ExtractionTask(DOCUMENT_KEY, 0, 9)).action()).isEqualTo(Action.REQUEUE);

            DeliveryDecision decision = consumer.handle(new ExtractionTask(DOCUMENT_KEY, 0, 10));

            assertThat(decision.action()).isEqualTo(Action.PARK);
            verify(store).updateStatus(DOCUMENT_KEY, DocumentStatus.FAILED, "Embeddings not available after 10 checks");
        }

        @Test
        void preconditionFailureIsParkedAtOnce() {
            when(citationRepository.embeddingsExist("RELIANCE", 2024)).thenReturn(true);
            when(pipeline.process(DOCUMENT_KEY)).thenThrow(new CompanyNotFoundException("RELIANCE"));

            DeliveryDecision decision = consumer.handle(ExtractionTask.firstDelivery(DOCUMENT_KEY));

            assertThat(decision.action()).isEqualTo(Action.PARK);
            assertThat(decision.reason()).contains("RELIANCE");
            verify(store).updateStatus(DOCUMENT_KEY, DocumentStatus.FAILED, "Company not found in catalog: RELIANCE");
        }

        @Test
        void transientFailureIsRequeuedUntilTheCeiling() {
            when(citationRepository.embeddingsExist(anyString(), anyInt())).thenReturn(true);
            when(pipeline.process(DOCUMENT_KEY))
                    .thenThrow(new IndicatorExtractionException("Error in Retrieval after 3 attempts", 3, null));

            assertThat(consumer.handle(new ExtractionTask(DOCUMENT_KEY, 2, 0)).action()).isEqualTo(Action.REQUEUE);
            assertThat(consumer.handle(new ExtractionTask(DOCUMENT_KEY, 3, 0)).action()).isEqualTo(Action.PARK);
            verify(pipeline, times(2)).process(DOCUMENT_KEY);
            verify(store).updateStatus(DOCUMENT_KEY, DocumentStatus.FAILED, "Error in Retrieval after 3 attempts");
        }

        @Test
        void statusWriteFailureStillParks() {
            doThrow(new IllegalStateException("mongo down"))
                    .when(store).updateStatus(anyString(), any(DocumentStatus.class), anyString());

            DeliveryDecision decision = consumer.handle(ExtractionTask.firstDelivery("report.pdf"));

            assertThat(decision.action()).isEqualTo(Action.PARK);
        }

        @Test
        void embeddingCheckErrorCountsAsDeliveryFailure() {
            when(citationRepository.embeddingsExist("RELIANCE", 2024)).thenThrow(new IllegalStateException("timeout"));

            DeliveryDecision decision = consumer.handle(ExtractionTask.firstDelivery(DOCUMENT_KEY));

            assertThat(decision.action()).isEqualTo(Action.REQUEUE);
            assertThat(decision.reason()).contains("timeout");
        }
    }
}
