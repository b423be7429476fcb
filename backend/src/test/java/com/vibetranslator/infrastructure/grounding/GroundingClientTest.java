package com.vibetranslator.infrastructure.grounding;

import com.vibetranslator.domain.vibe.model.GroundingDocument;
import com.vibetranslator.domain.vibe.service.GroundingStore;
import com.vibetranslator.infrastructure.ai.PipelineMetricsTracker;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GroundingClientTest {

    @Mock
    private GroundingStore store;

    private final PipelineMetricsTracker metrics = new PipelineMetricsTracker();

    @Test
    @DisplayName("Documents come back by relevance, highest first, limited to topK")
    void sortsAndLimits() {
        when(store.retrieve(any(), any(), any(), anyInt())).thenReturn(List.of(
                new GroundingDocument("low", "a", 0.1),
                new GroundingDocument("high", "b", 0.9),
                new GroundingDocument("mid", "c", 0.5)));

        List<GroundingDocument> docs = new GroundingClient(store, metrics).retrieve("q", "linkedin", null, 2);

        assertThat(docs).extracting(GroundingDocument::title).containsExactly("high", "mid");
    }

    @Test
    @DisplayName("Non-positive topK returns nothing without touching the store")
    void zeroTopK() {
        assertThat(new GroundingClient(store, metrics).retrieve("q", null, null, 0)).isEmpty();
        verifyNoInteractions(store);
    }

    @Test
    @DisplayName("A failing store yields no grounding and is counted")
    void storeFailure() {
        when(store.retrieve(any(), any(), any(), anyInt())).thenThrow(new IllegalStateException("offline"));

        assertThat(new GroundingClient(store, metrics).retrieve("q", null, null, 5)).isEmpty();
        assertThat(metrics.getGroundingFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("A null result is treated as a failure")
    void nullResult() {
        when(store.retrieve(any(), any(), any(), anyInt())).thenReturn(null);

        assertThat(new GroundingClient(store, metrics).retrieve("q", null, null, 5)).isEmpty();
        assertThat(metrics.getGroundingFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("Query names the platform, or generic when absent")
    void buildQuery() {
        assertThat(GroundingClient.buildQuery("Hi", "slack")).isEqualTo("slack guidance for: Hi");
        assertThat(GroundingClient.buildQuery("Hi", " ")).isEqualTo("generic guidance for: Hi");
    }
}
