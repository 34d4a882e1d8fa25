package com.grantlens.search.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.intThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.grantlens.search.embed.EmbeddingProvider;
import com.grantlens.search.embed.EmbeddingUnavailableException;
import com.grantlens.search.opensearch.OpenSearchGateway;
import com.grantlens.search.opensearch.OpenSearchQueryResult;
import com.grantlens.search.opensearch.OpenSearchRequestException;
import com.grantlens.search.opensearch.OpenSearchUnavailableException;
import com.grantlens.search.resilience.SearchDegradationRecorder;
import com.grantlens.search.resilience.SearchResilienceProperties;
import com.grantlens.search.resilience.SearchResilienceRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SemanticRetrieverTest {

    private static final List<Double> VECTOR = List.of(0.1, 0.2, 0.3);

    @Mock
    private EmbeddingProvider embeddingProvider;

    @Mock
    private OpenSearchGateway openSearchGateway;

    private SemanticRetriever retriever;

    @BeforeEach
    void setUp() {
        VectorSearchProperties properties = new VectorSearchProperties();
        retriever = new SemanticRetriever(
            embeddingProvider,
            List.of(
                new ApproximateKnnStrategy(openSearchGateway),
                new ExactScanStrategy(openSearchGateway, properties)
            ),
            properties,
            new SearchResilienceRegistry(new SearchResilienceProperties()),
            new SearchDegradationRecorder(new SimpleMeterRegistry())
        );
    }

    @Test
    void keepsOnlyHitsStrictlyAboveThreshold() {
        when(embeddingProvider.embed(anyString(), any(), any(), any())).thenReturn(VECTOR);
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("g1", 0.95);
        scores.put("g2", 0.625);
        scores.put("g3", 0.6);
        when(openSearchGateway.searchKnn(eq(VECTOR), eq(20), any()))
            .thenReturn(new OpenSearchQueryResult(List.of("g1", "g2", "g3"), scores, null, false));

        RetrievalStageResult result = retriever.retrieve(context("antibody engineering"));

        assertThat(result.isDegraded()).isFalse();
        assertThat(result.getDocIds()).containsExactly("g1");
        assertThat(result.getScoresByDocId().get("g1")).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void ordersHitsBySimilarity() {
        when(embeddingProvider.embed(anyString(), any(), any(), any())).thenReturn(VECTOR);
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("g1", 0.7);
        scores.put("g2", 0.9);
        when(openSearchGateway.searchKnn(eq(VECTOR), eq(20), any()))
            .thenReturn(new OpenSearchQueryResult(List.of("g1", "g2"), scores, null, false));

        RetrievalStageResult result = retriever.retrieve(context("tumor microenvironment"));

        assertThat(result.getDocIds()).containsExactly("g2", "g1");
    }

    @Test
    void fallsBackToExactScanWithReducedCount() {
        when(embeddingProvider.embed(anyString(), any(), any(), any())).thenReturn(VECTOR);
        when(openSearchGateway.searchKnn(any(), anyInt(), any()))
            .thenThrow(new OpenSearchUnavailableException("knn unavailable"));
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("g1", 1.9);
        scores.put("g2", 1.2);
        when(openSearchGateway.searchExactCosine(eq(VECTOR), eq(10), any()))
            .thenReturn(new OpenSearchQueryResult(List.of("g1", "g2"), scores, null, false));

        RetrievalStageResult result = retriever.retrieve(context("gene therapy"));

        assertThat(result.isError()).isFalse();
        assertThat(result.isDegraded()).isTrue();
        assertThat(result.getDocIds()).containsExactly("g1");
        assertThat(result.getScoresByDocId().get("g1")).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void embeddingFailureSkipsStage() {
        when(embeddingProvider.embed(anyString(), any(), any(), any()))
            .thenThrow(new EmbeddingUnavailableException("embed_timeout"));

        RetrievalStageResult result = retriever.retrieve(context("gene therapy"));

        assertThat(result.isSkipped()).isTrue();
        assertThat(result.getDocIds()).isEmpty();
        verifyNoInteractions(openSearchGateway);
    }

    @Test
    void opensVectorBreakerAfterRepeatedChainFailures() {
        when(openSearchGateway.searchKnn(any(), anyInt(), any()))
            .thenThrow(new OpenSearchUnavailableException("knn unavailable"));
        when(openSearchGateway.searchExactCosine(any(), anyInt(), any()))
            .thenThrow(new OpenSearchUnavailableException("scan unavailable"));

        for (int i = 0; i < 3; i++) {
            RetrievalStageResult failed = retriever.retrieveByVector(VECTOR, 0.25, 20, 1000);
            assertThat(failed.isError()).isTrue();
            assertThat(failed.isSkipped()).isFalse();
        }

        RetrievalStageResult result = retriever.retrieveByVector(VECTOR, 0.25, 20, 1000);

        assertThat(result.isSkipped()).isTrue();
        assertThat(result.getErrorMessage()).isEqualTo("vector_circuit_open");
        verify(openSearchGateway, times(3)).searchKnn(any(), anyInt(), any());
    }

    @Test
    void marksStoreUnreachableWhenEveryStrategyIsUnavailable() {
        when(openSearchGateway.searchKnn(any(), anyInt(), any()))
            .thenThrow(new OpenSearchUnavailableException("knn unavailable"));
        when(openSearchGateway.searchExactCosine(any(), anyInt(), any()))
            .thenThrow(new OpenSearchUnavailableException("scan unavailable"));

        RetrievalStageResult result = retriever.retrieveByVector(VECTOR, 0.25, 20, 1000);

        assertThat(result.isError()).isTrue();
        assertThat(result.isStoreUnavailable()).isTrue();
    }

    @Test
    void rejectedQueryIsNotStoreUnavailability() {
        when(openSearchGateway.searchKnn(any(), anyInt(), any()))
            .thenThrow(new OpenSearchUnavailableException("knn unavailable"));
        when(openSearchGateway.searchExactCosine(any(), anyInt(), any()))
            .thenThrow(new OpenSearchRequestException("OpenSearch error: 400"));

        RetrievalStageResult result = retriever.retrieveByVector(VECTOR, 0.25, 20, 1000);

        assertThat(result.isError()).isTrue();
        assertThat(result.isStoreUnavailable()).isFalse();
    }

    @Test
    void strategiesShareTheStageBudget() {
        when(openSearchGateway.searchKnn(any(), anyInt(), any()))
            .thenThrow(new OpenSearchUnavailableException("knn unavailable"));
        when(openSearchGateway.searchExactCosine(any(), anyInt(), any()))
            .thenReturn(new OpenSearchQueryResult(List.of(), Map.of(), null, false));

        retriever.retrieveByVector(VECTOR, 0.25, 20, 1000);

        verify(openSearchGateway).searchExactCosine(eq(VECTOR), eq(10), intThat(budget -> budget <= 1000));
    }

    @Test
    void nonPositiveCountReturnsNothing() {
        RetrievalStageResult result = retriever.retrieve(new RetrievalStageContext("gene", 0, null, 1000, "t", "r"));

        assertThat(result.getDocIds()).isEmpty();
        verify(embeddingProvider, never()).embed(anyString(), any(), any(), any());
    }

    private RetrievalStageContext context(String query) {
        return new RetrievalStageContext(query, 20, null, 3000, "trace-1", "req-1");
    }
}
