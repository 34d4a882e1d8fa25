package com.grantlens.search.retrieval;

import com.grantlens.search.embed.EmbeddingProvider;
import com.grantlens.search.embed.EmbeddingUnavailableException;
import com.grantlens.search.opensearch.OpenSearchRequestException;
import com.grantlens.search.opensearch.OpenSearchUnavailableException;
import com.grantlens.search.resilience.CircuitBreaker;
import com.grantlens.search.resilience.SearchDegradationRecorder;
import com.grantlens.search.resilience.SearchResilienceRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SemanticRetriever implements Retriever {
    private static final Logger log = LoggerFactory.getLogger(SemanticRetriever.class);
    private static final String STAGE = "semantic";

    private final EmbeddingProvider embeddingProvider;
    private final List<SemanticSearchStrategy> strategies;
    private final VectorSearchProperties properties;
    private final SearchResilienceRegistry resilienceRegistry;
    private final SearchDegradationRecorder degradationRecorder;

    public SemanticRetriever(
        EmbeddingProvider embeddingProvider,
        List<SemanticSearchStrategy> strategies,
        VectorSearchProperties properties,
        SearchResilienceRegistry resilienceRegistry,
        SearchDegradationRecorder degradationRecorder
    ) {
        this.embeddingProvider = embeddingProvider;
        this.strategies = List.copyOf(strategies);
        this.properties = properties;
        this.resilienceRegistry = resilienceRegistry;
        this.degradationRecorder = degradationRecorder;
    }

    @Override
    public String name() {
        return STAGE;
    }

    @Override
    public RetrievalStageResult retrieve(RetrievalStageContext context) {
        if (context == null || context.getQueryText() == null || context.getQueryText().isBlank()) {
            return RetrievalStageResult.empty();
        }
        if (context.getTopK() <= 0) {
            return RetrievalStageResult.empty();
        }
        if (!properties.isEnabled()) {
            return RetrievalStageResult.skipped("vector_disabled");
        }
        long started = System.nanoTime();
        List<Double> vector;
        try {
            vector = embeddingProvider.embed(
                context.getQueryText(),
                context.getTimeBudgetMs(),
                context.getTraceId(),
                context.getRequestId()
            );
        } catch (EmbeddingUnavailableException e) {
            degradationRecorder.record(STAGE, e.getMessage());
            return RetrievalStageResult.skipped(e.getMessage());
        }
        Integer remainingMs = context.getTimeBudgetMs();
        if (remainingMs != null) {
            remainingMs = (int) Math.max(0L, remainingMs - (System.nanoTime() - started) / 1_000_000L);
            if (remainingMs <= 0) {
                degradationRecorder.record(STAGE, "deadline", "after_embed");
                return RetrievalStageResult.timedOut();
            }
        }
        double threshold = context.getSimilarityThreshold() == null
            ? properties.getThreshold()
            : context.getSimilarityThreshold();
        return retrieveByVector(vector, threshold, context.getTopK(), remainingMs);
    }

    // first strategy that answers wins
    public RetrievalStageResult retrieveByVector(List<Double> vector, double threshold, int count, Integer timeBudgetMs) {
        if (vector == null || vector.isEmpty() || count <= 0) {
            return RetrievalStageResult.empty();
        }
        CircuitBreaker breaker = resilienceRegistry.getVectorBreaker();
        if (!breaker.allowRequest()) {
            degradationRecorder.record(STAGE, "vector_circuit_open");
            return RetrievalStageResult.skipped("vector_circuit_open");
        }

        long started = System.nanoTime();
        long deadline = timeBudgetMs == null ? Long.MAX_VALUE : started + timeBudgetMs * 1_000_000L;
        List<String> failures = new ArrayList<>();
        boolean storeUnreachable = true;
        for (SemanticSearchStrategy strategy : strategies) {
            Integer strategyBudgetMs = null;
            if (timeBudgetMs != null) {
                long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
                if (remainingMs <= 0) {
                    failures.add(strategy.name() + ":deadline");
                    storeUnreachable = false;
                    break;
                }
                strategyBudgetMs = (int) remainingMs;
            }
            try {
                List<SimilarityHit> hits = strategy.search(vector, threshold, count, strategyBudgetMs);
                breaker.recordSuccess();
                long tookMs = (System.nanoTime() - started) / 1_000_000L;
                log.debug("semantic retrieval strategy={} hits={} took_ms={}", strategy.name(), hits.size(), tookMs);
                if (failures.isEmpty()) {
                    return RetrievalStageResult.success(docIds(hits), similarities(hits), tookMs);
                }
                degradationRecorder.record(STAGE, "fallback_" + strategy.name(), String.join(",", failures));
                return RetrievalStageResult.partial(docIds(hits), similarities(hits), tookMs, "fallback_" + strategy.name());
            } catch (OpenSearchUnavailableException e) {
                failures.add(strategy.name() + ":" + e.getMessage());
                log.debug("semantic strategy unavailable strategy={} error={}", strategy.name(), e.getMessage());
            } catch (OpenSearchRequestException e) {
                failures.add(strategy.name() + ":" + e.getMessage());
                storeUnreachable = false;
                log.debug("semantic strategy failed strategy={} error={}", strategy.name(), e.getMessage());
            }
        }
        resilienceRegistry.recordFailure(breaker);
        degradationRecorder.record(STAGE, "all_strategies_failed", String.join(",", failures));
        if (storeUnreachable && !failures.isEmpty()) {
            return RetrievalStageResult.unavailable("all_strategies_unreachable");
        }
        return RetrievalStageResult.error("all_strategies_failed");
    }

    private List<String> docIds(List<SimilarityHit> hits) {
        List<String> docIds = new ArrayList<>(hits.size());
        for (SimilarityHit hit : hits) {
            docIds.add(hit.docId());
        }
        return docIds;
    }

    private Map<String, Double> similarities(List<SimilarityHit> hits) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (SimilarityHit hit : hits) {
            scores.put(hit.docId(), hit.similarity());
        }
        return scores;
    }
}
