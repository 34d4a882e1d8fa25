package com.grantlens.search.embed;

import com.grantlens.search.resilience.CircuitBreaker;
import com.grantlens.search.resilience.SearchResilienceRegistry;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Service;

@Service
public class EmbeddingService implements EmbeddingProvider {
    private final EmbeddingProperties properties;
    private final EmbeddingGateway embeddingGateway;
    private final ToyEmbedder toyEmbedder;
    private final EmbeddingCacheService cacheService;
    private final SearchResilienceRegistry resilienceRegistry;

    public EmbeddingService(
        EmbeddingProperties properties,
        EmbeddingGateway embeddingGateway,
        ToyEmbedder toyEmbedder,
        EmbeddingCacheService cacheService,
        SearchResilienceRegistry resilienceRegistry
    ) {
        this.properties = properties;
        this.embeddingGateway = embeddingGateway;
        this.toyEmbedder = toyEmbedder;
        this.cacheService = cacheService;
        this.resilienceRegistry = resilienceRegistry;
    }

    @Override
    public List<Double> embed(String text, Integer timeBudgetMs, String traceId, String requestId) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingUnavailableException("embed_empty_text");
        }
        Optional<List<Double>> cached = cacheService.get(text);
        if (cached.isPresent()) {
            return cached.get();
        }
        List<Double> vector = fetch(text, timeBudgetMs, traceId, requestId);
        cacheService.put(text, vector);
        return vector;
    }

    private List<Double> fetch(String text, Integer timeBudgetMs, String traceId, String requestId) {
        if (properties.getMode() == EmbeddingMode.TOY) {
            return toyEmbedder.embed(text);
        }
        CircuitBreaker breaker = resilienceRegistry.getEmbedBreaker();
        if (!breaker.allowRequest()) {
            throw new EmbeddingUnavailableException("embed_circuit_open");
        }
        try {
            List<Double> vector = embeddingGateway.embed(text, timeBudgetMs, traceId, requestId);
            breaker.recordSuccess();
            return vector;
        } catch (EmbeddingUnavailableException ex) {
            resilienceRegistry.recordFailure(breaker);
            throw ex;
        }
    }
}
