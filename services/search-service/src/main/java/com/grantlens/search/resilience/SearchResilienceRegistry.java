package com.grantlens.search.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SearchResilienceRegistry {
    private static final Logger log = LoggerFactory.getLogger(SearchResilienceRegistry.class);

    private final CircuitBreaker embedBreaker;
    private final CircuitBreaker vectorBreaker;

    public SearchResilienceRegistry(SearchResilienceProperties properties) {
        this.embedBreaker = new CircuitBreaker("embed", properties.getEmbedFailureThreshold(), properties.getEmbedOpenMs());
        this.vectorBreaker = new CircuitBreaker("vector", properties.getVectorFailureThreshold(), properties.getVectorOpenMs());
    }

    public CircuitBreaker getEmbedBreaker() {
        return embedBreaker;
    }

    public CircuitBreaker getVectorBreaker() {
        return vectorBreaker;
    }

    public void recordFailure(CircuitBreaker breaker) {
        if (breaker.recordFailure()) {
            log.warn("circuit opened breaker={}", breaker.getName());
        }
    }
}
