package com.grantlens.search.retrieval;

import java.util.List;

public interface SemanticSearchStrategy {
    String name();

    List<SimilarityHit> search(List<Double> vector, double threshold, int count, Integer timeBudgetMs);
}
