package com.grantlens.search.retrieval;

import com.grantlens.search.opensearch.OpenSearchGateway;
import com.grantlens.search.opensearch.OpenSearchQueryResult;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2)
public class ExactScanStrategy implements SemanticSearchStrategy {
    private final OpenSearchGateway openSearchGateway;
    private final VectorSearchProperties properties;

    public ExactScanStrategy(OpenSearchGateway openSearchGateway, VectorSearchProperties properties) {
        this.openSearchGateway = openSearchGateway;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "exact_scan";
    }

    @Override
    public List<SimilarityHit> search(List<Double> vector, double threshold, int count, Integer timeBudgetMs) {
        int reduced = reducedCount(count);
        OpenSearchQueryResult result = openSearchGateway.searchExactCosine(vector, reduced, timeBudgetMs);
        // knn_score with cosinesimil returns 1 + cos
        return SimilarityHits.fromScores(
            result.getDocIds(),
            result.getScoresByDocId(),
            score -> score - 1.0,
            threshold,
            reduced
        );
    }

    int reducedCount(int count) {
        double ratio = properties.getExactScanCountRatio();
        if (ratio <= 0 || ratio > 1) {
            ratio = 1.0;
        }
        return Math.max(1, (int) Math.ceil(count * ratio));
    }
}
