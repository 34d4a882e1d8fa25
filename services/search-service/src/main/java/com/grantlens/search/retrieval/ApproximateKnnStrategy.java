package com.grantlens.search.retrieval;

import com.grantlens.search.opensearch.OpenSearchGateway;
import com.grantlens.search.opensearch.OpenSearchQueryResult;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1)
public class ApproximateKnnStrategy implements SemanticSearchStrategy {
    private final OpenSearchGateway openSearchGateway;

    public ApproximateKnnStrategy(OpenSearchGateway openSearchGateway) {
        this.openSearchGateway = openSearchGateway;
    }

    @Override
    public String name() {
        return "approximate_knn";
    }

    @Override
    public List<SimilarityHit> search(List<Double> vector, double threshold, int count, Integer timeBudgetMs) {
        OpenSearchQueryResult result = openSearchGateway.searchKnn(vector, count, timeBudgetMs);
        // cosinesimil k-NN scores are (1 + cos) / 2
        return SimilarityHits.fromScores(
            result.getDocIds(),
            result.getScoresByDocId(),
            score -> 2.0 * score - 1.0,
            threshold,
            count
        );
    }
}
