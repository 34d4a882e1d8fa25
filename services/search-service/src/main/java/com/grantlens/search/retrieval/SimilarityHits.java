package com.grantlens.search.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

final class SimilarityHits {
    private SimilarityHits() {
    }

    static List<SimilarityHit> fromScores(
        List<String> docIds,
        Map<String, Double> scores,
        ScoreConverter converter,
        double threshold,
        int count
    ) {
        List<SimilarityHit> hits = new ArrayList<>();
        for (String docId : docIds) {
            Double score = scores.get(docId);
            if (score == null) {
                continue;
            }
            double similarity = converter.toSimilarity(score);
            if (similarity > threshold) {
                hits.add(new SimilarityHit(docId, similarity));
            }
        }
        hits.sort(Comparator.comparingDouble(SimilarityHit::similarity).reversed());
        return hits.size() > count ? new ArrayList<>(hits.subList(0, count)) : hits;
    }

    @FunctionalInterface
    interface ScoreConverter {
        double toSimilarity(double score);
    }
}
