package com.grantlens.search.retrieval;

public record SimilarityHit(String docId, double similarity) {
}
