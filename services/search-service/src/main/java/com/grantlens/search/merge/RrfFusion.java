package com.grantlens.search.merge;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class RrfFusion {
    public static final int DEFAULT_K = 60;

    private RrfFusion() {
    }

    public static List<Candidate> fuse(List<String> lexicalIds, List<String> semanticIds, Map<String, Double> similarities) {
        return fuse(lexicalIds, semanticIds, similarities, DEFAULT_K);
    }

    /**
     * Scores each id by {@code 1 / (k + rank)} per source, multiplying the semantic term by {@code 1 + similarity}.
     * Equal scores keep the order in which ids were first seen, lexical before semantic-only.
     */
    public static List<Candidate> fuse(
        List<String> lexicalIds,
        List<String> semanticIds,
        Map<String, Double> similarities,
        int k
    ) {
        Map<String, MutableCandidate> candidates = new LinkedHashMap<>();

        int rank = 1;
        for (String docId : lexicalIds == null ? List.<String>of() : lexicalIds) {
            MutableCandidate candidate = candidates.computeIfAbsent(docId, MutableCandidate::new);
            if (candidate.lexRank != null) {
                continue;
            }
            candidate.lexRank = rank;
            candidate.score += 1.0 / (k + rank);
            rank++;
        }

        rank = 1;
        for (String docId : semanticIds == null ? List.<String>of() : semanticIds) {
            MutableCandidate candidate = candidates.computeIfAbsent(docId, MutableCandidate::new);
            if (candidate.vecRank != null) {
                continue;
            }
            Double similarity = similarities == null ? null : similarities.get(docId);
            double boost = 1.0 + (similarity == null ? 0.0 : similarity);
            candidate.vecRank = rank;
            candidate.similarity = similarity;
            candidate.score += boost / (k + rank);
            rank++;
        }

        List<MutableCandidate> ordered = new ArrayList<>(candidates.values());
        ordered.sort(Comparator.comparingDouble(MutableCandidate::getScore).reversed());

        List<Candidate> fused = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            MutableCandidate candidate = ordered.get(i);
            fused.add(
                new Candidate(
                    candidate.docId,
                    candidate.score,
                    candidate.lexRank,
                    candidate.vecRank,
                    i + 1,
                    candidate.similarity
                )
            );
        }
        return fused;
    }

    public static final class Candidate {
        private final String docId;
        private final double score;
        private final Integer lexRank;
        private final Integer vecRank;
        private final int fusedRank;
        private final Double similarity;

        public Candidate(
            String docId,
            double score,
            Integer lexRank,
            Integer vecRank,
            int fusedRank,
            Double similarity
        ) {
            this.docId = docId;
            this.score = score;
            this.lexRank = lexRank;
            this.vecRank = vecRank;
            this.fusedRank = fusedRank;
            this.similarity = similarity;
        }

        public String getDocId() {
            return docId;
        }

        public double getScore() {
            return score;
        }

        public Integer getLexRank() {
            return lexRank;
        }

        public Integer getVecRank() {
            return vecRank;
        }

        public int getFusedRank() {
            return fusedRank;
        }

        public Double getSimilarity() {
            return similarity;
        }
    }

    private static final class MutableCandidate {
        private final String docId;
        private double score;
        private Integer lexRank;
        private Integer vecRank;
        private Double similarity;

        private MutableCandidate(String docId) {
            this.docId = docId;
        }

        private double getScore() {
            return score;
        }
    }
}
