package com.grantlens.search.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.vector")
public class VectorSearchProperties {
    private boolean enabled = true;
    private double threshold = 0.25;
    private int candidateMultiplier = 2;
    private double exactScanCountRatio = 0.5;
    private int budgetMs = 5000;
    private Similar similar = new Similar();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getCandidateMultiplier() {
        return candidateMultiplier;
    }

    public void setCandidateMultiplier(int candidateMultiplier) {
        this.candidateMultiplier = candidateMultiplier;
    }

    public double getExactScanCountRatio() {
        return exactScanCountRatio;
    }

    public void setExactScanCountRatio(double exactScanCountRatio) {
        this.exactScanCountRatio = exactScanCountRatio;
    }

    public int getBudgetMs() {
        return budgetMs;
    }

    public void setBudgetMs(int budgetMs) {
        this.budgetMs = budgetMs;
    }

    public Similar getSimilar() {
        return similar;
    }

    public void setSimilar(Similar similar) {
        this.similar = similar;
    }

    public static class Similar {
        private double threshold = 0.6;
        private int defaultLimit = 10;
        private int maxLimit = 10;

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }
    }
}
