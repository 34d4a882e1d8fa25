package com.grantlens.search.service;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.result")
public class SearchResultProperties {
    private int defaultLimit = 100;
    private int maxLimit = 1000;
    private int displayCap = 100;
    private int sampleSize = 10;
    private int hydrationBatchSize = 500;
    private int hydrationBudgetMs = 10000;
    private int contactBudgetMs = 2000;

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

    public int getDisplayCap() {
        return displayCap;
    }

    public void setDisplayCap(int displayCap) {
        this.displayCap = displayCap;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public int getHydrationBatchSize() {
        return hydrationBatchSize;
    }

    public void setHydrationBatchSize(int hydrationBatchSize) {
        this.hydrationBatchSize = hydrationBatchSize;
    }

    public int getHydrationBudgetMs() {
        return hydrationBudgetMs;
    }

    public void setHydrationBudgetMs(int hydrationBudgetMs) {
        this.hydrationBudgetMs = hydrationBudgetMs;
    }

    public int getContactBudgetMs() {
        return contactBudgetMs;
    }

    public void setContactBudgetMs(int contactBudgetMs) {
        this.contactBudgetMs = contactBudgetMs;
    }
}
