package com.grantlens.search.retrieval;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "search.lexical")
public class LexicalSearchProperties {
    private int pageSize = 1000;
    private int maxIdsPerVariant = 15000;
    private int maxSubQueries = 96;
    private int subQueryTimeoutMs = 4000;
    private int budgetMs = 8000;
    private boolean termsEnabled = true;

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public int getMaxIdsPerVariant() {
        return maxIdsPerVariant;
    }

    public void setMaxIdsPerVariant(int maxIdsPerVariant) {
        this.maxIdsPerVariant = maxIdsPerVariant;
    }

    public int getMaxSubQueries() {
        return maxSubQueries;
    }

    public void setMaxSubQueries(int maxSubQueries) {
        this.maxSubQueries = maxSubQueries;
    }

    public int getSubQueryTimeoutMs() {
        return subQueryTimeoutMs;
    }

    public void setSubQueryTimeoutMs(int subQueryTimeoutMs) {
        this.subQueryTimeoutMs = subQueryTimeoutMs;
    }

    public int getBudgetMs() {
        return budgetMs;
    }

    public void setBudgetMs(int budgetMs) {
        this.budgetMs = budgetMs;
    }

    public boolean isTermsEnabled() {
        return termsEnabled;
    }

    public void setTermsEnabled(boolean termsEnabled) {
        this.termsEnabled = termsEnabled;
    }
}
