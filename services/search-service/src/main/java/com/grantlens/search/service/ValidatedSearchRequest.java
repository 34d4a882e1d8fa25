package com.grantlens.search.service;

import com.grantlens.search.filter.SearchFilters;

public class ValidatedSearchRequest {
    private final String keywordQuery;
    private final String semanticQuery;
    private final SearchFilters filters;
    private final int limit;

    public ValidatedSearchRequest(String keywordQuery, String semanticQuery, SearchFilters filters, int limit) {
        this.keywordQuery = keywordQuery;
        this.semanticQuery = semanticQuery;
        this.filters = filters;
        this.limit = limit;
    }

    public String getKeywordQuery() {
        return keywordQuery;
    }

    public String getSemanticQuery() {
        return semanticQuery;
    }

    public SearchFilters getFilters() {
        return filters;
    }

    public int getLimit() {
        return limit;
    }

    public boolean hasKeywordQuery() {
        return keywordQuery != null;
    }

    public boolean hasSemanticQuery() {
        return semanticQuery != null;
    }

    public String displayQuery() {
        if (keywordQuery != null && semanticQuery != null && !keywordQuery.equals(semanticQuery)) {
            return keywordQuery + " / " + semanticQuery;
        }
        return keywordQuery != null ? keywordQuery : semanticQuery;
    }
}
