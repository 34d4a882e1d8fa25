package com.grantlens.search.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.grantlens.search.filter.SearchFilters;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchRequest {
    @JsonProperty("keyword_query")
    private String keywordQuery;

    @JsonProperty("semantic_query")
    private String semanticQuery;

    private SearchFilters filters;

    private Integer limit;

    public String getKeywordQuery() {
        return keywordQuery;
    }

    public void setKeywordQuery(String keywordQuery) {
        this.keywordQuery = keywordQuery;
    }

    public String getSemanticQuery() {
        return semanticQuery;
    }

    public void setSemanticQuery(String semanticQuery) {
        this.semanticQuery = semanticQuery;
    }

    public SearchFilters getFilters() {
        return filters;
    }

    public void setFilters(SearchFilters filters) {
        this.filters = filters;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }
}
