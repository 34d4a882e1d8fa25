package com.grantlens.search.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.grantlens.search.filter.SearchFilters;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class RefilterRequest {
    @JsonProperty("all_results")
    private List<GrantRecord> allResults;

    private SearchFilters filters;

    public List<GrantRecord> getAllResults() {
        return allResults;
    }

    public void setAllResults(List<GrantRecord> allResults) {
        this.allResults = allResults;
    }

    public SearchFilters getFilters() {
        return filters;
    }

    public void setFilters(SearchFilters filters) {
        this.filters = filters;
    }
}
