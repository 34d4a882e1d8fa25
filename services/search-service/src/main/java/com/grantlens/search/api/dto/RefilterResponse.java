package com.grantlens.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;

public class RefilterResponse {
    private String summary;

    @JsonProperty("total_count")
    private int totalCount;

    @JsonProperty("showing_count")
    private int showingCount;

    @JsonProperty("by_category")
    private Map<String, Integer> byCategory;

    @JsonProperty("by_org_type")
    private Map<String, Integer> byOrgType;

    @JsonProperty("cross_filter_counts")
    private CrossFilterCounts crossFilterCounts;

    @JsonProperty("all_results")
    private List<GrantRecord> allResults;

    @JsonProperty("sample_results")
    private List<ExemplarRecord> sampleResults;

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public int getTotalCount() {
        return totalCount;
    }

    public void setTotalCount(int totalCount) {
        this.totalCount = totalCount;
    }

    public int getShowingCount() {
        return showingCount;
    }

    public void setShowingCount(int showingCount) {
        this.showingCount = showingCount;
    }

    public Map<String, Integer> getByCategory() {
        return byCategory;
    }

    public void setByCategory(Map<String, Integer> byCategory) {
        this.byCategory = byCategory;
    }

    public Map<String, Integer> getByOrgType() {
        return byOrgType;
    }

    public void setByOrgType(Map<String, Integer> byOrgType) {
        this.byOrgType = byOrgType;
    }

    public CrossFilterCounts getCrossFilterCounts() {
        return crossFilterCounts;
    }

    public void setCrossFilterCounts(CrossFilterCounts crossFilterCounts) {
        this.crossFilterCounts = crossFilterCounts;
    }

    public List<GrantRecord> getAllResults() {
        return allResults;
    }

    public void setAllResults(List<GrantRecord> allResults) {
        this.allResults = allResults;
    }

    public List<ExemplarRecord> getSampleResults() {
        return sampleResults;
    }

    public void setSampleResults(List<ExemplarRecord> sampleResults) {
        this.sampleResults = sampleResults;
    }
}
