package com.grantlens.search.filter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchFilters {
    @JsonProperty("primary_category")
    private List<String> primaryCategory;

    @JsonProperty("org_type")
    private List<String> orgType;

    private List<String> state;

    @JsonProperty("min_funding")
    private Double minFunding;

    @JsonProperty("has_patents")
    private Boolean hasPatents;

    @JsonProperty("has_publications")
    private Boolean hasPublications;

    @JsonProperty("has_clinical_trials")
    private Boolean hasClinicalTrials;

    @JsonProperty("active_only")
    private Boolean activeOnly;

    @JsonProperty("sbir_sttr_only")
    private Boolean sbirSttrOnly;

    public SearchFilters() {
    }

    public SearchFilters(SearchFilters other) {
        this.primaryCategory = other.primaryCategory;
        this.orgType = other.orgType;
        this.state = other.state;
        this.minFunding = other.minFunding;
        this.hasPatents = other.hasPatents;
        this.hasPublications = other.hasPublications;
        this.hasClinicalTrials = other.hasClinicalTrials;
        this.activeOnly = other.activeOnly;
        this.sbirSttrOnly = other.sbirSttrOnly;
    }

    public static SearchFilters none() {
        return new SearchFilters();
    }

    public List<String> getPrimaryCategory() {
        return primaryCategory;
    }

    public void setPrimaryCategory(List<String> primaryCategory) {
        this.primaryCategory = primaryCategory;
    }

    public List<String> getOrgType() {
        return orgType;
    }

    public void setOrgType(List<String> orgType) {
        this.orgType = orgType;
    }

    public List<String> getState() {
        return state;
    }

    public void setState(List<String> state) {
        this.state = state;
    }

    public Double getMinFunding() {
        return minFunding;
    }

    public void setMinFunding(Double minFunding) {
        this.minFunding = minFunding;
    }

    public Boolean getHasPatents() {
        return hasPatents;
    }

    public void setHasPatents(Boolean hasPatents) {
        this.hasPatents = hasPatents;
    }

    public Boolean getHasPublications() {
        return hasPublications;
    }

    public void setHasPublications(Boolean hasPublications) {
        this.hasPublications = hasPublications;
    }

    public Boolean getHasClinicalTrials() {
        return hasClinicalTrials;
    }

    public void setHasClinicalTrials(Boolean hasClinicalTrials) {
        this.hasClinicalTrials = hasClinicalTrials;
    }

    public Boolean getActiveOnly() {
        return activeOnly;
    }

    public void setActiveOnly(Boolean activeOnly) {
        this.activeOnly = activeOnly;
    }

    public Boolean getSbirSttrOnly() {
        return sbirSttrOnly;
    }

    public void setSbirSttrOnly(Boolean sbirSttrOnly) {
        this.sbirSttrOnly = sbirSttrOnly;
    }
}
