package com.grantlens.search.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class GrantRecord {
    @JsonProperty("application_id")
    private String applicationId;

    @JsonProperty("project_number")
    private String projectNumber;

    private String title;

    @JsonProperty("org_name")
    private String orgName;

    @JsonProperty("org_state")
    private String orgState;

    @JsonProperty("org_type")
    private String orgType;

    @JsonProperty("primary_category")
    private String primaryCategory;

    @JsonProperty("secondary_category")
    private String secondaryCategory;

    @JsonProperty("primary_category_confidence")
    private Double primaryCategoryConfidence;

    @JsonProperty("total_cost")
    private Double totalCost;

    @JsonProperty("fiscal_year")
    private Integer fiscalYear;

    @JsonProperty("pi_names")
    private String piNames;

    @JsonProperty("program_officer")
    private String programOfficer;

    @JsonProperty("activity_code")
    private String activityCode;

    @JsonProperty("project_end")
    private String projectEnd;

    @JsonProperty("patent_count")
    private Integer patentCount;

    @JsonProperty("publication_count")
    private Integer publicationCount;

    @JsonProperty("clinical_trial_count")
    private Integer clinicalTrialCount;

    @JsonProperty("fusion_score")
    private Double fusionScore;

    public GrantRecord() {
    }

    public GrantRecord(GrantRecord other) {
        this.applicationId = other.applicationId;
        this.projectNumber = other.projectNumber;
        this.title = other.title;
        this.orgName = other.orgName;
        this.orgState = other.orgState;
        this.orgType = other.orgType;
        this.primaryCategory = other.primaryCategory;
        this.secondaryCategory = other.secondaryCategory;
        this.primaryCategoryConfidence = other.primaryCategoryConfidence;
        this.totalCost = other.totalCost;
        this.fiscalYear = other.fiscalYear;
        this.piNames = other.piNames;
        this.programOfficer = other.programOfficer;
        this.activityCode = other.activityCode;
        this.projectEnd = other.projectEnd;
        this.patentCount = other.patentCount;
        this.publicationCount = other.publicationCount;
        this.clinicalTrialCount = other.clinicalTrialCount;
        this.fusionScore = other.fusionScore;
    }

    public String getApplicationId() {
        return applicationId;
    }

    public void setApplicationId(String applicationId) {
        this.applicationId = applicationId;
    }

    public String getProjectNumber() {
        return projectNumber;
    }

    public void setProjectNumber(String projectNumber) {
        this.projectNumber = projectNumber;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getOrgName() {
        return orgName;
    }

    public void setOrgName(String orgName) {
        this.orgName = orgName;
    }

    public String getOrgState() {
        return orgState;
    }

    public void setOrgState(String orgState) {
        this.orgState = orgState;
    }

    public String getOrgType() {
        return orgType;
    }

    public void setOrgType(String orgType) {
        this.orgType = orgType;
    }

    public String getPrimaryCategory() {
        return primaryCategory;
    }

    public void setPrimaryCategory(String primaryCategory) {
        this.primaryCategory = primaryCategory;
    }

    public String getSecondaryCategory() {
        return secondaryCategory;
    }

    public void setSecondaryCategory(String secondaryCategory) {
        this.secondaryCategory = secondaryCategory;
    }

    public Double getPrimaryCategoryConfidence() {
        return primaryCategoryConfidence;
    }

    public void setPrimaryCategoryConfidence(Double primaryCategoryConfidence) {
        this.primaryCategoryConfidence = primaryCategoryConfidence;
    }

    public Double getTotalCost() {
        return totalCost;
    }

    public void setTotalCost(Double totalCost) {
        this.totalCost = totalCost;
    }

    public Integer getFiscalYear() {
        return fiscalYear;
    }

    public void setFiscalYear(Integer fiscalYear) {
        this.fiscalYear = fiscalYear;
    }

    public String getPiNames() {
        return piNames;
    }

    public void setPiNames(String piNames) {
        this.piNames = piNames;
    }

    public String getProgramOfficer() {
        return programOfficer;
    }

    public void setProgramOfficer(String programOfficer) {
        this.programOfficer = programOfficer;
    }

    public String getActivityCode() {
        return activityCode;
    }

    public void setActivityCode(String activityCode) {
        this.activityCode = activityCode;
    }

    public String getProjectEnd() {
        return projectEnd;
    }

    public void setProjectEnd(String projectEnd) {
        this.projectEnd = projectEnd;
    }

    public Integer getPatentCount() {
        return patentCount;
    }

    public void setPatentCount(Integer patentCount) {
        this.patentCount = patentCount;
    }

    public Integer getPublicationCount() {
        return publicationCount;
    }

    public void setPublicationCount(Integer publicationCount) {
        this.publicationCount = publicationCount;
    }

    public Integer getClinicalTrialCount() {
        return clinicalTrialCount;
    }

    public void setClinicalTrialCount(Integer clinicalTrialCount) {
        this.clinicalTrialCount = clinicalTrialCount;
    }

    public Double getFusionScore() {
        return fusionScore;
    }

    public void setFusionScore(Double fusionScore) {
        this.fusionScore = fusionScore;
    }
}
