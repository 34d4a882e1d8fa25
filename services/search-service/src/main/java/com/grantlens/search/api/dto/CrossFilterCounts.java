package com.grantlens.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public class CrossFilterCounts {
    @JsonProperty("by_category")
    private Map<String, Integer> byCategory;

    @JsonProperty("by_org_type")
    private Map<String, Integer> byOrgType;

    private Quick quick;

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

    public Quick getQuick() {
        return quick;
    }

    public void setQuick(Quick quick) {
        this.quick = quick;
    }

    public static class Quick {
        @JsonProperty("has_patents")
        private int hasPatents;

        @JsonProperty("has_publications")
        private int hasPublications;

        @JsonProperty("has_clinical_trials")
        private int hasClinicalTrials;

        private int active;

        @JsonProperty("sbir_sttr")
        private int sbirSttr;

        public int getHasPatents() {
            return hasPatents;
        }

        public void setHasPatents(int hasPatents) {
            this.hasPatents = hasPatents;
        }

        public int getHasPublications() {
            return hasPublications;
        }

        public void setHasPublications(int hasPublications) {
            this.hasPublications = hasPublications;
        }

        public int getHasClinicalTrials() {
            return hasClinicalTrials;
        }

        public void setHasClinicalTrials(int hasClinicalTrials) {
            this.hasClinicalTrials = hasClinicalTrials;
        }

        public int getActive() {
            return active;
        }

        public void setActive(int active) {
            this.active = active;
        }

        public int getSbirSttr() {
            return sbirSttr;
        }

        public void setSbirSttr(int sbirSttr) {
            this.sbirSttr = sbirSttr;
        }
    }
}
