package com.grantlens.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

public class ExemplarRecord extends GrantRecord {
    @JsonProperty("pi_email")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String piEmail;

    public ExemplarRecord() {
    }

    public ExemplarRecord(GrantRecord record) {
        super(record);
    }

    public String getPiEmail() {
        return piEmail;
    }

    public void setPiEmail(String piEmail) {
        this.piEmail = piEmail;
    }
}
