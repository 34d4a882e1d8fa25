package com.grantlens.search.opensearch;

public final class GrantIndexFields {
    public static final String APPLICATION_ID = "application_id";
    public static final String PROJECT_NUMBER = "project_number";
    public static final String ABSTRACT_TEXT = "abstract_text";
    public static final String TERMS = "terms";
    public static final String ABSTRACT_EMBEDDING = "abstract_embedding";
    public static final String PI_EMAIL = "pi_email";

    private GrantIndexFields() {
    }
}
