package com.grantlens.search.retrieval;

import com.grantlens.search.opensearch.GrantIndexFields;

public enum LexicalColumn {
    ABSTRACT(GrantIndexFields.ABSTRACT_TEXT, false),
    TERMS(GrantIndexFields.TERMS, true);

    private final String field;
    private final boolean bestEffort;

    LexicalColumn(String field, boolean bestEffort) {
        this.field = field;
        this.bestEffort = bestEffort;
    }

    public String field() {
        return field;
    }

    public boolean isBestEffort() {
        return bestEffort;
    }
}
