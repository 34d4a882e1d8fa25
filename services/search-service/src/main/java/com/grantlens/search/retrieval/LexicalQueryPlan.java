package com.grantlens.search.retrieval;

import java.util.List;

public class LexicalQueryPlan {
    private final int groupCount;
    private final List<LexicalSubQuery> subQueries;
    private final boolean termsDropped;
    private final boolean overCap;

    public LexicalQueryPlan(int groupCount, List<LexicalSubQuery> subQueries, boolean termsDropped, boolean overCap) {
        this.groupCount = groupCount;
        this.subQueries = subQueries == null ? List.of() : List.copyOf(subQueries);
        this.termsDropped = termsDropped;
        this.overCap = overCap;
    }

    public int getGroupCount() {
        return groupCount;
    }

    public List<LexicalSubQuery> getSubQueries() {
        return subQueries;
    }

    public boolean isTermsDropped() {
        return termsDropped;
    }

    public boolean isOverCap() {
        return overCap;
    }

    public boolean isEmpty() {
        return groupCount == 0 || subQueries.isEmpty();
    }
}
