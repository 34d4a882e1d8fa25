package com.grantlens.search.opensearch;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class OpenSearchQueryResult {
    private final List<String> docIds;
    private final Map<String, Double> scoresByDocId;
    private final String lastSortValue;
    private final boolean timedOut;

    public OpenSearchQueryResult(List<String> docIds, Map<String, Double> scoresByDocId) {
        this(docIds, scoresByDocId, null, false);
    }

    public OpenSearchQueryResult(
        List<String> docIds,
        Map<String, Double> scoresByDocId,
        String lastSortValue,
        boolean timedOut
    ) {
        this.docIds = docIds == null ? Collections.emptyList() : docIds;
        this.scoresByDocId = scoresByDocId == null ? Collections.emptyMap() : scoresByDocId;
        this.lastSortValue = lastSortValue;
        this.timedOut = timedOut;
    }

    public List<String> getDocIds() {
        return docIds;
    }

    public Map<String, Double> getScoresByDocId() {
        return scoresByDocId;
    }

    public String getLastSortValue() {
        return lastSortValue;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
