package com.grantlens.search.retrieval;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class RetrievalStageResult {
    private final List<String> docIds;
    private final Map<String, Double> scoresByDocId;
    private final boolean error;
    private final boolean timedOut;
    private final boolean skipped;
    private final boolean degraded;
    private final boolean storeUnavailable;
    private final long tookMs;
    private final String errorMessage;

    private RetrievalStageResult(
        List<String> docIds,
        Map<String, Double> scoresByDocId,
        boolean error,
        boolean timedOut,
        boolean skipped,
        boolean degraded,
        boolean storeUnavailable,
        long tookMs,
        String errorMessage
    ) {
        this.docIds = docIds == null ? List.of() : docIds;
        this.scoresByDocId = scoresByDocId == null ? Map.of() : scoresByDocId;
        this.error = error;
        this.timedOut = timedOut;
        this.skipped = skipped;
        this.degraded = degraded;
        this.storeUnavailable = storeUnavailable;
        this.tookMs = tookMs;
        this.errorMessage = errorMessage;
    }

    public static RetrievalStageResult success(List<String> docIds, Map<String, Double> scoresByDocId, long tookMs) {
        return new RetrievalStageResult(docIds, scoresByDocId, false, false, false, false, false, tookMs, null);
    }

    public static RetrievalStageResult partial(
        List<String> docIds,
        Map<String, Double> scoresByDocId,
        long tookMs,
        String reason
    ) {
        return new RetrievalStageResult(docIds, scoresByDocId, false, false, false, true, false, tookMs, reason);
    }

    public static RetrievalStageResult empty() {
        return new RetrievalStageResult(Collections.emptyList(), Map.of(), false, false, false, false, false, 0L, null);
    }

    public static RetrievalStageResult error(String message) {
        return new RetrievalStageResult(Collections.emptyList(), Map.of(), true, false, false, true, false, 0L, message);
    }

    public static RetrievalStageResult unavailable(String message) {
        return new RetrievalStageResult(Collections.emptyList(), Map.of(), true, false, false, true, true, 0L, message);
    }

    public static RetrievalStageResult timedOut() {
        return new RetrievalStageResult(Collections.emptyList(), Map.of(), true, true, false, true, false, 0L, "timeout");
    }

    public static RetrievalStageResult skipped(String reason) {
        return new RetrievalStageResult(Collections.emptyList(), Map.of(), true, false, true, true, false, 0L, reason);
    }

    public List<String> getDocIds() {
        return docIds;
    }

    public Map<String, Double> getScoresByDocId() {
        return scoresByDocId;
    }

    public boolean isError() {
        return error;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isSkipped() {
        return skipped;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public boolean isStoreUnavailable() {
        return storeUnavailable;
    }

    public long getTookMs() {
        return tookMs;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
