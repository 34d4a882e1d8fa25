package com.grantlens.search.retrieval;

public class RetrievalStageContext {
    private final String queryText;
    private final int topK;
    private final Double similarityThreshold;
    private final Integer timeBudgetMs;
    private final String traceId;
    private final String requestId;

    public RetrievalStageContext(
        String queryText,
        int topK,
        Double similarityThreshold,
        Integer timeBudgetMs,
        String traceId,
        String requestId
    ) {
        this.queryText = queryText;
        this.topK = topK;
        this.similarityThreshold = similarityThreshold;
        this.timeBudgetMs = timeBudgetMs;
        this.traceId = traceId;
        this.requestId = requestId;
    }

    public String getQueryText() {
        return queryText;
    }

    public int getTopK() {
        return topK;
    }

    public Double getSimilarityThreshold() {
        return similarityThreshold;
    }

    public Integer getTimeBudgetMs() {
        return timeBudgetMs;
    }

    public String getTraceId() {
        return traceId;
    }

    public String getRequestId() {
        return requestId;
    }
}
