package com.grantlens.search.retrieval;

public interface Retriever {
    String name();

    RetrievalStageResult retrieve(RetrievalStageContext context);
}
