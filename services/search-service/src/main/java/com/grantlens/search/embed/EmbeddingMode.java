package com.grantlens.search.embed;

public enum EmbeddingMode {
    HTTP,
    TOY
}
