package com.grantlens.search.retrieval;

public record LexicalSubQuery(int groupIndex, String synonym, String variant, LexicalColumn column) {
}
