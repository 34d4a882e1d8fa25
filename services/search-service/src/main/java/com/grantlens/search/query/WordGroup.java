package com.grantlens.search.query;

import java.util.List;

public class WordGroup {
    private final List<String> synonyms;

    public WordGroup(List<String> synonyms) {
        this.synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
    }

    public List<String> getSynonyms() {
        return synonyms;
    }

    public boolean isEmpty() {
        return synonyms.isEmpty();
    }

    @Override
    public String toString() {
        return String.join("|", synonyms);
    }
}
