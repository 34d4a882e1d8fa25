package com.grantlens.search.query;

import java.util.List;

public class KeywordQuery {
    private final String raw;
    private final List<WordGroup> groups;

    public KeywordQuery(String raw, List<WordGroup> groups) {
        this.raw = raw;
        this.groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public static KeywordQuery empty(String raw) {
        return new KeywordQuery(raw, List.of());
    }

    public String getRaw() {
        return raw;
    }

    public List<WordGroup> getGroups() {
        return groups;
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }
}
