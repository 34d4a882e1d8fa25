package com.grantlens.search.query;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class KeywordQueryParser {
    static final int MIN_TOKEN_LENGTH = 3;

    public KeywordQuery parse(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return KeywordQuery.empty(rawQuery);
        }
        List<WordGroup> groups = new ArrayList<>();
        for (String position : rawQuery.trim().split("\\s+")) {
            if (position.length() < MIN_TOKEN_LENGTH) {
                continue;
            }
            Set<String> seen = new LinkedHashSet<>();
            List<String> synonyms = new ArrayList<>();
            for (String synonym : position.split("\\|")) {
                String token = synonym.trim();
                if (token.length() < MIN_TOKEN_LENGTH) {
                    continue;
                }
                if (seen.add(token.toLowerCase(Locale.ROOT))) {
                    synonyms.add(token);
                }
            }
            if (!synonyms.isEmpty()) {
                groups.add(new WordGroup(synonyms));
            }
        }
        return new KeywordQuery(rawQuery, groups);
    }
}
