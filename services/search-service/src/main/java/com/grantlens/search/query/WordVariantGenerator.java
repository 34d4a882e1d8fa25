package com.grantlens.search.query;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class WordVariantGenerator {
    private static final List<String> SIBILANT_PLURALS = List.of("ses", "xes", "ches", "shes", "zes");
    private static final List<String> VOWEL_Y_ENDINGS = List.of("ay", "ey", "oy", "uy");

    public List<String> generateVariants(String token) {
        if (token == null || token.isBlank()) {
            return List.of();
        }
        String trimmed = token.trim();
        if (isAcronym(trimmed)) {
            return List.of(trimmed);
        }
        String word = trimmed.toLowerCase(Locale.ROOT);
        Set<String> variants = new LinkedHashSet<>();
        variants.add(word);

        if (word.endsWith("ies") && word.length() > 4) {
            variants.add(word.substring(0, word.length() - 3) + "y");
        } else if (word.endsWith("es") && word.length() > 4) {
            if (endsWithAny(word, SIBILANT_PLURALS)) {
                variants.add(word.substring(0, word.length() - 2));
            } else {
                variants.add(word.substring(0, word.length() - 1));
            }
        } else if (word.endsWith("s") && !word.endsWith("ss") && word.length() > 4) {
            variants.add(word.substring(0, word.length() - 1));
        }

        if (!word.endsWith("s") && word.length() > 3) {
            if (word.endsWith("y") && !endsWithAny(word, VOWEL_Y_ENDINGS)) {
                variants.add(word.substring(0, word.length() - 1) + "ies");
            } else {
                variants.add(word + "s");
            }
        }
        return new ArrayList<>(variants);
    }

    public boolean isAcronym(String token) {
        if (token == null) {
            return false;
        }
        String trimmed = token.trim();
        if (trimmed.length() <= 3) {
            return true;
        }
        return trimmed.equals(trimmed.toUpperCase(Locale.ROOT));
    }

    private boolean endsWithAny(String word, List<String> suffixes) {
        for (String suffix : suffixes) {
            if (word.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }
}
