package com.grantlens.search.filter;

import com.grantlens.search.api.dto.GrantRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

public final class FacetCounter {
    public static final String OTHER = "other";

    private FacetCounter() {
    }

    public static Map<String, Integer> byCategory(List<GrantRecord> records) {
        return countBy(records, GrantRecord::getPrimaryCategory);
    }

    public static Map<String, Integer> byOrgType(List<GrantRecord> records) {
        return countBy(records, GrantRecord::getOrgType);
    }

    public static Map<String, Integer> countBy(List<GrantRecord> records, Function<GrantRecord, String> dimension) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (records == null) {
            return counts;
        }
        for (GrantRecord record : records) {
            String value = dimension.apply(record);
            String key = value == null || value.isBlank() ? OTHER : value;
            counts.merge(key, 1, Integer::sum);
        }
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Integer>comparingByValue().reversed());
        Map<String, Integer> sorted = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : entries) {
            sorted.put(entry.getKey(), entry.getValue());
        }
        return sorted;
    }

    public static int count(List<GrantRecord> records, Predicate<GrantRecord> predicate) {
        int count = 0;
        if (records == null) {
            return count;
        }
        for (GrantRecord record : records) {
            if (predicate.test(record)) {
                count++;
            }
        }
        return count;
    }
}
