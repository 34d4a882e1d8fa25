package com.grantlens.search.filter;

import com.grantlens.search.api.dto.GrantRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class GrantDeduplicator {

    // latest fiscal year per project number wins; ties keep the earlier record
    public List<GrantRecord> dedupe(List<GrantRecord> records) {
        if (records == null || records.isEmpty()) {
            return new ArrayList<>();
        }
        Map<String, GrantRecord> latestByGroup = new LinkedHashMap<>();
        for (GrantRecord record : records) {
            if (record == null) {
                continue;
            }
            String key = groupKey(record);
            GrantRecord existing = latestByGroup.get(key);
            if (existing == null || year(record) > year(existing)) {
                latestByGroup.put(key, record);
            }
        }
        List<GrantRecord> survivors = new ArrayList<>(latestByGroup.values());
        survivors.sort(Comparator.comparingDouble(GrantDeduplicator::fusionScore).reversed());
        return survivors;
    }

    static String groupKey(GrantRecord record) {
        String projectNumber = record.getProjectNumber();
        if (projectNumber != null && !projectNumber.isBlank()) {
            return projectNumber.trim();
        }
        return record.getApplicationId() == null ? "" : record.getApplicationId();
    }

    private static int year(GrantRecord record) {
        return record.getFiscalYear() == null ? 0 : record.getFiscalYear();
    }

    private static double fusionScore(GrantRecord record) {
        return record.getFusionScore() == null ? 0.0 : record.getFusionScore();
    }
}
