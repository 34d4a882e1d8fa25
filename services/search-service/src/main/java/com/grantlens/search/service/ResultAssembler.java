package com.grantlens.search.service;

import com.grantlens.search.api.dto.ExemplarRecord;
import com.grantlens.search.api.dto.GrantRecord;
import com.grantlens.search.filter.FilteredGrants;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import org.springframework.stereotype.Component;

@Component
public class ResultAssembler {
    private final SearchResultProperties properties;

    public ResultAssembler(SearchResultProperties properties) {
        this.properties = properties;
    }

    public int showingCount(int totalCount) {
        return Math.min(totalCount, Math.max(0, properties.getDisplayCap()));
    }

    public List<ExemplarRecord> selectSamples(List<GrantRecord> records) {
        if (records == null || records.isEmpty()) {
            return new ArrayList<>();
        }
        List<GrantRecord> byFunding = new ArrayList<>(records);
        byFunding.sort(Comparator.comparingDouble(ResultAssembler::totalCost).reversed());
        int size = Math.min(byFunding.size(), Math.max(0, properties.getSampleSize()));
        List<ExemplarRecord> samples = new ArrayList<>(size);
        for (GrantRecord record : byFunding.subList(0, size)) {
            samples.add(new ExemplarRecord(record));
        }
        return samples;
    }

    public String summarize(FilteredGrants filtered) {
        StringBuilder summary = new StringBuilder();
        summary.append("Found ").append(filtered.getTotalCount()).append(" projects.");
        if (!filtered.getByCategory().isEmpty()) {
            summary.append(" By category: ").append(describe(filtered.getByCategory())).append('.');
        }
        if (!filtered.getByOrgType().isEmpty()) {
            summary.append(" By org_type: ").append(describe(filtered.getByOrgType())).append('.');
        }
        return summary.toString();
    }

    private String describe(Map<String, Integer> counts) {
        StringJoiner joiner = new StringJoiner(", ");
        counts.forEach((key, count) -> joiner.add(key + ": " + count));
        return joiner.toString();
    }

    private static double totalCost(GrantRecord record) {
        return record.getTotalCost() == null ? 0.0 : record.getTotalCost();
    }
}
