package com.grantlens.search.filter;

import com.grantlens.search.api.dto.GrantRecord;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class FilterPipeline {
    private final GrantFilterMatcher filterMatcher;
    private final GrantDeduplicator deduplicator;

    public FilterPipeline(GrantFilterMatcher filterMatcher, GrantDeduplicator deduplicator) {
        this.filterMatcher = filterMatcher;
        this.deduplicator = deduplicator;
    }

    public FilteredGrants apply(List<GrantRecord> fused, SearchFilters filters, LocalDate today) {
        List<GrantRecord> survivors = filterAndDedupe(fused, filters, today, EnumSet.noneOf(FilterDimension.class));
        return new FilteredGrants(survivors, FacetCounter.byCategory(survivors), FacetCounter.byOrgType(survivors));
    }

    public List<GrantRecord> filterAndDedupe(
        List<GrantRecord> records,
        SearchFilters filters,
        LocalDate today,
        Set<FilterDimension> ignored
    ) {
        List<GrantRecord> matched = new ArrayList<>();
        if (records != null) {
            for (GrantRecord record : records) {
                if (filterMatcher.matches(record, filters, today, ignored)) {
                    matched.add(record);
                }
            }
        }
        return deduplicator.dedupe(matched);
    }

    public GrantFilterMatcher getFilterMatcher() {
        return filterMatcher;
    }
}
