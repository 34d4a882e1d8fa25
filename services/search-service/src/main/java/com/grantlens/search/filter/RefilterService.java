package com.grantlens.search.filter;

import com.grantlens.search.api.dto.CrossFilterCounts;
import com.grantlens.search.api.dto.GrantRecord;
import com.grantlens.search.api.dto.RefilterResponse;
import com.grantlens.search.service.ResultAssembler;
import java.time.Clock;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.function.Predicate;
import org.springframework.stereotype.Service;

@Service
public class RefilterService {
    private final FilterPipeline filterPipeline;
    private final GrantDeduplicator deduplicator;
    private final ResultAssembler resultAssembler;
    private final Clock clock;

    public RefilterService(
        FilterPipeline filterPipeline,
        GrantDeduplicator deduplicator,
        ResultAssembler resultAssembler,
        Clock clock
    ) {
        this.filterPipeline = filterPipeline;
        this.deduplicator = deduplicator;
        this.resultAssembler = resultAssembler;
        this.clock = clock;
    }

    public RefilterResponse refilter(List<GrantRecord> fullResults, SearchFilters filters) {
        return refilter(fullResults, filters, LocalDate.now(clock));
    }

    public RefilterResponse refilter(List<GrantRecord> fullResults, SearchFilters filters, LocalDate today) {
        List<GrantRecord> base = deduplicator.dedupe(fullResults);
        FilteredGrants filtered = filterPipeline.apply(base, filters, today);

        RefilterResponse response = new RefilterResponse();
        response.setTotalCount(filtered.getTotalCount());
        response.setShowingCount(resultAssembler.showingCount(filtered.getTotalCount()));
        response.setByCategory(filtered.getByCategory());
        response.setByOrgType(filtered.getByOrgType());
        response.setAllResults(filtered.getRecords());
        response.setSampleResults(resultAssembler.selectSamples(filtered.getRecords()));
        response.setSummary(resultAssembler.summarize(filtered));
        response.setCrossFilterCounts(crossFilterCounts(base, filters, today));
        return response;
    }

    public CrossFilterCounts crossFilterCounts(List<GrantRecord> base, SearchFilters filters, LocalDate today) {
        GrantFilterMatcher matcher = filterPipeline.getFilterMatcher();
        CrossFilterCounts counts = new CrossFilterCounts();
        counts.setByCategory(FacetCounter.byCategory(without(base, filters, today, FilterDimension.CATEGORY)));
        counts.setByOrgType(FacetCounter.byOrgType(without(base, filters, today, FilterDimension.ORG_TYPE)));

        CrossFilterCounts.Quick quick = new CrossFilterCounts.Quick();
        quick.setHasPatents(countWithout(base, filters, today, FilterDimension.HAS_PATENTS, matcher::hasPatents));
        quick.setHasPublications(
            countWithout(base, filters, today, FilterDimension.HAS_PUBLICATIONS, matcher::hasPublications)
        );
        quick.setHasClinicalTrials(
            countWithout(base, filters, today, FilterDimension.HAS_CLINICAL_TRIALS, matcher::hasClinicalTrials)
        );
        quick.setActive(countWithout(base, filters, today, FilterDimension.ACTIVE, record -> matcher.isActive(record, today)));
        quick.setSbirSttr(countWithout(base, filters, today, FilterDimension.SBIR_STTR, matcher::isSbirSttr));
        counts.setQuick(quick);
        return counts;
    }

    private List<GrantRecord> without(
        List<GrantRecord> base,
        SearchFilters filters,
        LocalDate today,
        FilterDimension dimension
    ) {
        return filterPipeline.filterAndDedupe(base, filters, today, EnumSet.of(dimension));
    }

    private int countWithout(
        List<GrantRecord> base,
        SearchFilters filters,
        LocalDate today,
        FilterDimension dimension,
        Predicate<GrantRecord> predicate
    ) {
        return FacetCounter.count(without(base, filters, today, dimension), predicate);
    }
}
