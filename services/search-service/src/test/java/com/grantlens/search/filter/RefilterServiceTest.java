package com.grantlens.search.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

import com.grantlens.search.api.dto.CrossFilterCounts;
import com.grantlens.search.api.dto.GrantRecord;
import com.grantlens.search.api.dto.RefilterResponse;
import com.grantlens.search.service.ResultAssembler;
import com.grantlens.search.service.SearchResultProperties;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class RefilterServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 6, 1);

    private RefilterService refilterService;
    private List<GrantRecord> fullResults;

    @BeforeEach
    void setUp() {
        GrantDeduplicator deduplicator = new GrantDeduplicator();
        refilterService = new RefilterService(
            new FilterPipeline(new GrantFilterMatcher(), deduplicator),
            deduplicator,
            new ResultAssembler(new SearchResultProperties()),
            Clock.fixed(Instant.parse("2025-06-01T12:00:00Z"), ZoneOffset.UTC)
        );

        GrantRecord r1 = grant("r1", "P1", "biotools", "company", 2021, 0.9);
        r1.setPatentCount(2);
        r1.setProjectEnd("2030-01-01");
        r1.setActivityCode("R43");
        GrantRecord r2 = grant("r2", "P2", "biotools", "university", 2022, 0.8);
        r2.setPublicationCount(3);
        GrantRecord r3 = grant("r3", "P3", "therapeutics", "company", 2022, 0.7);
        r3.setClinicalTrialCount(1);
        GrantRecord r4 = grant("r4", "P4", "therapeutics", "company", 2020, 0.6);
        r4.setProjectEnd("2020-01-01");
        GrantRecord r5 = grant("r5", "P1", "biotools", "company", 2019, 0.5);
        fullResults = List.of(r1, r2, r3, r4, r5);
    }

    @Test
    void appliesFiltersOverDedupedResults() {
        RefilterResponse response = refilterService.refilter(fullResults, companyBiotools(), TODAY);

        assertThat(response.getAllResults()).extracting(GrantRecord::getApplicationId).containsExactly("r1");
        assertThat(response.getTotalCount()).isEqualTo(1);
        assertThat(response.getShowingCount()).isEqualTo(1);
        assertThat(response.getByCategory()).containsEntry("biotools", 1);
        assertThat(response.getSampleResults()).hasSize(1);
        assertThat(response.getSummary()).startsWith("Found 1 projects.");
    }

    @Test
    void crossCountsIgnoreTheirOwnDimension() {
        CrossFilterCounts counts = refilterService.refilter(fullResults, companyBiotools(), TODAY).getCrossFilterCounts();

        assertThat(counts.getByCategory()).containsExactly(
            entry("therapeutics", 2),
            entry("biotools", 1)
        );
        assertThat(counts.getByOrgType()).containsOnlyKeys("company", "university");
        assertThat(counts.getByOrgType()).containsEntry("company", 1).containsEntry("university", 1);
    }

    @Test
    void quickCountsApplyOtherActiveFilters() {
        CrossFilterCounts.Quick quick = refilterService.refilter(fullResults, companyBiotools(), TODAY)
            .getCrossFilterCounts()
            .getQuick();

        assertThat(quick.getHasPatents()).isEqualTo(1);
        assertThat(quick.getHasPublications()).isZero();
        assertThat(quick.getHasClinicalTrials()).isZero();
        assertThat(quick.getActive()).isEqualTo(1);
        assertThat(quick.getSbirSttr()).isEqualTo(1);
    }

    @Test
    void quickCountOfActiveToggleIgnoresItself() {
        SearchFilters filters = new SearchFilters();
        filters.setOrgType(List.of("company"));
        filters.setActiveOnly(true);

        RefilterResponse response = refilterService.refilter(fullResults, filters, TODAY);

        assertThat(response.getAllResults()).extracting(GrantRecord::getApplicationId).containsExactly("r1");
        assertThat(response.getCrossFilterCounts().getQuick().getActive()).isEqualTo(1);
        assertThat(response.getCrossFilterCounts().getQuick().getHasClinicalTrials()).isZero();
    }

    @Test
    void refilteringOwnOutputIsStable() {
        RefilterResponse first = refilterService.refilter(fullResults, companyBiotools(), TODAY);
        RefilterResponse second = refilterService.refilter(first.getAllResults(), companyBiotools(), TODAY);

        assertThat(second.getAllResults()).isEqualTo(first.getAllResults());
        assertThat(second.getTotalCount()).isEqualTo(first.getTotalCount());
    }

    @Test
    void noFiltersReturnsDedupedSet() {
        RefilterResponse response = refilterService.refilter(fullResults, SearchFilters.none());

        assertThat(response.getAllResults()).extracting(GrantRecord::getApplicationId)
            .containsExactly("r1", "r2", "r3", "r4");
        assertThat(response.getCrossFilterCounts().getQuick().getActive()).isEqualTo(1);
    }

    private SearchFilters companyBiotools() {
        SearchFilters filters = new SearchFilters();
        filters.setPrimaryCategory(List.of("biotools"));
        filters.setOrgType(List.of("company"));
        return filters;
    }

    private GrantRecord grant(
        String applicationId,
        String projectNumber,
        String category,
        String orgType,
        int fiscalYear,
        double fusionScore
    ) {
        GrantRecord record = new GrantRecord();
        record.setApplicationId(applicationId);
        record.setProjectNumber(projectNumber);
        record.setPrimaryCategory(category);
        record.setOrgType(orgType);
        record.setFiscalYear(fiscalYear);
        record.setFusionScore(fusionScore);
        record.setPatentCount(0);
        record.setPublicationCount(0);
        record.setClinicalTrialCount(0);
        return record;
    }
}
