package com.grantlens.search.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.grantlens.search.api.dto.ExemplarRecord;
import com.grantlens.search.api.dto.GrantRecord;
import com.grantlens.search.filter.FilteredGrants;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResultAssemblerTest {

    private final ResultAssembler assembler = new ResultAssembler(new SearchResultProperties());

    @Test
    void showingCountIsCappedAtDisplayLimit() {
        assertThat(assembler.showingCount(42)).isEqualTo(42);
        assertThat(assembler.showingCount(100)).isEqualTo(100);
        assertThat(assembler.showingCount(2500)).isEqualTo(100);
    }

    @Test
    void samplesAreTopTenByFunding() {
        List<GrantRecord> records = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            records.add(grant("g" + i, i * 1000.0));
        }
        records.add(grant("unfunded", null));

        List<ExemplarRecord> samples = assembler.selectSamples(records);

        assertThat(samples).hasSize(10);
        assertThat(samples.get(0).getApplicationId()).isEqualTo("g14");
        assertThat(samples.get(9).getApplicationId()).isEqualTo("g5");
        assertThat(samples).allMatch(sample -> sample.getPiEmail() == null);
    }

    @Test
    void equalFundingKeepsRankOrder() {
        List<ExemplarRecord> samples = assembler.selectSamples(List.of(grant("first", 10.0), grant("second", 10.0)));

        assertThat(samples).extracting(GrantRecord::getApplicationId).containsExactly("first", "second");
    }

    @Test
    void samplesDoNotShareInstancesWithResults() {
        GrantRecord record = grant("g1", 5.0);

        ExemplarRecord sample = assembler.selectSamples(List.of(record)).get(0);
        sample.setTitle("changed");

        assertThat(record.getTitle()).isNull();
    }

    @Test
    void summaryListsFacetsInOrder() {
        Map<String, Integer> byCategory = new LinkedHashMap<>();
        byCategory.put("therapeutics", 3);
        byCategory.put("biotools", 1);
        Map<String, Integer> byOrgType = new LinkedHashMap<>();
        byOrgType.put("company", 4);

        String summary = assembler.summarize(new FilteredGrants(List.of(grant("a", 1.0)), byCategory, byOrgType));

        assertThat(summary).isEqualTo(
            "Found 1 projects. By category: therapeutics: 3, biotools: 1. By org_type: company: 4."
        );
    }

    @Test
    void summaryOfNothingFound() {
        assertThat(assembler.summarize(new FilteredGrants(List.of(), Map.of(), Map.of()))).isEqualTo("Found 0 projects.");
    }

    private GrantRecord grant(String applicationId, Double totalCost) {
        GrantRecord record = new GrantRecord();
        record.setApplicationId(applicationId);
        record.setTotalCost(totalCost);
        return record;
    }
}
