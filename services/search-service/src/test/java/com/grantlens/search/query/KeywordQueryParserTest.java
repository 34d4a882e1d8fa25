package com.grantlens.search.query;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class KeywordQueryParserTest {
    private final KeywordQueryParser parser = new KeywordQueryParser();

    @Test
    void splitsPositionsAndSynonymGroups() {
        KeywordQuery query = parser.parse("neural|brain|cerebral  organoid");

        assertThat(query.getGroups()).hasSize(2);
        assertThat(query.getGroups().get(0).getSynonyms()).containsExactly("neural", "brain", "cerebral");
        assertThat(query.getGroups().get(1).getSynonyms()).containsExactly("organoid");
    }

    @Test
    void dropsShortTokensAndEmptyPositions() {
        KeywordQuery query = parser.parse("of in|at gene|xy");

        assertThat(query.getGroups()).hasSize(1);
        assertThat(query.getGroups().get(0).getSynonyms()).containsExactly("gene");
    }

    @Test
    void keepsOriginalCaseForAcronymDetection() {
        KeywordQuery query = parser.parse("CRISPR screening");

        assertThat(query.getGroups().get(0).getSynonyms()).containsExactly("CRISPR");
    }

    @Test
    void removesRepeatedSynonymsWithinPosition() {
        KeywordQuery query = parser.parse("tumor|Tumor|tumour");

        assertThat(query.getGroups().get(0).getSynonyms()).containsExactly("tumor", "tumour");
    }

    @Test
    void blankQueryIsEmpty() {
        assertThat(parser.parse("   ").isEmpty()).isTrue();
        assertThat(parser.parse(null).isEmpty()).isTrue();
        assertThat(parser.parse("a to").isEmpty()).isTrue();
    }
}
