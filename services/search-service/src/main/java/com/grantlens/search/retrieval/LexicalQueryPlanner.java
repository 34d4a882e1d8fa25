package com.grantlens.search.retrieval;

import com.grantlens.search.query.KeywordQuery;
import com.grantlens.search.query.WordGroup;
import com.grantlens.search.query.WordVariantGenerator;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class LexicalQueryPlanner {
    private final WordVariantGenerator variantGenerator;
    private final LexicalSearchProperties properties;

    public LexicalQueryPlanner(WordVariantGenerator variantGenerator, LexicalSearchProperties properties) {
        this.variantGenerator = variantGenerator;
        this.properties = properties;
    }

    public LexicalQueryPlan plan(KeywordQuery query) {
        if (query == null || query.isEmpty()) {
            return new LexicalQueryPlan(0, List.of(), false, false);
        }
        List<LexicalSubQuery> abstractQueries = new ArrayList<>();
        List<LexicalSubQuery> all = new ArrayList<>();
        List<WordGroup> groups = query.getGroups();
        for (int groupIndex = 0; groupIndex < groups.size(); groupIndex++) {
            for (String synonym : groups.get(groupIndex).getSynonyms()) {
                for (String variant : variantGenerator.generateVariants(synonym)) {
                    LexicalSubQuery abstractQuery = new LexicalSubQuery(groupIndex, synonym, variant, LexicalColumn.ABSTRACT);
                    abstractQueries.add(abstractQuery);
                    all.add(abstractQuery);
                    if (properties.isTermsEnabled()) {
                        all.add(new LexicalSubQuery(groupIndex, synonym, variant, LexicalColumn.TERMS));
                    }
                }
            }
        }

        int cap = properties.getMaxSubQueries();
        if (cap <= 0 || all.size() <= cap) {
            return new LexicalQueryPlan(groups.size(), all, false, false);
        }
        boolean termsDropped = abstractQueries.size() < all.size();
        return new LexicalQueryPlan(groups.size(), abstractQueries, termsDropped, abstractQueries.size() > cap);
    }
}
