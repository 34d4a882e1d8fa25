package com.grantlens.search.service;

import com.grantlens.search.api.dto.SearchRequest;
import com.grantlens.search.filter.SearchFilters;
import com.grantlens.search.query.KeywordQueryParser;
import com.grantlens.search.retrieval.LexicalQueryPlan;
import com.grantlens.search.retrieval.LexicalQueryPlanner;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class SearchRequestValidator {
    private static final Pattern LABEL = Pattern.compile("[a-z_]+");
    private static final Pattern STATE_CODE = Pattern.compile("[A-Za-z]{2}");

    private final KeywordQueryParser queryParser;
    private final LexicalQueryPlanner queryPlanner;
    private final SearchResultProperties properties;

    public SearchRequestValidator(
        KeywordQueryParser queryParser,
        LexicalQueryPlanner queryPlanner,
        SearchResultProperties properties
    ) {
        this.queryParser = queryParser;
        this.queryPlanner = queryPlanner;
        this.properties = properties;
    }

    public ValidatedSearchRequest validate(SearchRequest request) {
        if (request == null) {
            throw new InvalidSearchRequestException("request body is required");
        }
        String keywordQuery = trimToNull(request.getKeywordQuery());
        String semanticQuery = trimToNull(request.getSemanticQuery());
        if (keywordQuery == null && semanticQuery == null) {
            throw new InvalidSearchRequestException("keyword_query or semantic_query is required");
        }
        if (keywordQuery != null) {
            LexicalQueryPlan plan = queryPlanner.plan(queryParser.parse(keywordQuery));
            if (plan.isOverCap()) {
                throw new InvalidSearchRequestException("keyword_query expands to too many sub-queries");
            }
        }
        return new ValidatedSearchRequest(
            keywordQuery,
            semanticQuery,
            validateFilters(request.getFilters()),
            effectiveLimit(request.getLimit())
        );
    }

    public SearchFilters validateFilters(SearchFilters filters) {
        if (filters == null) {
            return SearchFilters.none();
        }
        SearchFilters normalized = new SearchFilters(filters);
        normalized.setPrimaryCategory(labels("primary_category", filters.getPrimaryCategory()));
        normalized.setOrgType(labels("org_type", filters.getOrgType()));
        normalized.setState(states(filters.getState()));
        Double minFunding = filters.getMinFunding();
        if (minFunding != null && (minFunding.isNaN() || minFunding < 0)) {
            throw new InvalidSearchRequestException("min_funding must be >= 0");
        }
        return normalized;
    }

    int effectiveLimit(Integer limit) {
        if (limit == null) {
            return properties.getDefaultLimit();
        }
        if (limit <= 0) {
            throw new InvalidSearchRequestException("limit must be > 0");
        }
        return Math.min(limit, properties.getMaxLimit());
    }

    private List<String> labels(String name, List<String> values) {
        if (values == null) {
            return null;
        }
        List<String> accepted = new ArrayList<>(values.size());
        for (String value : values) {
            if (value == null || !LABEL.matcher(value).matches()) {
                throw new InvalidSearchRequestException("invalid " + name + " value: " + value);
            }
            accepted.add(value);
        }
        return accepted;
    }

    private List<String> states(List<String> values) {
        if (values == null) {
            return null;
        }
        List<String> accepted = new ArrayList<>(values.size());
        for (String value : values) {
            String trimmed = value == null ? null : value.trim();
            if (trimmed == null || !STATE_CODE.matcher(trimmed).matches()) {
                throw new InvalidSearchRequestException("invalid state value: " + value);
            }
            accepted.add(trimmed.toUpperCase(Locale.ROOT));
        }
        return accepted;
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
