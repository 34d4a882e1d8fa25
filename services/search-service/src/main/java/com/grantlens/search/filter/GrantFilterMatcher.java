package com.grantlens.search.filter;

import com.grantlens.search.api.dto.GrantRecord;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class GrantFilterMatcher {
    static final Set<String> SBIR_STTR_ACTIVITY_CODES = Set.of("R41", "R42", "R43", "R44", "SB1");

    public boolean matches(GrantRecord record, SearchFilters filters, LocalDate today) {
        return matches(record, filters, today, EnumSet.noneOf(FilterDimension.class));
    }

    public boolean matches(GrantRecord record, SearchFilters filters, LocalDate today, Set<FilterDimension> ignored) {
        if (record == null) {
            return false;
        }
        if (filters == null) {
            return true;
        }
        if (!ignored.contains(FilterDimension.CATEGORY) && !inSet(record.getPrimaryCategory(), filters.getPrimaryCategory())) {
            return false;
        }
        if (!ignored.contains(FilterDimension.ORG_TYPE) && !inSet(record.getOrgType(), filters.getOrgType())) {
            return false;
        }
        if (!ignored.contains(FilterDimension.STATE) && !inSet(record.getOrgState(), filters.getState())) {
            return false;
        }
        if (!ignored.contains(FilterDimension.MIN_FUNDING) && filters.getMinFunding() != null
            && filters.getMinFunding() > 0 && totalCost(record) < filters.getMinFunding()) {
            return false;
        }
        if (!ignored.contains(FilterDimension.HAS_PATENTS) && isOn(filters.getHasPatents())
            && count(record.getPatentCount()) <= 0) {
            return false;
        }
        if (!ignored.contains(FilterDimension.HAS_PUBLICATIONS) && isOn(filters.getHasPublications())
            && count(record.getPublicationCount()) <= 0) {
            return false;
        }
        if (!ignored.contains(FilterDimension.HAS_CLINICAL_TRIALS) && isOn(filters.getHasClinicalTrials())
            && count(record.getClinicalTrialCount()) <= 0) {
            return false;
        }
        if (!ignored.contains(FilterDimension.ACTIVE) && isOn(filters.getActiveOnly()) && !isActive(record, today)) {
            return false;
        }
        if (!ignored.contains(FilterDimension.SBIR_STTR) && isOn(filters.getSbirSttrOnly()) && !isSbirSttr(record)) {
            return false;
        }
        return true;
    }

    public boolean isActive(GrantRecord record, LocalDate today) {
        String projectEnd = record.getProjectEnd();
        if (projectEnd == null || projectEnd.isBlank() || today == null) {
            return false;
        }
        String datePart = projectEnd.length() > 10 ? projectEnd.substring(0, 10) : projectEnd;
        try {
            return !LocalDate.parse(datePart).isBefore(today);
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    public boolean isSbirSttr(GrantRecord record) {
        String activityCode = record.getActivityCode();
        return activityCode != null && SBIR_STTR_ACTIVITY_CODES.contains(activityCode.trim().toUpperCase(Locale.ROOT));
    }

    public boolean hasPatents(GrantRecord record) {
        return count(record.getPatentCount()) > 0;
    }

    public boolean hasPublications(GrantRecord record) {
        return count(record.getPublicationCount()) > 0;
    }

    public boolean hasClinicalTrials(GrantRecord record) {
        return count(record.getClinicalTrialCount()) > 0;
    }

    private boolean inSet(String value, List<String> accepted) {
        if (accepted == null || accepted.isEmpty()) {
            return true;
        }
        return value != null && accepted.contains(value);
    }

    private boolean isOn(Boolean flag) {
        return Boolean.TRUE.equals(flag);
    }

    private double totalCost(GrantRecord record) {
        return record.getTotalCost() == null ? 0.0 : record.getTotalCost();
    }

    private int count(Integer value) {
        return value == null ? 0 : value;
    }
}
