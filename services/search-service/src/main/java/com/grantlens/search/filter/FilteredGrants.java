package com.grantlens.search.filter;

import com.grantlens.search.api.dto.GrantRecord;
import java.util.List;
import java.util.Map;

public class FilteredGrants {
    private final List<GrantRecord> records;
    private final Map<String, Integer> byCategory;
    private final Map<String, Integer> byOrgType;

    public FilteredGrants(List<GrantRecord> records, Map<String, Integer> byCategory, Map<String, Integer> byOrgType) {
        this.records = records == null ? List.of() : records;
        this.byCategory = byCategory == null ? Map.of() : byCategory;
        this.byOrgType = byOrgType == null ? Map.of() : byOrgType;
    }

    public List<GrantRecord> getRecords() {
        return records;
    }

    public int getTotalCount() {
        return records.size();
    }

    public Map<String, Integer> getByCategory() {
        return byCategory;
    }

    public Map<String, Integer> getByOrgType() {
        return byOrgType;
    }
}
