package com.grantlens.search.filter;

public enum FilterDimension {
    CATEGORY,
    ORG_TYPE,
    STATE,
    MIN_FUNDING,
    HAS_PATENTS,
    HAS_PUBLICATIONS,
    HAS_CLINICAL_TRIALS,
    ACTIVE,
    SBIR_STTR
}
