package com.event.seating.domain;

public enum ConstraintType {
    MUST_SIT_TOGETHER(null),
    MUST_NOT_SIT_TOGETHER(null),
    MAX_SELLERS_PER_TABLE(2),
    MIN_BUYERS_PER_TABLE(1);

    private final Integer defaultThreshold;

    ConstraintType(Integer defaultThreshold) {
        this.defaultThreshold = defaultThreshold;
    }

    public Integer getDefaultThreshold() {
        return defaultThreshold;
    }
}
