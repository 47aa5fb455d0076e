package com.platform.driftaudit.rules;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity levels for drift prioritization, lowest first.
 * {@link #INFO} is only used for compliant reconciliation verdicts.
 */
public enum Severity {
    INFO("info"),
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");
    
    private final String value;
    
    Severity(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    public static Severity max(Severity a, Severity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
    
    @Override
    public String toString() {
        return value;
    }
}
