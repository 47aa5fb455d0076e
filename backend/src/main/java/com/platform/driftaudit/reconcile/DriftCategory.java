package com.platform.driftaudit.reconcile;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of IaC drift between a declared and a deployed resource.
 */
public enum DriftCategory {
    MISSING("missing"),       // In IaC but not deployed
    SHADOW("shadow"),         // Deployed but not in IaC
    MODIFIED("modified"),     // Configuration mismatch
    COMPLIANT("compliant");   // No drift detected
    
    private final String value;
    
    DriftCategory(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    public boolean isDrift() {
        return this != COMPLIANT;
    }
}
