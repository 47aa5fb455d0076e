package com.platform.driftaudit.rules;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Types of security drift.
 * 
 * Declared in aggregation priority order: when a batch contains several types the first
 * declared one wins, regardless of how many changes carry the others.
 */
public enum DriftType {
    ENCRYPTION("encryption"),
    SECURITY_GROUP("security_group"),
    IAM_POLICY("iam_policy"),
    NETWORK_RULE("network_rule"),
    CONFIGURATION_CHANGE("configuration_change");
    
    private final String value;
    
    DriftType(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    /**
     * True if this type outranks {@code other} when picking the type of a batch.
     */
    public boolean outranks(DriftType other) {
        return ordinal() < other.ordinal();
    }
    
    @Override
    public String toString() {
        return value;
    }
}
