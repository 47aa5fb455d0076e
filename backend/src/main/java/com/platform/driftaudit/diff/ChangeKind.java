package com.platform.driftaudit.diff;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a field differs between baseline and current.
 */
public enum ChangeKind {
    ADDED("added"),
    REMOVED("removed"),
    MODIFIED("modified");
    
    private final String value;
    
    ChangeKind(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
    
    @Override
    public String toString() {
        return value;
    }
}
