package com.platform.driftaudit.classify;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.platform.driftaudit.diff.FieldChange;
import com.platform.driftaudit.rules.DriftType;
import com.platform.driftaudit.rules.Severity;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of comparing a baseline against a current snapshot.
 * Without drift there are no changes and no severity or drift type.
 */
@JsonPropertyOrder({"has_drift", "drift_type", "severity", "narrative", "changes"})
public record DetectionResult(
    @JsonProperty("has_drift") boolean hasDrift,
    @JsonProperty("drift_type") @JsonInclude(JsonInclude.Include.NON_NULL) DriftType driftType,
    @JsonInclude(JsonInclude.Include.NON_NULL) Severity severity,
    String narrative,
    List<FieldChange> changes
) {
    
    public static final String NO_CHANGES_NARRATIVE = "No changes detected";
    
    public DetectionResult {
        changes = List.copyOf(changes);
        Objects.requireNonNull(narrative, "narrative");
        if (hasDrift && (changes.isEmpty() || severity == null || driftType == null)) {
            throw new IllegalArgumentException("A drift result needs changes, a severity and a drift type");
        }
        if (!hasDrift && (!changes.isEmpty() || severity != null || driftType != null)) {
            throw new IllegalArgumentException("A result without drift cannot carry changes or a classification");
        }
    }
    
    public static DetectionResult noDrift() {
        return new DetectionResult(false, null, null, NO_CHANGES_NARRATIVE, List.of());
    }
    
    public static DetectionResult drift(DriftType driftType, Severity severity, String narrative,
                                        List<FieldChange> changes) {
        return new DetectionResult(true, driftType, severity, narrative, changes);
    }
}
