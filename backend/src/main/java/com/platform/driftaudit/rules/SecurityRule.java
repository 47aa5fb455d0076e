package com.platform.driftaudit.rules;

import com.platform.driftaudit.diff.FieldChange;

import java.util.Locale;
import java.util.Objects;

/**
 * One row of the security rule catalog.
 * 
 * Applies to a change when the change path contains {@code fieldPattern} (case-insensitive)
 * and the predicate accepts the change.
 */
public record SecurityRule(
    String fieldPattern,
    Severity severity,
    DriftType driftType,
    ChangePredicate predicate,
    String description
) {
    
    public SecurityRule {
        Objects.requireNonNull(fieldPattern, "fieldPattern");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(driftType, "driftType");
        Objects.requireNonNull(predicate, "predicate");
        fieldPattern = fieldPattern.toLowerCase(Locale.ROOT);
    }
    
    public boolean matches(FieldChange change) {
        return change.path().toLowerCase(Locale.ROOT).contains(fieldPattern) && predicate.test(change);
    }
}
