package com.platform.driftaudit.rules;

import com.platform.driftaudit.diff.FieldChange;

/**
 * Condition evaluated against a single field change.
 */
@FunctionalInterface
public interface ChangePredicate {
    
    boolean test(FieldChange change);
    
    default ChangePredicate or(ChangePredicate other) {
        return change -> test(change) || other.test(change);
    }
}
