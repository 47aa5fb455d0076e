package com.platform.driftaudit.classify;

import com.platform.driftaudit.diff.FieldChange;
import com.platform.driftaudit.rules.DriftType;
import com.platform.driftaudit.rules.SecurityRule;
import com.platform.driftaudit.rules.Severity;

/**
 * Verdict for a single change.
 *
 * @param rule the matching rule, or {@code null} when the default applied
 */
public record Classification(
    FieldChange change,
    Severity severity,
    DriftType driftType,
    SecurityRule rule
) {
    
    /**
     * Policy default for changes no rule matches.
     */
    public static final Severity DEFAULT_SEVERITY = Severity.LOW;
    public static final DriftType DEFAULT_DRIFT_TYPE = DriftType.CONFIGURATION_CHANGE;
    
    public static Classification matched(FieldChange change, SecurityRule rule) {
        return new Classification(change, rule.severity(), rule.driftType(), rule);
    }
    
    public static Classification unmatched(FieldChange change) {
        return new Classification(change, DEFAULT_SEVERITY, DEFAULT_DRIFT_TYPE, null);
    }
    
    public boolean isDefault() {
        return rule == null;
    }
    
    public String description() {
        return rule != null ? rule.description() : "Unclassified configuration change";
    }
}
