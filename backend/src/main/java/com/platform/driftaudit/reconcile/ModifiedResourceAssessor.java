package com.platform.driftaudit.reconcile;

import com.platform.driftaudit.config.DriftAuditProperties;
import com.platform.driftaudit.diff.FieldChange;
import com.platform.driftaudit.rules.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Rates a declared/deployed pair whose configurations differ and suggests what to do about it.
 * 
 * Severity comes from the names of the changed fields rather than from their values: any
 * security-critical field makes the pair critical, any high-risk field makes it high, otherwise
 * the size of the change set decides.
 */
@Component
public class ModifiedResourceAssessor {
    
    private static final List<String> CRITICAL_FIELDS =
        List.of("encryption", "public_access", "security_group", "iam_policy", "acl");
    private static final List<String> HIGH_RISK_FIELDS =
        List.of("password", "secret", "key", "network", "firewall");
    
    static final List<String> BASE_RECOMMENDATIONS = List.of(
        "Review the configuration differences",
        "Update IaC definition to match actual state, or",
        "Re-apply IaC to correct the drift"
    );
    static final String ENCRYPTION_CALLOUT = "CRITICAL: Encryption configuration has changed";
    static final String PUBLIC_ACCESS_CALLOUT = "CRITICAL: Public access configuration has changed";
    static final String NO_ACTION = "No action required";
    
    private final DriftAuditProperties properties;
    
    public ModifiedResourceAssessor(DriftAuditProperties properties) {
        this.properties = properties;
    }
    
    public Severity severity(List<FieldChange> changes) {
        if (anyPathContains(changes, CRITICAL_FIELDS)) {
            return Severity.CRITICAL;
        }
        if (anyPathContains(changes, HIGH_RISK_FIELDS)) {
            return Severity.HIGH;
        }
        if (changes.size() > properties.getReconciliation().getLargeChangeThreshold()) {
            return Severity.HIGH;
        }
        return Severity.MEDIUM;
    }
    
    public String recommendation(List<FieldChange> changes) {
        if (changes.isEmpty()) {
            return NO_ACTION;
        }
        
        List<String> recommendations = new ArrayList<>(BASE_RECOMMENDATIONS);
        for (FieldChange change : changes) {
            String field = change.path().toLowerCase(Locale.ROOT);
            if (field.contains("encryption")) {
                recommendations.add(ENCRYPTION_CALLOUT);
            }
            if (field.contains("public") && field.contains("access")) {
                recommendations.add(PUBLIC_ACCESS_CALLOUT);
            }
        }
        return String.join("; ", recommendations);
    }
    
    private static boolean anyPathContains(List<FieldChange> changes, List<String> fragments) {
        return changes.stream()
            .map(change -> change.path().toLowerCase(Locale.ROOT))
            .anyMatch(field -> fragments.stream().anyMatch(field::contains));
    }
}
