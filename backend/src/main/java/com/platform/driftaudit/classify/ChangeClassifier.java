package com.platform.driftaudit.classify;

import com.platform.driftaudit.config.DriftAuditProperties;
import com.platform.driftaudit.diff.FieldChange;
import com.platform.driftaudit.rules.DriftType;
import com.platform.driftaudit.rules.SecurityRule;
import com.platform.driftaudit.rules.SecurityRuleCatalog;
import com.platform.driftaudit.rules.Severity;
import com.platform.driftaudit.value.ConfigValueMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Classifies field changes against the security rule catalog.
 * 
 * Each change takes the severity and drift type of the first rule that matches it, or the
 * LOW / CONFIGURATION_CHANGE default. A batch takes the highest severity and the highest
 * priority drift type found in it, so one encryption regression is never outvoted by
 * many benign edits.
 */
@Slf4j
@Component
public class ChangeClassifier {
    
    private final SecurityRuleCatalog catalog;
    private final ConfigValueMapper valueMapper;
    private final DriftAuditProperties properties;
    
    public ChangeClassifier(SecurityRuleCatalog catalog, ConfigValueMapper valueMapper,
                            DriftAuditProperties properties) {
        this.catalog = catalog;
        this.valueMapper = valueMapper;
        this.properties = properties;
    }
    
    /**
     * Classify a non-empty batch of changes for one resource.
     */
    public DetectionResult classify(String resourceType, List<FieldChange> changes) {
        if (changes == null || changes.isEmpty()) {
            throw new IllegalArgumentException("Cannot classify an empty change set; report no drift instead");
        }
        
        List<SecurityRule> rules = catalog.rulesFor(resourceType);
        Severity highestSeverity = Classification.DEFAULT_SEVERITY;
        DriftType primaryType = Classification.DEFAULT_DRIFT_TYPE;
        
        for (FieldChange change : changes) {
            Classification classification = evaluate(rules, change);
            highestSeverity = Severity.max(highestSeverity, classification.severity());
            if (classification.driftType().outranks(primaryType)) {
                primaryType = classification.driftType();
            }
        }
        
        String narrative = describe(changes, highestSeverity);
        return DetectionResult.drift(primaryType, highestSeverity, narrative, changes);
    }
    
    /**
     * Classify a single change.
     */
    public Classification evaluate(String resourceType, FieldChange change) {
        return evaluate(catalog.rulesFor(resourceType), change);
    }
    
    private Classification evaluate(List<SecurityRule> rules, FieldChange change) {
        for (SecurityRule rule : rules) {
            if (rule.matches(change)) {
                log.debug("Change at {} matched rule '{}' ({})", change.path(), rule.fieldPattern(),
                    rule.severity());
                return Classification.matched(change, rule);
            }
        }
        return Classification.unmatched(change);
    }
    
    /**
     * Human-readable description listing the first few changes.
     */
    public String describe(List<FieldChange> changes, Severity severity) {
        if (changes.isEmpty()) {
            return DetectionResult.NO_CHANGES_NARRATIVE;
        }
        
        int limit = properties.getNarrative().getMaxListedChanges();
        StringBuilder detail = new StringBuilder()
            .append(changes.size())
            .append(" configuration change(s) detected with ")
            .append(severity)
            .append(" severity:\n");
        
        for (int i = 0; i < changes.size(); i++) {
            if (i >= limit) {
                detail.append("... and ").append(changes.size() - limit).append(" more changes");
                break;
            }
            FieldChange change = changes.get(i);
            detail.append("- ")
                .append(change.path()).append(": ").append(change.kind())
                .append(" (was: ").append(valueMapper.render(change.oldValue()))
                .append(", now: ").append(valueMapper.render(change.newValue()))
                .append(")\n");
        }
        
        return detail.toString();
    }
}
