package com.platform.driftaudit.summary;

import com.platform.driftaudit.reconcile.DriftCategory;
import com.platform.driftaudit.reconcile.ReconciliationVerdict;
import com.platform.driftaudit.rules.Severity;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Verdict counts by category and by severity.
 */
public record ReconciliationSummary(
    Map<DriftCategory, Long> byCategory,
    Map<Severity, Long> bySeverity,
    long total
) {
    
    public static ReconciliationSummary of(Collection<ReconciliationVerdict> verdicts) {
        Map<DriftCategory, Long> byCategory = zeroFilled(DriftCategory.class);
        Map<Severity, Long> bySeverity = zeroFilled(Severity.class);
        
        for (ReconciliationVerdict verdict : verdicts) {
            byCategory.merge(verdict.category(), 1L, Long::sum);
            bySeverity.merge(verdict.severity(), 1L, Long::sum);
        }
        
        return new ReconciliationSummary(
            Collections.unmodifiableMap(byCategory),
            Collections.unmodifiableMap(bySeverity),
            verdicts.size()
        );
    }
    
    public long count(DriftCategory category) {
        return byCategory.getOrDefault(category, 0L);
    }
    
    public long count(Severity severity) {
        return bySeverity.getOrDefault(severity, 0L);
    }
    
    /**
     * Verdicts that need attention, i.e. everything but compliant.
     */
    public long drifted() {
        return total - count(DriftCategory.COMPLIANT);
    }
    
    private static <E extends Enum<E>> Map<E, Long> zeroFilled(Class<E> type) {
        Map<E, Long> counts = new EnumMap<>(type);
        for (E constant : type.getEnumConstants()) {
            counts.put(constant, 0L);
        }
        return counts;
    }
}
