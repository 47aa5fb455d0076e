package com.platform.driftaudit.summary;

import com.platform.driftaudit.classify.DetectionResult;
import com.platform.driftaudit.rules.Severity;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Drift counts by severity over a batch of detection results.
 * Results without drift are counted as clean.
 */
public record DriftSummary(
    Map<Severity, Long> bySeverity,
    long drifted,
    long clean
) {
    
    public static DriftSummary of(Collection<DetectionResult> results) {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            if (severity != Severity.INFO) {
                counts.put(severity, 0L);
            }
        }
        
        long clean = 0;
        for (DetectionResult result : results) {
            if (result.hasDrift()) {
                counts.merge(result.severity(), 1L, Long::sum);
            } else {
                clean++;
            }
        }
        
        long drifted = results.size() - clean;
        return new DriftSummary(Collections.unmodifiableMap(counts), drifted, clean);
    }
    
    public long count(Severity severity) {
        return bySeverity.getOrDefault(severity, 0L);
    }
    
    public long total() {
        return drifted + clean;
    }
}
