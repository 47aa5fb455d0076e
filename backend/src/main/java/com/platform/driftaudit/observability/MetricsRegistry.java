package com.platform.driftaudit.observability;

import com.platform.driftaudit.classify.DetectionResult;
import com.platform.driftaudit.reconcile.ReconciliationVerdict;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for drift audit metrics.
 * Counts detections and reconciliation verdicts by outcome.
 */
@Slf4j
@Component
public class MetricsRegistry {
    
    static final String DETECTIONS = "driftaudit.detections";
    static final String VERDICTS = "driftaudit.reconciliation.verdicts";
    static final String RECONCILIATION_DURATION = "driftaudit.reconciliation.duration";
    
    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Timer reconciliationTimer;
    
    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.reconciliationTimer = Timer.builder(RECONCILIATION_DURATION)
            .description("Time spent reconciling a declared/actual resource set")
            .register(meterRegistry);
        log.info("Metrics registry initialized");
    }
    
    /**
     * Record the outcome of a single-resource detection.
     */
    public void recordDetection(DetectionResult result) {
        if (result.hasDrift()) {
            incrementCounter(DETECTIONS,
                "outcome", "drift",
                "severity", result.severity().getValue(),
                "drift_type", result.driftType().getValue());
        } else {
            incrementCounter(DETECTIONS, "outcome", "clean", "severity", "none", "drift_type", "none");
        }
    }
    
    /**
     * Record a reconciliation verdict.
     */
    public void recordVerdict(ReconciliationVerdict verdict) {
        incrementCounter(VERDICTS,
            "category", verdict.category().getValue(),
            "severity", verdict.severity().getValue());
    }
    
    public void recordReconciliationDuration(Duration duration) {
        reconciliationTimer.record(duration);
    }
    
    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + "." + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
}
