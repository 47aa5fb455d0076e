package com.platform.driftaudit.detect;

import com.platform.driftaudit.classify.ChangeClassifier;
import com.platform.driftaudit.classify.DetectionResult;
import com.platform.driftaudit.diff.ConfigDiffEngine;
import com.platform.driftaudit.diff.FieldChange;
import com.platform.driftaudit.observability.MetricsRegistry;
import com.platform.driftaudit.value.ConfigValue;
import com.platform.driftaudit.value.ConfigValueMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Detects drift of one resource against its baseline snapshot.
 * 
 * Runs the structural diff from the document root and classifies the resulting changes.
 */
@Slf4j
@Component
public class DriftDetector {
    
    private final ConfigDiffEngine diffEngine;
    private final ChangeClassifier classifier;
    private final ConfigValueMapper valueMapper;
    private final MetricsRegistry metricsRegistry;
    
    public DriftDetector(ConfigDiffEngine diffEngine, ChangeClassifier classifier,
                         ConfigValueMapper valueMapper, MetricsRegistry metricsRegistry) {
        this.diffEngine = diffEngine;
        this.classifier = classifier;
        this.valueMapper = valueMapper;
        this.metricsRegistry = metricsRegistry;
    }
    
    /**
     * Compare two JSON documents.
     *
     * @throws com.platform.driftaudit.error.ConfigDecodingException if either document is malformed
     */
    public DetectionResult detect(String resourceType, String baselineJson, String currentJson) {
        ConfigValue baseline = valueMapper.read(baselineJson, "baseline");
        ConfigValue current = valueMapper.read(currentJson, "current");
        return detect(resourceType, baseline, current);
    }
    
    public DetectionResult detect(String resourceType, ConfigValue baseline, ConfigValue current) {
        MDC.put("resourceType", String.valueOf(resourceType));
        try {
            List<FieldChange> changes = diffEngine.diff("", baseline, current);
            
            DetectionResult result = changes.isEmpty()
                ? DetectionResult.noDrift()
                : classifier.classify(resourceType, changes);
            
            if (result.hasDrift()) {
                log.info("Drift detected for {}: {} change(s), type={}, severity={}",
                    resourceType, changes.size(), result.driftType(), result.severity());
            } else {
                log.debug("No drift for {}", resourceType);
            }
            metricsRegistry.recordDetection(result);
            return result;
        } finally {
            MDC.remove("resourceType");
        }
    }
}
