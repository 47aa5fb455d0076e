package com.platform.driftaudit.reconcile;

import com.platform.driftaudit.diff.ConfigDiffEngine;
import com.platform.driftaudit.diff.FieldChange;
import com.platform.driftaudit.observability.MetricsRegistry;
import com.platform.driftaudit.rules.Severity;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reconciles resources declared in IaC against resources actually deployed.
 * 
 * Produces exactly one verdict per address in the union of both sides: MISSING (declared only),
 * SHADOW (deployed only), and MODIFIED or COMPLIANT (both). Verdicts are grouped in that order
 * and sorted by address within each group.
 */
@Slf4j
@Component
public class ResourceReconciler {
    
    static final String COMPLIANT_MESSAGE = "Resource configuration matches IaC definition";
    static final String MISSING_RECOMMENDATION = "Deploy this resource or remove it from IaC definition";
    static final String SHADOW_RECOMMENDATION = "Add this resource to IaC definition or remove from infrastructure";
    
    private final ConfigDiffEngine diffEngine;
    private final ComputedFieldFilter computedFieldFilter;
    private final ModifiedResourceAssessor assessor;
    private final MetricsRegistry metricsRegistry;
    
    public ResourceReconciler(ConfigDiffEngine diffEngine, ComputedFieldFilter computedFieldFilter,
                              ModifiedResourceAssessor assessor, MetricsRegistry metricsRegistry) {
        this.diffEngine = diffEngine;
        this.computedFieldFilter = computedFieldFilter;
        this.assessor = assessor;
        this.metricsRegistry = metricsRegistry;
    }
    
    public List<ReconciliationVerdict> reconcile(Collection<DeclaredResource> declared,
                                                 Collection<ActualResource> actual) {
        long started = System.nanoTime();
        
        Map<String, DeclaredResource> declaredByAddress = indexByAddress(declared, "declared");
        Map<String, ActualResource> actualByAddress = indexByAddress(actual, "actual");
        List<ReconciliationVerdict> verdicts = new ArrayList<>();
        
        // In IaC but not deployed
        for (DeclaredResource resource : declaredByAddress.values()) {
            if (!actualByAddress.containsKey(resource.address())) {
                verdicts.add(missing(resource));
            }
        }
        
        // Deployed but not in IaC
        for (ActualResource resource : actualByAddress.values()) {
            if (!declaredByAddress.containsKey(resource.address())) {
                verdicts.add(shadow(resource));
            }
        }
        
        // Present on both sides
        for (DeclaredResource resource : declaredByAddress.values()) {
            ActualResource deployed = actualByAddress.get(resource.address());
            if (deployed != null) {
                verdicts.add(compare(resource, deployed));
            }
        }
        
        verdicts.forEach(metricsRegistry::recordVerdict);
        metricsRegistry.recordReconciliationDuration(Duration.ofNanos(System.nanoTime() - started));
        
        log.info("Reconciled {} declared against {} deployed resources: {} verdict(s), {} with drift",
            declaredByAddress.size(), actualByAddress.size(), verdicts.size(),
            verdicts.stream().filter(v -> v.category().isDrift()).count());
        return verdicts;
    }
    
    /**
     * Compare one declared resource with its deployed counterpart.
     */
    public ReconciliationVerdict compare(DeclaredResource declared, ActualResource actual) {
        MDC.put("address", declared.address());
        try {
            List<FieldChange> changes = diffEngine.diff("", declared.configuration(), actual.configuration(),
                computedFieldFilter);
            
            if (changes.isEmpty()) {
                log.debug("Resource {} is compliant", declared.address());
                return new ReconciliationVerdict(
                    DriftCategory.COMPLIANT,
                    ResourceRef.of(declared),
                    ResourceRef.of(actual),
                    Severity.INFO,
                    0,
                    COMPLIANT_MESSAGE,
                    assessor.recommendation(changes),
                    List.of()
                );
            }
            
            Severity severity = assessor.severity(changes);
            log.info("Configuration drift for {}: {} change(s), severity={}",
                declared.address(), changes.size(), severity);
            return new ReconciliationVerdict(
                DriftCategory.MODIFIED,
                ResourceRef.of(declared),
                ResourceRef.of(actual),
                severity,
                changes.size(),
                String.format("Configuration drift detected for %s", declared.address()),
                assessor.recommendation(changes),
                changes
            );
        } finally {
            MDC.remove("address");
        }
    }
    
    private ReconciliationVerdict missing(DeclaredResource resource) {
        return new ReconciliationVerdict(
            DriftCategory.MISSING,
            ResourceRef.of(resource),
            null,
            Severity.HIGH,
            0,
            String.format("Resource defined in IaC but not deployed: %s", resource.address()),
            MISSING_RECOMMENDATION,
            List.of()
        );
    }
    
    private ReconciliationVerdict shadow(ActualResource resource) {
        return new ReconciliationVerdict(
            DriftCategory.SHADOW,
            null,
            ResourceRef.of(resource),
            Severity.MEDIUM,
            0,
            String.format("Resource deployed but not defined in IaC: %s", resource.address()),
            SHADOW_RECOMMENDATION,
            List.of()
        );
    }
    
    private <T extends InfrastructureResource> Map<String, T> indexByAddress(Collection<T> resources, String side) {
        Map<String, T> byAddress = new TreeMap<>();
        if (resources == null) {
            return byAddress;
        }
        for (T resource : resources) {
            T previous = byAddress.put(resource.address(), resource);
            if (previous != null) {
                log.warn("Duplicate {} resource address {}, keeping the last one", side, resource.address());
            }
        }
        return byAddress;
    }
}
