package com.platform.driftaudit.reconcile;

import com.platform.driftaudit.config.DriftAuditProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Field names assigned by the provider (IDs, timestamps, ARNs, addresses) that legitimately
 * appear on deployed resources without being declared. Matching is exact on the key name.
 */
@Slf4j
@Component
public class ComputedFieldFilter implements Predicate<String> {
    
    public static final Set<String> DEFAULT_COMPUTED_FIELDS = Set.of(
        "id",
        "arn",
        "self_link",
        "created_at",
        "updated_at",
        "creation_timestamp",
        "uid",
        "resource_version",
        "generation",
        "managed_fields",
        "status",
        "instance_id",
        "public_ip",
        "public_dns",
        "private_ip",
        "private_dns"
    );
    
    private final Set<String> computedFields;
    
    public ComputedFieldFilter(DriftAuditProperties properties) {
        Set<String> fields = new HashSet<>(DEFAULT_COMPUTED_FIELDS);
        fields.addAll(properties.getReconciliation().getExtraComputedFields());
        this.computedFields = Set.copyOf(fields);
        if (computedFields.size() > DEFAULT_COMPUTED_FIELDS.size()) {
            log.info("Computed field exclusions extended with {}",
                properties.getReconciliation().getExtraComputedFields());
        }
    }
    
    public boolean isComputed(String fieldName) {
        return fieldName != null && computedFields.contains(fieldName);
    }
    
    @Override
    public boolean test(String fieldName) {
        return isComputed(fieldName);
    }
}
