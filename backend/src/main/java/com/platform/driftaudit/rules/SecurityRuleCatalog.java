package com.platform.driftaudit.rules;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.platform.driftaudit.rules.ChangePredicates.*;

/**
 * Registry of security rules keyed by resource type.
 * 
 * Each resource type owns an ordered rule table; evaluation takes the first matching row.
 * Types without a table use the common rules. Type names are normalized so that
 * {@code "S3-Bucket"} and {@code "s3_bucket"} select the same table.
 */
@Slf4j
@Component
public class SecurityRuleCatalog {
    
    public static final String S3_BUCKET = "s3_bucket";
    public static final String GCS_BUCKET = "gcs_bucket";
    public static final String AZURE_STORAGE = "azure_storage";
    public static final String EC2_INSTANCE = "ec2_instance";
    public static final String GCE_INSTANCE = "gce_instance";
    public static final String AZURE_VM = "azure_vm";
    
    private final List<SecurityRule> commonRules;
    private final Map<String, List<SecurityRule>> rulesByType = new ConcurrentHashMap<>();
    
    public SecurityRuleCatalog() {
        this.commonRules = List.copyOf(defaultCommonRules());
        initializeRules();
    }
    
    private void initializeRules() {
        List<SecurityRule> storage = prepend(List.of(
            new SecurityRule("public_access", Severity.CRITICAL, DriftType.SECURITY_GROUP,
                PUBLIC_ACCESS_ENABLED, "Bucket public access enabled"),
            new SecurityRule("block_public", Severity.CRITICAL, DriftType.SECURITY_GROUP,
                BLOCK_PUBLIC_DISABLED, "Public access block turned off")
        ));
        register(S3_BUCKET, storage);
        register(GCS_BUCKET, storage);
        register(AZURE_STORAGE, storage);
        
        List<SecurityRule> compute = prepend(List.of(
            new SecurityRule("firewall", Severity.CRITICAL, DriftType.NETWORK_RULE,
                FIREWALL_OPENED, "Instance firewall allows unrestricted access")
        ));
        register(EC2_INSTANCE, compute);
        register(GCE_INSTANCE, compute);
        register(AZURE_VM, compute);
        
        log.info("Initialized security rule catalog: {} common rules, {} resource types",
            commonRules.size(), rulesByType.size());
    }
    
    private static List<SecurityRule> defaultCommonRules() {
        List<SecurityRule> rules = new ArrayList<>();
        
        // Critical
        rules.add(new SecurityRule("encryption", Severity.CRITICAL, DriftType.ENCRYPTION,
            ENCRYPTION_DISABLED, "Encryption was disabled or removed"));
        rules.add(new SecurityRule("acl", Severity.CRITICAL, DriftType.SECURITY_GROUP,
            ACL_MADE_PUBLIC, "Public access enabled through ACL"));
        rules.add(new SecurityRule("security_group", Severity.CRITICAL, DriftType.SECURITY_GROUP,
            SECURITY_GROUP_OPENED, "Security group open to world"));
        rules.add(new SecurityRule("network", Severity.CRITICAL, DriftType.NETWORK_RULE,
            FIREWALL_OPENED, "Firewall rules allow unrestricted access"));
        
        // High
        rules.add(new SecurityRule("iam", Severity.HIGH, DriftType.IAM_POLICY,
            PERMISSION_ESCALATION, "IAM policy changed - potential permission escalation"));
        rules.add(new SecurityRule("policy", Severity.HIGH, DriftType.IAM_POLICY,
            POLICY_CHANGED, "Resource policy modified"));
        rules.add(new SecurityRule("backup", Severity.HIGH, DriftType.CONFIGURATION_CHANGE,
            BACKUP_DISABLED, "Backup configuration was disabled"));
        rules.add(new SecurityRule("logging", Severity.HIGH, DriftType.CONFIGURATION_CHANGE,
            LOGGING_DISABLED, "Access logging was disabled"));
        
        // Medium
        rules.add(new SecurityRule("versioning", Severity.MEDIUM, DriftType.CONFIGURATION_CHANGE,
            VALUE_CHANGED, "Versioning configuration changed"));
        rules.add(new SecurityRule("ssh", Severity.MEDIUM, DriftType.SECURITY_GROUP,
            VALUE_CHANGED, "SSH configuration changed"));
        rules.add(new SecurityRule("monitoring", Severity.MEDIUM, DriftType.CONFIGURATION_CHANGE,
            MONITORING_DISABLED, "Monitoring was disabled"));
        
        return rules;
    }
    
    /**
     * Type-specific rules followed by the common rules.
     */
    public List<SecurityRule> prepend(List<SecurityRule> typeSpecific) {
        List<SecurityRule> rules = new ArrayList<>(typeSpecific);
        rules.addAll(commonRules);
        return rules;
    }
    
    /**
     * Register (or replace) the full, ordered rule table for a resource type.
     */
    public void register(String resourceType, List<SecurityRule> rules) {
        String key = normalize(resourceType);
        rulesByType.put(key, List.copyOf(rules));
        log.debug("Registered {} rules for resource type: {}", rules.size(), key);
    }
    
    /**
     * Ordered rules for a resource type, falling back to the common rules.
     */
    public List<SecurityRule> rulesFor(String resourceType) {
        if (resourceType == null) {
            return commonRules;
        }
        return rulesByType.getOrDefault(normalize(resourceType), commonRules);
    }
    
    public List<SecurityRule> getCommonRules() {
        return commonRules;
    }
    
    public boolean hasRulesFor(String resourceType) {
        return resourceType != null && rulesByType.containsKey(normalize(resourceType));
    }
    
    public static String normalize(String resourceType) {
        return resourceType.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
