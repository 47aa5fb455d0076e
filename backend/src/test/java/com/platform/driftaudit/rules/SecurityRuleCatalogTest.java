package com.platform.driftaudit.rules;

import com.platform.driftaudit.diff.FieldChange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.platform.driftaudit.value.ConfigValue.of;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SecurityRuleCatalogTest {
    
    private SecurityRuleCatalog catalog;
    
    @BeforeEach
    void setUp() {
        catalog = new SecurityRuleCatalog();
    }
    
    @Test
    void commonRulesKeepPriorityOrder() {
        assertThat(catalog.getCommonRules())
            .extracting(SecurityRule::fieldPattern)
            .containsExactly("encryption", "acl", "security_group", "network", "iam", "policy",
                "backup", "logging", "versioning", "ssh", "monitoring");
    }
    
    @Test
    void unknownTypeFallsBackToCommonRules() {
        assertThat(catalog.hasRulesFor("lambda_function")).isFalse();
        assertThat(catalog.rulesFor("lambda_function")).isSameAs(catalog.getCommonRules());
        assertThat(catalog.rulesFor(null)).isSameAs(catalog.getCommonRules());
    }
    
    @Test
    void storageTypesCheckPublicAccessFirst() {
        List<SecurityRule> rules = catalog.rulesFor(SecurityRuleCatalog.S3_BUCKET);
        
        assertThat(rules).hasSize(catalog.getCommonRules().size() + 2);
        assertThat(rules).extracting(SecurityRule::fieldPattern)
            .startsWith("public_access", "block_public", "encryption");
        assertThat(catalog.rulesFor(SecurityRuleCatalog.GCS_BUCKET)).isEqualTo(rules);
        assertThat(catalog.rulesFor(SecurityRuleCatalog.AZURE_STORAGE)).isEqualTo(rules);
    }
    
    @Test
    void computeTypesCheckFirewallFirst() {
        List<SecurityRule> rules = catalog.rulesFor(SecurityRuleCatalog.EC2_INSTANCE);
        
        assertThat(rules.get(0).fieldPattern()).isEqualTo("firewall");
        assertThat(rules.get(0).severity()).isEqualTo(Severity.CRITICAL);
        assertThat(rules.get(0).driftType()).isEqualTo(DriftType.NETWORK_RULE);
        assertThat(rules.subList(1, rules.size())).isEqualTo(catalog.getCommonRules());
    }
    
    @Test
    void typeNamesAreNormalized() {
        assertThat(catalog.hasRulesFor(" S3-Bucket ")).isTrue();
        assertThat(catalog.rulesFor("S3-BUCKET")).isEqualTo(catalog.rulesFor("s3_bucket"));
        assertThat(SecurityRuleCatalog.normalize(" Azure-VM")).isEqualTo("azure_vm");
    }
    
    @Test
    void registerReplacesTableWithImmutableCopy() {
        SecurityRule rule = new SecurityRule("Retention", Severity.HIGH, DriftType.CONFIGURATION_CHANGE,
            ChangePredicates.VALUE_CHANGED, "Retention changed");
        List<SecurityRule> table = catalog.prepend(List.of(rule));
        
        catalog.register("log-group", table);
        
        List<SecurityRule> registered = catalog.rulesFor("log_group");
        assertThat(registered).isEqualTo(table);
        assertThatThrownBy(() -> registered.add(rule)).isInstanceOf(UnsupportedOperationException.class);
    }
    
    @Test
    void rulePatternMatchesCaseInsensitively() {
        SecurityRule rule = new SecurityRule("Encryption", Severity.CRITICAL, DriftType.ENCRYPTION,
            ChangePredicates.ENCRYPTION_DISABLED, "Encryption was disabled or removed");
        
        assertThat(rule.fieldPattern()).isEqualTo("encryption");
        assertThat(rule.matches(FieldChange.modified("ServerSideEncryption.Enabled", of(true), of(false)))).isTrue();
        assertThat(rule.matches(FieldChange.modified("versioning.enabled", of(true), of(false)))).isFalse();
    }
}
