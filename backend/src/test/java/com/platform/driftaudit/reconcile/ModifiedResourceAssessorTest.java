package com.platform.driftaudit.reconcile;

import com.platform.driftaudit.config.DriftAuditProperties;
import com.platform.driftaudit.diff.FieldChange;
import com.platform.driftaudit.rules.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.platform.driftaudit.value.ConfigValue.of;
import static org.assertj.core.api.Assertions.assertThat;

class ModifiedResourceAssessorTest {
    
    private DriftAuditProperties properties;
    private ModifiedResourceAssessor assessor;
    
    @BeforeEach
    void setUp() {
        properties = new DriftAuditProperties();
        assessor = new ModifiedResourceAssessor(properties);
    }
    
    private static FieldChange change(String path) {
        return FieldChange.modified(path, of("old"), of("new"));
    }
    
    private static List<FieldChange> tagChanges(int count) {
        List<FieldChange> changes = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            changes.add(change("tags.t" + i));
        }
        return changes;
    }
    
    @Test
    void criticalFieldAnywhereWins() {
        List<FieldChange> changes = List.of(change("db_password"), change("Security_Group.ingress"));
        
        assertThat(assessor.severity(changes)).isEqualTo(Severity.CRITICAL);
    }
    
    @Test
    void highRiskFieldIsHigh() {
        assertThat(assessor.severity(List.of(change("tags.owner"), change("firewall.rules"))))
            .isEqualTo(Severity.HIGH);
    }
    
    @Test
    void largeChangeSetIsHigh() {
        assertThat(assessor.severity(tagChanges(5))).isEqualTo(Severity.MEDIUM);
        assertThat(assessor.severity(tagChanges(6))).isEqualTo(Severity.HIGH);
    }
    
    @Test
    void thresholdIsConfigurable() {
        properties.getReconciliation().setLargeChangeThreshold(1);
        
        assertThat(assessor.severity(tagChanges(2))).isEqualTo(Severity.HIGH);
    }
    
    @Test
    void recommendationStartsWithBaseAdvice() {
        assertThat(assessor.recommendation(List.of(change("tags.owner")))).isEqualTo(
            "Review the configuration differences; Update IaC definition to match actual state, or; "
                + "Re-apply IaC to correct the drift");
    }
    
    @Test
    void recommendationCallsOutSensitiveChanges() {
        String recommendation = assessor.recommendation(List.of(
            change("encryption.algorithm"), change("public_access_block.enabled")));
        
        assertThat(recommendation.split("; ")).containsExactly(
            "Review the configuration differences",
            "Update IaC definition to match actual state, or",
            "Re-apply IaC to correct the drift",
            ModifiedResourceAssessor.ENCRYPTION_CALLOUT,
            ModifiedResourceAssessor.PUBLIC_ACCESS_CALLOUT);
    }
    
    @Test
    void noChangesNeedNoAction() {
        assertThat(assessor.recommendation(List.of())).isEqualTo("No action required");
    }
}
