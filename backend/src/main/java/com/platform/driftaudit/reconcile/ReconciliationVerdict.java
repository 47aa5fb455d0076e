package com.platform.driftaudit.reconcile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.platform.driftaudit.diff.FieldChange;
import com.platform.driftaudit.rules.Severity;

import java.util.List;
import java.util.Objects;

/**
 * Reconciliation outcome for one resource address.
 */
@JsonPropertyOrder({"category", "declared", "actual", "severity", "change_count", "narrative",
    "recommendation", "changes"})
public record ReconciliationVerdict(
    DriftCategory category,
    @JsonInclude(JsonInclude.Include.NON_NULL) ResourceRef declared,
    @JsonInclude(JsonInclude.Include.NON_NULL) ResourceRef actual,
    Severity severity,
    @JsonProperty("change_count") int changeCount,
    String narrative,
    String recommendation,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) List<FieldChange> changes
) {
    
    public ReconciliationVerdict {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(severity, "severity");
        changes = List.copyOf(changes);
    }
    
    /**
     * Address of whichever side is present; both sides share it when both are present.
     */
    @JsonIgnore
    public String address() {
        return declared != null ? declared.address() : actual.address();
    }
}
