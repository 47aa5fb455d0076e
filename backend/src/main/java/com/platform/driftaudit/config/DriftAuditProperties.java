package com.platform.driftaudit.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for drift detection and reconciliation.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "driftaudit")
public class DriftAuditProperties {
    
    @Valid
    private Narrative narrative = new Narrative();
    
    @Valid
    private Reconciliation reconciliation = new Reconciliation();
    
    @Data
    public static class Narrative {
        /**
         * Changes listed individually in a detection narrative before the "and N more" line.
         */
        @Min(1)
        private int maxListedChanges = 5;
    }
    
    @Data
    public static class Reconciliation {
        /**
         * A modified resource with more changes than this and no sensitive field is rated high.
         */
        @Min(0)
        private int largeChangeThreshold = 5;
        
        /**
         * Field names treated as provider-computed in addition to the built-in set.
         */
        @NotNull
        private List<String> extraComputedFields = new ArrayList<>();
    }
}
