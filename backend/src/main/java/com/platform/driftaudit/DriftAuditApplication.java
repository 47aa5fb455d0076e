package com.platform.driftaudit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Drift Audit Application
 * 
 * Detection and classification engine for cloud configuration drift:
 * - Structural diff of configuration snapshots
 * - Security rule catalog per resource type
 * - Reconciliation of IaC-declared resources against deployed resources
 * 
 * Fetching inventories, persisting results and scheduling scans are left to the host.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class DriftAuditApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriftAuditApplication.class, args);
    }
}
