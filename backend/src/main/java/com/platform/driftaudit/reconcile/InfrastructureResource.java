package com.platform.driftaudit.reconcile;

import com.platform.driftaudit.value.ConfigValue;

/**
 * A resource on either side of a reconciliation, joined by {@link #address()}.
 */
public interface InfrastructureResource {
    
    /**
     * Stable join key, e.g. {@code module.vpc.aws_instance.web}.
     */
    String address();
    
    String resourceType();
    
    String resourceName();
    
    String provider();
    
    ConfigValue configuration();
}
