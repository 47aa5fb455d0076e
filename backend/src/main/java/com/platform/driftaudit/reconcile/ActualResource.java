package com.platform.driftaudit.reconcile;

import com.platform.driftaudit.error.ValidationException;
import com.platform.driftaudit.value.ConfigValue;

/**
 * Resource as found deployed at a cloud provider.
 */
public record ActualResource(
    String address,
    String resourceType,
    String resourceName,
    String provider,
    ConfigValue configuration
) implements InfrastructureResource {
    
    public ActualResource {
        if (address == null || address.isBlank()) {
            throw new ValidationException("address", "actual resource needs an address");
        }
        if (configuration == null) {
            configuration = ConfigValue.NULL;
        }
    }
}
