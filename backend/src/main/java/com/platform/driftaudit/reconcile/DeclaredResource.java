package com.platform.driftaudit.reconcile;

import com.platform.driftaudit.error.ValidationException;
import com.platform.driftaudit.value.ConfigValue;

/**
 * Resource as declared in an infrastructure-as-code definition.
 */
public record DeclaredResource(
    String address,
    String resourceType,
    String resourceName,
    String provider,
    ConfigValue configuration
) implements InfrastructureResource {
    
    public DeclaredResource {
        if (address == null || address.isBlank()) {
            throw new ValidationException("address", "declared resource needs an address");
        }
        if (configuration == null) {
            configuration = ConfigValue.NULL;
        }
    }
}
