package com.platform.driftaudit.reconcile;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identity of a resource referenced by a verdict, without its configuration.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceRef(
    String address,
    @JsonProperty("resource_type") String resourceType,
    @JsonProperty("resource_name") String resourceName,
    String provider
) {
    
    public static ResourceRef of(InfrastructureResource resource) {
        return resource == null ? null : new ResourceRef(
            resource.address(),
            resource.resourceType(),
            resource.resourceName(),
            resource.provider()
        );
    }
}
