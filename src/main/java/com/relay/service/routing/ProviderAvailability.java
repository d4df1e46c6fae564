package com.relay.service.routing;

import com.relay.model.routing.ProviderType;

/**
 * Whether a provider currently has an enabled client that requests can be dispatched to.
 */
@FunctionalInterface
public interface ProviderAvailability {

    boolean isRoutable(ProviderType provider);
}
