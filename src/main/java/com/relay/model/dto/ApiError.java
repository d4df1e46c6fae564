package com.relay.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.relay.model.routing.ProviderType;
import com.relay.service.quota.UpgradePrompt;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Error body returned by every endpoint.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

    int status;
    String error;
    String message;

    /** Present on quota refusals. */
    UpgradePrompt upgradePrompt;

    /** Present on dispatch failures. */
    List<ProviderType> attemptedProviders;
}
