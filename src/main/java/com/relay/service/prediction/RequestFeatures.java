package com.relay.service.prediction;

import com.relay.model.routing.CapabilityClass;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RequestFeatures {

    int promptTokens;
    int estimatedCompletionTokens;
    int messageCount;
    int totalChars;
    boolean hasSystemMessage;
    boolean hasTools;
    /** In [0, 1]. */
    double complexityScore;
    CapabilityClass capability;
    /** True when the capability came from the caller rather than classification. */
    boolean capabilityExplicit;
}
