package com.stratus.demofunction.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of the simulated table write.
 */
public record DbWriteResult(
        @JsonProperty("item_id") String itemId,
        @JsonProperty("request_id") String requestId,
        String status
) {
}
