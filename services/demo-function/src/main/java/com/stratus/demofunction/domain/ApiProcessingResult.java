package com.stratus.demofunction.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of the API handler's business logic.
 */
public record ApiProcessingResult(
        @JsonProperty("processed_at") String processedAt,
        @JsonProperty("external_data") ExternalData externalData,
        @JsonProperty("request_processed") boolean requestProcessed
) {
}
