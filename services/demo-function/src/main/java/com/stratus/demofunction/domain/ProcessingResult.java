package com.stratus.demofunction.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of the event handler's business logic.
 */
public record ProcessingResult(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("processing_time_ms") long processingTimeMs,
        String result,
        List<String> operations,
        @JsonProperty("db_result") DbWriteResult dbResult,
        @JsonProperty("s3_result") S3PutResult s3Result
) {

    public ProcessingResult {
        operations = operations == null ? List.of() : List.copyOf(operations);
    }
}
