package com.stratus.demofunction.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of the simulated object upload.
 */
public record S3PutResult(
        @JsonProperty("object_key") String objectKey,
        String bucket,
        long size
) {
}
