package com.stratus.demofunction.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code {statusCode, headers, body}} result every handler returns to the runtime.
 *
 * @param statusCode HTTP-style status code
 * @param headers    response headers in insertion order
 * @param body       serialized JSON body
 */
public record FunctionResponse(int statusCode, Map<String, String> headers, String body) {

    public static final String HEADER_CONTENT_TYPE = "Content-Type";
    public static final String HEADER_REQUEST_ID = "X-Request-ID";
    public static final String HEADER_RESPONSE_TIME = "X-Response-Time";
    public static final String HEADER_ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    public static final String APPLICATION_JSON = "application/json";

    public FunctionResponse {
        if (statusCode < 100 || statusCode > 599) {
            throw new IllegalArgumentException("statusCode must be a valid HTTP status, got " + statusCode);
        }
        headers = headers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        body = body == null ? "" : body;
    }

    /** Header value, or null if absent. */
    public String header(String name) {
        return headers.get(name);
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
