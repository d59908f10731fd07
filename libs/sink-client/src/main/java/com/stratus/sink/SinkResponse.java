package com.stratus.sink;

/**
 * Status and body returned by the sink for one POST.
 *
 * @param statusCode HTTP status code
 * @param body       response body, treated as an opaque diagnostic string
 */
public record SinkResponse(int statusCode, String body) {

    public SinkResponse {
        body = body == null ? "" : body;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
