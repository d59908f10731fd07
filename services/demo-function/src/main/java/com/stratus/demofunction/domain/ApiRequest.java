package com.stratus.demofunction.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The parts of an API-gateway proxy event the API handler reports on.
 *
 * @param method                  HTTP method, {@code UNKNOWN} if absent
 * @param path                    request path, {@code /} if absent
 * @param queryParams             query string parameters (never null)
 * @param headers                 request headers (never null)
 * @param userAgent               {@code User-Agent} header, {@code unknown} if absent
 * @param sourceIp                caller IP from the request context, {@code unknown} if absent
 * @param gatewayRequestId        the gateway's own request ID, empty if absent
 */
public record ApiRequest(
        String method,
        String path,
        Map<String, Object> queryParams,
        Map<String, Object> headers,
        String userAgent,
        String sourceIp,
        String gatewayRequestId
) {

    public static final String UNKNOWN = "unknown";

    public ApiRequest {
        queryParams = queryParams == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(queryParams));
        headers = headers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /**
     * Extracts the request from a proxy event; every missing field gets its default.
     */
    public static ApiRequest from(Map<String, Object> event) {
        Map<String, Object> source = event == null ? Map.of() : event;
        Map<String, Object> headers = mapAt(source, "headers");
        Map<String, Object> requestContext = mapAt(source, "requestContext");
        Map<String, Object> identity = mapAt(requestContext, "identity");
        return new ApiRequest(
                stringAt(source, "httpMethod", "UNKNOWN"),
                stringAt(source, "path", "/"),
                mapAt(source, "queryStringParameters"),
                headers,
                stringAt(headers, "User-Agent", UNKNOWN),
                stringAt(identity, "sourceIp", UNKNOWN),
                stringAt(requestContext, "requestId", ""));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> mapAt(Map<String, Object> source, String key) {
        Object value = source.get(key);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static String stringAt(Map<String, Object> source, String key, String fallback) {
        Object value = source.get(key);
        return value == null ? fallback : String.valueOf(value);
    }
}
