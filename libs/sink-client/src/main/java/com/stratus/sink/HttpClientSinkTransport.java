package com.stratus.sink;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * {@link SinkTransport} backed by the JDK {@link HttpClient}.
 * <p>
 * The client is thread-safe and may be kept for the life of the host process; reusing it across
 * invocations saves connection setup but nothing depends on it.
 */
public final class HttpClientSinkTransport implements SinkTransport {

    /** Default connect timeout. */
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(2);

    private final HttpClient httpClient;

    public HttpClientSinkTransport() {
        this(HttpClient.newBuilder()
                .connectTimeout(DEFAULT_CONNECT_TIMEOUT)
                .build());
    }

    public HttpClientSinkTransport(HttpClient httpClient) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient must not be null");
        }
        this.httpClient = httpClient;
    }

    @Override
    public SinkResponse post(URI uri, Map<String, String> headers, String body, Duration timeout)
            throws IOException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        headers.forEach(request::header);

        HttpResponse<String> response =
                httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        return new SinkResponse(response.statusCode(), response.body());
    }
}
