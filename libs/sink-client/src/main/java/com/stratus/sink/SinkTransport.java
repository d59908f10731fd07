package com.stratus.sink;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Sends one serialized batch to the sink.
 * <p>
 * The production implementation is {@link HttpClientSinkTransport}. Tests substitute
 * {@link com.stratus.sink.testing.RecordingSinkTransport} to observe calls without a network.
 */
@FunctionalInterface
public interface SinkTransport {

    /**
     * Performs a single POST and waits for the response.
     *
     * @param uri     target URL
     * @param headers request headers
     * @param body    JSON body
     * @param timeout upper bound for the whole exchange
     * @return the sink's response, whatever its status
     * @throws IOException          on network failure; {@link java.net.http.HttpTimeoutException}
     *                              when {@code timeout} elapses
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    SinkResponse post(URI uri, Map<String, String> headers, String body, Duration timeout)
            throws IOException, InterruptedException;
}
