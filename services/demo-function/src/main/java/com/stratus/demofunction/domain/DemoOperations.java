package com.stratus.demofunction.domain;

/**
 * Downstream calls made by the demo business logic.
 */
public interface DemoOperations {

    DbWriteResult putItem(String requestId) throws InterruptedException;

    S3PutResult putObject(String requestId) throws InterruptedException;

    ExternalData fetchExternalData(String requestId) throws InterruptedException;

    /**
     * Local processing step after the downstream calls.
     *
     * @param stage {@link Operation#PROCESSING} or {@link Operation#API_PROCESSING}
     */
    void process(Operation stage, String requestId) throws InterruptedException;
}
