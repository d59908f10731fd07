package com.stratus.demofunction.domain;

/**
 * Payload returned by the simulated external API.
 */
public record ExternalData(int id, String data, String timestamp, String status) {
}
