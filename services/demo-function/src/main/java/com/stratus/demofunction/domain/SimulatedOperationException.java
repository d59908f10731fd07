package com.stratus.demofunction.domain;

/**
 * Failure injected into a simulated downstream operation.
 */
public class SimulatedOperationException extends RuntimeException {

    private final Operation operation;

    public SimulatedOperationException(Operation operation) {
        super("Simulated " + operation.value() + " failure");
        this.operation = operation;
    }

    public Operation operation() {
        return operation;
    }
}
