package com.stratus.demofunction.domain;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * {@link DemoOperations} that only sleep.
 *
 * <p>Each operation sleeps its {@link Operation#delayUnits()} times the configured delay unit and
 * returns canned data. The operation named as failing throws {@link SimulatedOperationException}
 * after its sleep.
 */
public final class SimulatedOperations implements DemoOperations {

    private static final Logger log = LoggerFactory.getLogger(SimulatedOperations.class);

    public static final String TABLE = "demo-table";
    public static final String BUCKET = "demo-bucket";
    public static final long OBJECT_SIZE = 1024;

    private final Duration delayUnit;
    private final Operation failOperation;
    private final Clock clock;

    /**
     * @param delayUnit     base latency; zero disables sleeping
     * @param failOperation operation to fail, or null
     */
    public SimulatedOperations(Duration delayUnit, Operation failOperation) {
        this(delayUnit, failOperation, Clock.systemUTC());
    }

    public SimulatedOperations(Duration delayUnit, Operation failOperation, Clock clock) {
        this.delayUnit = delayUnit == null ? Duration.ZERO : delayUnit;
        this.failOperation = failOperation;
        this.clock = clock;
    }

    @Override
    public DbWriteResult putItem(String requestId) throws InterruptedException {
        log.info("Simulating DynamoDB operation...");
        simulate(Operation.DYNAMODB);
        return new DbWriteResult("item_" + clock.instant().getEpochSecond(), requestId, "created");
    }

    @Override
    public S3PutResult putObject(String requestId) throws InterruptedException {
        log.info("Simulating S3 operation...");
        simulate(Operation.S3);
        return new S3PutResult("logs/" + requestId + ".json", BUCKET, OBJECT_SIZE);
    }

    @Override
    public ExternalData fetchExternalData(String requestId) throws InterruptedException {
        log.info("Making external API call...");
        simulate(Operation.EXTERNAL_API);
        Instant now = clock.instant();
        return new ExternalData((int) (now.getEpochSecond() % 1000), "Sample data for request " + requestId,
                DateTimeFormatter.ISO_INSTANT.format(now), "success");
    }

    @Override
    public void process(Operation stage, String requestId) throws InterruptedException {
        log.debug("Processing stage {} for {}", stage.value(), requestId);
        simulate(stage);
    }

    private void simulate(Operation operation) throws InterruptedException {
        long millis = (long) (delayUnit.toMillis() * operation.delayUnits());
        if (millis > 0) {
            Thread.sleep(millis);
        }
        if (operation == failOperation) {
            throw new SimulatedOperationException(operation);
        }
    }
}
