package com.basketgov.policy;

import com.basketgov.contract.Operation;
import com.basketgov.contract.OperationType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ValidatorGatewayTest {

    private static final ValidationRequest REQUEST = new ValidationRequest("basket-1", "ws-1", "Extraction",
        List.of(Operation.of(OperationType.CREATE_BLOCK, Map.of("content", "hello"))));

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void reportIsReturned() {
        ValidatorReport report = new ValidatorReport(0.9, "one new block", List.of());
        ValidationOutcome outcome = gateway(request -> report, Duration.ofSeconds(1)).validate(REQUEST);

        assertInstanceOf(ValidationOutcome.Reported.class, outcome);
        assertEquals(report, outcome.reportOrNull());
    }

    @Test
    void noValidatorConfiguredIsUnavailable() {
        ValidatorGateway gateway = new ValidatorGateway(Optional.empty(), Duration.ofSeconds(1), executor);
        ValidationOutcome outcome = gateway.validate(REQUEST);

        assertInstanceOf(ValidationOutcome.Unavailable.class, outcome);
        assertNull(outcome.reportOrNull());
    }

    @Test
    void timeoutIsUnavailable() throws InterruptedException {
        CountDownLatch release = new CountDownLatch(1);
        ValidatorClient slow = request -> {
            release.await(5, TimeUnit.SECONDS);
            return new ValidatorReport(0.99, "late", List.of());
        };

        long started = System.nanoTime();
        ValidationOutcome outcome = gateway(slow, Duration.ofMillis(100)).validate(REQUEST);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        release.countDown();

        ValidationOutcome.Unavailable unavailable = assertInstanceOf(ValidationOutcome.Unavailable.class, outcome);
        assertTrue(unavailable.reason().contains("timed out"));
        assertTrue(elapsedMs < 2000, "gateway must not wait for the slow validator");
    }

    @Test
    void validatorErrorIsUnavailable() {
        ValidatorClient failing = request -> {
            throw new IllegalStateException("agent returned 502");
        };
        ValidationOutcome outcome = gateway(failing, Duration.ofSeconds(1)).validate(REQUEST);

        ValidationOutcome.Unavailable unavailable = assertInstanceOf(ValidationOutcome.Unavailable.class, outcome);
        assertTrue(unavailable.reason().contains("agent returned 502"));
    }

    @Test
    void malformedReportIsNeverTreatedAsSuccess() {
        ValidationOutcome outcome = gateway(request -> new ValidatorReport(1.7, "", List.of()),
            Duration.ofSeconds(1)).validate(REQUEST);
        assertInstanceOf(ValidationOutcome.Unavailable.class, outcome);
    }

    private ValidatorGateway gateway(ValidatorClient client, Duration timeout) {
        return new ValidatorGateway(Optional.of(client), timeout, executor);
    }
}
