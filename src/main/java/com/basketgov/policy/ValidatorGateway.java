package com.basketgov.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Synchronous validator call with an explicit timeout. Every failure mode
 * (no validator configured, timeout, error, malformed report) collapses to
 * {@link ValidationOutcome.Unavailable}.
 */
public class ValidatorGateway {

    private static final Logger log = LoggerFactory.getLogger(ValidatorGateway.class);

    private final Optional<ValidatorClient> client;
    private final Duration timeout;
    private final ExecutorService executor;

    public ValidatorGateway(Optional<ValidatorClient> client, Duration timeout, ExecutorService executor) {
        this.client = client;
        this.timeout = timeout;
        this.executor = executor;
    }

    public ValidationOutcome validate(ValidationRequest request) {
        if (client.isEmpty()) {
            return new ValidationOutcome.Unavailable("no validator configured");
        }
        ValidatorClient validator = client.get();
        CompletableFuture<ValidatorReport> future = CompletableFuture.supplyAsync(() -> {
            try {
                return validator.validate(request);
            } catch (Exception ex) {
                throw new IllegalStateException(ex.getMessage(), ex);
            }
        }, executor);

        try {
            ValidatorReport report = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (report == null || !report.isWellFormed()) {
                log.warn("Validator returned malformed report for basket={}", request.basketId());
                return new ValidationOutcome.Unavailable("invalid validator response");
            }
            return new ValidationOutcome.Reported(report);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Validator timed out after {}ms for basket={}", timeout.toMillis(), request.basketId());
            return new ValidationOutcome.Unavailable("validator timed out after " + timeout.toMillis() + "ms");
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.warn("Validator failed for basket={}: {}", request.basketId(), cause.getMessage());
            return new ValidationOutcome.Unavailable("validator error: " + cause.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return new ValidationOutcome.Unavailable("validator call interrupted");
        }
    }
}
