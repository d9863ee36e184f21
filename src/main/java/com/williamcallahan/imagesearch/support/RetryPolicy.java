package com.williamcallahan.imagesearch.support;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retry settings shared by the blob store and vector index adapters.
 *
 * <p>Only failures that {@link TransientErrorClassifier} considers transient are retried. The
 * delay doubles after every failed attempt and is capped at {@link #MAX_BACKOFF}.</p>
 *
 * @param maxAttempts attempts per call; 1 means a failure surfaces immediately
 * @param initialBackoff delay before the second attempt
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff) {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    /** Upper bound for the delay between two attempts. */
    public static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    public RetryPolicy {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must not be negative");
        }
    }

    /** A policy that never retries. */
    public static RetryPolicy none() {
        return new RetryPolicy(1, Duration.ZERO);
    }

    /**
     * Runs the call, retrying transient failures until it succeeds or the attempts are used up.
     *
     * @param operation collaborator call
     * @param operationName label for log messages
     * @param <T> result type
     * @return the first successful result
     * @throws RuntimeException the last failure, or the first permanent one
     */
    public <T> T execute(Supplier<T> operation, String operationName) {
        Duration backoff = initialBackoff;
        int attempt = 1;
        while (true) {
            try {
                return operation.get();
            } catch (RuntimeException failure) {
                if (attempt >= maxAttempts) {
                    if (maxAttempts > 1) {
                        log.error("{} failed after {} attempts, giving up", operationName, maxAttempts);
                    }
                    throw failure;
                }
                if (!TransientErrorClassifier.isTransient(failure)) {
                    log.warn("{} failed with non-transient error on attempt {}/{}, not retrying",
                            operationName, attempt, maxAttempts);
                    throw failure;
                }
                log.warn("{} failed with transient error on attempt {}/{}, retrying in {}ms",
                        operationName, attempt, maxAttempts, backoff.toMillis());
                pause(backoff);
                backoff = backoff.multipliedBy(2);
                if (backoff.compareTo(MAX_BACKOFF) > 0) {
                    backoff = MAX_BACKOFF;
                }
                attempt++;
            }
        }
    }

    public void run(Runnable operation, String operationName) {
        execute(() -> {
            operation.run();
            return null;
        }, operationName);
    }

    private static void pause(Duration backoff) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry interrupted", interrupted);
        }
    }
}
