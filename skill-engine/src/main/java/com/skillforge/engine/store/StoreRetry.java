package com.skillforge.engine.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry for store calls.
 *
 * Only {@link StoreUnavailableException} is retried; every other failure is
 * a caller or data defect and propagates on the first attempt. After the last
 * attempt the final exception propagates unchanged so each caller can
 * translate it (the search router reports SEARCH_UNAVAILABLE, for example).
 */
@Component
public class StoreRetry {

    private static final Logger log = LoggerFactory.getLogger(StoreRetry.class);

    private final int      maxAttempts;
    private final Duration backoff;

    public StoreRetry(
            @Value("${skillforge.retry.max-attempts:3}") int maxAttempts,
            @Value("${skillforge.retry.backoff:200ms}") Duration backoff) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoff     = backoff;
    }

    public int maxAttempts() { return maxAttempts; }

    public <T> T call(String operation, Supplier<T> action) {
        StoreUnavailableException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (StoreUnavailableException e) {
                last = e;
                if (attempt < maxAttempts) {
                    log.warn("{} failed (attempt {}/{}), retrying in {} ms: {}",
                            operation, attempt, maxAttempts, backoff.toMillis(), e.getReason());
                    sleep(operation);
                }
            }
        }
        log.error("{} failed after {} attempts", operation, maxAttempts);
        throw last;
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    private void sleep(String operation) {
        if (backoff.isZero() || backoff.isNegative()) return;
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException(operation, "-", "interrupted while waiting to retry", e);
        }
    }
}
