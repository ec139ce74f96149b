package com.dayloop.timeline.provider;

import com.dayloop.timeline.exception.ProcessingTimeoutException;
import com.dayloop.timeline.exception.ProviderException;
import com.dayloop.timeline.exception.RemoteProcessingFailedException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.IntFunction;

/**
 * Bounded retries with exponential backoff (1x, 2x, 4x ...). Each attempt gets its
 * 1-based number so the audit rows of one logical call can be told apart.
 */
@Slf4j
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;

    public RetryPolicy(int maxAttempts, Duration initialBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
    }

    public <T> T execute(String operation, IntFunction<T> attempt) {
        ProviderException last = null;
        for (int i = 1; i <= maxAttempts; i++) {
            try {
                return attempt.apply(i);
            } catch (ProviderException e) {
                last = e;
                if (!isRetryable(e) || i == maxAttempts) {
                    throw e;
                }
                long delay = initialBackoff.toMillis() * (1L << (i - 1));
                log.warn("{} attempt {}/{} failed: {}; retrying in {} ms", operation, i, maxAttempts, e.getMessage(), delay);
                sleep(operation, delay);
            }
        }
        throw new ProviderException(operation + " failed after " + maxAttempts + " attempts", last);
    }

    static boolean isRetryable(ProviderException e) {
        if (e instanceof ProcessingTimeoutException || e instanceof RemoteProcessingFailedException) {
            return false;
        }
        Integer status = e.getHttpStatus();
        // Client errors other than timeout / rate limit will fail the same way again
        return status == null || status < 400 || status >= 500 || status == 408 || status == 429;
    }

    private static void sleep(String operation, long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(operation + " interrupted during backoff", e);
        }
    }
}
