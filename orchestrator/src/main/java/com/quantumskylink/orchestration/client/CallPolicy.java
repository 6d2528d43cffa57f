package com.quantumskylink.orchestration.client;

import java.time.Duration;

/**
 * Timeout and retry settings for one collaborator.
 *
 * @param timeout        per-attempt request deadline
 * @param retries        extra attempts after the first; 0 means fail fast
 * @param initialBackoff wait before the first retry, doubled on each further retry
 */
public record CallPolicy(Duration timeout, int retries, Duration initialBackoff) {

    public CallPolicy {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be >= 0");
        }
    }
}
