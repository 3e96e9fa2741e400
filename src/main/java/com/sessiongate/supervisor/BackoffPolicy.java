package com.sessiongate.supervisor;

/**
 * Strategy for the delay before a retry.
 *
 * @see ExponentialBackoffPolicy
 */
public interface BackoffPolicy {

    /**
     * @param attempt the attempt about to be made (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempt);
}
