package com.flagship.pharmacy_ledger.ledger;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff between lock retries, with jitter so contending writers spread out.
 */
public class ExponentialBackoff {

    private final long initialBackoffMillis;
    private final long maxBackoffMillis;
    private final double backoffFactor;

    public ExponentialBackoff(long initialBackoffMillis, long maxBackoffMillis, double backoffFactor) {
        if (initialBackoffMillis <= 0 || maxBackoffMillis < initialBackoffMillis || backoffFactor < 1.0) {
            throw new IllegalArgumentException("Invalid backoff settings");
        }
        this.initialBackoffMillis = initialBackoffMillis;
        this.maxBackoffMillis = maxBackoffMillis;
        this.backoffFactor = backoffFactor;
    }

    public long calculateBackoffMillis(int attempt) {
        if (attempt <= 0) {
            throw new IllegalArgumentException("Attempt number must be positive.");
        }

        long calculated = (long) (initialBackoffMillis * Math.pow(backoffFactor, attempt - 1));
        long effective = Math.min(calculated, maxBackoffMillis);

        // [0.5, 1.5)
        double jitter = 0.5 + ThreadLocalRandom.current().nextDouble();
        return (long) (effective * jitter);
    }
}
