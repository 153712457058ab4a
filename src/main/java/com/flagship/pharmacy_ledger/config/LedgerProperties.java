package com.flagship.pharmacy_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Tunables for the reconciliation engine, bound from the {@code ledger.*} keys.
 */
@Getter
@ConfigurationProperties(prefix = "ledger")
public class LedgerProperties {

    private final Concurrency concurrency = new Concurrency();
    private final Stock stock = new Stock();
    private final Cash cash = new Cash();
    private final Idempotency idempotency = new Idempotency();
    private final Read read = new Read();

    /**
     * Zone used to turn statement/invoice dates into instants.
     */
    @Setter
    private ZoneId businessZone = ZoneId.of("Asia/Kolkata");

    @Getter
    @Setter
    public static class Concurrency {
        /**
         * Attempts per unit of work before giving up with a concurrency timeout.
         */
        private int maxAttempts = 3;

        /**
         * Transaction timeout; bounds how long a unit of work may wait on an entity lock.
         */
        private int lockTimeoutSeconds = 5;

        private long initialBackoffMillis = 50;
        private long maxBackoffMillis = 1000;
        private double backoffFactor = 2.0;
    }

    @Getter
    @Setter
    public static class Stock {
        private int defaultReorderLevel = 50;
        private int expiringWindowDays = 30;
    }

    @Getter
    @Setter
    public static class Cash {
        /**
         * Largest accepted difference between a declared and a computed running balance.
         */
        private BigDecimal balanceTolerance = new BigDecimal("0.01");
    }

    @Getter
    @Setter
    public static class Idempotency {
        private boolean redisEnabled = true;
        private Duration redisTtl = Duration.ofDays(30);
    }

    @Getter
    @Setter
    public static class Read {
        /**
         * Page size used by lazy ledger sequences.
         */
        private int pageSize = 500;
    }
}
