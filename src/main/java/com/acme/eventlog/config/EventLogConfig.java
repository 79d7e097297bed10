package com.acme.eventlog.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import java.time.Duration;

/**
 * Polling, batching and backoff settings.
 */
@ConfigurationProperties("eventlog")
public class EventLogConfig {

    private int batchSize = 1000;
    private Duration tickInterval = Duration.ofSeconds(1);
    private int backoffTableLength = 10;
    private Duration backoffBase = Duration.ofSeconds(1);
    private Claim claim = new Claim();

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public int getBackoffTableLength() {
        return backoffTableLength;
    }

    public void setBackoffTableLength(int backoffTableLength) {
        this.backoffTableLength = backoffTableLength;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public void setBackoffBase(Duration backoffBase) {
        this.backoffBase = backoffBase;
    }

    public Claim getClaim() {
        return claim;
    }

    public void setClaim(Claim claim) {
        this.claim = claim;
    }

    @ConfigurationProperties("claim")
    public static class Claim {
        private boolean enabled = false;
        private int sweepLimit = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        /**
         * Maximum events a single sweep tick claims.
         */
        public int getSweepLimit() {
            return sweepLimit;
        }

        public void setSweepLimit(int sweepLimit) {
            this.sweepLimit = sweepLimit;
        }
    }
}
