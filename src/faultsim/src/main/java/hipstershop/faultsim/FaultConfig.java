package hipstershop.faultsim;

import java.util.OptionalLong;

/**
 * Process-wide settings for storage fault simulation and retry.
 * Read once at startup; a new process is needed to pick up new values.
 */
public final class FaultConfig {

    public static final double DEFAULT_FAILURE_RATE = 0.3;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_BASE_DELAY_MS = 100;
    public static final double DEFAULT_SLOW_OPERATION_RATE = 0.1;
    public static final long DEFAULT_SLOW_DELAY_MIN_MS = 1000;
    public static final long DEFAULT_SLOW_DELAY_MAX_MS = 3000;

    private final boolean enabled;
    private final double failureRate;
    private final int maxRetries;
    private final long baseDelayMs;
    private final double slowOperationRate;
    private final long slowDelayMinMs;
    private final long slowDelayMaxMs;
    private final Long seed;

    private FaultConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.failureRate = Rates.checkProbability("failureRate", builder.failureRate);
        if (builder.maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + builder.maxRetries);
        }
        this.maxRetries = builder.maxRetries;
        this.baseDelayMs = Rates.checkDelay("baseDelayMs", builder.baseDelayMs);
        this.slowOperationRate = Rates.checkProbability("slowOperationRate", builder.slowOperationRate);
        this.slowDelayMinMs = Rates.checkDelay("slowDelayMinMs", builder.slowDelayMinMs);
        this.slowDelayMaxMs = Rates.checkDelay("slowDelayMaxMs", builder.slowDelayMaxMs);
        Rates.checkWindow("slowDelay", slowDelayMinMs, slowDelayMaxMs);
        this.seed = builder.seed;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Injection switched off; retry settings at their defaults. */
    public static FaultConfig disabled() {
        return builder().build();
    }

    public boolean isEnabled() { return enabled; }
    public double getFailureRate() { return failureRate; }
    public int getMaxRetries() { return maxRetries; }
    public long getBaseDelayMs() { return baseDelayMs; }
    public double getSlowOperationRate() { return slowOperationRate; }
    public long getSlowDelayMinMs() { return slowDelayMinMs; }
    public long getSlowDelayMaxMs() { return slowDelayMaxMs; }

    public OptionalLong getSeed() {
        return seed != null ? OptionalLong.of(seed) : OptionalLong.empty();
    }

    public RetryPolicy retryPolicy() {
        return RetryPolicy.of(maxRetries, baseDelayMs);
    }

    @Override
    public String toString() {
        return "FaultConfig{enabled=" + enabled +
                ", failureRate=" + failureRate +
                ", maxRetries=" + maxRetries +
                ", baseDelayMs=" + baseDelayMs +
                ", slowOperationRate=" + slowOperationRate +
                ", slowDelay=[" + slowDelayMinMs + ", " + slowDelayMaxMs + ")" +
                ", seed=" + (seed != null ? seed : "random") + "}";
    }

    public static final class Builder {
        private boolean enabled;
        private double failureRate = DEFAULT_FAILURE_RATE;
        private int maxRetries = DEFAULT_MAX_RETRIES;
        private long baseDelayMs = DEFAULT_BASE_DELAY_MS;
        private double slowOperationRate = DEFAULT_SLOW_OPERATION_RATE;
        private long slowDelayMinMs = DEFAULT_SLOW_DELAY_MIN_MS;
        private long slowDelayMaxMs = DEFAULT_SLOW_DELAY_MAX_MS;
        private Long seed;

        private Builder() {}

        public Builder enabled(boolean enabled) { this.enabled = enabled; return this; }
        public Builder failureRate(double failureRate) { this.failureRate = failureRate; return this; }
        public Builder maxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
        public Builder baseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; return this; }
        public Builder slowOperationRate(double slowOperationRate) { this.slowOperationRate = slowOperationRate; return this; }

        public Builder slowDelay(long minMs, long maxMs) {
            this.slowDelayMinMs = minMs;
            this.slowDelayMaxMs = maxMs;
            return this;
        }

        public Builder seed(Long seed) { this.seed = seed; return this; }

        public FaultConfig build() {
            return new FaultConfig(this);
        }
    }
}
