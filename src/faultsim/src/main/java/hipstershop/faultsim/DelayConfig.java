package hipstershop.faultsim;

import java.util.OptionalLong;

/**
 * Settings for {@link DelayInjector}.
 */
public final class DelayConfig {

    public static final double DEFAULT_DELAY_PROBABILITY = 0.3;
    public static final long DEFAULT_MIN_DELAY_MS = 2000;
    public static final long DEFAULT_MAX_DELAY_MS = 8000;
    public static final double DEFAULT_TIMEOUT_RATE = 0.1;

    private final boolean enabled;
    private final double delayProbability;
    private final long minDelayMs;
    private final long maxDelayMs;
    private final double timeoutRate;
    private final Long seed;

    private DelayConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.delayProbability = Rates.checkProbability("delayProbability", builder.delayProbability);
        this.minDelayMs = Rates.checkDelay("minDelayMs", builder.minDelayMs);
        this.maxDelayMs = Rates.checkDelay("maxDelayMs", builder.maxDelayMs);
        Rates.checkWindow("delay", minDelayMs, maxDelayMs);
        this.timeoutRate = Rates.checkProbability("timeoutRate", builder.timeoutRate);
        this.seed = builder.seed;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEnabled() { return enabled; }
    public double getDelayProbability() { return delayProbability; }
    public long getMinDelayMs() { return minDelayMs; }
    public long getMaxDelayMs() { return maxDelayMs; }
    public double getTimeoutRate() { return timeoutRate; }

    public OptionalLong getSeed() {
        return seed != null ? OptionalLong.of(seed) : OptionalLong.empty();
    }

    @Override
    public String toString() {
        return "DelayConfig{enabled=" + enabled +
                ", delayProbability=" + delayProbability +
                ", delay=[" + minDelayMs + ", " + maxDelayMs + ")" +
                ", timeoutRate=" + timeoutRate +
                ", seed=" + (seed != null ? seed : "random") + "}";
    }

    public static final class Builder {
        private boolean enabled;
        private double delayProbability = DEFAULT_DELAY_PROBABILITY;
        private long minDelayMs = DEFAULT_MIN_DELAY_MS;
        private long maxDelayMs = DEFAULT_MAX_DELAY_MS;
        private double timeoutRate = DEFAULT_TIMEOUT_RATE;
        private Long seed;

        private Builder() {}

        public Builder enabled(boolean enabled) { this.enabled = enabled; return this; }
        public Builder delayProbability(double delayProbability) { this.delayProbability = delayProbability; return this; }

        public Builder delay(long minMs, long maxMs) {
            this.minDelayMs = minMs;
            this.maxDelayMs = maxMs;
            return this;
        }

        public Builder timeoutRate(double timeoutRate) { this.timeoutRate = timeoutRate; return this; }
        public Builder seed(Long seed) { this.seed = seed; return this; }

        public DelayConfig build() {
            return new DelayConfig(this);
        }
    }
}
