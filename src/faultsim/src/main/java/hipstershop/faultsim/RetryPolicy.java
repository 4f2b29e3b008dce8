package hipstershop.faultsim;

import io.github.resilience4j.retry.RetryConfig;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Per-call-site retry parameters handed to {@link RetryExecutor}, which runs
 * them as a Resilience4j {@link RetryConfig}.
 */
public final class RetryPolicy {

    private static final Predicate<Throwable> RETRY_TRANSIENT = e -> !(e instanceof NonRetryableException);

    private final int maxRetries;
    private final long baseDelayMs;
    private final Predicate<Throwable> retryable;

    private RetryPolicy(int maxRetries, long baseDelayMs, Predicate<Throwable> retryable) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        this.maxRetries = maxRetries;
        this.baseDelayMs = Rates.checkDelay("baseDelayMs", baseDelayMs);
        this.retryable = Objects.requireNonNull(retryable, "retryable");
    }

    /** Retries everything except {@link NonRetryableException}. */
    public static RetryPolicy of(int maxRetries, long baseDelayMs) {
        return new RetryPolicy(maxRetries, baseDelayMs, RETRY_TRANSIENT);
    }

    /** Narrows the default predicate: an error is retried only if both agree. */
    public RetryPolicy retryIf(Predicate<Throwable> predicate) {
        return new RetryPolicy(maxRetries, baseDelayMs, retryable.and(predicate));
    }

    public int getMaxRetries() { return maxRetries; }
    public long getBaseDelayMs() { return baseDelayMs; }

    public boolean isRetryable(Throwable error) {
        return retryable.test(error);
    }

    /**
     * Delay before retry number {@code attempt} (1-based): {@code baseDelayMs * 2^(attempt-1)},
     * saturating at {@link Long#MAX_VALUE}.
     */
    public long backoffDelayMs(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, got " + attempt);
        }
        if (baseDelayMs == 0) {
            return 0;
        }
        int shift = attempt - 1;
        if (shift >= Long.numberOfLeadingZeros(baseDelayMs) - 1) {
            return Long.MAX_VALUE;
        }
        return baseDelayMs << shift;
    }

    /**
     * Resilience4j configuration for one call: {@code maxRetries + 1} attempts,
     * exponential backoff and this policy's predicate narrowed by {@code callFilter}.
     * The scheduled wait is at least 1 ms because Resilience4j ends the retry on a
     * zero interval.
     */
    RetryConfig toRetryConfig(Predicate<Throwable> callFilter) {
        int maxAttempts = maxRetries == Integer.MAX_VALUE ? Integer.MAX_VALUE : maxRetries + 1;
        return RetryConfig.<Object>custom()
                .maxAttempts(maxAttempts)
                .intervalBiFunction((attempt, outcome) -> Math.max(1L, backoffDelayMs(attempt)))
                .retryOnException(callFilter.and(retryable))
                .build();
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + maxRetries + ", baseDelayMs=" + baseDelayMs + "}";
    }
}
