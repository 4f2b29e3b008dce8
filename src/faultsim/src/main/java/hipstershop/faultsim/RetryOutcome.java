package hipstershop.faultsim;

/**
 * Attempts made and the last error seen by one exhausted call.
 */
public final class RetryOutcome {

    private final int attempts;
    private final Throwable lastError;

    public RetryOutcome(int attempts, Throwable lastError) {
        this.attempts = attempts;
        this.lastError = lastError;
    }

    public int getAttempts() { return attempts; }
    public Throwable getLastError() { return lastError; }

    public String getLastErrorMessage() {
        if (lastError == null) {
            return "unknown";
        }
        return lastError.getMessage() != null ? lastError.getMessage() : lastError.getClass().getName();
    }

    @Override
    public String toString() {
        return "RetryOutcome{attempts=" + attempts + ", lastError=" + getLastErrorMessage() + "}";
    }
}
