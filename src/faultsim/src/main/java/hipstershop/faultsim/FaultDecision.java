package hipstershop.faultsim;

import java.util.Objects;

/**
 * Outcome of asking a {@link FaultInjector} about one attempt.
 */
public final class FaultDecision {

    private static final FaultDecision NONE = new FaultDecision(FaultKind.NONE, 0);

    private final FaultKind kind;
    private final long delayMs;

    private FaultDecision(FaultKind kind, long delayMs) {
        this.kind = kind;
        this.delayMs = delayMs;
    }

    public static FaultDecision none() {
        return NONE;
    }

    public static FaultDecision failure(FaultKind kind) {
        if (!kind.isHardFailure()) {
            throw new IllegalArgumentException(kind + " is not a hard failure");
        }
        return new FaultDecision(kind, 0);
    }

    public static FaultDecision slowOperation(long delayMs) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be >= 0, got " + delayMs);
        }
        return new FaultDecision(FaultKind.SLOW_OPERATION, delayMs);
    }

    public FaultKind getKind() { return kind; }

    /** Delay before the real operation runs; zero unless this is a slow-operation decision. */
    public long getDelayMs() { return delayMs; }

    public boolean isNone() {
        return kind == FaultKind.NONE;
    }

    public boolean isHardFailure() {
        return kind.isHardFailure();
    }

    public boolean isSlowOperation() {
        return kind == FaultKind.SLOW_OPERATION;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FaultDecision)) return false;
        FaultDecision that = (FaultDecision) o;
        return delayMs == that.delayMs && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, delayMs);
    }

    @Override
    public String toString() {
        return isSlowOperation() ? kind + "(" + delayMs + "ms)" : kind.toString();
    }
}
