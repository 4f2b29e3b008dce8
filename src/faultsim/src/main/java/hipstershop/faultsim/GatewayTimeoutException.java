package hipstershop.faultsim;

/**
 * Thrown by {@link DelayInjector} when a delayed single-shot call ends in a timeout.
 */
public class GatewayTimeoutException extends UnavailableException {

    private final long delayMs;

    public GatewayTimeoutException(String operationName, long delayMs) {
        super(operationName, "Gateway timeout during " + operationName + " after " + delayMs + "ms", null);
        this.delayMs = delayMs;
    }

    public long getDelayMs() {
        return delayMs;
    }
}
