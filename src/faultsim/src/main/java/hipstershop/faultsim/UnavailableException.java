package hipstershop.faultsim;

/**
 * Canonical failure surfaced once local recovery is over. Callers may retry
 * the whole request later; this layer will not.
 */
public abstract class UnavailableException extends RuntimeException {

    private final String operationName;

    protected UnavailableException(String operationName, String message, Throwable cause) {
        super(message, cause);
        this.operationName = operationName;
    }

    public String getOperationName() {
        return operationName;
    }
}
