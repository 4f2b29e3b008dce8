package hipstershop.faultsim;

/**
 * Thrown when a storage operation still fails after every permitted retry.
 */
public class StorageUnavailableException extends UnavailableException {

    private final int attempts;
    private final String lastErrorMessage;

    public StorageUnavailableException(String operationName, RetryOutcome outcome) {
        super(operationName,
                "Can't access storage during " + operationName + " after " + outcome.getAttempts()
                        + " attempts. Last error: " + outcome.getLastErrorMessage(),
                outcome.getLastError());
        this.attempts = outcome.getAttempts();
        this.lastErrorMessage = outcome.getLastErrorMessage();
    }

    public int getAttempts() {
        return attempts;
    }

    public String getLastErrorMessage() {
        return lastErrorMessage;
    }
}
