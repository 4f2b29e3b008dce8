package hipstershop.faultsim;

/**
 * Base class for failures that retrying cannot fix, such as corrupt stored data.
 * The default {@link RetryPolicy} surfaces these immediately.
 */
public class NonRetryableException extends RuntimeException {

    public NonRetryableException(String message) {
        super(message);
    }

    public NonRetryableException(String message, Throwable cause) {
        super(message, cause);
    }
}
