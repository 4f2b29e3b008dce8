package hipstershop;

import hipstershop.faultsim.NonRetryableException;

/**
 * Stored cart bytes could not be read back. Retrying cannot repair them.
 */
public class CartDataException extends NonRetryableException {

    private final String userId;

    public CartDataException(String userId, Throwable cause) {
        super("Stored cart for user " + userId + " is malformed: " + cause.getMessage(), cause);
        this.userId = userId;
    }

    public CartDataException(String userId, String problem) {
        super("Stored cart for user " + userId + " is malformed: " + problem);
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
