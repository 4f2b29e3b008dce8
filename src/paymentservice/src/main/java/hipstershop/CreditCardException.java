package hipstershop;

/**
 * Card details rejected by the payment service. Never retried.
 */
public class CreditCardException extends RuntimeException {

    public CreditCardException(String message) {
        super(message);
    }
}
