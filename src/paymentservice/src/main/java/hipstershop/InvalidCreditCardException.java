package hipstershop;

public class InvalidCreditCardException extends CreditCardException {

    public InvalidCreditCardException() {
        super("Credit card info is invalid");
    }
}
