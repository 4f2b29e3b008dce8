package hipstershop;

public class ExpiredCreditCardException extends CreditCardException {

    public ExpiredCreditCardException(String lastFour, int month, int year) {
        super("Your credit card (ending " + lastFour + ") expired on " + month + "/" + year);
    }
}
