package hipstershop;

import hipstershop.faultsim.Cancellation;
import hipstershop.faultsim.DelayInjector;
import hipstershop.model.ChargeRequest;
import hipstershop.model.ChargeResponse;
import hipstershop.model.CreditCardInfo;
import hipstershop.model.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.YearMonth;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Verifies the credit card and (pretend) charges it. Each charge first passes
 * through the {@link DelayInjector}, which may slow it down or time it out.
 */
@Service
public class PaymentService {

    private static final Logger logger = LoggerFactory.getLogger(PaymentService.class);
    static final String CHARGE = "Charge";

    private final DelayInjector delayInjector;
    private final Clock clock;

    public PaymentService(DelayInjector delayInjector, Clock clock) {
        this.delayInjector = delayInjector;
        this.clock = clock;
    }

    /**
     * @return a future with the transaction id, failing with {@link CreditCardException}
     *         for rejected cards or {@link hipstershop.faultsim.GatewayTimeoutException}
     *         when the simulated gateway times out. Cancelling it cancels a pending delay.
     */
    public CompletableFuture<ChargeResponse> charge(ChargeRequest request) {
        CompletableFuture<Void> delay = delayInjector.maybeDelay(CHARGE);
        return Cancellation.propagate(delay, delay.thenApply(ignored -> process(request)));
    }

    ChargeResponse process(ChargeRequest request) {
        Money amount = request.getAmount();
        CreditCardInfo card = request.getCreditCard();
        if (amount == null || card == null || card.getCreditCardNumber() == null) {
            throw new InvalidCreditCardException();
        }
        String cardNumber = card.getCreditCardNumber().replace("-", "").replace(" ", "");

        if (cardNumber.length() < 12 || cardNumber.length() > 19
                || !cardNumber.matches("\\d+") || !passesLuhn(cardNumber)) {
            throw new InvalidCreditCardException();
        }

        String cardType = getCardType(cardNumber);
        if (cardType.equals("unknown")) {
            throw new InvalidCreditCardException();
        }

        // Only VISA and MasterCard accepted
        if (!cardType.equals("visa") && !cardType.equals("mastercard")) {
            throw new UnacceptedCreditCardException(cardType);
        }

        String lastFour = cardNumber.substring(cardNumber.length() - 4);
        int expMonth = card.getCreditCardExpirationMonth();
        int expYear = card.getCreditCardExpirationYear();
        YearMonth expiry;
        try {
            expiry = YearMonth.of(expYear, expMonth);
        } catch (DateTimeException e) {
            throw new InvalidCreditCardException();
        }
        if (YearMonth.now(clock).isAfter(expiry)) {
            throw new ExpiredCreditCardException(lastFour, expMonth, expYear);
        }

        String transactionId = UUID.randomUUID().toString();
        logger.info("Transaction processed: {} ending {} Amount: {}", cardType, lastFour, amount);
        return new ChargeResponse(transactionId);
    }

    static boolean passesLuhn(String number) {
        int sum = 0;
        boolean doubleDigit = false;
        for (int i = number.length() - 1; i >= 0; i--) {
            int digit = number.charAt(i) - '0';
            if (doubleDigit) {
                digit *= 2;
                if (digit > 9) {
                    digit -= 9;
                }
            }
            sum += digit;
            doubleDigit = !doubleDigit;
        }
        return sum % 10 == 0;
    }

    static String getCardType(String number) {
        if (number.startsWith("4")) {
            return "visa";
        }
        int prefix = Integer.parseInt(number.substring(0, 2));
        if (prefix >= 51 && prefix <= 55) {
            return "mastercard";
        }
        int prefix4 = Integer.parseInt(number.substring(0, 4));
        if (prefix4 >= 2221 && prefix4 <= 2720) {
            return "mastercard";
        }
        if (number.startsWith("34") || number.startsWith("37")) {
            return "amex";
        }
        if (number.startsWith("6011") || number.startsWith("65")) {
            return "discover";
        }
        return "unknown";
    }
}
