package hipstershop;

import hipstershop.faultsim.Cancellation;
import hipstershop.model.ChargeRequest;
import hipstershop.model.ChargeResponse;
import hipstershop.model.CreditCardInfo;
import hipstershop.model.Money;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/payment")
public class PaymentController {

    private static final Logger logger = LoggerFactory.getLogger(PaymentController.class);
    private final PaymentService paymentService;

    public PaymentController(PaymentService paymentService) {
        this.paymentService = paymentService;
    }

    @PostMapping("/charge")
    public CompletableFuture<ResponseEntity<ChargeResponse>> charge(@RequestBody ChargeRequest request) {
        Money amount = request.getAmount();
        CreditCardInfo card = request.getCreditCard();
        String cardNumber = card != null && card.getCreditCardNumber() != null ? card.getCreditCardNumber() : "";

        logger.info("PaymentService#Charge called: amount={}, card_ending={}",
                amount, cardNumber.length() >= 4 ? cardNumber.substring(cardNumber.length() - 4) : cardNumber);

        CompletableFuture<ChargeResponse> charge = paymentService.charge(request);
        return Cancellation.propagate(charge, charge.thenApply(ResponseEntity::ok));
    }
}
