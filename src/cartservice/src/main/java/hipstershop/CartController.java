package hipstershop;

import hipstershop.faultsim.Cancellation;
import hipstershop.model.Cart;
import hipstershop.model.CartItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

@RestController
@RequestMapping("/api/cart")
public class CartController {

    private static final Logger logger = LoggerFactory.getLogger(CartController.class);
    private final CartStore store;
    private final long requestTimeoutMs;

    public CartController(CartStore store, @Value("${cart.request-timeout-ms:25000}") long requestTimeoutMs) {
        this.store = store;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    @PostMapping("/{userId}/items")
    public CompletableFuture<ResponseEntity<Void>> addItem(@PathVariable String userId, @RequestBody CartItem item) {
        logger.debug("AddItem userId={} productId={} quantity={}", userId, item.getProductId(), item.getQuantity());
        return respond(store.addItem(userId, item.getProductId(), item.getQuantity()),
                ignored -> ResponseEntity.ok().<Void>build());
    }

    @GetMapping("/{userId}")
    public CompletableFuture<ResponseEntity<Cart>> getCart(@PathVariable String userId) {
        logger.debug("GetCart userId={}", userId);
        return respond(store.getCart(userId), ResponseEntity::ok);
    }

    @DeleteMapping("/{userId}")
    public CompletableFuture<ResponseEntity<Void>> emptyCart(@PathVariable String userId) {
        logger.debug("EmptyCart userId={}", userId);
        return respond(store.emptyCart(userId), ignored -> ResponseEntity.ok().<Void>build());
    }

    @GetMapping("/_healthz")
    public ResponseEntity<String> health() {
        if (store.ping()) {
            return ResponseEntity.ok("ok");
        }
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body("cart storage unreachable");
    }

    // a dropped or overdue request cancels the store call and its pending retries
    private <T, R> CompletableFuture<R> respond(CompletableFuture<T> call, Function<T, R> toResponse) {
        return Cancellation.propagate(call,
                call.thenApply(toResponse).orTimeout(requestTimeoutMs, TimeUnit.MILLISECONDS));
    }
}
