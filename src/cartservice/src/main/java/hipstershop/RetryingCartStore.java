package hipstershop;

import hipstershop.faultsim.RetryExecutor;
import hipstershop.faultsim.RetryPolicy;
import hipstershop.model.Cart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Cart store whose every operation is a read/modify/write against a {@link CartCache},
 * run through a {@link RetryExecutor}.
 *
 * <p>Concurrent {@code addItem} calls for the same user race; the last write wins.
 * An {@link IllegalArgumentException} raised inside an operation is never retried.
 */
public class RetryingCartStore implements CartStore {

    private static final Logger logger = LoggerFactory.getLogger(RetryingCartStore.class);

    static final String ADD_ITEM = "AddItem";
    static final String EMPTY_CART = "EmptyCart";
    static final String GET_CART = "GetCart";

    private final CartCache cache;
    private final CartCodec codec;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;

    public RetryingCartStore(CartCache cache, CartCodec codec, RetryExecutor retryExecutor, RetryPolicy retryPolicy) {
        this.cache = cache;
        this.codec = codec;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy.retryIf(e -> !(e instanceof IllegalArgumentException));
    }

    @Override
    public CompletableFuture<Void> addItem(String userId, String productId, int quantity) {
        requireKey("userId", userId);
        requireKey("productId", productId);
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive, got " + quantity);
        }
        logger.debug("AddItem called with userId={}, productId={}, quantity={}", userId, productId, quantity);

        return retryExecutor.execute(() -> {
            Cart cart = readCart(userId);
            try {
                cart.addItem(productId, quantity);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("quantity of product " + productId + " in cart of user "
                        + userId + " would exceed " + Integer.MAX_VALUE, e);
            }
            cache.set(userId, codec.encode(cart));
            return null;
        }, ADD_ITEM, retryPolicy);
    }

    @Override
    public CompletableFuture<Void> emptyCart(String userId) {
        requireKey("userId", userId);
        logger.debug("EmptyCart called with userId={}", userId);

        return retryExecutor.execute(() -> {
            cache.set(userId, codec.encode(new Cart(userId)));
            return null;
        }, EMPTY_CART, retryPolicy);
    }

    @Override
    public CompletableFuture<Cart> getCart(String userId) {
        requireKey("userId", userId);
        logger.debug("GetCart called with userId={}", userId);

        return retryExecutor.execute(() -> readCart(userId), GET_CART, retryPolicy);
    }

    @Override
    public boolean ping() {
        return cache.ping();
    }

    private Cart readCart(String userId) throws Exception {
        byte[] data = cache.get(userId);
        if (data == null) {
            return new Cart(userId);
        }
        return codec.decode(userId, data);
    }

    private static void requireKey(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }
}
