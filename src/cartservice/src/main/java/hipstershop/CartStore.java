package hipstershop;

import hipstershop.model.Cart;

import java.util.concurrent.CompletableFuture;

/**
 * Interface for cart storage backends.
 *
 * <p>Futures fail with {@link hipstershop.faultsim.StorageUnavailableException} when the
 * storage stays unreachable, or with {@link CartDataException} when a stored cart is corrupt.
 */
public interface CartStore {
    CompletableFuture<Void> addItem(String userId, String productId, int quantity);
    CompletableFuture<Void> emptyCart(String userId);

    /** A user with no stored cart gets an empty cart, not an error. */
    CompletableFuture<Cart> getCart(String userId);

    boolean ping();
}
