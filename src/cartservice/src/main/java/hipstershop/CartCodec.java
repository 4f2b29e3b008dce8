package hipstershop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import hipstershop.model.Cart;
import hipstershop.model.CartItem;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

/**
 * JSON encoding of carts as stored in the {@link CartCache}.
 */
public class CartCodec {

    private final ObjectMapper mapper;

    public CartCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] encode(Cart cart) throws JsonProcessingException {
        return mapper.writeValueAsBytes(cart);
    }

    /**
     * @throws CartDataException if the bytes are not a cart, or hold an item without a
     *         product id, with a non-positive quantity, or listed twice
     */
    public Cart decode(String userId, byte[] data) {
        Cart cart;
        try {
            cart = mapper.readValue(data, Cart.class);
        } catch (IOException e) {
            throw new CartDataException(userId, e);
        }
        if (cart == null) {
            throw new CartDataException(userId, new IOException("empty payload"));
        }
        checkItems(userId, cart);
        cart.setUserId(userId);
        return cart;
    }

    private static void checkItems(String userId, Cart cart) {
        Set<String> seen = new HashSet<>();
        for (CartItem item : cart.getItems()) {
            if (item == null || item.getProductId() == null || item.getProductId().isBlank()) {
                throw new CartDataException(userId, "item without product id");
            }
            if (item.getQuantity() <= 0) {
                throw new CartDataException(userId,
                        "non-positive quantity " + item.getQuantity() + " for product " + item.getProductId());
            }
            if (!seen.add(item.getProductId())) {
                throw new CartDataException(userId, "product " + item.getProductId() + " listed twice");
            }
        }
    }
}
