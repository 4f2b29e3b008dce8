package hipstershop.model;

import java.util.ArrayList;
import java.util.List;

public class Cart {
    private String userId;
    private List<CartItem> items = new ArrayList<>();

    public Cart() {}

    public Cart(String userId) {
        this.userId = userId;
    }

    public Cart(String userId, List<CartItem> items) {
        this.userId = userId;
        this.items = items != null ? items : new ArrayList<>();
    }

    /**
     * Adds {@code quantity} of a product, summing into the existing line when the
     * product is already in the cart so that each product appears at most once.
     *
     * @throws ArithmeticException if the summed quantity overflows an {@code int}
     */
    public void addItem(String productId, int quantity) {
        for (CartItem item : items) {
            if (item.getProductId().equals(productId)) {
                item.setQuantity(Math.addExact(item.getQuantity(), quantity));
                return;
            }
        }
        items.add(new CartItem(productId, quantity));
    }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }
    public List<CartItem> getItems() { return items; }
    public void setItems(List<CartItem> items) { this.items = items != null ? items : new ArrayList<>(); }
}
