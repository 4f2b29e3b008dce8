package hipstershop;

import com.fasterxml.jackson.databind.ObjectMapper;
import hipstershop.faultsim.NonRetryableException;
import hipstershop.model.Cart;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CartCodec")
class CartCodecTest {

    private final CartCodec codec = new CartCodec(new ObjectMapper());

    @Test
    @DisplayName("should_stamp_requested_user_on_decoded_cart")
    void should_stamp_requested_user_on_decoded_cart() {
        byte[] stored = "{\"items\":[{\"productId\":\"9SIQT8TOJO\",\"quantity\":2}]}".getBytes(StandardCharsets.UTF_8);

        Cart cart = codec.decode("user-1", stored);

        assertThat(cart.getUserId()).isEqualTo("user-1");
        assertThat(cart.getItems()).singleElement()
                .satisfies(item -> assertThat(item.getQuantity()).isEqualTo(2));
    }

    @Test
    @DisplayName("should_treat_malformed_and_null_payloads_as_non_retryable")
    void should_treat_malformed_and_null_payloads_as_non_retryable() {
        assertThatThrownBy(() -> codec.decode("user-1", new byte[]{0x08, 0x01, 0x12}))
                .isInstanceOf(CartDataException.class)
                .isInstanceOf(NonRetryableException.class)
                .hasMessageContaining("user-1");
        assertThatThrownBy(() -> codec.decode("user-1", "null".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(CartDataException.class);
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {
            "{\"items\":[{\"quantity\":1}]}",
            "{\"items\":[{\"productId\":\" \",\"quantity\":1}]}",
            "{\"items\":[{\"productId\":\"OLJCESPC7Z\",\"quantity\":0}]}",
            "{\"items\":[{\"productId\":\"OLJCESPC7Z\",\"quantity\":-3}]}",
            "{\"items\":[{\"productId\":\"OLJCESPC7Z\",\"quantity\":1},{\"productId\":\"OLJCESPC7Z\",\"quantity\":2}]}"
    })
    @DisplayName("should_reject_items_that_break_cart_invariants")
    void should_reject_items_that_break_cart_invariants(String stored) {
        assertThatThrownBy(() -> codec.decode("user-1", stored.getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(CartDataException.class)
                .hasMessageContaining("user-1");
    }
}
