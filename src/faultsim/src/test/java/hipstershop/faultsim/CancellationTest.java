package hipstershop.faultsim;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Cancellation")
class CancellationTest {

    @Test
    @DisplayName("should_cancel_source_when_derived_future_is_cancelled")
    void should_cancel_source_when_derived_future_is_cancelled() {
        // Given
        CompletableFuture<String> source = new CompletableFuture<>();
        CompletableFuture<Integer> derived = Cancellation.propagate(source, source.thenApply(String::length));

        // When
        derived.cancel(true);

        // Then
        assertThat(source).isCancelled();
    }

    @Test
    @DisplayName("should_cancel_source_when_derived_future_times_out")
    void should_cancel_source_when_derived_future_times_out() {
        // Given
        CompletableFuture<String> source = new CompletableFuture<>();
        CompletableFuture<Integer> derived = Cancellation.propagate(source,
                source.thenApply(String::length).orTimeout(10, TimeUnit.MILLISECONDS));

        // When
        derived.handle((value, error) -> null).join();

        // Then
        assertThat(source).isCancelled();
    }

    @Test
    @DisplayName("should_leave_source_alone_when_it_completes_normally")
    void should_leave_source_alone_when_it_completes_normally() {
        // Given
        CompletableFuture<String> source = new CompletableFuture<>();
        CompletableFuture<Integer> derived = Cancellation.propagate(source, source.thenApply(String::length));

        // When
        source.complete("cart");

        // Then
        assertThat(derived).isCompletedWithValue(4);
        assertThat(source).isCompletedWithValue("cart").isNotCancelled();
    }
}
