package hipstershop.faultsim;

import java.util.concurrent.CompletableFuture;

/**
 * Carries cancellation back from a derived future to the future it was built from.
 *
 * <p>{@code thenApply} and friends complete their result when the source completes,
 * but cancelling or timing out the result leaves the source running. Callers that
 * hand a derived future to the web layer link the two so that a dropped request
 * also stops the retries or the delay timer underneath.
 */
public final class Cancellation {

    private Cancellation() {
    }

    /**
     * Cancels {@code source} if {@code derived} completes first, for example through
     * {@code cancel} or {@code orTimeout}.
     *
     * @return {@code derived}
     */
    public static <T> CompletableFuture<T> propagate(CompletableFuture<?> source, CompletableFuture<T> derived) {
        derived.whenComplete((value, error) -> {
            if (!source.isDone()) {
                source.cancel(true);
            }
        });
        return derived;
    }
}
