package hipstershop.faultsim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Delays and sometimes fails a single remote call, without any retry.
 *
 * <p>Whether to delay and whether a delayed call then times out are drawn
 * independently; a call that is not delayed never times out.
 */
public class DelayInjector {

    private static final Logger logger = LoggerFactory.getLogger(DelayInjector.class);

    private final DelayConfig config;
    private final Random random;
    private final ScheduledExecutorService scheduler;

    public DelayInjector(DelayConfig config, Random random, ScheduledExecutorService scheduler) {
        this.config = Objects.requireNonNull(config, "config");
        this.random = Objects.requireNonNull(random, "random");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    public static DelayInjector create(DelayConfig config, ScheduledExecutorService scheduler) {
        return new DelayInjector(config, Rates.newRandom(config.getSeed()), scheduler);
    }

    public DelayConfig getConfig() {
        return config;
    }

    /**
     * @return a future that completes normally, immediately or after the simulated
     *         delay, or exceptionally with {@link GatewayTimeoutException}
     */
    public CompletableFuture<Void> maybeDelay(String operationName) {
        if (!config.isEnabled() || random.nextDouble() >= config.getDelayProbability()) {
            return CompletableFuture.completedFuture(null);
        }

        long delayMs = Rates.uniform(random, config.getMinDelayMs(), config.getMaxDelayMs());
        logger.warn("Simulating {} processing delay: {}ms", operationName, delayMs);

        CompletableFuture<Void> result = new CompletableFuture<>();
        ScheduledFuture<?> timer = scheduler.schedule(() -> {
            if (random.nextDouble() < config.getTimeoutRate()) {
                logger.error("{} processing timeout after {}ms", operationName, delayMs);
                result.completeExceptionally(new GatewayTimeoutException(operationName, delayMs));
            } else {
                logger.info("{} delay simulation completed after {}ms", operationName, delayMs);
                result.complete(null);
            }
        }, delayMs, TimeUnit.MILLISECONDS);
        result.whenComplete((ignored, error) -> timer.cancel(false));
        return result;
    }
}
