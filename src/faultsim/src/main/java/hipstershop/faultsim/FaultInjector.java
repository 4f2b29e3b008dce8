package hipstershop.faultsim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Random;

/**
 * Decides, per call, whether to synthesize a storage fault and which kind.
 *
 * <p>A hard failure is drawn first with {@link FaultConfig#getFailureRate()};
 * only when that draw misses may the call be declared slow, so one decision
 * never carries both. All draws come from the single {@link Random} handed to
 * the constructor.
 */
public class FaultInjector {

    private static final Logger logger = LoggerFactory.getLogger(FaultInjector.class);

    private final FaultConfig config;
    private final Random random;

    public FaultInjector(FaultConfig config, Random random) {
        this.config = Objects.requireNonNull(config, "config");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Creates an injector whose randomness is seeded from {@link FaultConfig#getSeed()}
     * when one is configured.
     */
    public static FaultInjector create(FaultConfig config) {
        return new FaultInjector(config, Rates.newRandom(config.getSeed()));
    }

    public FaultConfig getConfig() {
        return config;
    }

    public FaultDecision shouldInjectFault(String operationName) {
        if (!config.isEnabled()) {
            return FaultDecision.none();
        }

        if (random.nextDouble() < config.getFailureRate()) {
            FaultKind kind = FaultKind.HARD_FAILURES[random.nextInt(FaultKind.HARD_FAILURES.length)];
            logger.warn("Injecting {} fault into {}", kind, operationName);
            return FaultDecision.failure(kind);
        }

        if (random.nextDouble() < config.getSlowOperationRate()) {
            long delayMs = Rates.uniform(random, config.getSlowDelayMinMs(), config.getSlowDelayMaxMs());
            logger.warn("Simulating slow storage operation for {} ({}ms)", operationName, delayMs);
            return FaultDecision.slowOperation(delayMs);
        }

        return FaultDecision.none();
    }
}
