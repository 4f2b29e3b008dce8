package hipstershop;

import com.fasterxml.jackson.databind.ObjectMapper;
import hipstershop.faultsim.FaultConfig;
import hipstershop.faultsim.FaultInjector;
import hipstershop.faultsim.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class CartConfig {

    private static final Logger logger = LoggerFactory.getLogger(CartConfig.class);

    @Value("${redis.addr:}")
    private String redisAddr;

    @Value("${cart.storage.threads:8}")
    private int storageThreads;

    @Value("${fault.enabled:false}")
    private boolean faultEnabled;

    @Value("${fault.failure-rate:0.3}")
    private double failureRate;

    @Value("${fault.max-retries:3}")
    private int maxRetries;

    @Value("${fault.base-retry-delay-ms:100}")
    private long baseRetryDelayMs;

    @Value("${fault.slow-operation-rate:0.1}")
    private double slowOperationRate;

    @Value("${fault.random-seed:}")
    private Long randomSeed;

    @Bean
    public FaultConfig faultConfig() {
        FaultConfig config = FaultConfig.builder()
                .enabled(faultEnabled)
                .failureRate(failureRate)
                .maxRetries(maxRetries)
                .baseDelayMs(baseRetryDelayMs)
                .slowOperationRate(slowOperationRate)
                .seed(randomSeed)
                .build();
        logger.info("Cart storage fault simulation: {}", config);
        return config;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService retryScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "cart-retry-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService cartStorageExecutor() {
        return Executors.newFixedThreadPool(storageThreads);
    }

    @Bean
    public RetryExecutor retryExecutor(FaultConfig faultConfig,
                                       ExecutorService cartStorageExecutor,
                                       ScheduledExecutorService retryScheduler) {
        return new RetryExecutor(FaultInjector.create(faultConfig), cartStorageExecutor, retryScheduler);
    }

    @Bean
    public CartCache cartCache() {
        if (redisAddr != null && !redisAddr.isEmpty()) {
            return new RedisCartCache(redisAddr, storageThreads + 2);
        }
        logger.info("No redis.addr configured, using in-memory cart cache");
        return new InMemoryCartCache();
    }

    @Bean
    public CartStore cartStore(CartCache cartCache, ObjectMapper objectMapper,
                               RetryExecutor retryExecutor, FaultConfig faultConfig) {
        return new RetryingCartStore(cartCache, new CartCodec(objectMapper), retryExecutor, faultConfig.retryPolicy());
    }
}
