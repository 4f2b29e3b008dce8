package hipstershop;

import hipstershop.faultsim.DelayConfig;
import hipstershop.faultsim.DelayInjector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class PaymentConfig {

    private static final Logger logger = LoggerFactory.getLogger(PaymentConfig.class);

    @Value("${payment.delays.enabled:false}")
    private boolean delaysEnabled;

    @Value("${payment.delays.frequency:0.3}")
    private double delayFrequency;

    @Value("${payment.delays.min-ms:2000}")
    private long minDelayMs;

    @Value("${payment.delays.max-ms:8000}")
    private long maxDelayMs;

    @Value("${payment.delays.timeout-rate:0.1}")
    private double timeoutRate;

    @Value("${payment.delays.random-seed:}")
    private Long randomSeed;

    @Bean
    public DelayConfig paymentDelayConfig() {
        DelayConfig config = DelayConfig.builder()
                .enabled(delaysEnabled)
                .delayProbability(delayFrequency)
                .delay(minDelayMs, maxDelayMs)
                .timeoutRate(timeoutRate)
                .seed(randomSeed)
                .build();
        logger.info("Payment delay simulation: {}", config);
        return config;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService paymentDelayScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "payment-delay-scheduler");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public DelayInjector delayInjector(DelayConfig paymentDelayConfig, ScheduledExecutorService paymentDelayScheduler) {
        return DelayInjector.create(paymentDelayConfig, paymentDelayScheduler);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
