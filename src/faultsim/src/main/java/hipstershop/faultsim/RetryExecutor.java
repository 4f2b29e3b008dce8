package hipstershop.faultsim;

import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a unit of work with fault injection on the first attempt and
 * exponential-backoff retries afterwards, driven by a Resilience4j {@link Retry}.
 *
 * <p>Attempts run on the worker executor. Backoff and slow-operation waits are
 * scheduled on the scheduler, so a waiting call holds no thread. Attempts of
 * one call are strictly sequential. Completing the returned future from
 * outside, by {@code cancel} or {@code orTimeout} for example, drops a pending
 * slow-operation wait and stops further attempts.
 */
public class RetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    private final FaultInjector faultInjector;
    private final Executor workerExecutor;
    private final ScheduledExecutorService scheduler;

    public RetryExecutor(FaultInjector faultInjector, Executor workerExecutor, ScheduledExecutorService scheduler) {
        this.faultInjector = Objects.requireNonNull(faultInjector, "faultInjector");
        this.workerExecutor = Objects.requireNonNull(workerExecutor, "workerExecutor");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    public <T> CompletableFuture<T> execute(Callable<T> work, String operationName, int maxRetries, long baseDelayMs) {
        return execute(work, operationName, RetryPolicy.of(maxRetries, baseDelayMs));
    }

    /**
     * Executes {@code work} under {@code policy}.
     *
     * @return a future completing with the work's result, with the original error if
     *         the policy deems it non-retryable, or with {@link StorageUnavailableException}
     *         once the retries are used up
     */
    public <T> CompletableFuture<T> execute(Callable<T> work, String operationName, RetryPolicy policy) {
        Objects.requireNonNull(work, "work");
        Objects.requireNonNull(operationName, "operationName");
        Objects.requireNonNull(policy, "policy");

        RetryingCall<T> call = new RetryingCall<>(work, operationName, policy);
        call.start();
        return call.result;
    }

    private static String messageOf(Throwable error) {
        return error == null ? "" : error.getMessage();
    }

    private final class RetryingCall<T> {

        private final Callable<T> work;
        private final String operationName;
        private final RetryPolicy policy;
        private final CompletableFuture<T> result = new CompletableFuture<>();

        private final AtomicInteger attempts = new AtomicInteger();
        private volatile Future<?> slowWait;

        RetryingCall(Callable<T> work, String operationName, RetryPolicy policy) {
            this.work = work;
            this.operationName = operationName;
            this.policy = policy;
            result.whenComplete((value, error) -> {
                Future<?> wait = slowWait;
                if (wait != null) {
                    wait.cancel(false);
                }
                if (result.isCancelled()) {
                    logger.info("Storage operation {} cancelled after {} attempts", operationName, attempts.get());
                }
            });
        }

        void start() {
            Retry retry = Retry.of(operationName, policy.toRetryConfig(this::mayRetry));
            retry.getEventPublisher()
                    .onRetry(event -> logger.warn("Storage operation {} failed (attempt {}), retrying in {}ms: {}",
                            event.getName(), event.getNumberOfRetryAttempts(),
                            event.getWaitInterval().toMillis(), messageOf(event.getLastThrowable())))
                    .onError(event -> logger.error("Storage operation {} failed after {} attempts: {}",
                            event.getName(), event.getNumberOfRetryAttempts(), messageOf(event.getLastThrowable())))
                    .onIgnoredError(event -> {
                        if (!result.isDone() && !(event.getLastThrowable() instanceof RejectedExecutionException)) {
                            logger.error("Storage operation {} failed with a non-retryable error: {}",
                                    event.getName(), messageOf(event.getLastThrowable()));
                        }
                    });

            retry.executeCompletionStage(scheduler, this::nextAttempt)
                    .whenComplete(this::finish);
        }

        // a cancelled call, or a worker pool that refuses work, ends the retry loop
        private boolean mayRetry(Throwable error) {
            return !result.isDone() && !(error instanceof RejectedExecutionException);
        }

        private CompletionStage<T> nextAttempt() {
            CompletableFuture<T> attempt = new CompletableFuture<>();
            if (result.isDone()) {
                attempt.completeExceptionally(new CancellationException(operationName + " already completed"));
                return attempt;
            }
            int number = attempts.incrementAndGet();
            if (number == 1) {
                FaultDecision decision = faultInjector.shouldInjectFault(operationName);
                if (decision.isHardFailure()) {
                    attempt.completeExceptionally(decision.getKind().newException(operationName));
                    return attempt;
                }
                if (decision.isSlowOperation()) {
                    waitThen(decision.getDelayMs(), attempt);
                    return attempt;
                }
            }
            dispatch(attempt, number);
            return attempt;
        }

        private void waitThen(long delayMs, CompletableFuture<T> attempt) {
            try {
                slowWait = scheduler.schedule(() -> dispatch(attempt, 1), delayMs, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                logger.error("Could not schedule slow storage operation {}", operationName, e);
                attempt.completeExceptionally(e);
                return;
            }
            // completed while scheduling; the whenComplete hook may have missed this wait
            if (result.isDone()) {
                slowWait.cancel(false);
            }
        }

        private void dispatch(CompletableFuture<T> attempt, int number) {
            try {
                workerExecutor.execute(() -> runAttempt(attempt, number));
            } catch (RejectedExecutionException e) {
                logger.error("Storage operation {} rejected by worker pool", operationName, e);
                attempt.completeExceptionally(e);
            }
        }

        private void runAttempt(CompletableFuture<T> attempt, int number) {
            if (result.isDone()) {
                attempt.completeExceptionally(new CancellationException(operationName + " already completed"));
                return;
            }
            if (number == 1) {
                logger.debug("Running storage operation {} (attempt 1)", operationName);
            } else {
                logger.info("Retrying storage operation {} (attempt {})", operationName, number);
            }
            try {
                attempt.complete(work.call());
            } catch (Exception e) {
                attempt.completeExceptionally(e);
            }
        }

        private void finish(T value, Throwable error) {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (mayRetry(cause) && policy.isRetryable(cause)) {
                RetryOutcome outcome = new RetryOutcome(attempts.get(), cause);
                result.completeExceptionally(new StorageUnavailableException(operationName, outcome));
            } else {
                result.completeExceptionally(cause);
            }
        }
    }
}
