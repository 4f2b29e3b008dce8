package hipstershop.faultsim;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RetryExecutor")
class RetryExecutorTest {

    private static final Executor DIRECT = Runnable::run;

    private RecordingScheduler scheduler = RecordingScheduler.fast();

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private RetryExecutor executor(FaultConfig config) {
        return new RetryExecutor(FaultInjector.create(config), DIRECT, scheduler);
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    @Nested
    @DisplayName("with fault injection disabled")
    class InjectionDisabled {

        @Test
        @DisplayName("should_succeed_on_first_attempt_without_waiting")
        void should_succeed_on_first_attempt_without_waiting() throws Exception {
            // Given
            AtomicInteger calls = new AtomicInteger();

            // When
            String result = await(executor(FaultConfig.disabled())
                    .execute(() -> "cart-" + calls.incrementAndGet(), "GetCart", 3, 100));

            // Then
            assertThat(result).isEqualTo("cart-1");
            assertThat(calls).hasValue(1);
            assertThat(scheduler.delaysMs()).isEmpty();
        }

        @ParameterizedTest(name = "maxRetries={0}")
        @ValueSource(ints = {0, 1, 2, 3, 5})
        @DisplayName("should_make_exactly_max_retries_plus_one_attempts_when_work_always_fails")
        void should_make_exactly_max_retries_plus_one_attempts_when_work_always_fails(int maxRetries) {
            // Given
            AtomicInteger calls = new AtomicInteger();
            CompletableFuture<String> future = executor(FaultConfig.disabled()).execute(() -> {
                calls.incrementAndGet();
                throw new IOException("READONLY You can't write against a read only replica");
            }, "AddItem", maxRetries, 1);

            // When & Then
            assertThatThrownBy(() -> await(future))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseInstanceOf(StorageUnavailableException.class)
                    .satisfies(ex -> {
                        StorageUnavailableException cause = (StorageUnavailableException) ex.getCause();
                        assertThat(cause.getAttempts()).isEqualTo(maxRetries + 1);
                        assertThat(cause.getOperationName()).isEqualTo("AddItem");
                        assertThat(cause.getLastErrorMessage()).contains("read only replica");
                        assertThat(cause.getCause()).isInstanceOf(IOException.class);
                    });
            assertThat(calls).hasValue(maxRetries + 1);
        }

        @Test
        @DisplayName("should_double_backoff_delay_before_each_retry")
        void should_double_backoff_delay_before_each_retry() {
            // Given
            CompletableFuture<Void> future = executor(FaultConfig.disabled()).execute(() -> {
                throw new IllegalStateException("boom");
            }, "EmptyCart", 4, 100);

            // When
            assertThatThrownBy(() -> await(future)).hasCauseInstanceOf(StorageUnavailableException.class);

            // Then: attempt k waits baseDelay * 2^(k-1)
            assertThat(scheduler.delaysMs()).containsExactly(100L, 200L, 400L, 800L);
        }

        @Test
        @DisplayName("should_recover_after_transient_failures")
        void should_recover_after_transient_failures() throws Exception {
            // Given: two failures, then success
            AtomicInteger calls = new AtomicInteger();
            CompletableFuture<Integer> future = executor(FaultConfig.disabled()).execute(() -> {
                if (calls.incrementAndGet() <= 2) {
                    throw new IOException("Connection refused");
                }
                return calls.get();
            }, "GetCart", 3, 50);

            // When
            Integer result = await(future);

            // Then
            assertThat(result).isEqualTo(3);
            assertThat(scheduler.delaysMs()).containsExactly(50L, 100L);
        }

        @Test
        @DisplayName("should_not_retry_non_retryable_errors")
        void should_not_retry_non_retryable_errors() {
            // Given
            AtomicInteger calls = new AtomicInteger();
            CompletableFuture<Object> future = executor(FaultConfig.disabled()).execute(() -> {
                calls.incrementAndGet();
                throw new NonRetryableException("corrupt payload");
            }, "GetCart", 3, 10);

            // When & Then: original error surfaces, not StorageUnavailable
            assertThatThrownBy(() -> await(future))
                    .isInstanceOf(ExecutionException.class)
                    .hasCauseExactlyInstanceOf(NonRetryableException.class);
            assertThat(calls).hasValue(1);
            assertThat(scheduler.delaysMs()).isEmpty();
        }

        @Test
        @DisplayName("should_honour_a_narrowed_retry_predicate")
        void should_honour_a_narrowed_retry_predicate() {
            // Given
            AtomicInteger calls = new AtomicInteger();
            RetryPolicy policy = RetryPolicy.of(3, 10).retryIf(e -> !(e instanceof IllegalArgumentException));

            // When
            CompletableFuture<Object> future = executor(FaultConfig.disabled()).execute(() -> {
                calls.incrementAndGet();
                throw new IllegalArgumentException("bad key");
            }, "AddItem", policy);

            // Then
            assertThatThrownBy(() -> await(future)).hasCauseInstanceOf(IllegalArgumentException.class);
            assertThat(calls).hasValue(1);
        }
    }

    @Nested
    @DisplayName("with fault injection enabled")
    class InjectionEnabled {

        @Test
        @DisplayName("should_fail_after_one_attempt_with_certain_failure_and_no_retries")
        void should_fail_after_one_attempt_with_certain_failure_and_no_retries() {
            // Given
            FaultConfig config = FaultConfig.builder().enabled(true).failureRate(1.0).maxRetries(0).build();
            AtomicInteger calls = new AtomicInteger();

            // When
            CompletableFuture<String> future = executor(config)
                    .execute(() -> "cart-" + calls.incrementAndGet(), "GetCart", config.retryPolicy());

            // Then: the real operation never ran
            assertThatThrownBy(() -> await(future))
                    .hasCauseInstanceOf(StorageUnavailableException.class)
                    .satisfies(ex -> assertThat(((StorageUnavailableException) ex.getCause()).getAttempts())
                            .isEqualTo(1));
            assertThat(calls).hasValue(0);
        }

        @Test
        @DisplayName("should_run_real_operation_on_retry_after_injected_fault")
        void should_run_real_operation_on_retry_after_injected_fault() throws Exception {
            // Given: injection always fires, but only on the first attempt
            FaultConfig config = FaultConfig.builder().enabled(true).failureRate(1.0).maxRetries(1).baseDelayMs(25).build();
            AtomicInteger calls = new AtomicInteger();

            // When
            String result = await(executor(config)
                    .execute(() -> "cart-" + calls.incrementAndGet(), "AddItem", config.retryPolicy()));

            // Then
            assertThat(result).isEqualTo("cart-1");
            assertThat(calls).hasValue(1);
            assertThat(scheduler.delaysMs()).containsExactly(25L);
        }

        @Test
        @DisplayName("should_wait_then_run_real_operation_for_slow_decision")
        void should_wait_then_run_real_operation_for_slow_decision() throws Exception {
            // Given
            FaultConfig config = FaultConfig.builder()
                    .enabled(true)
                    .failureRate(0.0)
                    .slowOperationRate(1.0)
                    .slowDelay(1500, 1500)
                    .build();

            // When
            String result = await(executor(config).execute(() -> "ok", "GetCart", config.retryPolicy()));

            // Then
            assertThat(result).isEqualTo("ok");
            assertThat(scheduler.delaysMs()).containsExactly(1500L);
        }
    }

    @Nested
    @DisplayName("cancellation and rejection")
    class Cancellation {

        @Test
        @DisplayName("should_not_run_another_attempt_when_caller_cancels_during_backoff")
        void should_not_run_another_attempt_when_caller_cancels_during_backoff() {
            // Given: a long backoff is pending after the first failure
            scheduler.shutdownNow();
            scheduler = RecordingScheduler.realTime();
            AtomicInteger calls = new AtomicInteger();
            CompletableFuture<Object> future = executor(FaultConfig.disabled()).execute(() -> {
                calls.incrementAndGet();
                throw new IOException("timeout");
            }, "AddItem", 3, 60_000);
            assertThat(scheduler.delaysMs()).containsExactly(60_000L);

            // When: the caller cancels, then the backoff elapses
            future.cancel(true);
            scheduler.fireLast();

            // Then
            assertThat(calls).hasValue(1);
            assertThat(scheduler.delaysMs()).containsExactly(60_000L);
            assertThatThrownBy(future::join).isInstanceOf(CancellationException.class);
        }

        @Test
        @DisplayName("should_drop_pending_slow_operation_wait_when_caller_cancels")
        void should_drop_pending_slow_operation_wait_when_caller_cancels() {
            // Given
            scheduler.shutdownNow();
            scheduler = RecordingScheduler.realTime();
            FaultConfig config = FaultConfig.builder()
                    .enabled(true)
                    .failureRate(0.0)
                    .slowOperationRate(1.0)
                    .slowDelay(2000, 2000)
                    .build();
            AtomicInteger calls = new AtomicInteger();
            CompletableFuture<String> future = executor(config)
                    .execute(() -> "cart-" + calls.incrementAndGet(), "GetCart", config.retryPolicy());

            // When
            future.cancel(true);

            // Then
            assertThat(scheduler.lastScheduled().isCancelled()).isTrue();
            assertThat(calls).hasValue(0);
        }

        @Test
        @DisplayName("should_fail_when_worker_pool_rejects_attempt")
        void should_fail_when_worker_pool_rejects_attempt() {
            // Given
            List<Runnable> offered = new ArrayList<>();
            Executor rejecting = command -> {
                offered.add(command);
                throw new RejectedExecutionException("pool shut down");
            };
            RetryExecutor executor = new RetryExecutor(FaultInjector.create(FaultConfig.disabled()), rejecting, scheduler);

            // When
            CompletableFuture<String> future = executor.execute(() -> "never", "GetCart", 3, 10);

            // Then
            assertThatThrownBy(() -> await(future)).hasCauseInstanceOf(RejectedExecutionException.class);
            assertThat(offered).hasSize(1);
        }
    }
}
