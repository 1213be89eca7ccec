package com.retryable.core;

import com.retryable.core.function.CheckedRunnable;
import com.retryable.core.function.RetryableFunction;
import com.retryable.core.function.RetryableSupplier;
import com.retryable.exception.RetryConfigurationException;
import com.retryable.model.Failure;
import com.retryable.model.RetryOverrides;
import com.retryable.model.RetryResult;
import com.retryable.model.enums.FailureSource;
import com.retryable.model.enums.RetryState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    static class MsgError extends RuntimeException {
        final String msg;

        MsgError(String msg) {
            super(msg);
            this.msg = msg;
        }
    }

    private final RecordingSleeper sleeper = new RecordingSleeper();
    private final AtomicInteger calls = new AtomicInteger();

    private RetryPolicy.RetryPolicyBuilder policy() {
        return RetryPolicy.builder()
                .initialDelay(Duration.ofMillis(10))
                .sleeper(sleeper);
    }

    private String alwaysFail(RuntimeException e) {
        calls.incrementAndGet();
        throw e;
    }

    @ParameterizedTest(name = "maxAttempts={0}")
    @ValueSource(ints = {0, 1, 2, 3, 4})
    @DisplayName("Always failing operation is invoked maxAttempts + 1 times")
    void shouldInvokeMaxAttemptsPlusOneTimes(int maxAttempts) {
        // Given
        RetryableSupplier<String> wrapped = policy().maxAttempts(maxAttempts).build()
                .wrap(() -> alwaysFail(new RuntimeException("boom")));

        // When / Then
        assertThatThrownBy(wrapped::get).isInstanceOf(RuntimeException.class).hasMessage("boom");
        assertThat(calls.get()).isEqualTo(maxAttempts + 1);
        assertThat(sleeper.delays()).hasSize(maxAttempts);
    }

    @Test
    @DisplayName("Integer.MAX_VALUE attempts keeps retrying until the operation succeeds")
    void shouldRetryUntilSuccessWithUnboundedAttempts() {
        // Given
        RetryPolicy p = policy().maxAttempts(Integer.MAX_VALUE).initialDelay(Duration.ZERO).build();

        // When
        RetryResult<String> result = p.attempt(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("not yet");
            }
            return "done";
        });

        // Then
        assertThat(p.resolve(null).getTotalTries()).isEqualTo(Integer.MAX_VALUE);
        assertThat(result.getState()).isEqualTo(RetryState.SUCCEEDED);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Negative attempt count means a single try")
    void shouldTreatNegativeAttemptsAsNoRetry() {
        RetryPolicy p = policy().maxAttempts(-5).build();

        assertThatThrownBy(() -> p.execute(() -> alwaysFail(new IllegalStateException())))
                .isInstanceOf(IllegalStateException.class);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Success on the first try returns the value without waiting")
    void shouldReturnImmediatelyOnSuccess() throws Exception {
        RetryPolicy p = policy().build();

        String value = p.execute(() -> {
            calls.incrementAndGet();
            return "ok";
        });

        assertThat(value).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(1);
        assertThat(sleeper.delays()).isEmpty();
    }

    @Test
    @DisplayName("Transient failures are retried until the operation succeeds")
    void shouldRetryAndSucceed() throws Exception {
        RetryPolicy p = policy().maxAttempts(3).build();

        RetryResult<String> result = p.attempt(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("transient");
            }
            return "done";
        });

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getValue()).isEqualTo("done");
        assertThat(result.getAttempts()).isEqualTo(3);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("maxAttempts=0 propagates the original failure without retry count")
    void shouldPropagateUnannotatedWhenNoRetry() {
        RuntimeException boom = new RuntimeException("boom");
        RetryPolicy p = policy().maxAttempts(0).build();

        RetryResult<String> result = p.attempt(() -> alwaysFail(boom));

        assertThat(calls.get()).isEqualTo(1);
        assertThat(result.getState()).isEqualTo(RetryState.EXHAUSTED_FAILED);
        assertThat(result.getFailure().getCause()).isSameAs(boom);
        assertThat(result.getFailure().getRetryCount()).isEmpty();
        assertThatThrownBy(result::getOrThrow).isSameAs(boom);
    }

    @Test
    @DisplayName("Exhausted failure carries the number of attempts made")
    void shouldAttachRetryCountWhenExhausted() {
        RetryPolicy p = policy().maxAttempts(2).backoffMultiplier(2).build();

        RetryResult<String> result = p.attempt(() -> alwaysFail(new RuntimeException("boom")));

        assertThat(calls.get()).isEqualTo(3);
        assertThat(result.getState()).isEqualTo(RetryState.EXHAUSTED_FAILED);
        assertThat(result.getFailure().getRetryCount()).hasValue(3);
        assertThat(result.getFailure().getSource()).isEqualTo(FailureSource.OPERATION);
        assertThat(result.getFailure().getAttempt()).isEqualTo(3);
    }

    @Test
    @DisplayName("The last failure is propagated, earlier failures are discarded")
    void shouldPropagateLastFailure() {
        RetryPolicy p = policy().maxAttempts(2).build();

        assertThatThrownBy(() -> p.execute(() -> alwaysFail(new RuntimeException("call-" + (calls.get() + 1)))))
                .hasMessage("call-3")
                .hasNoSuppressedExceptions();
    }

    @Test
    @DisplayName("Checked exceptions keep their type")
    void shouldPropagateCheckedException() {
        RetryPolicy p = policy().maxAttempts(1).build();

        assertThatThrownBy(() -> p.execute(() -> {
            calls.incrementAndGet();
            throw new IOException("disk");
        })).isExactlyInstanceOf(IOException.class).hasMessage("disk");
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Deny-listed failure kind is invoked exactly once")
    void shouldNotRetryDenyListedFailure() {
        RetryPolicy p = policy().maxAttempts(5).deny(IOException.class).build();

        RetryResult<Object> result = p.attempt(() -> {
            calls.incrementAndGet();
            throw new IOException("denied");
        });

        assertThat(calls.get()).isEqualTo(1);
        assertThat(result.getState()).isEqualTo(RetryState.DENIED);
        assertThat(result.getFailure().getCause()).isInstanceOf(IOException.class);
        assertThat(sleeper.delays()).isEmpty();
    }

    @Test
    @DisplayName("Deny list matches subclasses and skips the predicate")
    void shouldMatchDenyListBySubtype() {
        AtomicInteger predicateCalls = new AtomicInteger();
        RetryPolicy p = policy()
                .maxAttempts(3)
                .denyList(List.of(IllegalArgumentException.class, IOException.class))
                .retryPredicate(f -> predicateCalls.incrementAndGet() > 0)
                .build();

        assertThatThrownBy(() -> p.execute(() -> alwaysFail(new NumberFormatException("nan"))))
                .isInstanceOf(NumberFormatException.class);
        assertThat(calls.get()).isEqualTo(1);
        assertThat(predicateCalls.get()).isZero();
    }

    @Test
    @DisplayName("Failures outside the deny list are retried")
    void shouldRetryFailuresOutsideDenyList() {
        RetryPolicy p = policy().maxAttempts(2).deny(IOException.class).build();

        assertThatThrownBy(() -> p.execute(() -> alwaysFail(new UncheckedIOException(new IOException()))))
                .isInstanceOf(UncheckedIOException.class);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Predicate returning false stops after one invocation")
    void shouldStopWhenPredicateSaysNo() {
        AtomicInteger predicateCalls = new AtomicInteger();
        RetryPolicy p = policy().maxAttempts(3).retryPredicate(f -> {
            predicateCalls.incrementAndGet();
            return false;
        }).build();

        RetryResult<String> result = p.attempt(() -> alwaysFail(new MsgError("false")));

        assertThat(calls.get()).isEqualTo(1);
        assertThat(predicateCalls.get()).isEqualTo(1);
        assertThat(result.getState()).isEqualTo(RetryState.DENIED);
        assertThat(result.getFailure().getCause()).isInstanceOf(MsgError.class);
    }

    @Test
    @DisplayName("Predicate returning true is consulted on every non-final failure")
    void shouldRetryWhilePredicateSaysYes() {
        AtomicInteger predicateCalls = new AtomicInteger();
        RetryPolicy p = policy().maxAttempts(3).retryPredicate(f -> {
            predicateCalls.incrementAndGet();
            return f.getCause() instanceof MsgError e && "true".equals(e.msg);
        }).build();

        assertThatThrownBy(() -> p.execute(() -> alwaysFail(new MsgError("true"))))
                .isInstanceOf(MsgError.class);
        assertThat(calls.get()).isEqualTo(4);
        assertThat(predicateCalls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Predicate turning false at attempt k gives k invocations and k predicate calls")
    void shouldStopAtFirstPredicateRejection() {
        int k = 3;
        AtomicInteger predicateCalls = new AtomicInteger();
        RetryPolicy p = policy().maxAttempts(5).retryPredicate(f -> predicateCalls.incrementAndGet() < k).build();

        RetryResult<String> result = p.attempt(() -> alwaysFail(new RuntimeException()));

        assertThat(calls.get()).isEqualTo(k);
        assertThat(predicateCalls.get()).isEqualTo(k);
        assertThat(result.getState()).isEqualTo(RetryState.DENIED);
        assertThat(result.getFailure().getRetryCount()).hasValue(k);
    }

    @Test
    @DisplayName("Predicate receives the failure of the current attempt")
    void shouldPassFailureToPredicate() {
        RetryPolicy p = policy().maxAttempts(1).retryPredicate(f -> {
            assertThat(f.getAttempt()).isEqualTo(1);
            assertThat(f.isInstanceOf(IllegalStateException.class)).isTrue();
            assertThat(f.getRetryCount()).isEmpty();
            return true;
        }).build();

        assertThatThrownBy(() -> p.execute(() -> alwaysFail(new IllegalStateException())))
                .isInstanceOf(IllegalStateException.class);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Exception raised by the predicate replaces the original and stops retrying")
    void shouldPropagatePredicateFailure() {
        IllegalStateException predicateError = new IllegalStateException("predicate broke");
        RetryPolicy p = policy().maxAttempts(3).retryPredicate(f -> {
            throw predicateError;
        }).build();

        RetryResult<String> result = p.attempt(() -> alwaysFail(new RuntimeException("original")));

        assertThat(calls.get()).isEqualTo(1);
        assertThat(result.getState()).isEqualTo(RetryState.PREDICATE_FAILED);
        assertThat(result.getFailure().getSource()).isEqualTo(FailureSource.PREDICATE);
        assertThatThrownBy(result::getOrThrow).isSameAs(predicateError);
    }

    @Test
    @DisplayName("Final allowed attempt is exhausted without consulting deny list or predicate")
    void shouldCheckExhaustionBeforeFilters() {
        AtomicInteger predicateCalls = new AtomicInteger();
        RetryPolicy p = policy()
                .maxAttempts(2)
                .deny(IOException.class)
                .retryPredicate(f -> {
                    predicateCalls.incrementAndGet();
                    return true;
                })
                .build();

        RetryResult<Object> result = p.attempt(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("retry me");
            }
            throw new IOException("denied kind on the last attempt");
        });

        assertThat(calls.get()).isEqualTo(3);
        assertThat(predicateCalls.get()).isEqualTo(2);
        assertThat(result.getState()).isEqualTo(RetryState.EXHAUSTED_FAILED);
        assertThat(result.getFailure().getCause()).isInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Delay before retry i equals initialDelay * backoff^(i-1)")
    void shouldBackOffExponentially() {
        RetryPolicy p = policy().maxAttempts(4).initialDelay(Duration.ofMillis(100)).backoffMultiplier(3).build();

        p.attempt(() -> alwaysFail(new RuntimeException()));

        assertThat(sleeper.delays()).containsExactly(
                Duration.ofMillis(100), Duration.ofMillis(300), Duration.ofMillis(900), Duration.ofMillis(2700));
    }

    @Test
    @DisplayName("Zero initial delay never waits")
    void shouldAllowZeroDelay() {
        RetryPolicy p = policy().maxAttempts(2).initialDelay(Duration.ZERO).build();

        p.attempt(() -> alwaysFail(new RuntimeException()));

        assertThat(sleeper.delays()).containsOnly(Duration.ZERO).hasSize(2);
    }

    @ParameterizedTest(name = "backoff={0}")
    @ValueSource(doubles = {1.0, 0.5, 0, -2, Double.NaN})
    @DisplayName("Backoff not above 1 is rejected before the operation runs")
    void shouldRejectInvalidBackoff(double backoff) {
        RetryPolicy p = policy().maxAttempts(1).backoffMultiplier(backoff).build();

        assertThatThrownBy(() -> p.execute(() -> alwaysFail(new RuntimeException())))
                .isInstanceOf(RetryConfigurationException.class)
                .hasMessageContaining("backoff must exceed 1");
        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("Negative delay is rejected before the operation runs")
    void shouldRejectNegativeDelay() {
        RetryPolicy p = policy().maxAttempts(1).initialDelay(Duration.ofMillis(-1)).build();

        assertThatThrownBy(() -> p.attempt(() -> alwaysFail(new RuntimeException())))
                .isInstanceOf(RetryConfigurationException.class)
                .hasMessageContaining("delay must be non-negative");
        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("Invalid backoff and delay are ignored when retries are disabled")
    void shouldSkipValidationWithoutRetries() {
        RetryPolicy p = policy().maxAttempts(0).backoffMultiplier(0.1).initialDelay(Duration.ofSeconds(-1)).build();

        RetryResult<String> result = p.attempt(() -> alwaysFail(new RuntimeException()));

        assertThat(result.getState()).isEqualTo(RetryState.EXHAUSTED_FAILED);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    @DisplayName("Call-time overrides win over wrap-time defaults")
    void shouldApplyOverrides() {
        RetryableSupplier<String> wrapped = policy().maxAttempts(5).backoffMultiplier(2).build()
                .wrap(() -> alwaysFail(new RuntimeException()));

        RetryResult<String> result = wrapped.attempt(RetryOverrides.builder()
                .maxAttempts(2)
                .initialDelay(Duration.ofMillis(50))
                .backoffMultiplier(4.0)
                .build());

        assertThat(calls.get()).isEqualTo(3);
        assertThat(result.getFailure().getRetryCount()).hasValue(3);
        assertThat(sleeper.delays()).containsExactly(Duration.ofMillis(50), Duration.ofMillis(200));
    }

    @Test
    @DisplayName("Predicate override replaces the wrap-time predicate for one call only")
    void shouldOverridePredicatePerCall() throws Exception {
        RetryableSupplier<String> wrapped = policy().maxAttempts(2).retryPredicate(f -> true).build()
                .wrap(() -> alwaysFail(new RuntimeException()));

        assertThatThrownBy(() -> wrapped.get(RetryOverrides.builder().retryPredicate(f -> false).build()))
                .isInstanceOf(RuntimeException.class);
        assertThat(calls.get()).isEqualTo(1);

        calls.set(0);
        assertThatThrownBy(wrapped::get).isInstanceOf(RuntimeException.class);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Invalid override is rejected even when the defaults are valid")
    void shouldValidateEffectiveValues() {
        RetryableSupplier<String> wrapped = policy().maxAttempts(0).build()
                .wrap(() -> alwaysFail(new RuntimeException()));

        assertThatThrownBy(() -> wrapped.get(RetryOverrides.builder().maxAttempts(1).backoffMultiplier(1.0).build()))
                .isInstanceOf(RetryConfigurationException.class);
        assertThat(calls.get()).isZero();
    }

    @Test
    @DisplayName("Wrapped function forwards its argument unchanged on every attempt")
    void shouldWrapFunction() throws Exception {
        RetryableFunction<Integer, Integer> twice = policy().maxAttempts(2).build().wrap(x -> {
            if (calls.incrementAndGet() < 2) {
                throw new IllegalStateException();
            }
            return x * 2;
        });

        assertThat(twice.apply(21)).isEqualTo(42);
        assertThat(calls.get()).isEqualTo(2);
        assertThat(twice.apply(5, RetryOverrides.none())).isEqualTo(10);
    }

    @Test
    @DisplayName("Wrapped runnable retries void operations")
    void shouldWrapRunnable() {
        CheckedRunnable task = () -> {
            calls.incrementAndGet();
            throw new IOException("no space");
        };

        assertThatThrownBy(() -> policy().maxAttempts(1).build().wrap(task).run())
                .isInstanceOf(IOException.class);
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Defaults match three retries, backoff 2 and one second delay")
    void shouldExposeDefaults() {
        RetryPolicy p = RetryPolicy.defaults();

        assertThat(p.getMaxAttempts()).isEqualTo(3);
        assertThat(p.getBackoffMultiplier()).isEqualTo(2.0);
        assertThat(p.getInitialDelay()).isEqualTo(Duration.ofSeconds(1));
        assertThat(p.getDenyList()).isEmpty();
        assertThat(p.getRetryPredicate()).isNull();
    }

    @Test
    @DisplayName("Resolved context starts at attempt one with the first delay")
    void shouldResolveContext() {
        var ctx = policy().maxAttempts(2).build().resolve(null);

        assertThat(ctx.getCurrentAttempt()).isEqualTo(1);
        assertThat(ctx.getTotalTries()).isEqualTo(3);
        assertThat(ctx.getCurrentDelay()).isEqualTo(Duration.ofMillis(10));
        assertThat(ctx.getState()).isEqualTo(RetryState.ATTEMPTING);
    }

    @Test
    @DisplayName("Failure value is immutable when a retry count is attached")
    void shouldKeepFailureImmutable() {
        RuntimeException cause = new RuntimeException();
        Failure first = Failure.ofOperation(cause, 1);

        Failure counted = first.withRetryCount(2);

        assertThat(first.getRetryCount()).isEmpty();
        assertThat(counted.getRetryCount()).hasValue(2);
        assertThat(counted.getCause()).isSameAs(cause);
    }
}
