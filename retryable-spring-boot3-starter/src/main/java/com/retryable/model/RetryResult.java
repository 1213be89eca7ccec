package com.retryable.model;

import com.retryable.model.enums.RetryState;
import lombok.Getter;

import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * 一次调用的终态结果：成功值 或 最终失败
 */
@Getter
public final class RetryResult<T> {

    private final RetryState state;
    private final T value;
    private final Failure failure;
    private final int attempts;

    private RetryResult(RetryState state, T value, Failure failure, int attempts) {
        this.state = state;
        this.value = value;
        this.failure = failure;
        this.attempts = attempts;
    }

    public static <T> RetryResult<T> success(T value, int attempts) {
        return new RetryResult<>(RetryState.SUCCEEDED, value, null, attempts);
    }

    public static <T> RetryResult<T> failure(RetryState state, Failure failure, int attempts) {
        if (!state.isTerminal() || state == RetryState.SUCCEEDED) {
            throw new IllegalArgumentException("not a failed terminal state: " + state);
        }
        return new RetryResult<>(state, null, Objects.requireNonNull(failure, "failure"), attempts);
    }

    public boolean isSuccess() {
        return state == RetryState.SUCCEEDED;
    }

    public T getValue() {
        if (!isSuccess()) {
            throw new NoSuchElementException("no value present, state=" + state);
        }
        return value;
    }

    /**
     * 成功返回值, 失败原样抛出最终异常（同一实例）
     */
    public T getOrThrow() throws Exception {
        if (isSuccess()) {
            return value;
        }
        Throwable t = failure.getCause();
        if (t instanceof Exception e) {
            throw e;
        }
        if (t instanceof Error err) {
            throw err;
        }
        // Exception/Error 之外的 Throwable 也原样抛出, 不包装
        throw RetryResult.<RuntimeException>rethrow(t);
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> E rethrow(Throwable t) throws E {
        throw (E) t;
    }
}
