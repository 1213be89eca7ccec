package com.retryable.core.function;

import com.retryable.model.RetryOverrides;
import com.retryable.model.RetryResult;

/**
 * 被重试包装后的单参操作
 */
public interface RetryableFunction<A, R> extends CheckedFunction<A, R> {

    @Override
    default R apply(A arg) throws Exception {
        return apply(arg, RetryOverrides.none());
    }

    default R apply(A arg, RetryOverrides overrides) throws Exception {
        return attempt(arg, overrides).getOrThrow();
    }

    RetryResult<R> attempt(A arg, RetryOverrides overrides);
}
