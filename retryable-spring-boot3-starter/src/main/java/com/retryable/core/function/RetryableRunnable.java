package com.retryable.core.function;

import com.retryable.model.RetryOverrides;
import com.retryable.model.RetryResult;

public interface RetryableRunnable extends CheckedRunnable {

    @Override
    default void run() throws Exception {
        run(RetryOverrides.none());
    }

    default void run(RetryOverrides overrides) throws Exception {
        attempt(overrides).getOrThrow();
    }

    RetryResult<Void> attempt(RetryOverrides overrides);
}
