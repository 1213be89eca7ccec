package com.retryable.core.function;

import com.retryable.model.RetryOverrides;
import com.retryable.model.RetryResult;

/**
 * 被重试包装后的无参操作
 */
public interface RetryableSupplier<T> extends CheckedSupplier<T> {

    /** 按包装时配置执行 */
    @Override
    default T get() throws Exception {
        return get(RetryOverrides.none());
    }

    /** 按调用期覆盖参数执行 */
    default T get(RetryOverrides overrides) throws Exception {
        return attempt(overrides).getOrThrow();
    }

    /** 不抛出, 返回终态结果（含重试次数） */
    RetryResult<T> attempt(RetryOverrides overrides);
}
