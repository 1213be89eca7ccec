package com.retryable.model.ctx;

import com.retryable.model.Failure;
import com.retryable.model.enums.RetryState;

import java.time.Duration;

/**
 * 单次调用上下文的只读视图, 提供给 {@link com.retryable.core.spi.RetryListener}
 */
public interface RetryContext {

    String getName();

    int getMaxAttempts();

    double getBackoffMultiplier();

    Duration getInitialDelay();

    int getTotalTries();

    /** 当前执行序号, 从1开始 */
    int getCurrentAttempt();

    /** 下一次重试前的等待时长 */
    Duration getCurrentDelay();

    /** 尚未失败时为空 */
    Failure getLastFailure();

    RetryState getState();

    int remainingTries();
}
