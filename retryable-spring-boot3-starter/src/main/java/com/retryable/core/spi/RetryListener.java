package com.retryable.core.spi;

import com.retryable.model.Failure;
import com.retryable.model.ctx.RetryContext;

import java.time.Duration;

/**
 * 重试过程监听（指标、告警等旁路观测）
 * 在调用线程上同步回调, 抛出的异常只记录日志, 不影响重试结果
 */
public interface RetryListener {

    /** 每次执行前 */
    default void onAttempt(RetryContext ctx) {}

    /** 决定重试, 即将等待 delay */
    default void onRetry(RetryContext ctx, Failure failure, Duration delay) {}

    default void onSuccess(RetryContext ctx) {}

    /** 进入失败终态（拒绝/耗尽/谓词异常/中断） */
    default void onFailure(RetryContext ctx, Failure failure) {}
}
