package com.retryable.core.metric;

import com.retryable.core.spi.RetryListener;
import com.retryable.model.Failure;
import com.retryable.model.ctx.RetryContext;

import java.time.Duration;

/**
 * 把重试过程写入 {@link RetryMetrics}
 */
public class MetricsRetryListener implements RetryListener {

    private final RetryMetrics meter;

    public MetricsRetryListener(RetryMetrics meter) {
        this.meter = meter;
    }

    @Override
    public void onAttempt(RetryContext ctx) {
        if (ctx.getCurrentAttempt() == 1) {
            meter.incCalls(ctx.getName());
        }
    }

    @Override
    public void onRetry(RetryContext ctx, Failure failure, Duration delay) {
        meter.incRetries(ctx.getName());
        meter.recordWait(ctx.getName(), delay);
    }

    @Override
    public void onSuccess(RetryContext ctx) {
        meter.incSuccess(ctx.getName());
        meter.recordAttempts(ctx.getName(), ctx.getCurrentAttempt());
    }

    @Override
    public void onFailure(RetryContext ctx, Failure failure) {
        switch (ctx.getState()) {
            case EXHAUSTED_FAILED -> meter.incExhausted(ctx.getName());
            case DENIED -> meter.incDenied(ctx.getName());
            case PREDICATE_FAILED -> meter.incPredicateErr(ctx.getName());
            case INTERRUPTED -> meter.incInterrupted(ctx.getName());
            default -> { }
        }
        meter.recordAttempts(ctx.getName(), ctx.getCurrentAttempt());
    }
}
