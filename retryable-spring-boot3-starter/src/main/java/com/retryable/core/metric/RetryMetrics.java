package com.retryable.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * 重试指标, 按策略名称打 name 标签
 */
public final class RetryMetrics {

    public static final String TAG_NAME = "name";

    private final MeterRegistry reg;

    private RetryMetrics(MeterRegistry reg) {
        this.reg = reg;
    }

    public static RetryMetrics create(MeterRegistry reg) { return new RetryMetrics(reg); }

    public MeterRegistry registry() { return reg; }

    public void incCalls(String name){       counter("retryable.calls", "calls started", name).increment(); }
    public void incSuccess(String name){     counter("retryable.success", "calls succeeded", name).increment(); }
    public void incRetries(String name){     counter("retryable.retries", "retries scheduled", name).increment(); }
    public void incExhausted(String name){   counter("retryable.exhausted", "calls failed after all tries", name).increment(); }
    public void incDenied(String name){      counter("retryable.denied", "failures rejected by deny list or predicate", name).increment(); }
    public void incPredicateErr(String name){ counter("retryable.predicate.error", "retry predicate raised", name).increment(); }
    public void incInterrupted(String name){ counter("retryable.interrupted", "interrupted while waiting", name).increment(); }

    public void recordAttempts(String name, int n) {
        DistributionSummary.builder("retryable.attempts")
                .description("attempt count per call").baseUnit("times")
                .tag(TAG_NAME, name).register(reg)
                .record(n);
    }

    public void recordWait(String name, Duration delay) {
        Timer.builder("retryable.wait.time")
                .description("delay before a retry")
                .tag(TAG_NAME, name).register(reg)
                .record(delay);
    }

    private Counter counter(String meter, String description, String name) {
        return Counter.builder(meter).description(description).tag(TAG_NAME, name).register(reg);
    }
}
