package com.retryable.core.backoff;

import com.retryable.core.spi.BackoffPolicy;

import java.time.Duration;

/**
 * 指数退避（无抖动）：第 i 次重试前等待 initialDelay * multiplier^(i-1)
 * 超出 long 纳秒范围时饱和
 */
public class ExponentialBackoffPolicy implements BackoffPolicy {

    public static final ExponentialBackoffPolicy INSTANCE = new ExponentialBackoffPolicy();

    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public Duration delayBefore(int retry, Duration initialDelay, double multiplier) {
        if (retry < 1) {
            throw new IllegalArgumentException("retry must be >= 1, got " + retry);
        }
        // 不用 toNanos(), 超大 Duration 会溢出
        double base = initialDelay.getSeconds() * 1_000_000_000d + initialDelay.getNano();
        if (base <= 0) {
            return Duration.ZERO;
        }
        double ideal = base * Math.pow(multiplier, retry - 1);
        if (Double.isNaN(ideal) || ideal >= (double) Long.MAX_VALUE) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(Math.round(ideal));
    }
}
