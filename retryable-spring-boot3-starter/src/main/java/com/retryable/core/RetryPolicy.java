package com.retryable.core;

import com.retryable.core.backoff.ExponentialBackoffPolicy;
import com.retryable.core.engine.RetryEngine;
import com.retryable.core.engine.ThreadSleeper;
import com.retryable.core.function.CheckedFunction;
import com.retryable.core.function.CheckedRunnable;
import com.retryable.core.function.CheckedSupplier;
import com.retryable.core.function.RetryableFunction;
import com.retryable.core.function.RetryableRunnable;
import com.retryable.core.function.RetryableSupplier;
import com.retryable.core.spi.BackoffPolicy;
import com.retryable.core.spi.RetryListener;
import com.retryable.core.spi.RetryPredicate;
import com.retryable.core.spi.Sleeper;
import com.retryable.exception.RetryConfigurationException;
import com.retryable.model.RetryOverrides;
import com.retryable.model.RetryResult;
import com.retryable.model.ctx.InvocationContext;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 重试策略：包装时确定的默认配置, 构建后只读
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.builder()
 *         .maxAttempts(2)
 *         .initialDelay(Duration.ofMillis(100))
 *         .deny(IllegalArgumentException.class)
 *         .build();
 *
 * RetryableFunction<String, Order> load = policy.wrap(orderClient::load);
 * Order order = load.apply("42");
 * Order once = load.apply("42", RetryOverrides.builder().maxAttempts(0).build());
 * }</pre>
 *
 * 每次调用生成独立的 {@link InvocationContext}, 同一策略及包装后的操作可被多线程共享
 */
@Getter
@Builder(toBuilder = true)
public final class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
    public static final String DEFAULT_NAME = "retryable";

    /** 首次执行之后的重试次数, <= 0 表示不重试 */
    @Builder.Default
    private final int maxAttempts = DEFAULT_MAX_ATTEMPTS;

    /** 每次重试后延迟乘以该倍数, 启用重试时必须 > 1 */
    @Builder.Default
    private final double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;

    /** 首次重试前的延迟, 启用重试时必须 >= 0 */
    @NonNull
    @Builder.Default
    private final Duration initialDelay = DEFAULT_INITIAL_DELAY;

    /** 命中即不重试（按类型 isInstance 匹配） */
    @Singular("deny")
    private final List<Class<? extends Throwable>> denyList;

    /** 可为空 */
    private final RetryPredicate retryPredicate;

    @NonNull
    @Builder.Default
    private final String name = DEFAULT_NAME;

    @NonNull
    @Builder.Default
    private final Sleeper sleeper = ThreadSleeper.INSTANCE;

    @NonNull
    @Builder.Default
    private final BackoffPolicy backoffPolicy = ExponentialBackoffPolicy.INSTANCE;

    @Singular
    private final List<RetryListener> listeners;

    public static RetryPolicy defaults() {
        return builder().build();
    }

    /**
     * 合并调用期覆盖参数与默认配置, 生成本次调用的上下文
     * 覆盖值存在则优先, 仅在启用重试时校验退避倍数和初始延迟
     *
     * @throws RetryConfigurationException 退避倍数 <= 1 或 初始延迟为负
     */
    public InvocationContext resolve(RetryOverrides overrides) {
        RetryOverrides opt = overrides == null ? RetryOverrides.none() : overrides;
        int attempts = Optional.ofNullable(opt.getMaxAttempts()).orElse(maxAttempts);
        double backoff = Optional.ofNullable(opt.getBackoffMultiplier()).orElse(backoffMultiplier);
        Duration delay = Optional.ofNullable(opt.getInitialDelay()).orElse(initialDelay);
        RetryPredicate predicate = Optional.ofNullable(opt.getRetryPredicate()).orElse(retryPredicate);

        Duration firstDelay = Duration.ZERO;
        if (attempts > 0) {
            // NaN 也视为非法
            if (!(backoff > 1)) {
                throw new RetryConfigurationException("backoff must exceed 1, got " + backoff);
            }
            if (delay.isNegative()) {
                throw new RetryConfigurationException("delay must be non-negative, got " + delay);
            }
            firstDelay = backoffPolicy.delayBefore(1, delay, backoff);
        }

        return InvocationContext.builder()
                .name(name)
                .maxAttempts(attempts)
                .backoffMultiplier(backoff)
                .initialDelay(delay)
                .retryPredicate(predicate)
                .totalTries(totalTries(attempts))
                .currentDelay(firstDelay)
                .build();
    }

    /** max(attempts, 0) + 1, Integer.MAX_VALUE 视为无限重试, 不溢出 */
    static int totalTries(int attempts) {
        return attempts == Integer.MAX_VALUE ? Integer.MAX_VALUE : Math.max(attempts, 0) + 1;
    }

    /**
     * 异常是否命中拒绝列表
     */
    public boolean isDenied(Throwable t) {
        if (denyList.isEmpty()) {
            return false;
        }
        for (Class<? extends Throwable> kind : denyList) {
            if (kind.isInstance(t)) {
                return true;
            }
        }
        return false;
    }

    public <T> RetryResult<T> attempt(CheckedSupplier<T> operation, RetryOverrides overrides) {
        Objects.requireNonNull(operation, "operation");
        InvocationContext ctx = resolve(overrides);
        return new RetryEngine(this).execute(ctx, operation);
    }

    public <T> RetryResult<T> attempt(CheckedSupplier<T> operation) {
        return attempt(operation, RetryOverrides.none());
    }

    /**
     * 执行并返回结果, 最终失败时原样抛出最后一次异常
     */
    public <T> T execute(CheckedSupplier<T> operation, RetryOverrides overrides) throws Exception {
        return attempt(operation, overrides).getOrThrow();
    }

    public <T> T execute(CheckedSupplier<T> operation) throws Exception {
        return execute(operation, RetryOverrides.none());
    }

    public <T> RetryableSupplier<T> wrap(CheckedSupplier<T> operation) {
        Objects.requireNonNull(operation, "operation");
        return overrides -> attempt(operation, overrides);
    }

    public <A, R> RetryableFunction<A, R> wrap(CheckedFunction<A, R> operation) {
        Objects.requireNonNull(operation, "operation");
        return (arg, overrides) -> attempt(() -> operation.apply(arg), overrides);
    }

    public RetryableRunnable wrap(CheckedRunnable operation) {
        Objects.requireNonNull(operation, "operation");
        return overrides -> attempt(() -> {
            operation.run();
            return null;
        }, overrides);
    }

    @Override
    public String toString() {
        return "RetryPolicy{name=" + name + ", maxAttempts=" + maxAttempts
                + ", backoffMultiplier=" + backoffMultiplier + ", initialDelay=" + initialDelay
                + ", denyList=" + denyList + ", retryPredicate=" + retryPredicate + "}";
    }
}
