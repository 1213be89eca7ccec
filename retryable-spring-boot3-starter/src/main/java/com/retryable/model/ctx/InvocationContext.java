package com.retryable.model.ctx;

import com.retryable.core.spi.RetryPredicate;
import com.retryable.model.Failure;
import com.retryable.model.enums.RetryState;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;

/**
 * 单次调用上下文
 * 每次调用新建, 只在调用线程上使用, 调用返回或抛出后丢弃
 * 监听器只拿到 {@link #readOnly()} 视图
 */
@Getter
@Builder
public class InvocationContext implements RetryContext {

    /** 策略名称（日志/指标标签） */
    private final String name;

    /** 生效的重试次数（不含首次） */
    private final int maxAttempts;
    private final double backoffMultiplier;
    private final Duration initialDelay;
    private final RetryPredicate retryPredicate;

    /** 总执行次数上限 = max(maxAttempts, 0) + 1 */
    private final int totalTries;

    /** 当前执行序号, 从1开始 */
    @Builder.Default
    private int currentAttempt = 1;

    /** 下一次重试前的等待时长 */
    private Duration currentDelay;

    @Setter
    private Failure lastFailure;

    @Setter
    @Builder.Default
    private RetryState state = RetryState.ATTEMPTING;

    /** 本次是否为最后一次允许的执行 */
    public boolean isLastAttempt() {
        return currentAttempt >= totalTries;
    }

    @Override
    public int remainingTries() {
        return totalTries - currentAttempt;
    }

    /**
     * 进入下一次执行
     * @param nextDelay 下一次重试前的等待时长
     */
    public void advance(Duration nextDelay) {
        currentAttempt++;
        currentDelay = nextDelay;
        state = RetryState.ATTEMPTING;
    }

    /**
     * 只读视图, 随本上下文变化
     */
    public RetryContext readOnly() {
        InvocationContext self = this;
        return new RetryContext() {
            @Override public String getName() { return self.getName(); }
            @Override public int getMaxAttempts() { return self.getMaxAttempts(); }
            @Override public double getBackoffMultiplier() { return self.getBackoffMultiplier(); }
            @Override public Duration getInitialDelay() { return self.getInitialDelay(); }
            @Override public int getTotalTries() { return self.getTotalTries(); }
            @Override public int getCurrentAttempt() { return self.getCurrentAttempt(); }
            @Override public Duration getCurrentDelay() { return self.getCurrentDelay(); }
            @Override public Failure getLastFailure() { return self.getLastFailure(); }
            @Override public RetryState getState() { return self.getState(); }
            @Override public int remainingTries() { return self.remainingTries(); }

            @Override
            public String toString() {
                return "RetryContext{name=" + self.getName() + ", attempt=" + self.getCurrentAttempt()
                        + "/" + self.getTotalTries() + ", state=" + self.getState() + "}";
            }
        };
    }
}
