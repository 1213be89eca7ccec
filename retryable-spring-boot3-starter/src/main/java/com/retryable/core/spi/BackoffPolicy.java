package com.retryable.core.spi;

import java.time.Duration;

/**
 * 回退策略（计算重试前的等待时长）
 */
public interface BackoffPolicy {

    /** 策略名称 */
    String name();

    /**
     * @param retry        第几次重试（从1开始）
     * @param initialDelay 首次重试前的延迟
     * @param multiplier   退避倍数
     * @return 第 retry 次重试前的等待时长
     */
    Duration delayBefore(int retry, Duration initialDelay, double multiplier);
}
