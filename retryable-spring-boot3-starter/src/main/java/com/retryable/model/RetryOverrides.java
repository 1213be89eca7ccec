package com.retryable.model;

import com.retryable.core.spi.RetryPredicate;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * 调用期覆盖参数, 为空的字段沿用包装时的默认值
 * 仅被重试包装器消费, 不会传给业务操作
 */
@Value
@Builder
public class RetryOverrides {

    private static final RetryOverrides NONE = RetryOverrides.builder().build();

    Integer maxAttempts;
    /** 首次重试前的延迟 */
    Duration initialDelay;
    Double backoffMultiplier;
    RetryPredicate retryPredicate;

    public static RetryOverrides none() {
        return NONE;
    }
}
