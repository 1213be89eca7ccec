package com.retryable.exception;

/**
 * 重试参数非法（退避倍数 <= 1 或 初始延迟为负）
 * 在第一次执行前同步抛出
 */
public class RetryConfigurationException extends IllegalArgumentException {

    public RetryConfigurationException(String message) {
        super(message);
    }
}
