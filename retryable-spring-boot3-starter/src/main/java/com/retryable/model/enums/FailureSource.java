package com.retryable.model.enums;

/**
 * 异常来源
 */
public enum FailureSource {
    /** 被包装的业务操作 */
    OPERATION,
    /** 重试谓词 */
    PREDICATE
}
