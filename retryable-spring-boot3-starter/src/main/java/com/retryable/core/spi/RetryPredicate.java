package com.retryable.core.spi;

import com.retryable.model.Failure;

/**
 * 重试谓词（按异常内容决定是否重试）
 * 只对未命中拒绝列表且不是最后一次的失败调用
 */
@FunctionalInterface
public interface RetryPredicate {

    /**
     * @param failure 本次执行的失败
     * @return true=重试；false=立即抛出原异常
     * @throws Exception 谓词自身异常, 会替代原异常抛给调用方且不再重试
     */
    boolean test(Failure failure) throws Exception;
}
