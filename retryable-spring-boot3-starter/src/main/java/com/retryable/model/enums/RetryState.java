package com.retryable.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 单次调用的重试状态
 */
@AllArgsConstructor
@Getter
public enum RetryState {
    ATTEMPTING(false, "执行中"),
    SUCCEEDED(true, "执行成功，终态"),
    DENIED(true, "命中拒绝列表或谓词返回false，立即抛出，终态"),
    RETRYABLY_FAILED(false, "可重试失败，等待后回到执行中"),
    EXHAUSTED_FAILED(true, "重试次数耗尽，抛出最后一次异常，终态"),
    PREDICATE_FAILED(true, "重试谓词自身抛出异常，抛出该异常，终态"),
    INTERRUPTED(true, "等待期间线程被中断，抛出最后一次异常，终态")
    ;

    public final boolean terminal;
    public final String desc;
}
