package com.retryable.core.function;

/**
 * 可抛出受检异常的无参操作
 */
@FunctionalInterface
public interface CheckedSupplier<T> {

    T get() throws Exception;
}
