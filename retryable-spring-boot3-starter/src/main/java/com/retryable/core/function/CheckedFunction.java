package com.retryable.core.function;

@FunctionalInterface
public interface CheckedFunction<A, R> {

    R apply(A arg) throws Exception;
}
