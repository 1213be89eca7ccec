package com.retryable.core.function;

@FunctionalInterface
public interface CheckedRunnable {

    void run() throws Exception;
}
