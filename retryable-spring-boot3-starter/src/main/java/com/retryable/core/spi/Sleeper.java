package com.retryable.core.spi;

import java.time.Duration;

/**
 * 阻塞等待, 在调用线程上执行
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;
}
