package com.retryable.core.engine;

import com.retryable.core.spi.Sleeper;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 默认等待：阻塞当前线程
 */
public class ThreadSleeper implements Sleeper {

    public static final ThreadSleeper INSTANCE = new ThreadSleeper();

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        TimeUnit.NANOSECONDS.sleep(duration.toNanos());
    }
}
