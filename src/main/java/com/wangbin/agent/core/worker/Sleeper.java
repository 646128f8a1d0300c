package com.wangbin.agent.core.worker;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * 间隔等待
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> TimeUnit.NANOSECONDS.sleep(duration.toNanos());

    void sleep(Duration duration) throws InterruptedException;
}
