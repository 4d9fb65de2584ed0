package com.easyretry.core.engine;

import com.easyretry.core.spi.Sleeper;

import java.time.Duration;

/**
 * 基于 Thread.sleep 的等待, 可被中断
 */
public class ThreadSleeper implements Sleeper {

    public static final ThreadSleeper INSTANCE = new ThreadSleeper();

    /** Thread.sleep 毫秒参数的上限 */
    private static final Duration MAX_SLEEP = Duration.ofMillis(Long.MAX_VALUE);

    @Override
    public void sleep(Duration delay) throws InterruptedException {
        if (delay == null || delay.isNegative() || delay.isZero()) {
            // 抖动后可能为负, 按 0 处理; 仍然检查中断
            if (Thread.interrupted()) {
                throw new InterruptedException("interrupted before retry");
            }
            return;
        }
        if (delay.compareTo(MAX_SLEEP) >= 0) {
            Thread.sleep(Long.MAX_VALUE);
            return;
        }
        Thread.sleep(delay.toMillis(), delay.toNanosPart() % 1_000_000);
    }
}
