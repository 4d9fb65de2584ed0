package com.easyretry.core.spi;

import java.time.Duration;

/**
 * 两次尝试之间的阻塞等待, 须响应线程中断
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * @param delay 等待时长, 负数按 0 处理
     */
    void sleep(Duration delay) throws InterruptedException;
}
