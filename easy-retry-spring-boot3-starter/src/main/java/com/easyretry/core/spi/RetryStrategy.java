package com.easyretry.core.spi;

import com.easyretry.core.strategy.StrategyConfig;

import java.time.Duration;

/**
 * 重试策略：计算下一次尝试前的等待时间
 * 每个重试序列新建一个实例, 不跨序列复用
 */
public interface RetryStrategy {

    /**
     * 本次尝试失败, 计算下一次尝试前的等待时间（已加抖动）
     * 同时将尝试计数 +1
     */
    Duration advance();

    /** 尝试计数达到 maxAttempts 即为耗尽 */
    boolean attemptsExhausted();

    /** 当前已计数的尝试次数 */
    int attempt();

    StrategyConfig config();
}
