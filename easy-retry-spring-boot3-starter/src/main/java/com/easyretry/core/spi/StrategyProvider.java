package com.easyretry.core.spi;

import com.easyretry.config.RetryProperties;

/**
 * 策略提供者, 按名称注册到 StrategyRegistry
 */
public interface StrategyProvider {

    /** 策略唯一名称（如 "linear"、"backoff"、"myPolicy"） */
    String name();

    /**
     * 新建一个策略实例, 每个重试序列调用一次
     * @param props 配置（读取 maxAttempts / jitterSpread / 间隔等）
     */
    RetryStrategy create(RetryProperties props);
}
