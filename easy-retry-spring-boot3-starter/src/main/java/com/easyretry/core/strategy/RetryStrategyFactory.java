package com.easyretry.core.strategy;

import com.easyretry.core.spi.RetryStrategy;

import java.time.Duration;

/**
 * 每个重试序列调用一次, 返回全新的策略实例
 */
@FunctionalInterface
public interface RetryStrategyFactory {

    RetryStrategy create();

    static RetryStrategyFactory linear(Duration interval, StrategyConfig config) {
        // 提前校验, 配置错误在构建期暴露
        new LinearStrategy(interval, config);
        return () -> new LinearStrategy(interval, config);
    }

    static RetryStrategyFactory backoff(Duration startInterval, Duration maxInterval, StrategyConfig config) {
        new BackoffStrategy(startInterval, maxInterval, config);
        return () -> new BackoffStrategy(startInterval, maxInterval, config);
    }

    static RetryStrategyFactory custom(BaseDelay baseDelay, StrategyConfig config) {
        return () -> new CustomStrategy(baseDelay, config);
    }
}
