package com.easyretry.core.strategy;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * 各策略共享的计数与抖动逻辑, 由具体策略组合使用
 * 单个重试序列独占, 非线程安全
 */
public final class AttemptTracker {

    private final StrategyConfig config;

    private final DoubleSupplier random;

    private int attempt;

    public AttemptTracker(StrategyConfig config) {
        this(config, Jitter.DEFAULT_RANDOM);
    }

    public AttemptTracker(StrategyConfig config, DoubleSupplier random) {
        this.config = Objects.requireNonNull(config, "config");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * 计数 +1 并对基础延迟加抖动
     */
    public Duration advance(Duration baseDelay) {
        attempt++;
        return Jitter.apply(baseDelay, config.getJitterSpread(), random);
    }

    public boolean exhausted() {
        return attempt >= config.getMaxAttempts();
    }

    public int attempt() {
        return attempt;
    }

    public StrategyConfig config() {
        return config;
    }
}
