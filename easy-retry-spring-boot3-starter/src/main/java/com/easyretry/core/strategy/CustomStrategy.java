package com.easyretry.core.strategy;

import com.easyretry.core.spi.RetryStrategy;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * 用户自定义延迟：只需提供 {@link BaseDelay}, 计数与抖动复用 {@link AttemptTracker}
 */
public class CustomStrategy implements RetryStrategy {

    private final AttemptTracker tracker;

    private final BaseDelay baseDelay;

    public CustomStrategy(BaseDelay baseDelay, StrategyConfig config) {
        this(baseDelay, config, Jitter.DEFAULT_RANDOM);
    }

    public CustomStrategy(BaseDelay baseDelay, StrategyConfig config, DoubleSupplier random) {
        this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
        this.tracker = new AttemptTracker(config, random);
    }

    @Override
    public Duration advance() {
        Duration base = Objects.requireNonNull(baseDelay.next(tracker.attempt() + 1), "base delay");
        return tracker.advance(base);
    }

    @Override
    public boolean attemptsExhausted() {
        return tracker.exhausted();
    }

    @Override
    public int attempt() {
        return tracker.attempt();
    }

    @Override
    public StrategyConfig config() {
        return tracker.config();
    }
}
