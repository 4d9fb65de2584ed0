package com.easyretry.core.strategy;

import com.easyretry.core.spi.RetryStrategy;
import com.easyretry.exception.RetryConfigurationException;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * 指数退避策略
 * 首次返回 startInterval, 之后每次翻倍, 上限 maxInterval：
 * start=1s, max=8s -> 1s, 2s, 4s, 8s, 8s ...
 */
public class BackoffStrategy implements RetryStrategy {

    public static final Duration DEFAULT_START_INTERVAL = Duration.ofSeconds(1);

    public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(1);

    private final AttemptTracker tracker;

    private final Duration startInterval;

    private final Duration maxInterval;

    /** 下一次返回的基础间隔 */
    private Duration current;

    public BackoffStrategy() {
        this(DEFAULT_START_INTERVAL, DEFAULT_MAX_INTERVAL, StrategyConfig.defaults());
    }

    public BackoffStrategy(Duration startInterval, Duration maxInterval, StrategyConfig config) {
        this(startInterval, maxInterval, config, Jitter.DEFAULT_RANDOM);
    }

    public BackoffStrategy(Duration startInterval, Duration maxInterval, StrategyConfig config,
                           DoubleSupplier random) {
        Objects.requireNonNull(startInterval, "startInterval");
        Objects.requireNonNull(maxInterval, "maxInterval");
        if (startInterval.isNegative()) {
            throw new RetryConfigurationException("startInterval must not be negative, got " + startInterval);
        }
        if (maxInterval.compareTo(startInterval) < 0) {
            throw new RetryConfigurationException("maxInterval must be >= startInterval");
        }
        this.startInterval = startInterval;
        this.maxInterval = maxInterval;
        this.current = startInterval;
        this.tracker = new AttemptTracker(config, random);
    }

    @Override
    public Duration advance() {
        Duration base = current;
        current = doubled(current);
        return tracker.advance(base);
    }

    private Duration doubled(Duration d) {
        // d * 2 > max 等价于 d > max - d, 避免翻倍溢出
        if (d.compareTo(maxInterval.minus(d)) > 0) {
            return maxInterval;
        }
        return d.multipliedBy(2);
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

    public Duration getStartInterval() { return startInterval; }

    public Duration getMaxInterval() { return maxInterval; }
}
