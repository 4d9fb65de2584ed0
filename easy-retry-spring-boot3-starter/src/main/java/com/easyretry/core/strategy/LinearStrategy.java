package com.easyretry.core.strategy;

import com.easyretry.core.spi.RetryStrategy;
import com.easyretry.exception.RetryConfigurationException;

import java.time.Duration;
import java.util.Objects;
import java.util.function.DoubleSupplier;

/**
 * 固定间隔策略（可选抖动）
 */
public class LinearStrategy implements RetryStrategy {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(1);

    private final AttemptTracker tracker;

    private final Duration interval;

    public LinearStrategy() {
        this(DEFAULT_INTERVAL, StrategyConfig.defaults());
    }

    public LinearStrategy(Duration interval, StrategyConfig config) {
        this(interval, config, Jitter.DEFAULT_RANDOM);
    }

    public LinearStrategy(Duration interval, StrategyConfig config, DoubleSupplier random) {
        Objects.requireNonNull(interval, "interval");
        if (interval.isNegative()) {
            throw new RetryConfigurationException("interval must not be negative, got " + interval);
        }
        this.interval = interval;
        this.tracker = new AttemptTracker(config, random);
    }

    @Override
    public Duration advance() {
        return tracker.advance(interval);
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

    public Duration getInterval() {
        return interval;
    }
}
