package com.easyretry.core.strategy;

import com.easyretry.exception.RetryConfigurationException;

import java.util.Objects;

/**
 * 策略公共配置（不可变）
 * - maxAttempts：最大尝试次数, 默认 10
 * - jitterSpread：抖动比例 [0,1], 默认 0 即关闭
 */
public final class StrategyConfig {

    public static final int DEFAULT_MAX_ATTEMPTS = 10;

    public static final double DEFAULT_JITTER_SPREAD = 0.0;

    private static final StrategyConfig DEFAULTS = new StrategyConfig(DEFAULT_MAX_ATTEMPTS, DEFAULT_JITTER_SPREAD);

    private final int maxAttempts;

    private final double jitterSpread;

    private StrategyConfig(int maxAttempts, double jitterSpread) {
        if (maxAttempts < 1) {
            throw new RetryConfigurationException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        // NaN 也在这里被拒绝
        if (!(jitterSpread >= 0.0 && jitterSpread <= 1.0)) {
            throw new RetryConfigurationException("jitterSpread must be between 0 and 1, got " + jitterSpread);
        }
        this.maxAttempts = maxAttempts;
        this.jitterSpread = jitterSpread;
    }

    public static StrategyConfig of(int maxAttempts, double jitterSpread) {
        return new StrategyConfig(maxAttempts, jitterSpread);
    }

    public static StrategyConfig defaults() {
        return DEFAULTS;
    }

    public StrategyConfig withMaxAttempts(int maxAttempts) {
        return new StrategyConfig(maxAttempts, jitterSpread);
    }

    public StrategyConfig withJitterSpread(double jitterSpread) {
        return new StrategyConfig(maxAttempts, jitterSpread);
    }

    public int getMaxAttempts() { return maxAttempts; }

    public double getJitterSpread() { return jitterSpread; }

    public boolean jitterEnabled() { return jitterSpread > 0.0; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StrategyConfig that)) return false;
        return maxAttempts == that.maxAttempts && Double.compare(jitterSpread, that.jitterSpread) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxAttempts, jitterSpread);
    }

    @Override
    public String toString() {
        return "StrategyConfig{maxAttempts=" + maxAttempts + ", jitterSpread=" + jitterSpread + "}";
    }
}
