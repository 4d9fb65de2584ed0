package com.easyretry.core.strategy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 抖动：base + base * spread * r, r 取 [-1, 1] 均匀分布
 * spread 的合法性由 {@link StrategyConfig} 在构造期校验
 */
public final class Jitter {

    /** 结果上限, 超出即饱和 */
    public static final Duration MAX_DELAY = Duration.ofSeconds(Long.MAX_VALUE, 999_999_999);

    /** toNanos() 能表示的最大时长 */
    private static final Duration NANOS_LIMIT = Duration.ofNanos(Long.MAX_VALUE);

    /** 线程安全的默认随机源 */
    public static final DoubleSupplier DEFAULT_RANDOM = () -> ThreadLocalRandom.current().nextDouble(-1.0, 1.0);

    private Jitter() {
    }

    public static Duration apply(Duration base, double spread) {
        return apply(base, spread, DEFAULT_RANDOM);
    }

    public static Duration apply(Duration base, double spread, DoubleSupplier random) {
        // spread 为 0 时不生成随机数
        if (spread == 0.0) {
            return base;
        }
        return apply(base, spread, random.getAsDouble());
    }

    /**
     * @param r 已抽取的随机数, 取值 [-1, 1]
     */
    public static Duration apply(Duration base, double spread, double r) {
        if (spread == 0.0) {
            return base;
        }
        if (base.compareTo(NANOS_LIMIT) <= 0) {
            // Math.round 在 long 范围外饱和
            double nanos = base.toNanos();
            return Duration.ofNanos(Math.round(nanos + nanos * spread * r));
        }
        // 约 292 年以上按秒计算
        double seconds = base.getSeconds() + base.getNano() / 1e9;
        double v = seconds + seconds * spread * r;
        if (v >= (double) Long.MAX_VALUE) {
            return MAX_DELAY;
        }
        long whole = (long) Math.floor(v);
        return Duration.ofSeconds(whole, Math.round((v - whole) * 1e9));
    }
}
