package com.easyretry.annotation;

import java.lang.annotation.*;

/**
 * 标注在 Spring Bean 的方法（或类）上, 调用失败时按策略重试
 * 未设置的属性沿用 retry.* 全局配置
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Inherited
public @interface Retryable {

    /**
     * 序列名称, 用于日志与监听器; 为空取方法签名
     */
    String name() default "";

    /**
     * 策略：linear | backoff | spi:{name}
     */
    String strategy() default "";

    /** 最大尝试次数（含首次调用）, <=0 表示沿用全局 */
    int maxAttempts() default -1;

    /** 抖动比例 [0,1], 负数表示沿用全局 */
    double jitterSpread() default -1;

    /** linear 固定间隔（毫秒）, 负数表示沿用全局 */
    long intervalMs() default -1;

    /** backoff 首次间隔（毫秒） */
    long startIntervalMs() default -1;

    /** backoff 间隔上限（毫秒） */
    long maxIntervalMs() default -1;

    /**
     * 只重试这些异常; 为空则重试任意 Exception
     */
    Class<? extends Throwable>[] retryOn() default {};

    /**
     * 即使命中 retryOn 也不重试
     */
    Class<? extends Throwable>[] noRetryOn() default {};
}
