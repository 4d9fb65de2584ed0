package com.easyretry.config;

import com.easyretry.core.strategy.BackoffStrategy;
import com.easyretry.core.strategy.LinearStrategy;
import com.easyretry.core.strategy.StrategyConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 重试配置（绑定前缀：retry）
 *
 * YAML 示例：
 * retry:
 *   enabled: true
 *   strategy: backoff
 *   max-attempts: 5
 *   jitter-spread: 0.2
 *   timeout: 30s
 *   linear:
 *     interval: 1s
 *   backoff:
 *     start-interval: 200ms
 *     max-interval: 10s
 *   annotation:
 *     enabled: true
 */
@ConfigurationProperties(prefix = "retry")
public class RetryProperties {

    /** 是否装配默认 RetryExecutor */
    private boolean enabled = true;

    /** 策略：linear | backoff | spi:{name} */
    private String strategy = "linear";

    /** 最大尝试次数（含首次调用） */
    private int maxAttempts = StrategyConfig.DEFAULT_MAX_ATTEMPTS;

    /** 抖动比例（0~1），例如 0.2 表示 ±20% */
    private double jitterSpread = StrategyConfig.DEFAULT_JITTER_SPREAD;

    /** 总体超时, 为空不限制 */
    private Duration timeout;

    private Linear linear = new Linear();

    private Backoff backoff = new Backoff();

    private Annotation annotation = new Annotation();

    // ----------------- 嵌套配置对象 -----------------

    public static class Linear {
        /** 固定间隔 */
        private Duration interval = LinearStrategy.DEFAULT_INTERVAL;

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }

    public static class Backoff {
        /** 首次间隔 */
        private Duration startInterval = BackoffStrategy.DEFAULT_START_INTERVAL;

        /** 间隔上限 */
        private Duration maxInterval = BackoffStrategy.DEFAULT_MAX_INTERVAL;

        public Duration getStartInterval() { return startInterval; }
        public void setStartInterval(Duration startInterval) { this.startInterval = startInterval; }
        public Duration getMaxInterval() { return maxInterval; }
        public void setMaxInterval(Duration maxInterval) { this.maxInterval = maxInterval; }
    }

    public static class Annotation {
        /** 是否拦截 @Retryable 方法 */
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    // ----------------- getters/setters 顶层 -----------------

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getStrategy() { return strategy; }
    public void setStrategy(String strategy) { this.strategy = strategy; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public double getJitterSpread() { return jitterSpread; }
    public void setJitterSpread(double jitterSpread) { this.jitterSpread = jitterSpread; }

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }

    public Linear getLinear() { return linear; }
    public void setLinear(Linear linear) { this.linear = linear; }

    public Backoff getBackoff() { return backoff; }
    public void setBackoff(Backoff backoff) { this.backoff = backoff; }

    public Annotation getAnnotation() { return annotation; }
    public void setAnnotation(Annotation annotation) { this.annotation = annotation; }

    // ----------------- 便捷换算 -----------------

    /** 公共策略配置, 参数非法时抛出 RetryConfigurationException */
    public StrategyConfig strategyConfig() {
        return StrategyConfig.of(maxAttempts, jitterSpread);
    }

    /** 拷贝一份, 供 @Retryable 按方法覆盖 */
    public RetryProperties copy() {
        RetryProperties c = new RetryProperties();
        c.setEnabled(enabled);
        c.setStrategy(strategy);
        c.setMaxAttempts(maxAttempts);
        c.setJitterSpread(jitterSpread);
        c.setTimeout(timeout);
        c.getLinear().setInterval(linear.getInterval());
        c.getBackoff().setStartInterval(backoff.getStartInterval());
        c.getBackoff().setMaxInterval(backoff.getMaxInterval());
        c.getAnnotation().setEnabled(annotation.isEnabled());
        return c;
    }
}
