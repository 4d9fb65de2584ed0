package com.easyretry.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 重试指标写入的注册表：
 * - 容器中有唯一（或 @Primary）的 MeterRegistry 时直接使用
 * - 否则退回本地 SimpleMeterRegistry, 指标仅进程内可见
 */
public class RetryMeterRegistryProvider {

    private static final Logger log = LoggerFactory.getLogger(RetryMeterRegistryProvider.class);

    private final MeterRegistry registry;

    private final boolean fallback;

    /**
     * @param contextRegistry 容器中的注册表, 可为 null
     */
    public RetryMeterRegistryProvider(MeterRegistry contextRegistry) {
        this.fallback = contextRegistry == null;
        if (fallback) {
            log.info("[Retry-Metrics] no MeterRegistry in context, using local SimpleMeterRegistry");
            this.registry = new SimpleMeterRegistry();
        } else {
            this.registry = contextRegistry;
        }
    }

    public MeterRegistry getRegistry() { return registry; }

    /** 是否使用了本地兜底注册表 */
    public boolean isFallback() { return fallback; }
}
