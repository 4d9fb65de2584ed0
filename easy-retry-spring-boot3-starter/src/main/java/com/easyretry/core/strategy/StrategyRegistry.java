package com.easyretry.core.strategy;

import com.easyretry.config.RetryProperties;
import com.easyretry.core.spi.StrategyProvider;
import com.easyretry.core.strategy.provider.BackoffStrategyProvider;
import com.easyretry.core.strategy.provider.LinearStrategyProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 策略注册中心：
 * - 内置 linear / backoff
 * - 解析 "spi:{name}" 映射到外部注册的 StrategyProvider（name() 返回的名字）
 * - 空或未知名称回落到 linear
 * - 线程安全
 */
public class StrategyRegistry {

    private static final Logger log = LoggerFactory.getLogger(StrategyRegistry.class);

    private static final String PREFIX_SPI = "spi:";

    private final Map<String, StrategyProvider> providers = new ConcurrentHashMap<>(16);

    public StrategyRegistry() {
        this(null);
    }

    public StrategyRegistry(List<StrategyProvider> discovered) {
        if (discovered != null) {
            discovered.forEach(p -> registry(p.name(), p));
        }
        // 内置策略
        providers.putIfAbsent(LinearStrategyProvider.NAME, new LinearStrategyProvider());
        providers.putIfAbsent(BackoffStrategyProvider.NAME, new BackoffStrategyProvider());
    }

    /**
     * 注册或覆盖策略
     */
    public StrategyRegistry registry(String name, StrategyProvider provider) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(provider, "provider");
        providers.put(normalize(name), provider);
        return this;
    }

    /**
     * 按名称解析策略, 支持 spi:{name} 前缀
     */
    public StrategyProvider resolve(String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return providers.get(LinearStrategyProvider.NAME);
        }
        String s = strategy.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            s = s.substring(PREFIX_SPI.length());
        }
        StrategyProvider p = providers.get(normalize(s));
        if (p == null) {
            log.warn("[Retry-Registry] unknown strategy '{}', fallback to {}", strategy, LinearStrategyProvider.NAME);
            return providers.get(LinearStrategyProvider.NAME);
        }
        return p;
    }

    /**
     * 按配置生成策略工厂, 并立即校验一次参数
     */
    public RetryStrategyFactory factory(RetryProperties props) {
        Objects.requireNonNull(props, "props");
        StrategyProvider p = resolve(props.getStrategy());
        p.create(props);
        return () -> p.create(props);
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(providers.keySet()); }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }
}
