package com.easyretry.autoconfig;

import com.easyretry.config.RetryProperties;
import com.easyretry.core.engine.RetryExecutor;
import com.easyretry.core.engine.ThreadSleeper;
import com.easyretry.core.interceptor.RetryableAnnotationBeanPostProcessor;
import com.easyretry.core.interceptor.RetryableMethodInterceptor;
import com.easyretry.core.listener.LoggingRetryListener;
import com.easyretry.core.spi.RetryListener;
import com.easyretry.core.spi.Sleeper;
import com.easyretry.core.spi.StrategyProvider;
import com.easyretry.core.strategy.StrategyRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * 策略注册中心 / 执行器 / @Retryable 拦截装配
 * 所有 Bean 均可由业务方覆盖
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(RetryProperties.class)
@ConditionalOnProperty(prefix = "retry", name = "enabled", matchIfMissing = true)
public class RetryAutoConfiguration {

    /**
     * 策略注册中心, 合入业务方注册的 StrategyProvider
     */
    @Bean
    @ConditionalOnMissingBean(StrategyRegistry.class)
    public StrategyRegistry strategyRegistry(ObjectProvider<StrategyProvider> discovered) {
        return new StrategyRegistry(discovered.orderedStream().toList());
    }

    /**
     * 日志监听, 默认启用
     */
    @Bean
    @ConditionalOnMissingBean(name = "loggingRetryListener")
    public RetryListener loggingRetryListener() {
        return new LoggingRetryListener();
    }

    @Bean
    @ConditionalOnMissingBean(Sleeper.class)
    public Sleeper retrySleeper() {
        return new ThreadSleeper();
    }

    /**
     * 按 retry.* 配置构建的默认执行器
     */
    @Bean
    @ConditionalOnMissingBean(RetryExecutor.class)
    public RetryExecutor retryExecutor(StrategyRegistry registry,
                                       RetryProperties props,
                                       ObjectProvider<RetryListener> listeners,
                                       Sleeper sleeper) {
        RetryExecutor executor = RetryExecutor.builder()
                .name("default")
                .strategy(registry.factory(props))
                .listeners(listeners.orderedStream().toList())
                .sleeper(sleeper)
                .timeout(props.getTimeout())
                .build();
        log.info("[Easy-Retry] executor ready: strategy={}, maxAttempts={}, jitterSpread={}, timeout={}, listeners={}",
                props.getStrategy(), props.getMaxAttempts(), props.getJitterSpread(), props.getTimeout(),
                executor.getListeners().stream().map(RetryListener::name).toList());
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean(RetryableMethodInterceptor.class)
    public RetryableMethodInterceptor retryableMethodInterceptor(StrategyRegistry registry,
                                                                 RetryProperties props,
                                                                 ObjectProvider<RetryListener> listeners,
                                                                 Sleeper sleeper) {
        return new RetryableMethodInterceptor(registry, props, listeners.orderedStream().toList(), sleeper);
    }

    /**
     * static: BeanPostProcessor 须尽早注册
     */
    @Bean
    @ConditionalOnProperty(prefix = "retry.annotation", name = "enabled", matchIfMissing = true)
    public static RetryableAnnotationBeanPostProcessor retryableAnnotationBeanPostProcessor(
            ObjectProvider<RetryableMethodInterceptor> interceptor) {
        return new RetryableAnnotationBeanPostProcessor(interceptor);
    }
}
