package com.easyretry.autoconfig;

import com.easyretry.core.listener.MetricsRetryListener;
import com.easyretry.core.metric.RetryMeterRegistryProvider;
import com.easyretry.core.metric.RetryMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnProperty(prefix = "retry", name = "enabled", matchIfMissing = true)
public class RetryMetricsAutoConfiguration {

    /**
     * 多个注册表且无 @Primary 时取不到唯一值, 退回本地注册表
     */
    @Bean
    @ConditionalOnMissingBean(RetryMeterRegistryProvider.class)
    public RetryMeterRegistryProvider retryMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered) {
        return new RetryMeterRegistryProvider(discovered.getIfUnique());
    }

    @Bean
    @ConditionalOnMissingBean(RetryMetrics.class)
    public RetryMetrics retryMetrics(RetryMeterRegistryProvider provider) {
        return RetryMetrics.create(provider.getRegistry());
    }

    @Bean
    @ConditionalOnMissingBean(MetricsRetryListener.class)
    public MetricsRetryListener metricsRetryListener(RetryMetrics metrics) {
        return new MetricsRetryListener(metrics);
    }
}
