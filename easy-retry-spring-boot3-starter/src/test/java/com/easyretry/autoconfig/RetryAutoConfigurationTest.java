package com.easyretry.autoconfig;

import com.easyretry.annotation.Retryable;
import com.easyretry.config.RetryProperties;
import com.easyretry.core.engine.RecordingSleeper;
import com.easyretry.core.engine.RetryExecutor;
import com.easyretry.core.interceptor.RetryableAnnotationBeanPostProcessor;
import com.easyretry.core.interceptor.RetryableMethodInterceptor;
import com.easyretry.core.listener.MetricsRetryListener;
import com.easyretry.core.metric.RetryMeterRegistryProvider;
import com.easyretry.core.spi.RetryListener;
import com.easyretry.core.spi.RetryStrategy;
import com.easyretry.core.spi.StrategyProvider;
import com.easyretry.core.strategy.CustomStrategy;
import com.easyretry.core.strategy.StrategyRegistry;
import com.easyretry.exception.OperationFailedException;
import com.easyretry.exception.RetryConfigurationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.aop.support.AopUtils;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RetryAutoConfiguration.class, RetryMetricsAutoConfiguration.class))
            .withBean(RecordingSleeper.class, RecordingSleeper::new);

    private static final StrategyProvider HALF_SECOND = new StrategyProvider() {
        @Override
        public String name() {
            return "halfSecond";
        }

        @Override
        public RetryStrategy create(RetryProperties props) {
            return new CustomStrategy(attempt -> Duration.ofMillis(500), props.strategyConfig());
        }
    };

    @Test
    void defaultBeansAreRegistered() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(StrategyRegistry.class)
                    .hasSingleBean(RetryExecutor.class)
                    .hasSingleBean(RetryableMethodInterceptor.class)
                    .hasSingleBean(RetryableAnnotationBeanPostProcessor.class)
                    .hasSingleBean(MetricsRetryListener.class);
            RetryExecutor executor = context.getBean(RetryExecutor.class);
            assertThat(executor.getName()).isEqualTo("default");
            assertThat(executor.getTimeout()).isNull();
            assertThat(executor.getListeners()).extracting(RetryListener::name)
                    .containsExactlyInAnyOrder("log", "metrics");
            assertThat(context.getBean(RetryMeterRegistryProvider.class).isFallback()).isTrue();
        });
    }

    @Test
    void executorFollowsBackoffProperties() {
        runner.withPropertyValues(
                        "retry.strategy=backoff",
                        "retry.max-attempts=3",
                        "retry.backoff.start-interval=100ms",
                        "retry.backoff.max-interval=1s")
                .run(context -> {
                    RetryExecutor executor = context.getBean(RetryExecutor.class);
                    AtomicInteger calls = new AtomicInteger();

                    assertThatThrownBy(() -> executor.execute(() -> {
                        calls.incrementAndGet();
                        throw new IllegalStateException("down");
                    })).isInstanceOf(OperationFailedException.class);

                    assertThat(calls).hasValue(3);
                    assertThat(context.getBean(RecordingSleeper.class).delays())
                            .containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
                });
    }

    @Test
    void invalidJitterFailsStartup() {
        runner.withPropertyValues("retry.jitter-spread=1.5")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).rootCause()
                            .isInstanceOf(RetryConfigurationException.class);
                });
    }

    @Test
    void disabledRetryRegistersNothing() {
        runner.withPropertyValues("retry.enabled=false")
                .run(context -> assertThat(context)
                        .doesNotHaveBean(RetryExecutor.class)
                        .doesNotHaveBean(StrategyRegistry.class)
                        .doesNotHaveBean(MetricsRetryListener.class));
    }

    @Test
    void retryableBeansAreProxiedAndRetried() {
        runner.withUserConfiguration(ServiceConfig.class)
                .withPropertyValues("retry.linear.interval=20ms")
                .run(context -> {
                    InventoryClient client = context.getBean(InventoryClient.class);
                    assertThat(AopUtils.isAopProxy(client)).isTrue();

                    assertThat(client.reserve()).isEqualTo("reserved");
                    assertThat(context.getBean(RecordingSleeper.class).delays())
                            .containsExactly(Duration.ofMillis(20), Duration.ofMillis(20));
                });
    }

    @Test
    void annotationSupportCanBeSwitchedOff() {
        runner.withUserConfiguration(ServiceConfig.class)
                .withPropertyValues("retry.annotation.enabled=false")
                .run(context -> {
                    assertThat(context).doesNotHaveBean(RetryableAnnotationBeanPostProcessor.class);
                    assertThat(AopUtils.isAopProxy(context.getBean(InventoryClient.class))).isFalse();
                });
    }

    @Test
    void strategyProviderBeansAreResolvable() {
        runner.withBean("halfSecondProvider", StrategyProvider.class, () -> HALF_SECOND)
                .withPropertyValues("retry.strategy=spi:halfSecond", "retry.max-attempts=2")
                .run(context -> {
                    assertThat(context.getBean(StrategyRegistry.class).names()).contains("halfsecond");

                    RetryExecutor executor = context.getBean(RetryExecutor.class);
                    assertThatThrownBy(() -> executor.execute(() -> {
                        throw new IllegalStateException("down");
                    })).isInstanceOf(OperationFailedException.class);
                    assertThat(context.getBean(RecordingSleeper.class).delays())
                            .containsExactly(Duration.ofMillis(500));
                });
    }

    @Test
    void outcomesAreWrittenToDiscoveredMeterRegistry() {
        runner.withBean(SimpleMeterRegistry.class, SimpleMeterRegistry::new)
                .withPropertyValues("retry.max-attempts=2")
                .run(context -> {
                    RetryExecutor executor = context.getBean(RetryExecutor.class);
                    assertThatThrownBy(() -> executor.execute(() -> {
                        throw new IllegalStateException("down");
                    })).isInstanceOf(OperationFailedException.class);

                    SimpleMeterRegistry registry = context.getBean(SimpleMeterRegistry.class);
                    assertThat(context.getBean(RetryMeterRegistryProvider.class).getRegistry()).isSameAs(registry);
                    assertThat(registry.get("retry.exhausted").counter().count()).isEqualTo(1.0);
                    assertThat(registry.get("retry.failed.attempt").counter().count()).isEqualTo(2.0);
                });
    }

    @Configuration(proxyBeanMethods = false)
    static class ServiceConfig {

        @Bean
        InventoryClient inventoryClient() {
            return new InventoryClient();
        }
    }

    public static class InventoryClient {

        private final AtomicInteger calls = new AtomicInteger();

        @Retryable(maxAttempts = 3)
        public String reserve() {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("stock service unavailable");
            }
            return "reserved";
        }
    }
}
