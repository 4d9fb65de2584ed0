package com.easyretry.core.interceptor;

import com.easyretry.annotation.Retryable;
import com.easyretry.config.RetryProperties;
import com.easyretry.core.RetryableOperation;
import com.easyretry.core.engine.RetryExecutor;
import com.easyretry.core.filter.ExceptionFilter;
import com.easyretry.core.spi.RetryListener;
import com.easyretry.core.spi.Sleeper;
import com.easyretry.core.strategy.StrategyRegistry;
import org.aopalliance.intercept.MethodInterceptor;
import org.aopalliance.intercept.MethodInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.ProxyMethodInvocation;
import org.springframework.aop.support.AopUtils;
import org.springframework.core.MethodClassKey;
import org.springframework.core.annotation.AnnotatedElementUtils;

import java.lang.reflect.Method;
import java.lang.reflect.UndeclaredThrowableException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 拦截 @Retryable 方法, 每次调用走一次完整的重试序列
 * 执行器按 方法+目标类 缓存, 策略实例仍按调用新建
 */
public class RetryableMethodInterceptor implements MethodInterceptor {

    private static final Logger log = LoggerFactory.getLogger(RetryableMethodInterceptor.class);

    private final StrategyRegistry registry;

    private final RetryProperties props;

    private final List<RetryListener> listeners;

    private final Sleeper sleeper;

    private final Map<MethodClassKey, RetryExecutor> executors = new ConcurrentHashMap<>();

    public RetryableMethodInterceptor(StrategyRegistry registry, RetryProperties props,
                                      List<RetryListener> listeners, Sleeper sleeper) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.props = Objects.requireNonNull(props, "props");
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public Object invoke(MethodInvocation invocation) throws Throwable {
        Method method = invocation.getMethod();
        Class<?> targetClass = invocation.getThis() != null
                ? AopUtils.getTargetClass(invocation.getThis()) : method.getDeclaringClass();
        Retryable retryable = findRetryable(method, targetClass);
        if (retryable == null) {
            return invocation.proceed();
        }
        RetryExecutor executor = executors.computeIfAbsent(new MethodClassKey(method, targetClass),
                k -> build(retryable, method, targetClass));

        // 每次尝试都从当前拦截器之后重新执行调用链
        RetryableOperation<Object> op = () -> proceed(invocation instanceof ProxyMethodInvocation pmi
                ? pmi.invocableClone() : invocation);
        return executor.execute(op);
    }

    private static Object proceed(MethodInvocation mi) throws Exception {
        try {
            return mi.proceed();
        } catch (Exception | Error e) {
            throw e;
        } catch (Throwable t) {
            throw new UndeclaredThrowableException(t);
        }
    }

    private static Retryable findRetryable(Method method, Class<?> targetClass) {
        Method specific = AopUtils.getMostSpecificMethod(method, targetClass);
        Retryable r = AnnotatedElementUtils.findMergedAnnotation(specific, Retryable.class);
        if (r == null && specific != method) {
            r = AnnotatedElementUtils.findMergedAnnotation(method, Retryable.class);
        }
        if (r == null) {
            r = AnnotatedElementUtils.findMergedAnnotation(targetClass, Retryable.class);
        }
        return r;
    }

    /**
     * 注解属性覆盖全局配置后构建执行器, 参数非法在首次调用时抛出
     */
    RetryExecutor build(Retryable r, Method method, Class<?> targetClass) {
        RetryProperties merged = props.copy();
        if (!r.strategy().isBlank()) {
            merged.setStrategy(r.strategy());
        }
        if (r.maxAttempts() > 0) {
            merged.setMaxAttempts(r.maxAttempts());
        }
        if (r.jitterSpread() >= 0) {
            merged.setJitterSpread(r.jitterSpread());
        }
        if (r.intervalMs() >= 0) {
            merged.getLinear().setInterval(Duration.ofMillis(r.intervalMs()));
        }
        if (r.startIntervalMs() >= 0) {
            merged.getBackoff().setStartInterval(Duration.ofMillis(r.startIntervalMs()));
        }
        if (r.maxIntervalMs() >= 0) {
            merged.getBackoff().setMaxInterval(Duration.ofMillis(r.maxIntervalMs()));
        }

        ExceptionFilter filter = r.retryOn().length == 0 ? ExceptionFilter.any() : ExceptionFilter.of(r.retryOn());
        if (r.noRetryOn().length > 0) {
            filter = filter.and(ExceptionFilter.of(r.noRetryOn()).negate());
        }

        String name = r.name().isBlank() ? targetClass.getSimpleName() + "#" + method.getName() : r.name();
        RetryExecutor executor = RetryExecutor.builder()
                .name(name)
                .strategy(registry.factory(merged))
                .retryOn(filter)
                .listeners(listeners)
                .sleeper(sleeper)
                .timeout(merged.getTimeout())
                .build();
        log.debug("[Retry-Interceptor] built executor for {}, strategy={}, maxAttempts={}",
                name, merged.getStrategy(), merged.getMaxAttempts());
        return executor;
    }
}
