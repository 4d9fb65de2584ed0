package com.easyretry.core.interceptor;

import com.easyretry.annotation.Retryable;
import org.aopalliance.intercept.MethodInterceptor;
import org.springframework.aop.Pointcut;
import org.springframework.aop.framework.autoproxy.AbstractBeanFactoryAwareAdvisingPostProcessor;
import org.springframework.aop.support.ComposablePointcut;
import org.springframework.aop.support.DefaultPointcutAdvisor;
import org.springframework.aop.support.annotation.AnnotationMatchingPointcut;
import org.springframework.beans.factory.ObjectProvider;

/**
 * 为带 @Retryable 的 Bean 织入 {@link RetryableMethodInterceptor}
 * 拦截器延迟获取, 避免 BeanPostProcessor 提前初始化业务依赖
 */
public class RetryableAnnotationBeanPostProcessor extends AbstractBeanFactoryAwareAdvisingPostProcessor {

    public RetryableAnnotationBeanPostProcessor(ObjectProvider<RetryableMethodInterceptor> interceptor) {
        Pointcut pointcut = new ComposablePointcut(new AnnotationMatchingPointcut(Retryable.class, true))
                .union(new AnnotationMatchingPointcut(null, Retryable.class, true));
        MethodInterceptor lazy = invocation -> interceptor.getObject().invoke(invocation);
        this.advisor = new DefaultPointcutAdvisor(pointcut, lazy);
        setBeforeExistingAdvisors(true);
        setProxyTargetClass(true);
    }
}
