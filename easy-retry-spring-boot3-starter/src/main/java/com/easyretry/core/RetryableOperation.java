package com.easyretry.core;

/**
 * 被保护的操作
 * 返回即成功, 抛出异常即失败（是否重试由过滤器决定）
 */
@FunctionalInterface
public interface RetryableOperation<T> {

    T call() throws Exception;
}
