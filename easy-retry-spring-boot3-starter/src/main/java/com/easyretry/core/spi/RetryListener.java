package com.easyretry.core.spi;

import com.easyretry.exception.OperationFailedException;
import com.easyretry.exception.RetryCancelledException;
import com.easyretry.model.ctx.RetryContext;

import java.time.Duration;

/**
 * 重试序列事件监听
 * 同步回调, 抛出的异常只记录日志, 不影响重试结果
 */
public interface RetryListener {

    /**
     * 返回监听器名称, 用于日志
     */
    default String name() {
        return getClass().getSimpleName();
    }

    /** 可重试的失败, 即将等待 delay 后再次尝试 */
    default void onFailedAttempt(RetryContext ctx, Throwable error, Duration delay) {
    }

    default void onSuccess(RetryContext ctx) {
    }

    /** 异常不匹配过滤器, 原样抛出 */
    default void onAborted(RetryContext ctx, Throwable error) {
    }

    default void onExhausted(RetryContext ctx, OperationFailedException failure) {
    }

    default void onCancelled(RetryContext ctx, RetryCancelledException failure) {
    }
}
