package com.easyretry.core.listener;

import com.easyretry.core.spi.RetryListener;
import com.easyretry.exception.OperationFailedException;
import com.easyretry.exception.RetryCancelledException;
import com.easyretry.model.ctx.RetryContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志监听, 默认启用
 */
public class LoggingRetryListener implements RetryListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingRetryListener.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void onSuccess(RetryContext ctx) {
        // 首次即成功不打印
        if (ctx.getAttempt() > 1) {
            log.info("[Retry-{}] name={}, attempts={}, elapsed={}ms",
                    ctx.getOutcome(), ctx.getName(), ctx.getAttempt(), ctx.getElapsed().toMillis());
        }
    }

    @Override
    public void onAborted(RetryContext ctx, Throwable error) {
        log.warn("[Retry-{}] name={}, attempts={}, err={}",
                ctx.getOutcome(), ctx.getName(), ctx.getAttempt(), truncate(error.toString()));
    }

    @Override
    public void onExhausted(RetryContext ctx, OperationFailedException failure) {
        log.error("[Retry-{}] name={}, attempts={}/{}, elapsed={}ms, lastErr={}",
                ctx.getOutcome(), ctx.getName(), ctx.getAttempt(), ctx.getMaxAttempts(),
                ctx.getElapsed().toMillis(), truncate(String.valueOf(failure.getCause())));
    }

    @Override
    public void onCancelled(RetryContext ctx, RetryCancelledException failure) {
        log.warn("[Retry-{}] name={}, attempts={}", ctx.getOutcome(), ctx.getName(), ctx.getAttempt());
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
