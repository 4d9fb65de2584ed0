package com.easyretry.core.listener;

import com.easyretry.core.metric.RetryMetrics;
import com.easyretry.core.spi.RetryListener;
import com.easyretry.exception.OperationFailedException;
import com.easyretry.exception.RetryCancelledException;
import com.easyretry.model.ctx.RetryContext;

import java.time.Duration;
import java.util.Objects;

/**
 * 指标监听, 把序列结果写入 {@link RetryMetrics}
 */
public class MetricsRetryListener implements RetryListener {

    private final RetryMetrics meter;

    public MetricsRetryListener(RetryMetrics meter) {
        this.meter = Objects.requireNonNull(meter, "meter");
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public void onFailedAttempt(RetryContext ctx, Throwable error, Duration delay) {
        meter.incFailedAttempt();
    }

    @Override
    public void onSuccess(RetryContext ctx) {
        meter.incSuccess();
        finish(ctx);
    }

    @Override
    public void onAborted(RetryContext ctx, Throwable error) {
        meter.incAborted();
        finish(ctx);
    }

    @Override
    public void onExhausted(RetryContext ctx, OperationFailedException failure) {
        // 最后一次失败不会触发 onFailedAttempt
        meter.incFailedAttempt();
        meter.incExhausted();
        finish(ctx);
    }

    @Override
    public void onCancelled(RetryContext ctx, RetryCancelledException failure) {
        meter.incCancelled();
        finish(ctx);
    }

    private void finish(RetryContext ctx) {
        meter.recordAttempts(ctx.getAttempt());
        meter.recordElapsed(ctx.getElapsed());
    }
}
