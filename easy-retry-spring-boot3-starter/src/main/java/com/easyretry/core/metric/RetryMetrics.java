package com.easyretry.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

public final class RetryMetrics {
    private final Counter success;
    private final Counter failedAttempt;
    private final Counter exhausted;
    private final Counter aborted;
    private final Counter cancelled;
    private final DistributionSummary attempts;
    private final Timer execTimer;

    private RetryMetrics(MeterRegistry reg) {
        this.success       = Counter.builder("retry.success").description("sequences succeeded").register(reg);
        this.failedAttempt = Counter.builder("retry.failed.attempt").description("retryable attempt failures").register(reg);
        this.exhausted     = Counter.builder("retry.exhausted").description("sequences exhausted").register(reg);
        this.aborted       = Counter.builder("retry.aborted").description("sequences aborted by unmatched error").register(reg);
        this.cancelled     = Counter.builder("retry.cancelled").description("sequences cancelled by interrupt").register(reg);
        this.attempts = DistributionSummary.builder("retry.attempts")
                .description("attempt count per sequence").baseUnit("times").register(reg);
        this.execTimer = Timer.builder("retry.exec.time").description("sequence elapsed time").register(reg);
    }

    public static RetryMetrics create(MeterRegistry reg) { return new RetryMetrics(reg); }

    public void incSuccess(){       success.increment(); }
    public void incFailedAttempt(){ failedAttempt.increment(); }
    public void incExhausted(){     exhausted.increment(); }
    public void incAborted(){       aborted.increment(); }
    public void incCancelled(){     cancelled.increment(); }
    public void recordAttempts(int n){ attempts.record(n); }
    public void recordElapsed(Duration d){ execTimer.record(d); }
}
