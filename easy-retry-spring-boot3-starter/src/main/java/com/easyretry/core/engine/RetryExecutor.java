package com.easyretry.core.engine;

import com.easyretry.core.RetryableOperation;
import com.easyretry.core.filter.ExceptionFilter;
import com.easyretry.core.spi.RetryListener;
import com.easyretry.core.spi.RetryStrategy;
import com.easyretry.core.spi.Sleeper;
import com.easyretry.core.strategy.LinearStrategy;
import com.easyretry.core.strategy.RetryStrategyFactory;
import com.easyretry.core.strategy.StrategyConfig;
import com.easyretry.exception.OperationFailedException;
import com.easyretry.exception.RetryCancelledException;
import com.easyretry.exception.RetryConfigurationException;
import com.easyretry.model.ctx.RetryContext;
import com.easyretry.model.enums.RetryOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.UndeclaredThrowableException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * 重试执行器
 * 调用操作 -> 失败则过滤/记录 -> 策略给出延迟 -> 等待 -> 再次调用,
 * 直到成功、异常不匹配、次数耗尽或被中断
 *
 * 实例不可变, 可在线程间共享; 策略与失败记录每次 execute 新建
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final String name;

    private final RetryStrategyFactory strategyFactory;

    private final ExceptionFilter filter;

    private final List<RetryListener> listeners;

    private final Sleeper sleeper;

    private final Clock clock;

    /** 总体超时, null 表示不限 */
    private final Duration timeout;

    private RetryExecutor(Builder b) {
        this.name = b.name;
        this.strategyFactory = b.strategyFactory;
        this.filter = b.filter;
        this.listeners = List.copyOf(b.listeners);
        this.sleeper = b.sleeper;
        this.clock = b.clock;
        this.timeout = b.timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RetryExecutor linear(Duration interval, StrategyConfig config) {
        return builder().strategy(RetryStrategyFactory.linear(interval, config)).build();
    }

    public static RetryExecutor backoff(Duration startInterval, Duration maxInterval, StrategyConfig config) {
        return builder().strategy(RetryStrategyFactory.backoff(startInterval, maxInterval, config)).build();
    }

    /**
     * 执行一次完整的重试序列
     *
     * @return 操作成功时的返回值
     * @throws OperationFailedException 次数或超时耗尽, reasons 为全部失败
     * @throws RetryCancelledException  线程被中断（等待期间或操作抛出 InterruptedException）
     * @throws Exception                不匹配过滤器的异常, 原样抛出
     */
    public <T> T execute(RetryableOperation<T> operation) throws Exception {
        Objects.requireNonNull(operation, "operation");
        RetryStrategy strategy = strategyFactory.create();
        List<Throwable> reasons = new ArrayList<>();
        Instant start = clock.instant();
        Instant deadline = timeout == null ? null : start.plus(timeout);
        int calls = 0;

        while (true) {
            calls++;
            try {
                T result = operation.call();
                RetryContext ctx = context(strategy, calls, start, RetryOutcome.SUCCEEDED, reasons);
                if (calls > 1) {
                    log.debug("[Retry-Executor] {} succeeded on attempt {}", name, calls);
                }
                fire(l -> l.onSuccess(ctx));
                return result;
            } catch (Throwable t) {
                // 操作内部被中断, 与等待期间中断同样处理
                if (t instanceof InterruptedException ie) {
                    throw cancelled(strategy, calls, start, reasons, ie);
                }
                if (!filter.matches(t)) {
                    RetryContext ctx = context(strategy, calls, start, RetryOutcome.ABORTED_UNMATCHED, reasons);
                    log.debug("[Retry-Executor] {} aborted on attempt {}, unmatched {}", name, calls, t.toString());
                    fire(l -> l.onAborted(ctx, t));
                    throw rethrow(t);
                }
                reasons.add(t);

                Duration delay = strategy.advance();
                if (strategy.attemptsExhausted()) {
                    throw exhausted(strategy, calls, start, reasons,
                            new OperationFailedException(reasons));
                }
                if (deadline != null && nonNegative(delay).compareTo(Duration.between(clock.instant(), deadline)) > 0) {
                    throw exhausted(strategy, calls, start, reasons,
                            new OperationFailedException("operation timed out after " + calls + " attempt(s)", reasons));
                }

                RetryContext ctx = context(strategy, calls, start, RetryOutcome.RUNNING, reasons);
                log.debug("[Retry-Executor] {} attempt {}/{} failed: {}, next in {}",
                        name, calls, strategy.config().getMaxAttempts(), t.toString(), nonNegative(delay));
                fire(l -> l.onFailedAttempt(ctx, t, delay));

                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    throw cancelled(strategy, calls, start, reasons, ie);
                }
            }
        }
    }

    /**
     * 包装为每次调用都执行完整重试序列的操作
     */
    public <T> RetryableOperation<T> decorate(RetryableOperation<T> operation) {
        Objects.requireNonNull(operation, "operation");
        return () -> execute(operation);
    }

    private OperationFailedException exhausted(RetryStrategy strategy, int calls, Instant start,
                                               List<Throwable> reasons, OperationFailedException failure) {
        RetryContext ctx = context(strategy, calls, start, RetryOutcome.EXHAUSTED, reasons);
        log.warn("[Retry-Executor] {} exhausted after {} attempt(s), last error: {}",
                name, calls, reasons.get(reasons.size() - 1).toString());
        fire(l -> l.onExhausted(ctx, failure));
        return failure;
    }

    /**
     * 恢复中断标记并结束序列, reasons 为中断前已记录的失败
     */
    private RetryCancelledException cancelled(RetryStrategy strategy, int calls, Instant start,
                                              List<Throwable> reasons, InterruptedException ie) {
        Thread.currentThread().interrupt();
        RetryCancelledException cancelled = new RetryCancelledException(reasons, ie);
        RetryContext ctx = context(strategy, calls, start, RetryOutcome.CANCELLED, reasons);
        log.info("[Retry-Executor] {} cancelled after {} attempt(s)", name, calls);
        fire(l -> l.onCancelled(ctx, cancelled));
        return cancelled;
    }

    private RetryContext context(RetryStrategy strategy, int calls, Instant start,
                                 RetryOutcome outcome, List<Throwable> reasons) {
        return RetryContext.builder()
                .name(name)
                .attempt(calls)
                .maxAttempts(strategy.config().getMaxAttempts())
                .elapsed(Duration.between(start, clock.instant()))
                .outcome(outcome)
                .reasons(List.copyOf(reasons))
                .build();
    }

    private void fire(Consumer<RetryListener> event) {
        for (RetryListener l : listeners) {
            try {
                event.accept(l);
            } catch (RuntimeException e) {
                log.warn("[Retry-Executor] listener {} failed", l.name(), e);
            }
        }
    }

    private static Exception rethrow(Throwable t) {
        if (t instanceof Error e) {
            throw e;
        }
        if (t instanceof Exception e) {
            return e;
        }
        return new UndeclaredThrowableException(t);
    }

    private static Duration nonNegative(Duration d) {
        return d.isNegative() ? Duration.ZERO : d;
    }

    public String getName() { return name; }

    public Duration getTimeout() { return timeout; }

    public List<RetryListener> getListeners() { return listeners; }

    public static final class Builder {

        private String name = "retry";

        private RetryStrategyFactory strategyFactory =
                RetryStrategyFactory.linear(LinearStrategy.DEFAULT_INTERVAL, StrategyConfig.defaults());

        private ExceptionFilter filter = ExceptionFilter.any();

        private final List<RetryListener> listeners = new ArrayList<>();

        private Sleeper sleeper = ThreadSleeper.INSTANCE;

        private Clock clock = Clock.systemUTC();

        private Duration timeout;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        public Builder strategy(RetryStrategyFactory strategyFactory) {
            this.strategyFactory = Objects.requireNonNull(strategyFactory, "strategyFactory");
            return this;
        }

        public Builder retryOn(ExceptionFilter filter) {
            this.filter = Objects.requireNonNull(filter, "filter");
            return this;
        }

        @SafeVarargs
        public final Builder retryOn(Class<? extends Throwable>... types) {
            return retryOn(ExceptionFilter.of(types));
        }

        public Builder listener(RetryListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        public Builder listeners(List<? extends RetryListener> listeners) {
            if (listeners != null) {
                listeners.forEach(this::listener);
            }
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * 总体超时：下一次等待若会越过 start + timeout, 直接按耗尽处理
         */
        public Builder timeout(Duration timeout) {
            if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
                throw new RetryConfigurationException("timeout must be positive, got " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public RetryExecutor build() {
            return new RetryExecutor(this);
        }
    }
}
