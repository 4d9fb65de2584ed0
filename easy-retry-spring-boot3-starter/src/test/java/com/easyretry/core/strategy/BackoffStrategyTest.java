package com.easyretry.core.strategy;

import com.easyretry.exception.RetryConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackoffStrategyTest {

    @Test
    void doublesUntilCapped() {
        BackoffStrategy strategy = new BackoffStrategy(Duration.ofSeconds(1), Duration.ofSeconds(8), StrategyConfig.defaults());
        List<Long> seconds = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            seconds.add(strategy.advance().toSeconds());
        }
        assertThat(seconds).containsExactly(1L, 2L, 4L, 8L, 8L, 8L);
        assertThat(strategy.attempt()).isEqualTo(6);
    }

    @Test
    void capIsHitEvenWhenNotAPowerOfTwo() {
        BackoffStrategy strategy = new BackoffStrategy(Duration.ofMillis(300), Duration.ofMillis(1000), StrategyConfig.defaults());
        assertThat(strategy.advance()).isEqualTo(Duration.ofMillis(300));
        assertThat(strategy.advance()).isEqualTo(Duration.ofMillis(600));
        assertThat(strategy.advance()).isEqualTo(Duration.ofMillis(1000));
        assertThat(strategy.advance()).isEqualTo(Duration.ofMillis(1000));
    }

    @Test
    void defaultsKeepAOneSecondDelay() {
        BackoffStrategy strategy = new BackoffStrategy();
        assertThat(strategy.advance()).isEqualTo(Duration.ofSeconds(1));
        assertThat(strategy.advance()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void hugeCapDoesNotOverflow() {
        Duration max = Duration.ofSeconds(Long.MAX_VALUE);
        BackoffStrategy strategy = new BackoffStrategy(Duration.ofSeconds(Long.MAX_VALUE / 2 + 1), max,
                StrategyConfig.of(5, 0.0));
        strategy.advance();
        assertThat(strategy.advance()).isEqualTo(max);
        assertThat(strategy.advance()).isEqualTo(max);
    }

    @Test
    void jitteredHugeCapSaturatesInsteadOfFailing() {
        BackoffStrategy strategy = new BackoffStrategy(Duration.ofSeconds(Long.MAX_VALUE / 2 + 1),
                Duration.ofSeconds(Long.MAX_VALUE), StrategyConfig.of(5, 0.5), () -> 1.0);
        assertThat(strategy.advance()).isGreaterThan(Duration.ofSeconds(Long.MAX_VALUE / 2));
        assertThat(strategy.advance()).isEqualTo(Jitter.MAX_DELAY);
        assertThat(strategy.advance()).isEqualTo(Jitter.MAX_DELAY);
    }

    @Test
    void jitterAppliesToCurrentIntervalOnly() {
        BackoffStrategy strategy = new BackoffStrategy(Duration.ofSeconds(1), Duration.ofSeconds(8),
                StrategyConfig.of(10, 0.5), () -> 1.0);
        assertThat(strategy.advance()).isEqualTo(Duration.ofMillis(1500));
        assertThat(strategy.advance()).isEqualTo(Duration.ofMillis(3000));
        assertThat(strategy.advance()).isEqualTo(Duration.ofMillis(6000));
    }

    @Test
    void exhaustedAfterMaxAttemptsAdvances() {
        BackoffStrategy strategy = new BackoffStrategy(Duration.ofSeconds(1), Duration.ofSeconds(8), StrategyConfig.of(2, 0.0));
        strategy.advance();
        assertThat(strategy.attemptsExhausted()).isFalse();
        strategy.advance();
        assertThat(strategy.attemptsExhausted()).isTrue();
    }

    @Test
    void startAboveMaxIsRejected() {
        assertThatThrownBy(() -> new BackoffStrategy(Duration.ofSeconds(10), Duration.ofSeconds(1), StrategyConfig.defaults()))
                .isInstanceOf(RetryConfigurationException.class)
                .hasMessageContaining("maxInterval");
    }
}
