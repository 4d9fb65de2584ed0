package com.easyretry.core.strategy;

import com.easyretry.exception.RetryConfigurationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LinearStrategyTest {

    @Test
    void everyDelayEqualsInterval() {
        LinearStrategy strategy = new LinearStrategy(Duration.ofMillis(750), StrategyConfig.of(20, 0.0));
        for (int i = 1; i <= 20; i++) {
            assertThat(strategy.advance()).isEqualTo(Duration.ofMillis(750));
            assertThat(strategy.attempt()).isEqualTo(i);
        }
    }

    @Test
    void defaultsToOneSecondAndTenAttempts() {
        LinearStrategy strategy = new LinearStrategy();
        assertThat(strategy.getInterval()).isEqualTo(Duration.ofSeconds(1));
        assertThat(strategy.config()).isEqualTo(StrategyConfig.defaults());
        assertThat(strategy.advance()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void exhaustedOnceCounterReachesMaxAttempts() {
        LinearStrategy strategy = new LinearStrategy(Duration.ofSeconds(1), StrategyConfig.of(3, 0.0));
        assertThat(strategy.attemptsExhausted()).isFalse();
        strategy.advance();
        strategy.advance();
        assertThat(strategy.attemptsExhausted()).isFalse();
        strategy.advance();
        assertThat(strategy.attemptsExhausted()).isTrue();
    }

    @Test
    void jitterIsAppliedToTheInterval() {
        LinearStrategy strategy = new LinearStrategy(Duration.ofSeconds(2), StrategyConfig.of(5, 0.25), () -> -1.0);
        assertThat(strategy.advance()).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    void negativeIntervalIsRejected() {
        assertThatThrownBy(() -> new LinearStrategy(Duration.ofSeconds(-1), StrategyConfig.defaults()))
                .isInstanceOf(RetryConfigurationException.class);
    }
}
