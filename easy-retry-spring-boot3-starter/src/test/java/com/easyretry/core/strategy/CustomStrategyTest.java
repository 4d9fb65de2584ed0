package com.easyretry.core.strategy;

import com.easyretry.core.spi.RetryStrategy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CustomStrategyTest {

    @Test
    void baseDelayReceivesOneBasedAttempt() {
        List<Integer> seen = new ArrayList<>();
        CustomStrategy strategy = new CustomStrategy(attempt -> {
            seen.add(attempt);
            return Duration.ofMillis(100L * attempt);
        }, StrategyConfig.of(3, 0.0));

        assertThat(strategy.advance()).isEqualTo(Duration.ofMillis(100));
        assertThat(strategy.advance()).isEqualTo(Duration.ofMillis(200));
        assertThat(strategy.advance()).isEqualTo(Duration.ofMillis(300));
        assertThat(seen).containsExactly(1, 2, 3);
        assertThat(strategy.attemptsExhausted()).isTrue();
    }

    @Test
    void sharesJitterWithBuiltIns() {
        CustomStrategy strategy = new CustomStrategy(attempt -> Duration.ofSeconds(4), StrategyConfig.of(3, 0.5), () -> -0.5);
        assertThat(strategy.advance()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void factoryCreatesIndependentInstances() {
        RetryStrategyFactory factory = RetryStrategyFactory.custom(attempt -> Duration.ofMillis(attempt), StrategyConfig.of(5, 0.0));
        RetryStrategy first = factory.create();
        first.advance();
        first.advance();
        RetryStrategy second = factory.create();
        assertThat(second).isNotSameAs(first);
        assertThat(second.attempt()).isZero();
        assertThat(second.advance()).isEqualTo(Duration.ofMillis(1));
    }
}
