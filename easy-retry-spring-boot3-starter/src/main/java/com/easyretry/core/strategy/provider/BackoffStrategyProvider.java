package com.easyretry.core.strategy.provider;

import com.easyretry.config.RetryProperties;
import com.easyretry.core.spi.RetryStrategy;
import com.easyretry.core.spi.StrategyProvider;
import com.easyretry.core.strategy.BackoffStrategy;

public class BackoffStrategyProvider implements StrategyProvider {

    public static final String NAME = "backoff";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RetryStrategy create(RetryProperties props) {
        RetryProperties.Backoff b = props.getBackoff();
        return new BackoffStrategy(b.getStartInterval(), b.getMaxInterval(), props.strategyConfig());
    }
}
