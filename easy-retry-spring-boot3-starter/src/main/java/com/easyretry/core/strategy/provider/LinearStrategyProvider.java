package com.easyretry.core.strategy.provider;

import com.easyretry.config.RetryProperties;
import com.easyretry.core.spi.RetryStrategy;
import com.easyretry.core.spi.StrategyProvider;
import com.easyretry.core.strategy.LinearStrategy;

public class LinearStrategyProvider implements StrategyProvider {

    public static final String NAME = "linear";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public RetryStrategy create(RetryProperties props) {
        return new LinearStrategy(props.getLinear().getInterval(), props.strategyConfig());
    }
}
