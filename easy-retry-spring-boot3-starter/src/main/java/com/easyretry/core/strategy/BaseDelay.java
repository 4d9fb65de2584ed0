package com.easyretry.core.strategy;

import java.time.Duration;

/**
 * 自定义策略的基础延迟（抖动前）
 */
@FunctionalInterface
public interface BaseDelay {

    /**
     * @param attempt 已失败的次数, 从 1 开始
     */
    Duration next(int attempt);
}
