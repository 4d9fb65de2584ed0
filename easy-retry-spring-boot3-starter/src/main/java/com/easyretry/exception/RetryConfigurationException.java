package com.easyretry.exception;

/**
 * 策略参数非法（jitterSpread 越界、maxAttempts 非正数等）
 * 构造期同步抛出, 不参与重试
 */
public class RetryConfigurationException extends IllegalArgumentException {

    public RetryConfigurationException(String message) {
        super(message);
    }
}
