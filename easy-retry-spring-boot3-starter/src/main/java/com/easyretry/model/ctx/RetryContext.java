package com.easyretry.model.ctx;

import com.easyretry.model.enums.RetryOutcome;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.util.List;

/**
 * 监听器可见的重试序列快照
 */
@Getter
@Builder
@ToString(exclude = "reasons")
public class RetryContext {

    /** 序列名称（方法签名或自定义） */
    private final String name;

    /** 已调用操作的次数 */
    private final int attempt;

    private final int maxAttempts;

    /** 自序列开始的耗时 */
    private final Duration elapsed;

    private final RetryOutcome outcome;

    /** 已记录的失败, 按尝试顺序 */
    @Builder.Default
    private final List<Throwable> reasons = List.of();
}
