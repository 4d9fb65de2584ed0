package com.easyretry.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 重试序列状态
 */
@AllArgsConstructor
@Getter
public enum RetryOutcome {
    RUNNING(0, "执行中, 非终态"),
    SUCCEEDED(1, "操作成功返回, 终态"),
    ABORTED_UNMATCHED(2, "异常未匹配过滤器, 原样抛出, 终态"),
    EXHAUSTED(3, "次数或超时耗尽, 抛出聚合异常, 终态"),
    CANCELLED(4, "等待期间线程被中断, 终态")
    ;

    public final int code;
    public final String desc;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
