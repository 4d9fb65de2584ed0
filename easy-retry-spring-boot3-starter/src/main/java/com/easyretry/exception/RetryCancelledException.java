package com.easyretry.exception;

import java.util.List;

/**
 * 等待下一次尝试时线程被中断
 * 携带中断前已记录的失败, 中断标记由执行器恢复
 */
public class RetryCancelledException extends RuntimeException {

    private final List<Throwable> reasons;

    public RetryCancelledException(List<Throwable> reasons, InterruptedException interrupted) {
        super("retry cancelled after " + reasons.size() + " attempt(s)", interrupted);
        this.reasons = List.copyOf(reasons);
    }

    public List<Throwable> getReasons() {
        return reasons;
    }
}
