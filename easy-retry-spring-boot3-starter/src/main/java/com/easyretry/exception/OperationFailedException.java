package com.easyretry.exception;

import java.util.List;

/**
 * 重试次数耗尽后抛出的聚合异常
 * reasons 按尝试顺序保存每一次被捕获的异常
 */
public class OperationFailedException extends RuntimeException {

    private final List<Throwable> reasons;

    public OperationFailedException(List<Throwable> reasons) {
        this(message(reasons), reasons);
    }

    public OperationFailedException(String message, List<Throwable> reasons) {
        super(message, last(reasons));
        this.reasons = List.copyOf(reasons);
        // 最后一次作为 cause, 其余挂到 suppressed 便于排查
        for (int i = 0; i < this.reasons.size() - 1; i++) {
            addSuppressed(this.reasons.get(i));
        }
    }

    /** 每次失败的异常, 按尝试顺序 */
    public List<Throwable> getReasons() {
        return reasons;
    }

    private static String message(List<Throwable> reasons) {
        return "operation failed after " + reasons.size() + " attempt(s)";
    }

    private static Throwable last(List<Throwable> reasons) {
        return reasons.isEmpty() ? null : reasons.get(reasons.size() - 1);
    }
}
