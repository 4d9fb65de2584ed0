package com.easyretry.core.filter;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 异常过滤器：匹配的异常进入重试, 其余原样抛出
 */
@FunctionalInterface
public interface ExceptionFilter {

    boolean matches(Throwable t);

    /**
     * 默认：任意 {@link Exception}
     */
    static ExceptionFilter any() {
        return t -> t instanceof Exception;
    }

    /**
     * 异常本身是给定类型之一（含子类）
     */
    @SafeVarargs
    static ExceptionFilter of(Class<? extends Throwable>... types) {
        List<Class<? extends Throwable>> list = copy(types);
        return t -> list.stream().anyMatch(c -> c.isInstance(t));
    }

    /**
     * 展开 cause 链, 先本体再逐级 cause, 任一匹配即可
     */
    @SafeVarargs
    static ExceptionFilter causedBy(Class<? extends Throwable>... types) {
        List<Class<? extends Throwable>> list = copy(types);
        return t -> {
            for (Throwable e = t; e != null; e = e.getCause()) {
                Throwable cur = e;
                if (list.stream().anyMatch(c -> c.isInstance(cur))) {
                    return true;
                }
                // 自引用 cause 链
                if (e.getCause() == e) {
                    break;
                }
            }
            return false;
        };
    }

    default ExceptionFilter and(ExceptionFilter other) {
        Objects.requireNonNull(other, "other");
        return t -> matches(t) && other.matches(t);
    }

    default ExceptionFilter or(ExceptionFilter other) {
        Objects.requireNonNull(other, "other");
        return t -> matches(t) || other.matches(t);
    }

    default ExceptionFilter negate() {
        return t -> !matches(t);
    }

    private static List<Class<? extends Throwable>> copy(Class<? extends Throwable>[] types) {
        Objects.requireNonNull(types, "types");
        if (types.length == 0) {
            throw new IllegalArgumentException("at least one exception type is required");
        }
        return List.copyOf(Arrays.asList(types));
    }
}
