package com.rummikub.engine;

import java.util.Objects;
import java.util.function.Function;

/**
 * 规则检查/状态转换的结果：要么成功并携带值，要么失败并携带违例
 *
 * @param <T> 成功时的值类型
 */
public final class Outcome<T> {

    private static final Outcome<Void> PASSED = new Outcome<>(null, null, null);

    private final T value;
    private final RuleViolation violation;
    private final String detail;

    private Outcome(T value, RuleViolation violation, String detail) {
        this.value = value;
        this.violation = violation;
        this.detail = detail;
    }

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "value"), null, null);
    }

    /**
     * 不带值的检查通过
     */
    public static Outcome<Void> passed() {
        return PASSED;
    }

    public static <T> Outcome<T> rejected(RuleViolation violation) {
        return rejected(violation, violation.getDefaultMessage());
    }

    public static <T> Outcome<T> rejected(RuleViolation violation, String detail) {
        return new Outcome<>(null, Objects.requireNonNull(violation, "violation"), detail);
    }

    public boolean isOk() {
        return violation == null;
    }

    public boolean isRejected() {
        return violation != null;
    }

    /**
     * 成功的值
     * @throws IllegalStateException 结果是失败的
     */
    public T getValue() {
        if (violation != null) {
            throw new IllegalStateException("结果被拒绝，没有值：" + violation.getCode());
        }
        return value;
    }

    public RuleViolation getViolation() {
        return violation;
    }

    public String getDetail() {
        return detail;
    }

    /**
     * 失败结果换成另一种值类型（违例和说明保持不变）
     */
    public <U> Outcome<U> propagate() {
        if (violation == null) {
            throw new IllegalStateException("成功的结果不能按失败传递");
        }
        return new Outcome<>(null, violation, detail);
    }

    public <X extends RuntimeException> T orElseThrow(Function<Outcome<T>, X> exceptionFactory) {
        if (violation != null) {
            throw exceptionFactory.apply(this);
        }
        return value;
    }

    @Override
    public String toString() {
        return violation == null ? "Ok(" + value + ")" : "Rejected(" + violation.getCode() + ": " + detail + ")";
    }
}
