package com.retryable.model;

import com.retryable.model.enums.FailureSource;
import lombok.Getter;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * 一次执行产生的失败（不可变）
 * 不修改原异常, 重试次数作为独立字段携带
 */
@Getter
public final class Failure {

    private final Throwable cause;
    private final FailureSource source;
    /** 产生该失败的执行序号（从1开始） */
    private final int attempt;
    /** 至少发生过一次重试时才有值, 等于已执行次数 */
    private final OptionalInt retryCount;

    private Failure(Throwable cause, FailureSource source, int attempt, OptionalInt retryCount) {
        this.cause = Objects.requireNonNull(cause, "cause");
        this.source = source;
        this.attempt = attempt;
        this.retryCount = retryCount;
    }

    public static Failure ofOperation(Throwable cause, int attempt) {
        return new Failure(cause, FailureSource.OPERATION, attempt, OptionalInt.empty());
    }

    public static Failure ofPredicate(Throwable cause, int attempt) {
        return new Failure(cause, FailureSource.PREDICATE, attempt, OptionalInt.empty());
    }

    /**
     * 附加重试次数, 返回新实例
     */
    public Failure withRetryCount(int count) {
        return new Failure(cause, source, attempt, OptionalInt.of(count));
    }

    public boolean isInstanceOf(Class<? extends Throwable> kind) {
        return kind.isInstance(cause);
    }

    public Class<? extends Throwable> kind() {
        return cause.getClass();
    }

    @Override
    public String toString() {
        return "Failure{source=" + source + ", attempt=" + attempt
                + ", retryCount=" + retryCount + ", cause=" + cause + "}";
    }
}
