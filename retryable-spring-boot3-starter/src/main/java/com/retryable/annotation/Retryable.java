package com.retryable.annotation;

import com.retryable.core.spi.RetryPredicate;

import java.lang.annotation.*;

/**
 * 对 Spring Bean 方法启用重试, 通过代理调用时生效
 * 未设置的属性沿用全局默认策略（retryable.* 配置）
 * 标注在类型上时对所有 public 方法生效, 方法上的标注优先
 */
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
public @interface Retryable {

    /** 未设置的重试次数 */
    int UNSET_ATTEMPTS = Integer.MIN_VALUE;

    /** 策略名称, 为空时取 类名.方法名 */
    String name() default "";

    /** 首次执行之后的重试次数, <= 0 不重试 */
    int maxAttempts() default UNSET_ATTEMPTS;

    /** 首次重试前的延迟, 如 "500ms"、"2s"、"PT1S" */
    String initialDelay() default "";

    /** 退避倍数 */
    double backoffMultiplier() default Double.NaN;

    /** 不重试的异常类型, 非空时替换全局配置 */
    Class<? extends Throwable>[] denyList() default {};

    /** 重试谓词, 存在该类型的 Bean 时优先使用 Bean */
    Class<? extends RetryPredicate> predicate() default RetryPredicate.class;
}
