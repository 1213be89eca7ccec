package com.retryable.annotation;

import java.lang.annotation.*;

/**
 * 标注在配置类上, 控制 {@link Retryable} 方法拦截是否启用
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EnableRetryable {

    /**
     * 是否启动
     */
    boolean value() default true;
}
