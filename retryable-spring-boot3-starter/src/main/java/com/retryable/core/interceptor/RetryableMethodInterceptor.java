package com.retryable.core.interceptor;

import com.retryable.annotation.Retryable;
import com.retryable.core.RetryPolicy;
import com.retryable.core.function.CheckedSupplier;
import com.retryable.core.spi.RetryPredicate;
import lombok.extern.slf4j.Slf4j;
import org.aopalliance.intercept.MethodInterceptor;
import org.aopalliance.intercept.MethodInvocation;
import org.springframework.aop.ProxyMethodInvocation;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.BeanUtils;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.util.ClassUtils;
import org.springframework.util.StringUtils;

import java.lang.reflect.Method;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * {@link Retryable} 方法拦截
 * 每个方法解析一次注解生成 {@link RetryPolicy} 并缓存, 每次尝试重新走一遍后续拦截链
 */
@Slf4j
public class RetryableMethodInterceptor implements MethodInterceptor {

    /** 全局默认策略, 延迟获取 */
    private final Supplier<RetryPolicy> defaults;

    /** 可为空 */
    private final BeanFactory beanFactory;

    private final Map<Method, RetryPolicy> policies = new ConcurrentHashMap<>(64);

    public RetryableMethodInterceptor(Supplier<RetryPolicy> defaults, BeanFactory beanFactory) {
        this.defaults = defaults;
        this.beanFactory = beanFactory;
    }

    @Override
    public Object invoke(MethodInvocation invocation) throws Throwable {
        Class<?> targetClass = invocation.getThis() != null
                ? AopUtils.getTargetClass(invocation.getThis())
                : invocation.getMethod().getDeclaringClass();
        Method method = AopUtils.getMostSpecificMethod(invocation.getMethod(), targetClass);
        RetryPolicy policy = policies.computeIfAbsent(method, m -> buildPolicy(m, targetClass));

        CheckedSupplier<Object> attempt = () -> {
            // 拦截链只能前进一次, 每次尝试使用副本
            MethodInvocation mi = invocation instanceof ProxyMethodInvocation pmi
                    ? pmi.invocableClone()
                    : invocation;
            try {
                return mi.proceed();
            } catch (Exception | Error e) {
                throw e;
            } catch (Throwable t) {
                throw new UndeclaredThrowableException(t);
            }
        };
        return policy.execute(attempt);
    }

    /**
     * 方法注解优先于类注解, 未设置的属性沿用默认策略
     */
    RetryPolicy buildPolicy(Method method, Class<?> targetClass) {
        Retryable ann = AnnotatedElementUtils.findMergedAnnotation(method, Retryable.class);
        if (ann == null) {
            ann = AnnotatedElementUtils.findMergedAnnotation(targetClass, Retryable.class);
        }
        RetryPolicy base = defaults.get();
        if (ann == null) {
            return base;
        }

        RetryPolicy.RetryPolicyBuilder b = base.toBuilder();
        b.name(StringUtils.hasText(ann.name())
                ? ann.name()
                : ClassUtils.getShortName(targetClass) + "." + method.getName());
        if (ann.maxAttempts() != Retryable.UNSET_ATTEMPTS) {
            b.maxAttempts(ann.maxAttempts());
        }
        if (StringUtils.hasText(ann.initialDelay())) {
            b.initialDelay(DurationStyle.detectAndParse(ann.initialDelay()));
        }
        if (!Double.isNaN(ann.backoffMultiplier())) {
            b.backoffMultiplier(ann.backoffMultiplier());
        }
        if (ann.denyList().length > 0) {
            b.clearDenyList().denyList(Arrays.asList(ann.denyList()));
        }
        if (ann.predicate() != RetryPredicate.class) {
            b.retryPredicate(resolvePredicate(ann.predicate()));
        }
        RetryPolicy policy = b.build();
        log.debug("[Retryable] resolved {} for {}", policy, method);
        return policy;
    }

    private RetryPredicate resolvePredicate(Class<? extends RetryPredicate> type) {
        if (beanFactory != null) {
            RetryPredicate bean = beanFactory.getBeanProvider(type).getIfUnique();
            if (bean != null) {
                return bean;
            }
        }
        return BeanUtils.instantiateClass(type);
    }
}
