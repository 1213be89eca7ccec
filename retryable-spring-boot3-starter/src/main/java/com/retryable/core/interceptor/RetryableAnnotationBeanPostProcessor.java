package com.retryable.core.interceptor;

import com.retryable.annotation.EnableRetryable;
import com.retryable.annotation.Retryable;
import com.retryable.core.RetryPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.Pointcut;
import org.springframework.aop.framework.autoproxy.AbstractBeanFactoryAwareAdvisingPostProcessor;
import org.springframework.aop.support.ComposablePointcut;
import org.springframework.aop.support.DefaultPointcutAdvisor;
import org.springframework.aop.support.annotation.AnnotationMatchingPointcut;
import org.springframework.beans.factory.BeanFactory;
import org.springframework.beans.factory.ListableBeanFactory;

/**
 * 为带 {@link Retryable} 的 Bean 创建代理
 * 存在 {@code @EnableRetryable(false)} 时不代理
 */
@Slf4j
public class RetryableAnnotationBeanPostProcessor extends AbstractBeanFactoryAwareAdvisingPostProcessor {

    /** 默认策略 Bean 名称 */
    public static final String DEFAULT_POLICY_BEAN = "retryablePolicy";

    public RetryableAnnotationBeanPostProcessor() {
        setBeforeExistingAdvisors(true);
    }

    @Override
    public void setBeanFactory(BeanFactory beanFactory) {
        super.setBeanFactory(beanFactory);
        if (!isEnabled(beanFactory)) {
            log.info("[Retryable] @EnableRetryable(false) found, method interception disabled");
            return;
        }
        Pointcut typeLevel = new AnnotationMatchingPointcut(Retryable.class, true);
        Pointcut methodLevel = new AnnotationMatchingPointcut(null, Retryable.class, true);
        RetryableMethodInterceptor interceptor =
                new RetryableMethodInterceptor(() -> defaultPolicy(beanFactory), beanFactory);
        this.advisor = new DefaultPointcutAdvisor(new ComposablePointcut(typeLevel).union(methodLevel), interceptor);
    }

    private static RetryPolicy defaultPolicy(BeanFactory beanFactory) {
        if (beanFactory.containsBean(DEFAULT_POLICY_BEAN)) {
            return beanFactory.getBean(DEFAULT_POLICY_BEAN, RetryPolicy.class);
        }
        return beanFactory.getBeanProvider(RetryPolicy.class).getIfUnique(RetryPolicy::defaults);
    }

    private static boolean isEnabled(BeanFactory beanFactory) {
        if (!(beanFactory instanceof ListableBeanFactory lbf)) {
            return true;
        }
        for (String name : lbf.getBeanNamesForAnnotation(EnableRetryable.class)) {
            EnableRetryable an = lbf.findAnnotationOnBean(name, EnableRetryable.class, false);
            if (an != null && !an.value()) {
                return false;
            }
        }
        return true;
    }
}
