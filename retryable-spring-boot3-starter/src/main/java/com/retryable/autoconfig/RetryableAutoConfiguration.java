package com.retryable.autoconfig;

import com.retryable.config.RetryableProperties;
import com.retryable.core.RetryPolicy;
import com.retryable.core.interceptor.RetryableAnnotationBeanPostProcessor;
import com.retryable.core.spi.RetryListener;
import com.retryable.core.spi.Sleeper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Role;

import java.util.stream.Collectors;

/**
 * 默认重试策略及 @Retryable 方法拦截
 */
@AutoConfiguration(after = RetryableMetricsAutoConfiguration.class)
@EnableConfigurationProperties(RetryableProperties.class)
public class RetryableAutoConfiguration {

    /**
     * 全局默认策略, 收集容器中所有 RetryListener
     */
    @Bean(RetryableAnnotationBeanPostProcessor.DEFAULT_POLICY_BEAN)
    @ConditionalOnMissingBean(name = RetryableAnnotationBeanPostProcessor.DEFAULT_POLICY_BEAN)
    public RetryPolicy retryablePolicy(RetryableProperties props,
                                       ObjectProvider<RetryListener> listeners,
                                       ObjectProvider<Sleeper> sleeper) {
        RetryPolicy.RetryPolicyBuilder b = props.toPolicyBuilder()
                .listeners(listeners.orderedStream().collect(Collectors.toList()));
        sleeper.ifUnique(b::sleeper);
        return b.build();
    }

    /**
     * 注解代理, 需要早于普通 Bean 创建, 故为 static
     */
    @Bean
    @Role(BeanDefinition.ROLE_INFRASTRUCTURE)
    @ConditionalOnMissingBean(RetryableAnnotationBeanPostProcessor.class)
    @ConditionalOnProperty(prefix = "retryable", name = "enabled", havingValue = "true", matchIfMissing = true)
    public static RetryableAnnotationBeanPostProcessor retryableAnnotationBeanPostProcessor() {
        return new RetryableAnnotationBeanPostProcessor();
    }
}
