package com.retryable.autoconfig;

import com.retryable.config.RetryableProperties;
import com.retryable.core.metric.MetricsRetryListener;
import com.retryable.core.metric.RetryMeterRegistryProvider;
import com.retryable.core.metric.RetryMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

@AutoConfiguration
@EnableConfigurationProperties(RetryableProperties.class)
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnProperty(prefix = "retryable.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RetryableMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public RetryMeterRegistryProvider retryMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered,
                                                                 RetryableProperties props) {
        RetryableProperties.Metrics metrics = props.getMetrics();
        return new RetryMeterRegistryProvider(discovered.orderedStream().collect(Collectors.toList()),
                metrics.isLocalRegistry(), metrics.getTags());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryMetrics retryMetrics(RetryMeterRegistryProvider provider) {
        return RetryMetrics.create(provider.getRegistry());
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsRetryListener metricsRetryListener(RetryMetrics meter) {
        return new MetricsRetryListener(meter);
    }
}
