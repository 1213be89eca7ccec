package com.retryable.config;

import com.retryable.core.RetryPolicy;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 重试默认配置（绑定前缀：retryable）
 *
 * YAML 示例：
 * retryable:
 *   enabled: true
 *   name: retryable
 *   max-attempts: 3
 *   backoff-multiplier: 2.0
 *   initial-delay: 1s
 *   deny-list:
 *     - java.lang.IllegalArgumentException
 *   metrics:
 *     enabled: true
 *     local-registry: true
 *     tags:
 *       app: order-service
 *
 * 退避倍数/初始延迟的合法性在调用时校验（仅当 max-attempts > 0）
 */
@Validated
@ConfigurationProperties(prefix = "retryable")
public class RetryableProperties {

    /** 是否拦截 @Retryable 方法 */
    private boolean enabled = true;

    /** 默认策略名称（日志/指标标签） */
    @NotNull
    private String name = RetryPolicy.DEFAULT_NAME;

    /** 首次执行之后的重试次数, <= 0 不重试 */
    private int maxAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;

    /** 退避倍数 */
    private double backoffMultiplier = RetryPolicy.DEFAULT_BACKOFF_MULTIPLIER;

    /** 首次重试前的延迟（Duration 写法：500ms / 1s） */
    @NotNull
    private Duration initialDelay = RetryPolicy.DEFAULT_INITIAL_DELAY;

    /** 不重试的异常类型（全限定类名） */
    private List<Class<? extends Throwable>> denyList = new ArrayList<>();

    private Metrics metrics = new Metrics();

    public static class Metrics {
        /** 是否记录 Micrometer 指标 */
        private boolean enabled = true;

        /** 是否附带本地 SimpleMeterRegistry（未接入监控系统时也能读取） */
        private boolean localRegistry = true;

        /** 附加到所有重试指标上的公共标签 */
        private Map<String, String> tags = new LinkedHashMap<>();

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public boolean isLocalRegistry() { return localRegistry; }
        public void setLocalRegistry(boolean localRegistry) { this.localRegistry = localRegistry; }
        public Map<String, String> getTags() { return tags; }
        public void setTags(Map<String, String> tags) { this.tags = tags; }
    }

    /**
     * 按配置生成策略构建器, 其余参数（谓词、监听器等）由调用方补充
     */
    public RetryPolicy.RetryPolicyBuilder toPolicyBuilder() {
        return RetryPolicy.builder()
                .name(name)
                .maxAttempts(maxAttempts)
                .backoffMultiplier(backoffMultiplier)
                .initialDelay(initialDelay)
                .denyList(denyList);
    }

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public double getBackoffMultiplier() { return backoffMultiplier; }
    public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }
    public Duration getInitialDelay() { return initialDelay; }
    public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }
    public List<Class<? extends Throwable>> getDenyList() { return denyList; }
    public void setDenyList(List<Class<? extends Throwable>> denyList) { this.denyList = denyList; }
    public Metrics getMetrics() { return metrics; }
    public void setMetrics(Metrics metrics) { this.metrics = metrics; }
}
