package com.retryable.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 重试指标使用的注册表
 * 按 retryable.metrics 配置组合：本地 Simple 注册表（可关）+ 容器中发现的注册表, 并附加公共标签
 */
@Slf4j
public class RetryMeterRegistryProvider {

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    /** 本地注册表, 关闭时为 null */
    private final SimpleMeterRegistry local;

    public RetryMeterRegistryProvider(List<MeterRegistry> discovered, boolean localRegistry, Map<String, String> commonTags) {
        this.local = localRegistry ? new SimpleMeterRegistry() : null;

        // 同一个注册表只挂一次, 嵌套的组合注册表展开
        Set<MeterRegistry> members = Collections.newSetFromMap(new IdentityHashMap<>());
        if (local != null) {
            members.add(local);
        }
        if (discovered != null) {
            for (MeterRegistry mr : discovered) {
                if (mr instanceof CompositeMeterRegistry c) {
                    members.addAll(c.getRegistries());
                } else {
                    members.add(mr);
                }
            }
        }
        members.forEach(composite::add);

        if (commonTags != null && !commonTags.isEmpty()) {
            List<Tag> tags = new ArrayList<>();
            commonTags.forEach((k, v) -> tags.add(Tag.of(k, v)));
            composite.config().commonTags(tags);
        }
        if (members.isEmpty()) {
            log.warn("[Retryable] no meter registry available, retry metrics will be dropped");
        }
        log.debug("[Retryable] metrics composite of {} registries, common tags {}", members.size(), commonTags);
    }

    public MeterRegistry getRegistry() { return composite; }

    /** 本地注册表, retryable.metrics.local-registry=false 时为 null */
    public SimpleMeterRegistry getLocalRegistry() { return local; }
}
