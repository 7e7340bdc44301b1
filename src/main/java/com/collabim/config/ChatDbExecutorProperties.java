package com.collabim.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * WS 入站事件里涉及落库/查库的操作（join_chat 校验、message_read 回执）使用的线程池配置。
 */
@ConfigurationProperties(prefix = "collab.executors.db")
public record ChatDbExecutorProperties(
        Integer corePoolSize,
        Integer maxPoolSize,
        Integer queueCapacity
) {

    public int corePoolSizeEffective() {
        return corePoolSize == null ? 8 : Math.max(1, corePoolSize);
    }

    public int maxPoolSizeEffective() {
        return maxPoolSize == null ? 32 : Math.max(1, maxPoolSize);
    }

    public int queueCapacityEffective() {
        return queueCapacity == null ? 10_000 : Math.max(0, queueCapacity);
    }
}
