package com.collabim.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 会话/消息相关的限制与分页参数。未配置时使用 *Effective() 里的默认值。
 */
@ConfigurationProperties(prefix = "collab.chat")
public record ChatProperties(
        Integer maxContentLength,
        Integer messagePageSizeDefault,
        Integer messagePageSizeMax,
        Integer inboxPageSizeDefault,
        Integer inboxPageSizeMax
) {

    public int maxContentLengthEffective() {
        return maxContentLength == null ? 2000 : Math.max(1, maxContentLength);
    }

    public int messagePageSizeMaxEffective() {
        return messagePageSizeMax == null ? 100 : Math.max(1, messagePageSizeMax);
    }

    public int messagePageSizeDefaultEffective() {
        int v = messagePageSizeDefault == null ? 50 : Math.max(1, messagePageSizeDefault);
        return Math.min(v, messagePageSizeMaxEffective());
    }

    public int inboxPageSizeMaxEffective() {
        return inboxPageSizeMax == null ? 50 : Math.max(1, inboxPageSizeMax);
    }

    public int inboxPageSizeDefaultEffective() {
        int v = inboxPageSizeDefault == null ? 20 : Math.max(1, inboxPageSizeDefault);
        return Math.min(v, inboxPageSizeMaxEffective());
    }
}
