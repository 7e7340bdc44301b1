package com.collabim.common.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "collab.cache")
public class CacheProperties {

    private boolean enabled = true;

    /** 身份摘要（展示名/角色/标签）缓存时间。 */
    private long identityTtlSeconds = 1800;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getIdentityTtlSeconds() {
        return identityTtlSeconds;
    }

    public void setIdentityTtlSeconds(long identityTtlSeconds) {
        this.identityTtlSeconds = identityTtlSeconds;
    }
}
