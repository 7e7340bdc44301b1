package com.collabim.domain.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "collab.chat.recruitment")
public class RecruitmentProperties {

    public static final String MODE_PERMISSIVE = "permissive";
    public static final String MODE_STRICT = "strict";

    /**
     * 招募状态修改规则：
     * <ul>
     *   <li>permissive：任意参与者可从任意状态改到任意状态</li>
     *   <li>strict：只允许预定义的状态迁移，其余返回 illegal_transition</li>
     * </ul>
     */
    private String mode = MODE_PERMISSIVE;

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public boolean isStrict() {
        return mode != null && MODE_STRICT.equalsIgnoreCase(mode.trim());
    }
}
