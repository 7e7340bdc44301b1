package com.collabim.domain.model;

import com.collabim.domain.enums.UserRole;
import com.collabim.domain.enums.UserStanding;

/**
 * 会话核心关心的账号摘要。
 */
public record Identity(
        long id,
        String displayName,
        UserRole role,
        String label,
        UserStanding standing
) {

    public boolean isApprovedCreator() {
        return role == UserRole.CREATOR && standing == UserStanding.APPROVED;
    }

    /** 展示用名称：优先 label（品牌名 / handle）。 */
    public String displayLabel() {
        if (label != null && !label.isBlank()) {
            return label;
        }
        return displayName;
    }
}
