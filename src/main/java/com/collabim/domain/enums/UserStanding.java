package com.collabim.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** 账号审核状态（t_user.standing）。只有 approved 的达人可以被发起会话。 */
@Getter
@RequiredArgsConstructor
public enum UserStanding {

    PENDING("pending"),

    APPROVED("approved"),

    REJECTED("rejected");

    @EnumValue
    @JsonValue
    private final String code;
}
