package com.collabim.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** 账号角色（t_user.role）。 */
@Getter
@RequiredArgsConstructor
public enum UserRole {

    BRAND("brand"),

    CREATOR("creator"),

    ADMIN("admin");

    @EnumValue
    @JsonValue
    private final String code;
}
