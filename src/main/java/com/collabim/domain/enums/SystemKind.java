package com.collabim.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 系统消息子类型（对应表字段：t_message.system_kind）。
 */
@Getter
@RequiredArgsConstructor
public enum SystemKind {

    CHAT_STARTED("chat_started"),

    OFFER_SENT("offer_sent"),

    OFFER_ACCEPTED("offer_accepted"),

    OFFER_DECLINED("offer_declined");

    @EnumValue
    @JsonValue
    private final String code;
}
