package com.collabim.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 投递状态（对应表字段：t_message.delivery_status）。只前进不回退：sent -> delivered -> read。
 */
@Getter
@RequiredArgsConstructor
public enum DeliveryStatus {

    SENT("sent"),

    DELIVERED("delivered"),

    READ("read");

    @EnumValue
    @JsonValue
    private final String code;
}
