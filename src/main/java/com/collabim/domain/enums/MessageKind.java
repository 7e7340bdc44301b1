package com.collabim.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 消息类别（对应表字段：t_message.kind）。system 只能由服务端合成。
 */
@Getter
@RequiredArgsConstructor
public enum MessageKind {

    TEXT("text"),

    OFFER("offer"),

    SYSTEM("system");

    @EnumValue
    @JsonValue
    private final String code;

    /**
     * 解析协议层/请求体里的字符串取值（大小写不敏感）。无法识别时返回 null。
     */
    public static MessageKind fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (MessageKind s : values()) {
            if (s.code.equalsIgnoreCase(v) || s.name().equalsIgnoreCase(v)) {
                return s;
            }
        }
        return null;
    }
}
