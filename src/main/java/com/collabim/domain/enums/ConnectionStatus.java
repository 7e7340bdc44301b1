package com.collabim.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 会话连接状态（对应表字段：t_conversation.connection_status）。
 *
 * <p>只有 active 允许继续发消息；archived/blocked 仍可查询与标记已读。</p>
 */
@Getter
@RequiredArgsConstructor
public enum ConnectionStatus {

    ACTIVE("active"),

    ARCHIVED("archived"),

    BLOCKED("blocked");

    @EnumValue
    @JsonValue
    private final String code;

    /**
     * 解析协议层/请求体里的字符串取值（大小写不敏感）。无法识别时返回 null。
     */
    public static ConnectionStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (ConnectionStatus s : values()) {
            if (s.code.equalsIgnoreCase(v) || s.name().equalsIgnoreCase(v)) {
                return s;
            }
        }
        return null;
    }
}
