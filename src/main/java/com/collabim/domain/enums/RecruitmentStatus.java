package com.collabim.domain.enums;

import com.baomidou.mybatisplus.annotation.EnumValue;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 招募协商阶段（对应表字段：t_conversation.recruitment_status）。与消息内容无关，只由参与者显式修改。
 */
@Getter
@RequiredArgsConstructor
public enum RecruitmentStatus {

    DISCUSSING("discussing"),

    OFFER_SENT("offer_sent"),

    ACCEPTED("accepted"),

    DECLINED("declined"),

    COMPLETED("completed");

    @EnumValue
    @JsonValue
    private final String code;

    /**
     * 解析协议层/请求体里的字符串取值（大小写不敏感）。无法识别时返回 null。
     */
    public static RecruitmentStatus fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.trim();
        for (RecruitmentStatus s : values()) {
            if (s.code.equalsIgnoreCase(v) || s.name().equalsIgnoreCase(v)) {
                return s;
            }
        }
        return null;
    }
}
