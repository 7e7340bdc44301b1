package com.collabim.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.collabim.domain.enums.DeliveryStatus;
import com.collabim.domain.enums.MessageKind;
import com.collabim.domain.enums.SystemKind;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 会话内的一条消息（只追加）。
 *
 * <p>offer_* 列只在 kind=offer 时有值，system_kind 只在 kind=system 时有值；
 * 业务层通过 {@link com.collabim.domain.model.MessageDraft} 构造，保证不会出现非法组合。</p>
 */
@Data
@TableName("t_message")
public class MessageEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long conversationId;

    /** 会话内单调递增序号：排序键。 */
    private Long msgSeq;

    private Long senderId;

    private MessageKind kind;

    private String content;

    private BigDecimal offerAmount;

    private String offerCurrency;

    private String offerDescription;

    private LocalDateTime offerDeadline;

    private SystemKind systemKind;

    private DeliveryStatus deliveryStatus;

    private LocalDateTime createdAt;
}
