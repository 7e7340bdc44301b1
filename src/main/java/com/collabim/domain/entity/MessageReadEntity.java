package com.collabim.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 已读回执。唯一键 (message_id, reader_id)：每个读者对每条消息最多一条。
 */
@Data
@TableName("t_message_read")
public class MessageReadEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long messageId;

    private Long conversationId;

    private Long readerId;

    private LocalDateTime readAt;
}
