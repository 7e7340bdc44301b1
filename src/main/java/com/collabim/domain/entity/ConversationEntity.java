package com.collabim.domain.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.collabim.domain.enums.ConnectionStatus;
import com.collabim.domain.enums.RecruitmentStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 品牌方与达人围绕某个 campaign 的会话。
 *
 * <p>唯一键 (campaign_id, brand_id, creator_id)：同一 campaign 下同一对参与者只会有一个会话。</p>
 */
@Data
@TableName("t_conversation")
public class ConversationEntity {

    @TableId(value = "id", type = IdType.ASSIGN_ID)
    private Long id;

    private Long campaignId;

    private Long brandId;

    private Long creatorId;

    private Long initiatorId;

    /** 弱引用：只用于展示最后一条消息，不做外键。 */
    private Long lastMessageId;

    private LocalDateTime lastActivityAt;

    private ConnectionStatus connectionStatus;

    private RecruitmentStatus recruitmentStatus;

    /** msg_seq 分配游标（见 MsgSeqAllocator）。 */
    @JsonIgnore
    private Long nextMsgSeq;

    private LocalDateTime createdAt;

    @TableField(fill = FieldFill.INSERT_UPDATE)
    private LocalDateTime updatedAt;

    public boolean isParticipant(long identityId) {
        return (brandId != null && brandId == identityId) || (creatorId != null && creatorId == identityId);
    }

    /**
     * 另一方参与者；调用方需先确认 identityId 是参与者。
     */
    public Long otherParticipant(long identityId) {
        return brandId != null && brandId == identityId ? creatorId : brandId;
    }
}
