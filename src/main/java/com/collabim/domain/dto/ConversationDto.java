package com.collabim.domain.dto;

import com.collabim.domain.enums.ConnectionStatus;
import com.collabim.domain.enums.RecruitmentStatus;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 会话视图：带上参与者、campaign 摘要和最后一条消息，收件箱与 new_chat 事件共用。
 */
@Data
public class ConversationDto {

    private Long id;

    private CampaignSummaryDto campaign;

    private ParticipantDto brand;

    private ParticipantDto creator;

    private Long initiatorId;

    /** 最后一条消息（引用的消息不存在时为 null） */
    private MessageDto lastMessage;

    private LocalDateTime lastActivityAt;

    private ConnectionStatus connectionStatus;

    private RecruitmentStatus recruitmentStatus;

    /** 当前查看者视角的未读数 */
    private Long unreadCount;

    private LocalDateTime createdAt;
}
