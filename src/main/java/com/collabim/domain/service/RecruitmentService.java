package com.collabim.domain.service;

import com.collabim.domain.dto.ConversationDto;
import com.collabim.domain.enums.ConnectionStatus;
import com.collabim.domain.enums.RecruitmentStatus;

public interface RecruitmentService {

    ConversationDto setRecruitmentStatus(long requesterId, long conversationId, RecruitmentStatus status);

    ConversationDto setConnectionStatus(long requesterId, long conversationId, ConnectionStatus status);

    /**
     * 一次修改两个状态字段；为 null 的字段保持不变，但不能同时为 null。
     */
    ConversationDto updateStatus(long requesterId, long conversationId,
                                 ConnectionStatus connectionStatus, RecruitmentStatus recruitmentStatus);
}
