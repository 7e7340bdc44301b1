package com.collabim.domain.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class InitiateConversationRequest {

    @NotNull(message = "campaign_id_required")
    private Long campaignId;

    @NotNull(message = "creator_id_required")
    private Long creatorId;

    /** 可选的首条消息 */
    private String message;
}
