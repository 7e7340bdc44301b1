package com.collabim.domain.entity;

import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@TableName("t_campaign_application")
public class CampaignApplicationEntity {

    @TableId("id")
    private Long id;

    private Long campaignId;

    private Long creatorId;

    private LocalDateTime appliedAt;
}
