package com.collabim.domain.entity;

import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

@Data
@TableName("t_campaign")
public class CampaignEntity {

    @TableId("id")
    private Long id;

    private Long brandId;

    private String name;

    private String status;
}
