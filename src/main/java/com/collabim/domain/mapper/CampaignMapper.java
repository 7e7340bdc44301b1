package com.collabim.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.collabim.domain.entity.CampaignEntity;

public interface CampaignMapper extends BaseMapper<CampaignEntity> {
}
