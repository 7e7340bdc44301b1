package com.collabim.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.collabim.domain.entity.CampaignApplicationEntity;

public interface CampaignApplicationMapper extends BaseMapper<CampaignApplicationEntity> {
}
