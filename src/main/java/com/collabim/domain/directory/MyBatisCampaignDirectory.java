package com.collabim.domain.directory;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.collabim.domain.entity.CampaignApplicationEntity;
import com.collabim.domain.entity.CampaignEntity;
import com.collabim.domain.mapper.CampaignApplicationMapper;
import com.collabim.domain.mapper.CampaignMapper;
import com.collabim.domain.model.Campaign;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

@Component
public class MyBatisCampaignDirectory implements CampaignDirectory {

    private final CampaignMapper campaignMapper;
    private final CampaignApplicationMapper applicationMapper;

    public MyBatisCampaignDirectory(CampaignMapper campaignMapper, CampaignApplicationMapper applicationMapper) {
        this.campaignMapper = campaignMapper;
        this.applicationMapper = applicationMapper;
    }

    @Override
    public Campaign getCampaign(long campaignId) {
        CampaignEntity c = campaignMapper.selectById(campaignId);
        return c == null ? null : toCampaign(c);
    }

    @Override
    public Map<Long, Campaign> getCampaigns(Collection<Long> campaignIds) {
        Map<Long, Campaign> out = new HashMap<>();
        if (campaignIds == null || campaignIds.isEmpty()) {
            return out;
        }
        for (CampaignEntity c : campaignMapper.selectBatchIds(campaignIds)) {
            out.put(c.getId(), toCampaign(c));
        }
        return out;
    }

    @Override
    public boolean hasApplied(long campaignId, long creatorId) {
        Long n = applicationMapper.selectCount(new LambdaQueryWrapper<CampaignApplicationEntity>()
                .eq(CampaignApplicationEntity::getCampaignId, campaignId)
                .eq(CampaignApplicationEntity::getCreatorId, creatorId));
        return n != null && n > 0;
    }

    private static Campaign toCampaign(CampaignEntity c) {
        return new Campaign(c.getId(), c.getBrandId() == null ? 0L : c.getBrandId(), c.getName());
    }
}
