package com.collabim.domain.directory;

import com.collabim.domain.model.Campaign;

import java.util.Collection;
import java.util.Map;

/**
 * campaign 与报名记录查询。campaign 的增删改不在本服务内。
 */
public interface CampaignDirectory {

    /**
     * @return 不存在时返回 null
     */
    Campaign getCampaign(long campaignId);

    Map<Long, Campaign> getCampaigns(Collection<Long> campaignIds);

    boolean hasApplied(long campaignId, long creatorId);
}
