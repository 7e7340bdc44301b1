package com.collabim.domain.service;

import com.collabim.domain.dto.ConversationDto;

public interface ChatLifecycleService {

    String NEW_CHAT_NOTICE = "You have a new message from a brand!";

    /**
     * 品牌方就某个 campaign 向已报名的达人发起会话。
     *
     * <p>校验顺序（首个失败即返回）：campaign 存在、请求者是 campaign 所有者、达人已报名、
     * 达人存在且审核通过、该三元组尚无会话（冲突时异常里带已有会话 id）。</p>
     *
     * @param firstMessage 可选；非空时作为第二条（text）消息写入
     * @return 以发起者视角组装的会话
     */
    ConversationDto initiateConversation(long requesterId, long campaignId, long creatorId, String firstMessage);
}
