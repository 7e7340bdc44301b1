package com.collabim.domain.store;

import com.collabim.domain.dto.PageResult;
import com.collabim.domain.entity.ConversationEntity;
import com.collabim.domain.entity.MessageEntity;
import com.collabim.domain.enums.ConnectionStatus;
import com.collabim.domain.enums.RecruitmentStatus;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 会话持久化。
 *
 * <p>存储故障以 Spring {@link org.springframework.dao.DataAccessException} 抛出；
 * 唯一键冲突为 {@link org.springframework.dao.DuplicateKeyException}。</p>
 */
public interface ConversationStore {

    ConversationEntity findById(long conversationId);

    ConversationEntity findByParticipants(long campaignId, long brandId, long creatorId);

    /**
     * 新建会话并按顺序写入初始消息；lastMessageId 指向最后一条。
     * 会话与消息在同一事务内提交。
     *
     * @throws org.springframework.dao.DuplicateKeyException 同一 (campaign, brand, creator) 已有会话
     */
    void create(ConversationEntity conversation, List<MessageEntity> initialMessages);

    /**
     * 更新状态字段并刷新 lastActivityAt。传 null 的状态保持不变。
     */
    void updateStatus(long conversationId, ConnectionStatus connectionStatus,
                      RecruitmentStatus recruitmentStatus, LocalDateTime activityAt);

    /**
     * 按 lastActivityAt 倒序分页列出某人参与的会话；status 为 null 时不过滤。
     */
    PageResult<ConversationEntity> pageForParticipant(long identityId, ConnectionStatus status, int page, int pageSize);

    Map<ConnectionStatus, Long> countByStatus(long identityId);
}
