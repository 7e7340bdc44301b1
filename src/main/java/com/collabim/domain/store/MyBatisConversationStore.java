package com.collabim.domain.store;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.collabim.domain.dto.PageResult;
import com.collabim.domain.entity.ConversationEntity;
import com.collabim.domain.entity.MessageEntity;
import com.collabim.domain.enums.ConnectionStatus;
import com.collabim.domain.enums.RecruitmentStatus;
import com.collabim.domain.mapper.ConversationMapper;
import com.collabim.domain.mapper.MessageMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class MyBatisConversationStore implements ConversationStore {

    private final ConversationMapper conversationMapper;
    private final MessageMapper messageMapper;

    public MyBatisConversationStore(ConversationMapper conversationMapper, MessageMapper messageMapper) {
        this.conversationMapper = conversationMapper;
        this.messageMapper = messageMapper;
    }

    @Override
    public ConversationEntity findById(long conversationId) {
        return conversationMapper.selectById(conversationId);
    }

    @Override
    public ConversationEntity findByParticipants(long campaignId, long brandId, long creatorId) {
        return conversationMapper.selectOne(new LambdaQueryWrapper<ConversationEntity>()
                .eq(ConversationEntity::getCampaignId, campaignId)
                .eq(ConversationEntity::getBrandId, brandId)
                .eq(ConversationEntity::getCreatorId, creatorId));
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void create(ConversationEntity conversation, List<MessageEntity> initialMessages) {
        if (conversation.getId() == null) {
            conversation.setId(IdWorker.getId());
        }
        // 新会话的序号直接从 1 开始顺排，不必经过 MsgSeqAllocator。
        long seq = 0;
        for (MessageEntity m : initialMessages) {
            if (m.getId() == null) {
                m.setId(IdWorker.getId());
            }
            m.setConversationId(conversation.getId());
            m.setMsgSeq(++seq);
            conversation.setLastMessageId(m.getId());
        }
        conversation.setNextMsgSeq(seq);

        conversationMapper.insert(conversation);
        for (MessageEntity m : initialMessages) {
            messageMapper.insert(m);
        }
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void updateStatus(long conversationId, ConnectionStatus connectionStatus,
                             RecruitmentStatus recruitmentStatus, LocalDateTime activityAt) {
        LambdaUpdateWrapper<ConversationEntity> w = new LambdaUpdateWrapper<ConversationEntity>()
                .eq(ConversationEntity::getId, conversationId)
                .set(ConversationEntity::getLastActivityAt, activityAt)
                .set(ConversationEntity::getUpdatedAt, activityAt);
        if (connectionStatus != null) {
            w.set(ConversationEntity::getConnectionStatus, connectionStatus);
        }
        if (recruitmentStatus != null) {
            w.set(ConversationEntity::getRecruitmentStatus, recruitmentStatus);
        }
        conversationMapper.update(null, w);
    }

    @Override
    public PageResult<ConversationEntity> pageForParticipant(long identityId, ConnectionStatus status, int page, int pageSize) {
        LambdaQueryWrapper<ConversationEntity> w = new LambdaQueryWrapper<>();
        w.nested(x -> x.eq(ConversationEntity::getBrandId, identityId)
                .or()
                .eq(ConversationEntity::getCreatorId, identityId));
        if (status != null) {
            w.eq(ConversationEntity::getConnectionStatus, status);
        }
        w.orderByDesc(ConversationEntity::getLastActivityAt).orderByDesc(ConversationEntity::getId);

        Page<ConversationEntity> p = conversationMapper.selectPage(new Page<>(page, pageSize), w);
        return PageResult.of(p.getRecords(), page, pageSize, p.getTotal());
    }

    @Override
    public Map<ConnectionStatus, Long> countByStatus(long identityId) {
        Map<ConnectionStatus, Long> out = new EnumMap<>(ConnectionStatus.class);
        for (ConnectionStatus s : ConnectionStatus.values()) {
            out.put(s, 0L);
        }
        for (Map<String, Object> row : conversationMapper.selectStatusCountsForParticipant(identityId)) {
            ConnectionStatus s = ConnectionStatus.fromString(String.valueOf(row.get("connectionStatus")));
            Object total = row.get("total");
            if (s != null && total instanceof Number n) {
                out.put(s, n.longValue());
            }
        }
        return out;
    }
}
