package com.collabim.domain.store;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.collabim.domain.entity.ConversationEntity;
import com.collabim.domain.entity.MessageEntity;
import com.collabim.domain.entity.MessageReadEntity;
import com.collabim.domain.mapper.ConversationMapper;
import com.collabim.domain.mapper.MessageMapper;
import com.collabim.domain.mapper.MessageReadMapper;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class MyBatisMessageStore implements MessageStore {

    /** 单条 insert ... values 的最大行数。 */
    private static final int BATCH_SIZE = 500;

    private final MessageMapper messageMapper;
    private final MessageReadMapper messageReadMapper;
    private final ConversationMapper conversationMapper;
    private final MsgSeqAllocator msgSeqAllocator;

    public MyBatisMessageStore(MessageMapper messageMapper,
                               MessageReadMapper messageReadMapper,
                               ConversationMapper conversationMapper,
                               MsgSeqAllocator msgSeqAllocator) {
        this.messageMapper = messageMapper;
        this.messageReadMapper = messageReadMapper;
        this.conversationMapper = conversationMapper;
        this.msgSeqAllocator = msgSeqAllocator;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public MessageEntity append(MessageEntity message) {
        long conversationId = message.getConversationId();
        message.setMsgSeq(msgSeqAllocator.allocateNextSeq(conversationId));
        messageMapper.insert(message);

        conversationMapper.update(null, new LambdaUpdateWrapper<ConversationEntity>()
                .eq(ConversationEntity::getId, conversationId)
                .set(ConversationEntity::getLastMessageId, message.getId())
                .set(ConversationEntity::getLastActivityAt, message.getCreatedAt())
                .set(ConversationEntity::getUpdatedAt, message.getCreatedAt()));
        return message;
    }

    @Override
    public MessageEntity findById(long messageId) {
        return messageMapper.selectById(messageId);
    }

    @Override
    public List<MessageEntity> findByIds(Collection<Long> messageIds) {
        if (messageIds == null || messageIds.isEmpty()) {
            return List.of();
        }
        return messageMapper.selectBatchIds(messageIds);
    }

    @Override
    public long countByConversation(long conversationId) {
        Long n = messageMapper.selectCount(new LambdaQueryWrapper<MessageEntity>()
                .eq(MessageEntity::getConversationId, conversationId));
        return n == null ? 0 : n;
    }

    @Override
    public List<MessageEntity> listNewestFirst(long conversationId, long offset, int limit) {
        return messageMapper.selectList(new LambdaQueryWrapper<MessageEntity>()
                .eq(MessageEntity::getConversationId, conversationId)
                .orderByDesc(MessageEntity::getMsgSeq)
                .last("limit " + Math.max(0, offset) + ", " + Math.max(1, limit)));
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public boolean addReadReceipt(MessageReadEntity receipt) {
        if (receipt.getId() == null) {
            receipt.setId(IdWorker.getId());
        }
        if (messageReadMapper.insertIgnore(receipt) <= 0) {
            return false;
        }
        messageMapper.markReadByIds(List.of(receipt.getMessageId()));
        return true;
    }

    @Override
    public MessageReadEntity findReadReceipt(long messageId, long readerId) {
        return messageReadMapper.selectOne(new LambdaQueryWrapper<MessageReadEntity>()
                .eq(MessageReadEntity::getMessageId, messageId)
                .eq(MessageReadEntity::getReaderId, readerId));
    }

    @Override
    public List<MessageReadEntity> findReadReceipts(Collection<Long> messageIds) {
        if (messageIds == null || messageIds.isEmpty()) {
            return List.of();
        }
        return messageReadMapper.selectList(new LambdaQueryWrapper<MessageReadEntity>()
                .in(MessageReadEntity::getMessageId, messageIds)
                .orderByAsc(MessageReadEntity::getReadAt));
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public List<Long> markAllRead(long conversationId, long readerId, LocalDateTime readAt) {
        List<Long> ids = messageMapper.selectUnreadIds(conversationId, readerId);
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        for (int from = 0; from < ids.size(); from += BATCH_SIZE) {
            List<Long> chunk = ids.subList(from, Math.min(ids.size(), from + BATCH_SIZE));
            List<MessageReadEntity> rows = new ArrayList<>(chunk.size());
            for (Long id : chunk) {
                MessageReadEntity r = new MessageReadEntity();
                r.setId(IdWorker.getId());
                r.setMessageId(id);
                r.setConversationId(conversationId);
                r.setReaderId(readerId);
                r.setReadAt(readAt);
                rows.add(r);
            }
            messageReadMapper.insertIgnoreBatch(rows);
            messageMapper.markReadByIds(chunk);
        }
        return ids;
    }

    @Override
    public boolean markDelivered(long messageId) {
        return messageMapper.markDelivered(messageId) > 0;
    }

    @Override
    public long countUnread(long conversationId, long readerId) {
        return messageMapper.countUnread(conversationId, readerId);
    }

    @Override
    public Map<Long, Long> countUnread(Collection<Long> conversationIds, long readerId) {
        Map<Long, Long> out = new HashMap<>();
        if (conversationIds == null || conversationIds.isEmpty()) {
            return out;
        }
        List<Map<String, Object>> rows = messageMapper.selectUnreadCounts(List.copyOf(conversationIds), readerId);
        for (Map<String, Object> row : rows) {
            Object cid = row.get("conversationId");
            Object cnt = row.get("unreadCount");
            if (cid instanceof Number c && cnt instanceof Number n) {
                out.put(c.longValue(), n.longValue());
            }
        }
        return out;
    }

    @Override
    public long countUnreadTotal(long readerId) {
        return messageMapper.countUnreadTotal(readerId);
    }
}
