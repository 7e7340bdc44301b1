package com.collabim.domain.store;

import cn.hutool.core.bean.BeanUtil;
import com.collabim.domain.dto.PageResult;
import com.collabim.domain.entity.ConversationEntity;
import com.collabim.domain.entity.MessageEntity;
import com.collabim.domain.entity.MessageReadEntity;
import com.collabim.domain.enums.ConnectionStatus;
import com.collabim.domain.enums.DeliveryStatus;
import com.collabim.domain.enums.RecruitmentStatus;
import org.springframework.dao.DuplicateKeyException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 测试用内存存储：会话与消息两个存储接口共享同一份数据，语义与 MyBatis 实现保持一致。
 * 读出的实体都是副本，调用方修改不会影响已存数据。
 */
public class InMemoryChatStore {

    private final AtomicLong ids = new AtomicLong(1000);

    private final Map<Long, ConversationEntity> conversations = new ConcurrentHashMap<>();
    private final Map<Long, MessageEntity> messages = new ConcurrentHashMap<>();
    private final Map<String, MessageReadEntity> receipts = new ConcurrentHashMap<>();

    private final Conversations conversationView = new Conversations();
    private final Messages messageView = new Messages();

    public ConversationStore conversationStore() {
        return conversationView;
    }

    public MessageStore messageStore() {
        return messageView;
    }

    private class Conversations implements ConversationStore {

        @Override
        public synchronized ConversationEntity findById(long conversationId) {
            return copy(conversations.get(conversationId));
        }

        @Override
        public synchronized ConversationEntity findByParticipants(long campaignId, long brandId, long creatorId) {
            for (ConversationEntity c : conversations.values()) {
                if (c.getCampaignId() == campaignId && c.getBrandId() == brandId && c.getCreatorId() == creatorId) {
                    return copy(c);
                }
            }
            return null;
        }

        @Override
        public synchronized void create(ConversationEntity conversation, List<MessageEntity> initialMessages) {
            if (findByParticipants(conversation.getCampaignId(), conversation.getBrandId(), conversation.getCreatorId()) != null) {
                throw new DuplicateKeyException("Duplicate entry for key 'uk_conversation_participants'");
            }
            conversation.setId(ids.incrementAndGet());
            long seq = 0;
            for (MessageEntity m : initialMessages) {
                m.setId(ids.incrementAndGet());
                m.setConversationId(conversation.getId());
                m.setMsgSeq(++seq);
                messages.put(m.getId(), copy(m));
                conversation.setLastMessageId(m.getId());
            }
            conversation.setNextMsgSeq(seq + 1);
            conversations.put(conversation.getId(), copy(conversation));
        }

        @Override
        public synchronized void updateStatus(long conversationId, ConnectionStatus connectionStatus,
                                              RecruitmentStatus recruitmentStatus, LocalDateTime activityAt) {
            ConversationEntity c = conversations.get(conversationId);
            if (c == null) {
                return;
            }
            if (connectionStatus != null) {
                c.setConnectionStatus(connectionStatus);
            }
            if (recruitmentStatus != null) {
                c.setRecruitmentStatus(recruitmentStatus);
            }
            c.setLastActivityAt(activityAt);
            c.setUpdatedAt(activityAt);
        }

        @Override
        public synchronized PageResult<ConversationEntity> pageForParticipant(long identityId, ConnectionStatus status,
                                                                              int page, int pageSize) {
            List<ConversationEntity> all = conversations.values().stream()
                    .filter(c -> c.isParticipant(identityId))
                    .filter(c -> status == null || c.getConnectionStatus() == status)
                    .sorted(Comparator.comparing(ConversationEntity::getLastActivityAt)
                            .thenComparing(ConversationEntity::getId)
                            .reversed())
                    .map(InMemoryChatStore::copy)
                    .toList();
            int from = Math.min(all.size(), (page - 1) * pageSize);
            int to = Math.min(all.size(), from + pageSize);
            return PageResult.of(new ArrayList<>(all.subList(from, to)), page, pageSize, all.size());
        }

        @Override
        public synchronized Map<ConnectionStatus, Long> countByStatus(long identityId) {
            Map<ConnectionStatus, Long> out = new EnumMap<>(ConnectionStatus.class);
            for (ConversationEntity c : conversations.values()) {
                if (c.isParticipant(identityId)) {
                    out.merge(c.getConnectionStatus(), 1L, Long::sum);
                }
            }
            return out;
        }
    }

    private class Messages implements MessageStore {

        @Override
        public synchronized MessageEntity append(MessageEntity message) {
            ConversationEntity c = conversations.get(message.getConversationId());
            if (c == null) {
                throw new IllegalStateException("conversation not found: " + message.getConversationId());
            }
            long seq = c.getNextMsgSeq() == null ? 1 : c.getNextMsgSeq();
            c.setNextMsgSeq(seq + 1);
            message.setId(ids.incrementAndGet());
            message.setMsgSeq(seq);
            messages.put(message.getId(), copy(message));
            c.setLastMessageId(message.getId());
            c.setLastActivityAt(message.getCreatedAt());
            return message;
        }

        @Override
        public synchronized MessageEntity findById(long messageId) {
            return copy(messages.get(messageId));
        }

        @Override
        public synchronized List<MessageEntity> findByIds(Collection<Long> messageIds) {
            List<MessageEntity> out = new ArrayList<>();
            for (Long id : messageIds) {
                MessageEntity m = messages.get(id);
                if (m != null) {
                    out.add(copy(m));
                }
            }
            return out;
        }

        @Override
        public synchronized long countByConversation(long conversationId) {
            return inConversation(conversationId).size();
        }

        @Override
        public synchronized List<MessageEntity> listNewestFirst(long conversationId, long offset, int limit) {
            return inConversation(conversationId).stream()
                    .sorted(Comparator.comparing(MessageEntity::getMsgSeq).reversed())
                    .skip(offset)
                    .limit(limit)
                    .map(InMemoryChatStore::copy)
                    .toList();
        }

        @Override
        public synchronized boolean addReadReceipt(MessageReadEntity receipt) {
            String key = receipt.getMessageId() + ":" + receipt.getReaderId();
            if (receipts.containsKey(key)) {
                return false;
            }
            receipt.setId(ids.incrementAndGet());
            receipts.put(key, BeanUtil.copyProperties(receipt, MessageReadEntity.class));
            MessageEntity m = messages.get(receipt.getMessageId());
            if (m != null) {
                m.setDeliveryStatus(DeliveryStatus.READ);
            }
            return true;
        }

        @Override
        public synchronized MessageReadEntity findReadReceipt(long messageId, long readerId) {
            MessageReadEntity r = receipts.get(messageId + ":" + readerId);
            return r == null ? null : BeanUtil.copyProperties(r, MessageReadEntity.class);
        }

        @Override
        public synchronized List<MessageReadEntity> findReadReceipts(Collection<Long> messageIds) {
            return receipts.values().stream()
                    .filter(r -> messageIds.contains(r.getMessageId()))
                    .map(r -> BeanUtil.copyProperties(r, MessageReadEntity.class))
                    .toList();
        }

        @Override
        public synchronized List<Long> markAllRead(long conversationId, long readerId, LocalDateTime readAt) {
            List<Long> marked = new ArrayList<>();
            for (MessageEntity m : unreadFor(conversationId, readerId)) {
                MessageReadEntity r = new MessageReadEntity();
                r.setMessageId(m.getId());
                r.setConversationId(conversationId);
                r.setReaderId(readerId);
                r.setReadAt(readAt);
                addReadReceipt(r);
                marked.add(m.getId());
            }
            return marked;
        }

        @Override
        public synchronized boolean markDelivered(long messageId) {
            MessageEntity m = messages.get(messageId);
            if (m == null || m.getDeliveryStatus() != DeliveryStatus.SENT) {
                return false;
            }
            m.setDeliveryStatus(DeliveryStatus.DELIVERED);
            return true;
        }

        @Override
        public synchronized long countUnread(long conversationId, long readerId) {
            return unreadFor(conversationId, readerId).size();
        }

        @Override
        public synchronized Map<Long, Long> countUnread(Collection<Long> conversationIds, long readerId) {
            Map<Long, Long> out = new HashMap<>();
            for (Long id : conversationIds) {
                long n = countUnread(id, readerId);
                if (n > 0) {
                    out.put(id, n);
                }
            }
            return out;
        }

        @Override
        public synchronized long countUnreadTotal(long readerId) {
            long total = 0;
            for (ConversationEntity c : conversations.values()) {
                if (c.isParticipant(readerId)) {
                    total += countUnread(c.getId(), readerId);
                }
            }
            return total;
        }
    }

    public ConversationEntity conversation(long conversationId) {
        return copy(conversations.get(conversationId));
    }

    public MessageEntity message(long messageId) {
        return copy(messages.get(messageId));
    }

    public synchronized int conversationCount() {
        return conversations.size();
    }

    public synchronized List<MessageEntity> messagesOf(long conversationId) {
        return inConversation(conversationId).stream()
                .sorted(Comparator.comparing(MessageEntity::getMsgSeq))
                .map(InMemoryChatStore::copy)
                .toList();
    }

    private List<MessageEntity> inConversation(long conversationId) {
        return messages.values().stream()
                .filter(m -> m.getConversationId() == conversationId)
                .toList();
    }

    private List<MessageEntity> unreadFor(long conversationId, long readerId) {
        return inConversation(conversationId).stream()
                .filter(m -> m.getSenderId() != readerId)
                .filter(m -> !receipts.containsKey(m.getId() + ":" + readerId))
                .sorted(Comparator.comparing(MessageEntity::getMsgSeq))
                .toList();
    }

    private static ConversationEntity copy(ConversationEntity c) {
        return c == null ? null : BeanUtil.copyProperties(c, ConversationEntity.class);
    }

    private static MessageEntity copy(MessageEntity m) {
        return m == null ? null : BeanUtil.copyProperties(m, MessageEntity.class);
    }
}
