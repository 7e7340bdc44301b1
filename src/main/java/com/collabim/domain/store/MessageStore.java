package com.collabim.domain.store;

import com.collabim.domain.entity.MessageEntity;
import com.collabim.domain.entity.MessageReadEntity;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * 消息与已读回执持久化。
 */
public interface MessageStore {

    /**
     * 分配 msgSeq、写入消息，并把会话的 lastMessageId / lastActivityAt 指向它（同一事务）。
     *
     * @return 带 id / msgSeq 的消息
     */
    MessageEntity append(MessageEntity message);

    MessageEntity findById(long messageId);

    List<MessageEntity> findByIds(Collection<Long> messageIds);

    long countByConversation(long conversationId);

    /**
     * 按 msgSeq 倒序取一页（offset 从 0 开始）。
     */
    List<MessageEntity> listNewestFirst(long conversationId, long offset, int limit);

    /**
     * 写入回执并把消息置为 read。
     *
     * @return true 表示新写入；false 表示该读者已有回执（原 readAt 不变）
     */
    boolean addReadReceipt(MessageReadEntity receipt);

    MessageReadEntity findReadReceipt(long messageId, long readerId);

    List<MessageReadEntity> findReadReceipts(Collection<Long> messageIds);

    /**
     * 把会话内所有“非 reader 发送且 reader 未读”的消息置为已读（同一事务）。
     *
     * @return 本次新标记的消息 id（按 msgSeq 升序）
     */
    List<Long> markAllRead(long conversationId, long readerId, LocalDateTime readAt);

    /**
     * sent -> delivered；其他状态不变。
     */
    boolean markDelivered(long messageId);

    long countUnread(long conversationId, long readerId);

    Map<Long, Long> countUnread(Collection<Long> conversationIds, long readerId);

    long countUnreadTotal(long readerId);
}
