package com.collabim.domain.service;

import com.collabim.domain.dto.MessageDto;
import com.collabim.domain.dto.PageResult;
import com.collabim.domain.dto.ReadReceiptDto;
import com.collabim.domain.model.MessageDraft;
import com.collabim.domain.model.OfferDetails;

public interface MessagePipelineService {

    /**
     * 客户端发消息入口：kind 为原始字符串（缺省 text），非法值返回 bad_kind。
     */
    MessageDto sendMessage(long senderId, long conversationId, String content, String kind, OfferDetails offer);

    MessageDto sendMessage(long senderId, long conversationId, MessageDraft draft);

    /**
     * 重复标记不报错，也不会改动首次的 readAt。
     */
    ReadReceiptDto markRead(long readerId, long conversationId, long messageId);

    /**
     * @return 本次新标记为已读的消息数
     */
    int markAllRead(long readerId, long conversationId);

    /**
     * 第 1 页是最新的 pageSize 条，页内按时间正序。
     */
    PageResult<MessageDto> listMessages(long requesterId, long conversationId, Integer page, Integer pageSize);

    long unreadCount(long identityId, long conversationId);
}
