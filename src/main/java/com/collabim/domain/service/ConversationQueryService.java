package com.collabim.domain.service;

import com.collabim.common.error.ChatException;
import com.collabim.domain.config.ChatProperties;
import com.collabim.domain.dto.ChatStatsDto;
import com.collabim.domain.dto.ConversationDto;
import com.collabim.domain.dto.PageResult;
import com.collabim.domain.entity.ConversationEntity;
import com.collabim.domain.enums.ConnectionStatus;
import com.collabim.domain.store.ConversationStore;
import com.collabim.domain.store.MessageStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * 收件箱、会话详情与统计（只读）。
 */
@Service
@RequiredArgsConstructor
public class ConversationQueryService {

    private final ConversationStore conversationStore;
    private final MessageStore messageStore;
    private final ChatViewAssembler assembler;
    private final ChatProperties chatProps;

    /**
     * @param status 为 null 时按 active 过滤
     */
    public PageResult<ConversationDto> inbox(long identityId, Integer page, Integer limit, ConnectionStatus status) {
        int safePage = page == null || page < 1 ? 1 : page;
        int safeLimit = chatProps.inboxPageSizeDefaultEffective();
        if (limit != null) {
            safeLimit = Math.max(1, Math.min(limit, chatProps.inboxPageSizeMaxEffective()));
        }
        ConnectionStatus filter = status == null ? ConnectionStatus.ACTIVE : status;

        PageResult<ConversationEntity> p = conversationStore.pageForParticipant(identityId, filter, safePage, safeLimit);
        return new PageResult<>(assembler.toConversationDtos(p.records(), identityId),
                p.page(), p.pageSize(), p.total(), p.totalPages(), p.hasNext(), p.hasPrevious());
    }

    /**
     * 非参与者同样返回 NOT_FOUND，不暴露会话是否存在。
     */
    public ConversationDto getConversation(long identityId, long conversationId) {
        ConversationEntity conv = conversationStore.findById(conversationId);
        if (conv == null || !conv.isParticipant(identityId)) {
            throw ChatException.notFound("conversation_not_found");
        }
        return assembler.toConversationDto(conv, identityId);
    }

    public ChatStatsDto stats(long identityId) {
        Map<ConnectionStatus, Long> counts = conversationStore.countByStatus(identityId);
        long active = counts.getOrDefault(ConnectionStatus.ACTIVE, 0L);
        long archived = counts.getOrDefault(ConnectionStatus.ARCHIVED, 0L);
        long blocked = counts.getOrDefault(ConnectionStatus.BLOCKED, 0L);
        long unread = messageStore.countUnreadTotal(identityId);
        return new ChatStatsDto(active, archived, blocked, active + archived + blocked, unread);
    }
}
