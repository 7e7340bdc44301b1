package com.collabim.domain.service;

import com.collabim.common.error.ChatException;
import com.collabim.domain.entity.ConversationEntity;
import com.collabim.domain.store.ConversationStore;
import org.springframework.stereotype.Component;

/**
 * 会话存在性与参与者校验，各服务共用。
 */
@Component
public class ConversationAccess {

    private final ConversationStore conversationStore;

    public ConversationAccess(ConversationStore conversationStore) {
        this.conversationStore = conversationStore;
    }

    public ConversationEntity requireConversation(long conversationId) {
        ConversationEntity conv = conversationStore.findById(conversationId);
        if (conv == null) {
            throw ChatException.notFound("conversation_not_found");
        }
        return conv;
    }

    /**
     * 会话不存在 -> NOT_FOUND；不是参与者 -> FORBIDDEN。
     */
    public ConversationEntity requireParticipant(long identityId, long conversationId) {
        ConversationEntity conv = requireConversation(conversationId);
        if (!conv.isParticipant(identityId)) {
            throw ChatException.forbidden("not_participant");
        }
        return conv;
    }
}
