package com.collabim.domain.service.impl;

import com.collabim.common.error.ChatException;
import com.collabim.domain.dto.ConversationDto;
import com.collabim.domain.entity.ConversationEntity;
import com.collabim.domain.enums.ConnectionStatus;
import com.collabim.domain.enums.RecruitmentStatus;
import com.collabim.domain.service.ChatViewAssembler;
import com.collabim.domain.service.ConversationAccess;
import com.collabim.domain.service.ConversationLocks;
import com.collabim.domain.service.RecruitmentService;
import com.collabim.domain.service.RecruitmentTransitionPolicy;
import com.collabim.domain.store.ConversationStore;
import com.collabim.gateway.session.ChannelKey;
import com.collabim.gateway.session.RoomRouter;
import com.collabim.gateway.ws.WsEvents;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 状态变更只改字段、刷新 lastActivityAt，不会自动产生消息（例如改成 offer_sent 不会自动发 offer）。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecruitmentServiceImpl implements RecruitmentService {

    private final ConversationStore conversationStore;
    private final ConversationAccess access;
    private final ConversationLocks locks;
    private final RecruitmentTransitionPolicy policy;
    private final ChatViewAssembler assembler;
    private final RoomRouter router;

    @Override
    public ConversationDto setRecruitmentStatus(long requesterId, long conversationId, RecruitmentStatus status) {
        if (status == null) {
            throw ChatException.validation("bad_recruitment_status");
        }
        return updateStatus(requesterId, conversationId, null, status);
    }

    @Override
    public ConversationDto setConnectionStatus(long requesterId, long conversationId, ConnectionStatus status) {
        if (status == null) {
            throw ChatException.validation("bad_status");
        }
        return updateStatus(requesterId, conversationId, status, null);
    }

    @Override
    public ConversationDto updateStatus(long requesterId, long conversationId,
                                        ConnectionStatus connectionStatus, RecruitmentStatus recruitmentStatus) {
        if (connectionStatus == null && recruitmentStatus == null) {
            throw ChatException.validation("status_required");
        }

        boolean[] changed = {false};
        ConversationEntity conv = locks.withLock(conversationId, () -> {
            ConversationEntity c = access.requireParticipant(requesterId, conversationId);
            policy.check(c.getRecruitmentStatus(), recruitmentStatus);

            boolean connChanged = connectionStatus != null && connectionStatus != c.getConnectionStatus();
            boolean recruitChanged = recruitmentStatus != null && recruitmentStatus != c.getRecruitmentStatus();
            if (!connChanged && !recruitChanged) {
                return c;
            }
            LocalDateTime now = LocalDateTime.now();
            conversationStore.updateStatus(conversationId,
                    connChanged ? connectionStatus : null,
                    recruitChanged ? recruitmentStatus : null,
                    now);
            if (connChanged) {
                c.setConnectionStatus(connectionStatus);
            }
            if (recruitChanged) {
                c.setRecruitmentStatus(recruitmentStatus);
            }
            c.setLastActivityAt(now);
            c.setUpdatedAt(now);
            changed[0] = true;
            return c;
        });

        if (changed[0]) {
            log.info("conversation status updated: id={}, by={}, connectionStatus={}, recruitmentStatus={}",
                    conversationId, requesterId, conv.getConnectionStatus(), conv.getRecruitmentStatus());
            try {
                router.publish(
                        List.of(ChannelKey.conversation(conversationId), ChannelKey.personal(conv.otherParticipant(requesterId))),
                        WsEvents.CHAT_STATUS_UPDATED,
                        new WsEvents.ChatStatusUpdated(conversationId, conv.getConnectionStatus(),
                                conv.getRecruitmentStatus(), requesterId, conv.getLastActivityAt()),
                        requesterId);
            } catch (Exception e) {
                log.warn("publish chat_status_updated failed: conversationId={}, err={}", conversationId, e.toString());
            }
        }
        return assembler.toConversationDto(conv, requesterId);
    }
}
