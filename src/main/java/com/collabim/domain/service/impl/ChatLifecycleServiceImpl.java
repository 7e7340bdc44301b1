package com.collabim.domain.service.impl;

import com.collabim.common.error.ChatException;
import com.collabim.domain.config.ChatProperties;
import com.collabim.domain.directory.CampaignDirectory;
import com.collabim.domain.directory.IdentityDirectory;
import com.collabim.domain.dto.ConversationDto;
import com.collabim.domain.entity.ConversationEntity;
import com.collabim.domain.entity.MessageEntity;
import com.collabim.domain.enums.ConnectionStatus;
import com.collabim.domain.enums.RecruitmentStatus;
import com.collabim.domain.enums.SystemKind;
import com.collabim.domain.model.Campaign;
import com.collabim.domain.model.Identity;
import com.collabim.domain.model.MessageDraft;
import com.collabim.domain.service.ChatLifecycleService;
import com.collabim.domain.service.ChatViewAssembler;
import com.collabim.domain.store.ConversationStore;
import com.collabim.gateway.session.ChannelKey;
import com.collabim.gateway.session.RoomRouter;
import com.collabim.gateway.ws.WsEvents;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChatLifecycleServiceImpl implements ChatLifecycleService {

    private final ConversationStore conversationStore;
    private final CampaignDirectory campaignDirectory;
    private final IdentityDirectory identityDirectory;
    private final ChatViewAssembler assembler;
    private final RoomRouter router;
    private final ChatProperties chatProps;

    @Override
    public ConversationDto initiateConversation(long requesterId, long campaignId, long creatorId, String firstMessage) {
        Campaign campaign = campaignDirectory.getCampaign(campaignId);
        if (campaign == null) {
            throw ChatException.notFound("campaign_not_found");
        }
        if (campaign.ownerId() != requesterId) {
            throw ChatException.forbidden("not_campaign_owner");
        }
        if (!campaignDirectory.hasApplied(campaignId, creatorId)) {
            throw ChatException.invalidState("not_applied");
        }
        Identity creator = identityDirectory.getIdentityFresh(creatorId);
        if (creator == null || !creator.isApprovedCreator()) {
            throw ChatException.notFound("creator_not_found");
        }
        ConversationEntity existing = conversationStore.findByParticipants(campaignId, requesterId, creatorId);
        if (existing != null) {
            throw ChatException.conflict("conversation_exists", existing.getId());
        }

        String text = firstMessage == null ? null : firstMessage.trim();
        if (text != null && text.length() > chatProps.maxContentLengthEffective()) {
            throw ChatException.validation("content_too_long");
        }

        Identity brand = identityDirectory.getIdentity(requesterId);
        String brandLabel = brand == null ? String.valueOf(requesterId) : brand.displayLabel();
        LocalDateTime now = LocalDateTime.now();

        ConversationEntity conv = new ConversationEntity();
        conv.setCampaignId(campaignId);
        conv.setBrandId(requesterId);
        conv.setCreatorId(creatorId);
        conv.setInitiatorId(requesterId);
        conv.setConnectionStatus(ConnectionStatus.ACTIVE);
        conv.setRecruitmentStatus(RecruitmentStatus.DISCUSSING);
        conv.setLastActivityAt(now);
        conv.setCreatedAt(now);
        conv.setUpdatedAt(now);

        List<MessageEntity> initial = new ArrayList<>(2);
        initial.add(MessageFactory.fromDraft(MessageDraft.system(SystemKind.CHAT_STARTED,
                brandLabel + " started a conversation about \"" + campaign.name() + "\""), requesterId, now));
        if (text != null && !text.isEmpty()) {
            initial.add(MessageFactory.fromDraft(MessageDraft.text(text), requesterId, now));
        }

        try {
            conversationStore.create(conv, initial);
        } catch (DuplicateKeyException e) {
            // 并发发起：另一请求已先写入
            ConversationEntity winner = conversationStore.findByParticipants(campaignId, requesterId, creatorId);
            if (winner == null) {
                throw e;
            }
            throw ChatException.conflict("conversation_exists", winner.getId());
        }
        log.info("conversation created: id={}, campaignId={}, brandId={}, creatorId={}",
                conv.getId(), campaignId, requesterId, creatorId);

        try {
            ConversationDto forCreator = assembler.toConversationDto(conv, creatorId);
            router.publish(ChannelKey.personal(creatorId), WsEvents.NEW_CHAT,
                    new WsEvents.NewChat(forCreator, NEW_CHAT_NOTICE));
        } catch (Exception e) {
            log.warn("publish new_chat failed: conversationId={}, err={}", conv.getId(), e.toString());
        }
        return assembler.toConversationDto(conv, requesterId);
    }
}
