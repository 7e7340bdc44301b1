package com.collabim.domain.service;

import cn.hutool.core.bean.BeanUtil;
import com.collabim.domain.directory.CampaignDirectory;
import com.collabim.domain.directory.IdentityDirectory;
import com.collabim.domain.dto.CampaignSummaryDto;
import com.collabim.domain.dto.ConversationDto;
import com.collabim.domain.dto.MessageDto;
import com.collabim.domain.dto.ParticipantDto;
import com.collabim.domain.dto.ReadReceiptDto;
import com.collabim.domain.entity.ConversationEntity;
import com.collabim.domain.entity.MessageEntity;
import com.collabim.domain.entity.MessageReadEntity;
import com.collabim.domain.enums.MessageKind;
import com.collabim.domain.model.Campaign;
import com.collabim.domain.model.Identity;
import com.collabim.domain.model.OfferDetails;
import com.collabim.domain.store.MessageStore;
import com.collabim.gateway.session.PresenceRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 实体 -> 视图。批量查参与者、campaign、最后一条消息和未读数，避免 N+1。
 */
@Component
@RequiredArgsConstructor
public class ChatViewAssembler {

    private final MessageStore messageStore;
    private final IdentityDirectory identityDirectory;
    private final CampaignDirectory campaignDirectory;
    private final PresenceRegistry presenceRegistry;

    public MessageDto toMessageDto(MessageEntity m, List<MessageReadEntity> receipts) {
        MessageDto dto = BeanUtil.copyProperties(m, MessageDto.class, "readReceipts");
        if (m.getKind() == MessageKind.OFFER) {
            dto.setOfferDetails(new OfferDetails(m.getOfferAmount(), m.getOfferCurrency(),
                    m.getOfferDescription(), m.getOfferDeadline()));
        }
        List<ReadReceiptDto> list = new ArrayList<>();
        if (receipts != null) {
            for (MessageReadEntity r : receipts) {
                list.add(new ReadReceiptDto(r.getMessageId(), r.getReaderId(), r.getReadAt()));
            }
        }
        dto.setReadReceipts(list);
        return dto;
    }

    public List<MessageDto> toMessageDtos(List<MessageEntity> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        List<Long> ids = messages.stream().map(MessageEntity::getId).toList();
        Map<Long, List<MessageReadEntity>> receiptsByMessage = new HashMap<>();
        for (MessageReadEntity r : messageStore.findReadReceipts(ids)) {
            receiptsByMessage.computeIfAbsent(r.getMessageId(), k -> new ArrayList<>()).add(r);
        }
        List<MessageDto> out = new ArrayList<>(messages.size());
        for (MessageEntity m : messages) {
            out.add(toMessageDto(m, receiptsByMessage.get(m.getId())));
        }
        return out;
    }

    public ConversationDto toConversationDto(ConversationEntity conv, long viewerId) {
        return toConversationDtos(List.of(conv), viewerId).get(0);
    }

    /**
     * @param viewerId 未读数按该身份计算
     */
    public List<ConversationDto> toConversationDtos(List<ConversationEntity> convs, long viewerId) {
        if (convs == null || convs.isEmpty()) {
            return List.of();
        }
        Set<Long> identityIds = new HashSet<>();
        Set<Long> campaignIds = new HashSet<>();
        List<Long> lastMessageIds = new ArrayList<>();
        List<Long> convIds = new ArrayList<>();
        for (ConversationEntity c : convs) {
            identityIds.add(c.getBrandId());
            identityIds.add(c.getCreatorId());
            campaignIds.add(c.getCampaignId());
            convIds.add(c.getId());
            if (c.getLastMessageId() != null) {
                lastMessageIds.add(c.getLastMessageId());
            }
        }

        Map<Long, Identity> identities = identityDirectory.getIdentities(identityIds);
        Map<Long, Campaign> campaigns = campaignDirectory.getCampaigns(campaignIds);
        Map<Long, MessageEntity> lastMessages = new HashMap<>();
        for (MessageEntity m : messageStore.findByIds(lastMessageIds)) {
            lastMessages.put(m.getId(), m);
        }
        Map<Long, Long> unread = messageStore.countUnread(convIds, viewerId);

        List<ConversationDto> out = new ArrayList<>(convs.size());
        for (ConversationEntity c : convs) {
            ConversationDto dto = new ConversationDto();
            dto.setId(c.getId());
            Campaign campaign = campaigns.get(c.getCampaignId());
            dto.setCampaign(new CampaignSummaryDto(c.getCampaignId(), campaign == null ? null : campaign.name()));
            dto.setBrand(participant(c.getBrandId(), identities.get(c.getBrandId())));
            dto.setCreator(participant(c.getCreatorId(), identities.get(c.getCreatorId())));
            dto.setInitiatorId(c.getInitiatorId());
            // 弱引用：消息不存在时 lastMessage 为 null，不报错
            MessageEntity last = c.getLastMessageId() == null ? null : lastMessages.get(c.getLastMessageId());
            dto.setLastMessage(last == null ? null : toMessageDto(last, null));
            dto.setLastActivityAt(c.getLastActivityAt());
            dto.setConnectionStatus(c.getConnectionStatus());
            dto.setRecruitmentStatus(c.getRecruitmentStatus());
            dto.setUnreadCount(unread.getOrDefault(c.getId(), 0L));
            dto.setCreatedAt(c.getCreatedAt());
            out.add(dto);
        }
        return out;
    }

    private ParticipantDto participant(Long id, Identity identity) {
        boolean online = id != null && presenceRegistry.isOnline(id);
        if (identity == null) {
            return new ParticipantDto(id, null, null, null, online);
        }
        return new ParticipantDto(id, identity.displayName(), identity.label(), identity.role(), online);
    }
}
