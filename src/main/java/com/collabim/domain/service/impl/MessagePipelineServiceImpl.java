package com.collabim.domain.service.impl;

import cn.hutool.core.bean.BeanUtil;
import com.collabim.common.error.ChatException;
import com.collabim.domain.config.ChatProperties;
import com.collabim.domain.dto.MessageDto;
import com.collabim.domain.dto.PageResult;
import com.collabim.domain.dto.ReadReceiptDto;
import com.collabim.domain.entity.ConversationEntity;
import com.collabim.domain.entity.MessageEntity;
import com.collabim.domain.entity.MessageReadEntity;
import com.collabim.domain.enums.ConnectionStatus;
import com.collabim.domain.enums.DeliveryStatus;
import com.collabim.domain.enums.MessageKind;
import com.collabim.domain.model.MessageDraft;
import com.collabim.domain.model.OfferDetails;
import com.collabim.domain.service.ChatViewAssembler;
import com.collabim.domain.service.ConversationAccess;
import com.collabim.domain.service.ConversationLocks;
import com.collabim.domain.service.MessagePipelineService;
import com.collabim.domain.store.MessageStore;
import com.collabim.gateway.session.ChannelKey;
import com.collabim.gateway.session.RoomRouter;
import com.collabim.gateway.ws.WsEvents;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

@Slf4j
@Service
@RequiredArgsConstructor
public class MessagePipelineServiceImpl implements MessagePipelineService {

    private static final int OFFER_AMOUNT_PRECISION = 18;
    private static final int OFFER_AMOUNT_SCALE = 2;
    private static final Pattern CURRENCY_CODE = Pattern.compile("[A-Z]{3}");

    private final MessageStore messageStore;
    private final ConversationAccess access;
    private final ConversationLocks locks;
    private final ChatViewAssembler assembler;
    private final RoomRouter router;
    private final ChatProperties chatProps;

    @Override
    public MessageDto sendMessage(long senderId, long conversationId, String content, String kind, OfferDetails offer) {
        Sent sent = locks.withLock(conversationId, () -> {
            ConversationEntity conv = requireSendable(senderId, conversationId);
            String text = validContent(content);
            MessageKind k = kind == null || kind.isBlank() ? MessageKind.TEXT : MessageKind.fromString(kind);
            if (k == null || k == MessageKind.SYSTEM) {
                throw ChatException.validation("bad_kind");
            }
            MessageDraft draft;
            if (k == MessageKind.OFFER) {
                if (offer == null) {
                    throw ChatException.validation("offer_required");
                }
                draft = MessageDraft.offer(text, validOffer(offer));
            } else {
                draft = MessageDraft.text(text);
            }
            return append(conv, senderId, draft);
        });
        return afterSend(sent, senderId);
    }

    @Override
    public MessageDto sendMessage(long senderId, long conversationId, MessageDraft draft) {
        Sent sent = locks.withLock(conversationId, () -> {
            ConversationEntity conv = requireSendable(senderId, conversationId);
            if (draft == null) {
                throw ChatException.validation("content_required");
            }
            String text = validContent(draft.getContent());
            if (draft.getKind() == MessageKind.SYSTEM) {
                throw ChatException.validation("bad_kind");
            }
            MessageDraft normalized = draft.getKind() == MessageKind.OFFER
                    ? MessageDraft.offer(text, validOffer(draft.getOffer()))
                    : MessageDraft.text(text);
            return append(conv, senderId, normalized);
        });
        return afterSend(sent, senderId);
    }

    private ConversationEntity requireSendable(long senderId, long conversationId) {
        ConversationEntity conv = access.requireParticipant(senderId, conversationId);
        if (conv.getConnectionStatus() != ConnectionStatus.ACTIVE) {
            throw ChatException.invalidState("conversation_not_active");
        }
        return conv;
    }

    private String validContent(String content) {
        String text = content == null ? "" : content.trim();
        if (text.isEmpty()) {
            throw ChatException.validation("content_required");
        }
        if (text.length() > chatProps.maxContentLengthEffective()) {
            throw ChatException.validation("content_too_long");
        }
        return text;
    }

    /**
     * 按 t_message 的列宽校验：金额 DECIMAL(18,2) 且不为负，币种三位字母，描述不超过正文上限。
     */
    private OfferDetails validOffer(OfferDetails offer) {
        if (offer == null) {
            throw ChatException.validation("offer_required");
        }
        BigDecimal amount = offer.amount();
        if (amount != null) {
            BigDecimal a = amount.stripTrailingZeros();
            if (a.signum() < 0 || a.scale() > OFFER_AMOUNT_SCALE
                    || a.precision() - a.scale() > OFFER_AMOUNT_PRECISION - OFFER_AMOUNT_SCALE) {
                throw ChatException.validation("offer_amount_invalid");
            }
        }
        if (!CURRENCY_CODE.matcher(offer.currency()).matches()) {
            throw ChatException.validation("offer_currency_invalid");
        }
        if (offer.description() != null && offer.description().length() > chatProps.maxContentLengthEffective()) {
            throw ChatException.validation("offer_description_too_long");
        }
        return offer;
    }

    /**
     * 必须在会话锁内调用：createdAt 与 msgSeq 同序。
     */
    private Sent append(ConversationEntity conv, long senderId, MessageDraft draft) {
        MessageEntity m = MessageFactory.fromDraft(draft, senderId, LocalDateTime.now());
        m.setConversationId(conv.getId());
        return new Sent(messageStore.append(m), conv.otherParticipant(senderId));
    }

    /**
     * 落库已成功；推送与 delivered 标记都是尽力而为，失败只记日志。
     */
    private MessageDto afterSend(Sent sent, long senderId) {
        MessageEntity saved = sent.message();
        MessageDto dto = assembler.toMessageDto(saved, null);
        long conversationId = saved.getConversationId();
        Long other = sent.recipientId();
        // 推送副本单独构造（写出在 eventLoop 上异步序列化）；收到推送的只有对方，对对方而言即已送达
        MessageDto pushed = BeanUtil.copyProperties(dto, MessageDto.class);
        pushed.setDeliveryStatus(DeliveryStatus.DELIVERED);
        try {
            Set<Long> reached = router.publish(
                    List.of(ChannelKey.personal(other), ChannelKey.conversation(conversationId)),
                    WsEvents.NEW_MESSAGE,
                    new WsEvents.NewMessage(conversationId, pushed),
                    senderId);
            if (reached.contains(other) && messageStore.markDelivered(saved.getId())) {
                saved.setDeliveryStatus(DeliveryStatus.DELIVERED);
                dto.setDeliveryStatus(DeliveryStatus.DELIVERED);
            }
        } catch (Exception e) {
            log.warn("post-send fanout failed: conversationId={}, messageId={}, err={}",
                    conversationId, saved.getId(), e.toString());
        }
        return dto;
    }

    @Override
    public ReadReceiptDto markRead(long readerId, long conversationId, long messageId) {
        boolean[] created = {false};
        MessageReadEntity receipt = locks.withLock(conversationId, () -> {
            access.requireParticipant(readerId, conversationId);
            MessageEntity m = messageStore.findById(messageId);
            if (m == null || m.getConversationId() == null || m.getConversationId() != conversationId) {
                throw ChatException.notFound("message_not_found");
            }
            if (m.getSenderId() != null && m.getSenderId() == readerId) {
                throw ChatException.forbidden("cannot_read_own_message");
            }
            MessageReadEntity r = new MessageReadEntity();
            r.setMessageId(messageId);
            r.setConversationId(conversationId);
            r.setReaderId(readerId);
            r.setReadAt(LocalDateTime.now());
            if (messageStore.addReadReceipt(r)) {
                created[0] = true;
                return r;
            }
            MessageReadEntity existing = messageStore.findReadReceipt(messageId, readerId);
            return existing == null ? r : existing;
        });

        if (created[0]) {
            try {
                router.publish(List.of(ChannelKey.conversation(conversationId)), WsEvents.MESSAGE_READ_RECEIPT,
                        new WsEvents.ReadReceipt(conversationId, messageId, readerId, receipt.getReadAt()), readerId);
            } catch (Exception e) {
                log.warn("publish read receipt failed: conversationId={}, messageId={}, err={}",
                        conversationId, messageId, e.toString());
            }
        }
        return new ReadReceiptDto(receipt.getMessageId(), receipt.getReaderId(), receipt.getReadAt());
    }

    @Override
    public int markAllRead(long readerId, long conversationId) {
        LocalDateTime readAt = LocalDateTime.now();
        List<Long> ids = locks.withLock(conversationId, () -> {
            access.requireParticipant(readerId, conversationId);
            return messageStore.markAllRead(conversationId, readerId, readAt);
        });
        if (!ids.isEmpty()) {
            try {
                router.publish(List.of(ChannelKey.conversation(conversationId)), WsEvents.MESSAGES_READ,
                        new WsEvents.BulkRead(conversationId, readerId, ids.size(), readAt), readerId);
            } catch (Exception e) {
                log.warn("publish messages_read failed: conversationId={}, err={}", conversationId, e.toString());
            }
        }
        return ids.size();
    }

    @Override
    public PageResult<MessageDto> listMessages(long requesterId, long conversationId, Integer page, Integer pageSize) {
        access.requireParticipant(requesterId, conversationId);

        int safePage = page == null || page < 1 ? 1 : page;
        int safeSize = chatProps.messagePageSizeDefaultEffective();
        if (pageSize != null) {
            safeSize = Math.max(1, Math.min(pageSize, chatProps.messagePageSizeMaxEffective()));
        }

        long total = messageStore.countByConversation(conversationId);
        long offset = (long) (safePage - 1) * safeSize;
        List<MessageEntity> rows = offset >= total
                ? List.of()
                : new ArrayList<>(messageStore.listNewestFirst(conversationId, offset, safeSize));
        if (!rows.isEmpty()) {
            Collections.reverse(rows);
        }
        return PageResult.of(assembler.toMessageDtos(rows), safePage, safeSize, total);
    }

    @Override
    public long unreadCount(long identityId, long conversationId) {
        access.requireParticipant(identityId, conversationId);
        return messageStore.countUnread(conversationId, identityId);
    }

    private record Sent(MessageEntity message, Long recipientId) {
    }
}
