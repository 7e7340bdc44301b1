package com.collabim.domain.service.impl;

import com.collabim.domain.entity.MessageEntity;
import com.collabim.domain.enums.DeliveryStatus;
import com.collabim.domain.model.MessageDraft;
import com.collabim.domain.model.OfferDetails;

import java.time.LocalDateTime;

final class MessageFactory {

    private MessageFactory() {
    }

    static MessageEntity fromDraft(MessageDraft draft, long senderId, LocalDateTime createdAt) {
        MessageEntity m = new MessageEntity();
        m.setSenderId(senderId);
        m.setKind(draft.getKind());
        m.setContent(draft.getContent());
        m.setSystemKind(draft.getSystemKind());
        OfferDetails offer = draft.getOffer();
        if (offer != null) {
            m.setOfferAmount(offer.amount());
            m.setOfferCurrency(offer.currency());
            m.setOfferDescription(offer.description());
            m.setOfferDeadline(offer.deadline());
        }
        m.setDeliveryStatus(DeliveryStatus.SENT);
        m.setCreatedAt(createdAt);
        return m;
    }
}
