package com.collabim.domain.model;

import com.collabim.domain.enums.MessageKind;
import com.collabim.domain.enums.SystemKind;
import lombok.Getter;

import java.util.Objects;

/**
 * 待落库的消息内容。
 *
 * <p>只能通过 {@link #text}、{@link #offer}、{@link #system} 构造：
 * offer 必带 {@link OfferDetails}，system 必带 {@link SystemKind}，text 两者都没有。</p>
 */
@Getter
public final class MessageDraft {

    private final MessageKind kind;

    private final String content;

    private final OfferDetails offer;

    private final SystemKind systemKind;

    private MessageDraft(MessageKind kind, String content, OfferDetails offer, SystemKind systemKind) {
        this.kind = kind;
        this.content = content;
        this.offer = offer;
        this.systemKind = systemKind;
    }

    public static MessageDraft text(String content) {
        return new MessageDraft(MessageKind.TEXT, content, null, null);
    }

    public static MessageDraft offer(String content, OfferDetails offer) {
        Objects.requireNonNull(offer, "offer");
        return new MessageDraft(MessageKind.OFFER, content, offer, null);
    }

    public static MessageDraft system(SystemKind systemKind, String content) {
        Objects.requireNonNull(systemKind, "systemKind");
        return new MessageDraft(MessageKind.SYSTEM, content, null, systemKind);
    }
}
