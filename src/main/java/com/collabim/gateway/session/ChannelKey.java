package com.collabim.gateway.session;

import java.util.Objects;

/**
 * 推送频道：个人频道（每个身份一个，连接后自动订阅）或会话频道（进入聊天页时 join）。
 */
public record ChannelKey(Kind kind, long id) {

    public enum Kind {
        PERSONAL,
        CONVERSATION
    }

    public ChannelKey {
        Objects.requireNonNull(kind, "kind");
    }

    public static ChannelKey personal(long identityId) {
        return new ChannelKey(Kind.PERSONAL, identityId);
    }

    public static ChannelKey conversation(long conversationId) {
        return new ChannelKey(Kind.CONVERSATION, conversationId);
    }

    /**
     * 仅用于日志。
     */
    public String wireName() {
        return (kind == Kind.PERSONAL ? "user_" : "chat_") + id;
    }

    @Override
    public String toString() {
        return wireName();
    }
}
