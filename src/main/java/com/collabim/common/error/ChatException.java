package com.collabim.common.error;

import lombok.Getter;

/**
 * 会话/消息核心的统一业务异常。
 *
 * <p>reason 使用 snake_case（例如 {@code not_applied}），HTTP 与 WS 两侧都直接透传给客户端。</p>
 */
@Getter
public class ChatException extends RuntimeException {

    private final ErrorKind kind;

    private final String reason;

    /** 仅 CONFLICT（重复会话）时有值：已存在的会话 id。 */
    private final Long conversationId;

    public ChatException(ErrorKind kind, String reason) {
        this(kind, reason, null, null);
    }

    public ChatException(ErrorKind kind, String reason, Long conversationId, Throwable cause) {
        super(kind + ": " + reason, cause);
        this.kind = kind;
        this.reason = reason;
        this.conversationId = conversationId;
    }

    public static ChatException unauthenticated() {
        return new ChatException(ErrorKind.UNAUTHENTICATED, "unauthorized");
    }

    public static ChatException forbidden(String reason) {
        return new ChatException(ErrorKind.FORBIDDEN, reason);
    }

    public static ChatException notFound(String reason) {
        return new ChatException(ErrorKind.NOT_FOUND, reason);
    }

    public static ChatException invalidState(String reason) {
        return new ChatException(ErrorKind.INVALID_STATE, reason);
    }

    public static ChatException validation(String reason) {
        return new ChatException(ErrorKind.VALIDATION, reason);
    }

    public static ChatException conflict(String reason, long existingConversationId) {
        return new ChatException(ErrorKind.CONFLICT, reason, existingConversationId, null);
    }

    public static ChatException unavailable(Throwable cause) {
        return new ChatException(ErrorKind.UNAVAILABLE, "store_unavailable", null, cause);
    }
}
