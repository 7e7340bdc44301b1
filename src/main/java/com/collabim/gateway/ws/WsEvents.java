package com.collabim.gateway.ws;

import com.collabim.domain.dto.ConversationDto;
import com.collabim.domain.dto.MessageDto;
import com.collabim.domain.enums.ConnectionStatus;
import com.collabim.domain.enums.RecruitmentStatus;

import java.time.LocalDateTime;

/**
 * WS 事件名与出站载荷。
 */
public final class WsEvents {

    private WsEvents() {
    }

    // 入站
    public static final String JOIN_CHAT = "join_chat";
    public static final String LEAVE_CHAT = "leave_chat";
    public static final String TYPING_START = "typing_start";
    public static final String TYPING_STOP = "typing_stop";
    public static final String MESSAGE_READ = "message_read";
    public static final String UPDATE_STATUS = "update_status";
    public static final String PING = "ping";

    // 出站
    public static final String CONNECTED = "connected";
    public static final String JOINED = "joined";
    public static final String USER_ONLINE = "user_online";
    public static final String USER_OFFLINE = "user_offline";
    public static final String USER_TYPING = "user_typing";
    public static final String USER_STOPPED_TYPING = "user_stopped_typing";
    public static final String MESSAGE_READ_RECEIPT = "message_read_receipt";
    public static final String MESSAGES_READ = "messages_read";
    public static final String NEW_CHAT = "new_chat";
    public static final String NEW_MESSAGE = "new_message";
    public static final String USER_STATUS_UPDATE = "user_status_update";
    public static final String CHAT_STATUS_UPDATED = "chat_status_updated";
    public static final String PONG = "pong";
    public static final String ERROR = "error";

    public record Connected(long identityId, long timestamp) {
    }

    public record Joined(long conversationId) {
    }

    public record Presence(long identityId, String displayInfo, long conversationId) {
    }

    public record Typing(long identityId, long conversationId) {
    }

    public record ReadReceipt(long conversationId, long messageId, long readBy, LocalDateTime readAt) {
    }

    public record BulkRead(long conversationId, long readBy, int count, LocalDateTime readAt) {
    }

    public record NewChat(ConversationDto conversation, String message) {
    }

    public record NewMessage(long conversationId, MessageDto message) {
    }

    public record StatusUpdate(long identityId, String status) {
    }

    public record ChatStatusUpdated(long conversationId,
                                    ConnectionStatus connectionStatus,
                                    RecruitmentStatus recruitmentStatus,
                                    long updatedBy,
                                    LocalDateTime lastActivityAt) {
    }
}
