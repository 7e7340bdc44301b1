package com.collabim.gateway.ws;

import com.collabim.common.error.ChatException;
import com.collabim.domain.service.MessagePipelineService;
import com.collabim.gateway.session.ChannelConnectionHandle;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 业务帧处理：每个 TextWebSocketFrame 是一个 JSON {@link WsEnvelope}，按 type 分发。
 *
 * <p>涉及查库/落库的事件（join_chat、message_read）切到 DB 线程池执行，结果回到 eventLoop 写出。</p>
 */
@Slf4j
public class WsFrameHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private static final long DB_TIMEOUT_SEC = 3;
    private static final int MAX_STATUS_LEN = 64;

    private final ObjectMapper objectMapper;
    private final WsWriter writer;
    private final WsPresenceService presenceService;
    private final MessagePipelineService messagePipelineService;
    private final Executor dbExecutor;

    public WsFrameHandler(ObjectMapper objectMapper,
                          WsWriter writer,
                          WsPresenceService presenceService,
                          MessagePipelineService messagePipelineService,
                          Executor dbExecutor) {
        this.objectMapper = objectMapper;
        this.writer = writer;
        this.presenceService = presenceService;
        this.messagePipelineService = messagePipelineService;
        this.dbExecutor = dbExecutor;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        ChannelConnectionHandle handle = ChannelConnectionHandle.of(ctx.channel());
        if (handle == null) {
            writer.writeError(ctx.channel(), "unauthorized", null);
            ctx.close();
            return;
        }

        WsEnvelope msg;
        try {
            msg = objectMapper.readValue(frame.text(), WsEnvelope.class);
        } catch (Exception e) {
            writer.writeError(ctx.channel(), "bad_json", null);
            return;
        }
        if (msg.type == null || msg.type.isBlank()) {
            writer.writeError(ctx.channel(), "missing_type", null);
            return;
        }
        log.debug("received envelope type={}, identityId={}, conversationId={}",
                msg.type, handle.identityId(), msg.conversationId);

        try {
            switch (msg.type) {
                case WsEvents.JOIN_CHAT -> handleJoin(ctx, handle, msg);
                case WsEvents.LEAVE_CHAT -> {
                    if (requireConversationId(ctx, msg)) {
                        presenceService.leaveConversation(handle, msg.conversationId);
                    }
                }
                case WsEvents.TYPING_START, WsEvents.TYPING_STOP -> {
                    if (requireConversationId(ctx, msg)) {
                        presenceService.typing(handle, msg.conversationId, WsEvents.TYPING_START.equals(msg.type));
                    }
                }
                case WsEvents.MESSAGE_READ -> handleMessageRead(ctx, handle, msg);
                case WsEvents.UPDATE_STATUS -> handleUpdateStatus(ctx, handle, msg);
                case WsEvents.PING -> writer.writeEvent(ctx.channel(), WsEvents.PONG, null);
                default -> writer.writeError(ctx.channel(), "not_implemented", null);
            }
        } catch (ChatException e) {
            writer.writeError(ctx.channel(), e.getReason(), msg.conversationId);
        }
    }

    private void handleJoin(ChannelHandlerContext ctx, ChannelConnectionHandle handle, WsEnvelope msg) {
        if (!requireConversationId(ctx, msg)) {
            return;
        }
        long conversationId = msg.conversationId;
        runOnDb(ctx, conversationId,
                () -> presenceService.canJoin(handle.identityId(), conversationId),
                ok -> {
                    if (Boolean.TRUE.equals(ok)) {
                        presenceService.joinConversation(handle, conversationId);
                    } else {
                        writer.writeError(ctx.channel(), "not_participant", conversationId);
                    }
                });
    }

    private void handleMessageRead(ChannelHandlerContext ctx, ChannelConnectionHandle handle, WsEnvelope msg) {
        if (!requireConversationId(ctx, msg)) {
            return;
        }
        if (msg.messageId == null) {
            writer.writeError(ctx.channel(), "missing_message_id", msg.conversationId);
            return;
        }
        long conversationId = msg.conversationId;
        long messageId = msg.messageId;
        // 回执落库后由 MessagePipeline 广播 message_read_receipt，这里不再单独回包。
        runOnDb(ctx, conversationId,
                () -> messagePipelineService.markRead(handle.identityId(), conversationId, messageId),
                receipt -> {
                });
    }

    private void handleUpdateStatus(ChannelHandlerContext ctx, ChannelConnectionHandle handle, WsEnvelope msg) {
        String label = msg.status == null ? null : msg.status.trim();
        if (label == null || label.isEmpty()) {
            writer.writeError(ctx.channel(), "missing_status", null);
            return;
        }
        if (label.length() > MAX_STATUS_LEN) {
            writer.writeError(ctx.channel(), "status_too_long", null);
            return;
        }
        presenceService.updateStatus(handle, label);
    }

    private boolean requireConversationId(ChannelHandlerContext ctx, WsEnvelope msg) {
        if (msg.conversationId == null || msg.conversationId <= 0) {
            writer.writeError(ctx.channel(), "missing_conversation_id", null);
            return false;
        }
        return true;
    }

    private <T> void runOnDb(ChannelHandlerContext ctx, long conversationId, Supplier<T> task, Consumer<T> onSuccess) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(task, dbExecutor);
        } catch (Exception e) {
            log.warn("db executor rejected ws task: conversationId={}, err={}", conversationId, e.toString());
            writer.writeError(ctx.channel(), "server_busy", conversationId);
            return;
        }
        future.orTimeout(DB_TIMEOUT_SEC, TimeUnit.SECONDS)
                .whenComplete((v, err) -> ctx.executor().execute(() -> {
                    if (err == null) {
                        onSuccess.accept(v);
                        return;
                    }
                    String reason = reasonOf(err);
                    if ("internal_error".equals(reason)) {
                        log.error("ws task failed: conversationId={}", conversationId, err);
                    }
                    writer.writeError(ctx.channel(), reason, conversationId);
                }));
    }

    static String reasonOf(Throwable err) {
        Throwable t = err;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof ChatException ce) {
            return ce.getReason();
        }
        if (t instanceof DataIntegrityViolationException) {
            return "invalid_data";
        }
        if (t instanceof TimeoutException || t instanceof DataAccessException) {
            return "store_unavailable";
        }
        return "internal_error";
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            Long identityId = ctx.channel().attr(WsHandshakeAuthHandler.ATTR_IDENTITY_ID).get();
            if (identityId == null) {
                ctx.close();
                return;
            }
            ChannelConnectionHandle handle = ChannelConnectionHandle.bind(ctx.channel(), identityId, writer);
            presenceService.onConnected(handle, ctx.channel().attr(WsHandshakeAuthHandler.ATTR_DISPLAY_INFO).get());
            return;
        }
        if (evt instanceof IdleStateEvent e && e.state() == IdleState.READER_IDLE) {
            // 长时间没有任何入站数据（包括 ping）：视为断线。
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        ChannelConnectionHandle handle = ChannelConnectionHandle.of(ctx.channel());
        if (handle != null) {
            presenceService.onDisconnected(handle);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("ws channel error: conn={}, err={}", ctx.channel().id().asShortText(), cause.toString());
        ctx.close();
    }
}
