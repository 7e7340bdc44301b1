package com.collabim.gateway.ws;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * WS 文本协议统一写出器：
 * - 统一序列化/错误回包
 * - 保证 ch.writeAndFlush 在对应 channel eventLoop 执行
 * - channel 不可写（对端读得慢）时直接丢弃，不阻塞调用方
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WsWriter {

    private final ObjectMapper objectMapper;

    public ChannelFuture write(Channel ch, WsEnvelope env) {
        if (ch == null) {
            throw new IllegalArgumentException("channel is null");
        }
        if (!ch.isActive()) {
            return ch.newFailedFuture(new IllegalStateException("channel inactive"));
        }
        if (!ch.isWritable()) {
            return ch.newFailedFuture(new IllegalStateException("ws backpressure: channel not writable"));
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(env);
        } catch (Exception e) {
            return ch.newFailedFuture(new IllegalStateException("ws encode failed", e));
        }
        // 非 eventLoop 线程调用时，Netty 会把写操作投递到该 channel 的 eventLoop。
        return ch.writeAndFlush(new TextWebSocketFrame(json));
    }

    public ChannelFuture writeEvent(Channel ch, String event, Object data) {
        WsEnvelope env = new WsEnvelope();
        env.type = event;
        env.data = data;
        env.ts = Instant.now().toEpochMilli();
        return write(ch, env);
    }

    public ChannelFuture writeError(Channel ch, String reason, Long conversationId) {
        WsEnvelope err = new WsEnvelope();
        err.type = WsEvents.ERROR;
        err.conversationId = conversationId;
        err.reason = reason;
        err.ts = Instant.now().toEpochMilli();
        return write(ch, err);
    }
}
