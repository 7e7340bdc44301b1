package com.collabim.gateway.session;

import com.collabim.gateway.ws.WsWriter;
import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import lombok.extern.slf4j.Slf4j;

/**
 * 基于 Netty Channel 的连接句柄。写出交给 channel 的 eventLoop，调用方不会被慢连接拖住。
 */
@Slf4j
public class ChannelConnectionHandle implements ConnectionHandle {

    public static final AttributeKey<ChannelConnectionHandle> ATTR_HANDLE = AttributeKey.valueOf("collab:conn");

    private final Channel channel;
    private final long identityId;
    private final WsWriter writer;

    public ChannelConnectionHandle(Channel channel, long identityId, WsWriter writer) {
        this.channel = channel;
        this.identityId = identityId;
        this.writer = writer;
    }

    public static ChannelConnectionHandle bind(Channel channel, long identityId, WsWriter writer) {
        ChannelConnectionHandle handle = new ChannelConnectionHandle(channel, identityId, writer);
        channel.attr(ATTR_HANDLE).set(handle);
        return handle;
    }

    public static ChannelConnectionHandle of(Channel channel) {
        return channel == null ? null : channel.attr(ATTR_HANDLE).get();
    }

    @Override
    public String id() {
        return channel.id().asLongText();
    }

    @Override
    public long identityId() {
        return identityId;
    }

    @Override
    public boolean isActive() {
        return channel.isActive();
    }

    @Override
    public void send(String event, Object payload) {
        writer.writeEvent(channel, event, payload).addListener(f -> {
            if (!f.isSuccess()) {
                log.debug("ws send dropped: conn={}, event={}, err={}", id(), event, String.valueOf(f.cause()));
            }
        });
    }
}
