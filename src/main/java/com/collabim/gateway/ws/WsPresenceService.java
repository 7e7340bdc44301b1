package com.collabim.gateway.ws;

import com.collabim.common.error.ChatException;
import com.collabim.domain.entity.ConversationEntity;
import com.collabim.domain.store.ConversationStore;
import com.collabim.gateway.session.ChannelKey;
import com.collabim.gateway.session.ConnectionHandle;
import com.collabim.gateway.session.PresenceEntry;
import com.collabim.gateway.session.PresenceRegistry;
import com.collabim.gateway.session.RoomRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 连接生命周期与房间内的在线/输入中提示。与 Netty 无关，只依赖 {@link ConnectionHandle}。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WsPresenceService {

    private final PresenceRegistry registry;
    private final RoomRouter router;
    private final ConversationStore conversationStore;

    /**
     * 握手完成：登记在线、订阅个人频道、回 connected。
     * 同一身份的旧连接不再接收个人频道事件。
     */
    public void onConnected(ConnectionHandle handle, String displayInfo) {
        long identityId = handle.identityId();
        ChannelKey personal = ChannelKey.personal(identityId);
        PresenceEntry prev = registry.register(identityId, handle, displayInfo);
        if (prev != null && prev.handle() != handle) {
            router.unsubscribe(prev.handle(), personal);
        }
        router.subscribe(handle, personal);
        handle.send(WsEvents.CONNECTED, new WsEvents.Connected(identityId, Instant.now().toEpochMilli()));
        log.info("ws connected: identityId={}, conn={}, online={}", identityId, handle.id(), registry.size());
    }

    /**
     * 断开：条件删除在线记录（新连接已覆盖时不删），退订全部频道，向所在会话房间广播离线。
     * 新连接已重新加入的房间不广播，那里该身份仍在线。
     */
    public void onDisconnected(ConnectionHandle handle) {
        long identityId = handle.identityId();
        String info = displayInfo(identityId);
        boolean removed = registry.unregister(identityId, handle);
        Set<ChannelKey> keys = router.unsubscribeAll(handle);
        ConnectionHandle current = removed ? null : registry.lookup(identityId);
        for (ChannelKey key : keys) {
            if (current != null && router.isSubscribed(current, key)) {
                continue;
            }
            if (key.kind() == ChannelKey.Kind.CONVERSATION) {
                router.publish(List.of(key), WsEvents.USER_OFFLINE,
                        new WsEvents.Presence(identityId, info, key.id()), identityId);
            }
        }
        log.info("ws disconnected: identityId={}, conn={}, presenceRemoved={}, rooms={}",
                identityId, handle.id(), removed, keys.size());
    }

    /**
     * 查库判断是否为参与者。阻塞调用，不要在 eventLoop 上执行。
     */
    public boolean canJoin(long identityId, long conversationId) {
        ConversationEntity conv = conversationStore.findById(conversationId);
        return conv != null && conv.isParticipant(identityId);
    }

    public void joinConversation(ConnectionHandle handle, long conversationId) {
        ChannelKey key = ChannelKey.conversation(conversationId);
        router.subscribe(handle, key);
        handle.send(WsEvents.JOINED, new WsEvents.Joined(conversationId));
        router.publish(List.of(key), WsEvents.USER_ONLINE,
                new WsEvents.Presence(handle.identityId(), displayInfo(handle.identityId()), conversationId),
                handle.identityId());
        log.debug("joined {}: identityId={}, conn={}", key, handle.identityId(), handle.id());
    }

    public void leaveConversation(ConnectionHandle handle, long conversationId) {
        ChannelKey key = ChannelKey.conversation(conversationId);
        if (!router.isSubscribed(handle, key)) {
            return;
        }
        router.unsubscribe(handle, key);
        router.publish(List.of(key), WsEvents.USER_OFFLINE,
                new WsEvents.Presence(handle.identityId(), displayInfo(handle.identityId()), conversationId),
                handle.identityId());
    }

    /**
     * 只有已 join 的房间才转发输入中提示。
     */
    public void typing(ConnectionHandle handle, long conversationId, boolean started) {
        ChannelKey key = ChannelKey.conversation(conversationId);
        if (!router.isSubscribed(handle, key)) {
            throw ChatException.invalidState("not_joined");
        }
        router.publish(List.of(key),
                started ? WsEvents.USER_TYPING : WsEvents.USER_STOPPED_TYPING,
                new WsEvents.Typing(handle.identityId(), conversationId),
                handle.identityId());
    }

    /**
     * 更新在线状态文案，并通知其他所有在线身份。
     */
    public void updateStatus(ConnectionHandle handle, String label) {
        long identityId = handle.identityId();
        registry.updateStatusLabel(identityId, label);
        List<ChannelKey> targets = new ArrayList<>();
        for (PresenceEntry e : registry.listAll()) {
            if (e.identityId() != identityId) {
                targets.add(ChannelKey.personal(e.identityId()));
            }
        }
        router.publish(targets, WsEvents.USER_STATUS_UPDATE, new WsEvents.StatusUpdate(identityId, label), identityId);
    }

    private String displayInfo(long identityId) {
        PresenceEntry e = registry.entry(identityId);
        return e == null ? null : e.displayInfo();
    }
}
