package com.collabim.gateway.session;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 频道订阅与事件分发。
 *
 * <p>推送是 fire-and-forget：没有订阅者就丢弃，不重试、不落库。
 * 客户端重连后通过 HTTP 拉取补齐。</p>
 */
@Slf4j
@Component
public class RoomRouter {

    private final ConcurrentHashMap<ChannelKey, Set<ConnectionHandle>> subscribers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<ChannelKey>> subscriptionsByConn = new ConcurrentHashMap<>();

    public void subscribe(ConnectionHandle handle, ChannelKey key) {
        // add 必须在 compute 内完成，否则并发退订可能先把空集合移出 map
        subscribers.compute(key, (k, set) -> {
            Set<ConnectionHandle> out = set == null ? ConcurrentHashMap.newKeySet() : set;
            out.add(handle);
            return out;
        });
        subscriptionsByConn.compute(handle.id(), (k, set) -> {
            Set<ChannelKey> out = set == null ? ConcurrentHashMap.newKeySet() : set;
            out.add(key);
            return out;
        });
    }

    public void unsubscribe(ConnectionHandle handle, ChannelKey key) {
        subscribers.computeIfPresent(key, (k, set) -> {
            set.remove(handle);
            return set.isEmpty() ? null : set;
        });
        subscriptionsByConn.computeIfPresent(handle.id(), (k, set) -> {
            set.remove(key);
            return set.isEmpty() ? null : set;
        });
    }

    /**
     * 退订该连接的全部频道。
     *
     * @return 退订前持有的频道
     */
    public Set<ChannelKey> unsubscribeAll(ConnectionHandle handle) {
        Set<ChannelKey> keys = subscriptionsByConn.remove(handle.id());
        if (keys == null) {
            return Set.of();
        }
        Set<ChannelKey> out = new HashSet<>(keys);
        for (ChannelKey key : out) {
            subscribers.computeIfPresent(key, (k, set) -> {
                set.remove(handle);
                return set.isEmpty() ? null : set;
            });
        }
        return out;
    }

    public boolean isSubscribed(ConnectionHandle handle, ChannelKey key) {
        Set<ConnectionHandle> set = subscribers.get(key);
        return set != null && set.contains(handle);
    }

    public Set<ChannelKey> subscriptions(ConnectionHandle handle) {
        Set<ChannelKey> keys = subscriptionsByConn.get(handle.id());
        return keys == null ? Set.of() : Set.copyOf(keys);
    }

    public int publish(ChannelKey key, String event, Object payload) {
        return publish(Set.of(key), event, payload, null).size();
    }

    /**
     * 推送到多个频道；同一连接即使订阅了多个目标频道也只收到一次。
     *
     * @param excludedIdentityId 不推给该身份（通常是事件发起者），可为 null
     * @return 实际写出过的身份 id
     */
    public Set<Long> publish(Collection<ChannelKey> keys, String event, Object payload, Long excludedIdentityId) {
        Set<Long> reached = new LinkedHashSet<>();
        Set<String> seen = new HashSet<>();
        for (ChannelKey key : keys) {
            Set<ConnectionHandle> set = subscribers.get(key);
            if (set == null || set.isEmpty()) {
                continue;
            }
            for (ConnectionHandle h : set) {
                if (excludedIdentityId != null && h.identityId() == excludedIdentityId) {
                    continue;
                }
                if (!seen.add(h.id())) {
                    continue;
                }
                if (!h.isActive()) {
                    unsubscribeAll(h);
                    continue;
                }
                try {
                    h.send(event, payload);
                    reached.add(h.identityId());
                } catch (Exception e) {
                    log.warn("publish failed: channel={}, event={}, conn={}, err={}", key, event, h.id(), e.toString());
                }
            }
        }
        return reached;
    }
}
