package com.collabim.gateway.session;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 本进程内 identityId -> 当前连接 的映射。
 *
 * <p>每个身份最多一条：重连/多开时新连接覆盖旧记录，旧连接不会被主动关闭，
 * 只是不再被视为“当前连接”。所有修改按 key 原子执行（ConcurrentHashMap#compute）。</p>
 */
@Slf4j
@Component
public class PresenceRegistry {

    private final ConcurrentHashMap<Long, PresenceEntry> entries = new ConcurrentHashMap<>();

    private final Clock clock;

    public PresenceRegistry() {
        this(Clock.systemUTC());
    }

    PresenceRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * 登记连接，覆盖同一身份的旧记录。
     *
     * @return 被覆盖的旧记录；没有则为 null
     */
    public PresenceEntry register(long identityId, ConnectionHandle handle, String displayInfo) {
        PresenceEntry entry = new PresenceEntry(identityId, handle, displayInfo, clock.instant(), null);
        PresenceEntry prev = entries.put(identityId, entry);
        if (prev != null && prev.handle() != handle) {
            log.info("presence replaced: identityId={}, oldConn={}, newConn={}", identityId, prev.handle().id(), handle.id());
        }
        return prev;
    }

    public void unregister(long identityId) {
        entries.remove(identityId);
    }

    /**
     * 仅当当前记录仍属于该连接时删除（旧连接晚于新连接断开时，不能把新连接的记录删掉）。
     */
    public boolean unregister(long identityId, ConnectionHandle handle) {
        boolean[] removed = {false};
        entries.computeIfPresent(identityId, (k, cur) -> {
            if (cur.handle() == handle) {
                removed[0] = true;
                return null;
            }
            return cur;
        });
        return removed[0];
    }

    /**
     * @return 当前连接；不在线时为 null
     */
    public ConnectionHandle lookup(long identityId) {
        PresenceEntry e = entries.get(identityId);
        return e == null ? null : e.handle();
    }

    public PresenceEntry entry(long identityId) {
        return entries.get(identityId);
    }

    public boolean isOnline(long identityId) {
        PresenceEntry e = entries.get(identityId);
        return e != null && e.handle().isActive();
    }

    public List<PresenceEntry> listAll() {
        return new ArrayList<>(entries.values());
    }

    /**
     * @return 该身份不在线时返回 false
     */
    public boolean updateStatusLabel(long identityId, String label) {
        return entries.computeIfPresent(identityId, (k, cur) -> cur.withStatusLabel(label)) != null;
    }

    public int size() {
        return entries.size();
    }

    @PreDestroy
    public void clear() {
        entries.clear();
    }
}
