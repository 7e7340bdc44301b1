package com.collabim.gateway.session;

import java.time.Instant;

/**
 * 在线记录：只存在于本进程内存，断开即删除。
 */
public record PresenceEntry(
        long identityId,
        ConnectionHandle handle,
        String displayInfo,
        Instant connectedAt,
        String statusLabel
) {

    public PresenceEntry withStatusLabel(String label) {
        return new PresenceEntry(identityId, handle, displayInfo, connectedAt, label);
    }
}
