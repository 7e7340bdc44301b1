package com.collabim.gateway.session;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PresenceRegistryTest {

    private final Instant now = Instant.parse("2026-05-01T10:00:00Z");
    private final PresenceRegistry registry = new PresenceRegistry(Clock.fixed(now, ZoneOffset.UTC));

    @Test
    void registerAndLookup() {
        RecordingConnectionHandle h = new RecordingConnectionHandle(7L);

        assertNull(registry.register(7L, h, "Jane"));

        assertSame(h, registry.lookup(7L));
        assertTrue(registry.isOnline(7L));
        assertEquals("Jane", registry.entry(7L).displayInfo());
        assertEquals(now, registry.entry(7L).connectedAt());
        assertNull(registry.lookup(8L));
        assertFalse(registry.isOnline(8L));
    }

    @Test
    void secondConnection_ShouldReplaceFirst() {
        RecordingConnectionHandle first = new RecordingConnectionHandle(7L);
        RecordingConnectionHandle second = new RecordingConnectionHandle(7L);

        registry.register(7L, first, "Jane");
        PresenceEntry prev = registry.register(7L, second, "Jane");

        assertSame(first, prev.handle());
        assertSame(second, registry.lookup(7L));
        assertEquals(1, registry.size());
    }

    @Test
    void staleDisconnect_ShouldNotRemoveNewerConnection() {
        RecordingConnectionHandle first = new RecordingConnectionHandle(7L);
        RecordingConnectionHandle second = new RecordingConnectionHandle(7L);
        registry.register(7L, first, "Jane");
        registry.register(7L, second, "Jane");

        assertFalse(registry.unregister(7L, first));
        assertSame(second, registry.lookup(7L));

        assertTrue(registry.unregister(7L, second));
        assertNull(registry.lookup(7L));
    }

    @Test
    void unregisterUnknown_ShouldBeNoop() {
        registry.unregister(42L);
        assertFalse(registry.unregister(42L, new RecordingConnectionHandle(42L)));
        assertEquals(0, registry.size());
    }

    @Test
    void inactiveHandle_ShouldNotCountAsOnline() {
        RecordingConnectionHandle h = new RecordingConnectionHandle(7L);
        registry.register(7L, h, "Jane");
        h.setActive(false);

        assertFalse(registry.isOnline(7L));
        assertSame(h, registry.lookup(7L));
    }

    @Test
    void updateStatusLabel_OnlyForOnlineIdentity() {
        registry.register(7L, new RecordingConnectionHandle(7L), "Jane");

        assertTrue(registry.updateStatusLabel(7L, "busy"));
        assertEquals("busy", registry.entry(7L).statusLabel());
        assertFalse(registry.updateStatusLabel(8L, "busy"));
    }
}
