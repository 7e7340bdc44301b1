package com.collabim.gateway.session;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 记录收到的事件，用于断言推送结果。
 */
public class RecordingConnectionHandle implements ConnectionHandle {

    private static final AtomicInteger SEQ = new AtomicInteger();

    public record Event(String name, Object payload) {
    }

    private final String id;
    private final long identityId;
    private final List<Event> events = new CopyOnWriteArrayList<>();
    private volatile boolean active = true;
    private volatile boolean failOnSend;

    public RecordingConnectionHandle(long identityId) {
        this.id = "conn-" + identityId + "-" + SEQ.incrementAndGet();
        this.identityId = identityId;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public long identityId() {
        return identityId;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    @Override
    public void send(String event, Object payload) {
        if (failOnSend) {
            throw new IllegalStateException("send failed");
        }
        events.add(new Event(event, payload));
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public void setFailOnSend(boolean failOnSend) {
        this.failOnSend = failOnSend;
    }

    public List<Event> events() {
        return events;
    }

    public List<Event> events(String name) {
        return events.stream().filter(e -> e.name().equals(name)).toList();
    }

    public List<String> names() {
        return events.stream().map(Event::name).toList();
    }

    public void clear() {
        events.clear();
    }
}
