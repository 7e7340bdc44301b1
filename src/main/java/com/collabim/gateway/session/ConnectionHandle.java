package com.collabim.gateway.session;

/**
 * 一条已鉴权的实时连接。
 */
public interface ConnectionHandle {

    /** 连接 id（进程内唯一）。 */
    String id();

    long identityId();

    boolean isActive();

    /**
     * 异步写出一个事件，不阻塞调用线程；连接不可写时直接丢弃。
     */
    void send(String event, Object payload);
}
