package com.collabim.domain.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 按会话 id 串行化写操作（发消息、已读、状态变更）。
 *
 * <p>锁对象用弱引用缓存：没有线程持有/等待时可被回收，不会随会话数量无限增长。</p>
 */
@Component
public class ConversationLocks {

    private final Cache<Long, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build();

    public <T> T withLock(long conversationId, Supplier<T> action) {
        ReentrantLock lock = locks.get(conversationId, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
