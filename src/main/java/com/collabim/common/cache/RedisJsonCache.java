package com.collabim.common.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Redis JSON 缓存。缓存只是加速层：任何 Redis 故障都降级为 miss，不向上抛出。
 */
@Slf4j
@Component
public class RedisJsonCache {

    /**
     * Redis 故障后的熔断窗口：窗口内直接返回 miss，避免每次读写都卡在连接超时上。
     */
    private static final long REDIS_FAIL_FAST_MS = 10_000;

    private final AtomicLong unavailableUntilMs = new AtomicLong(0);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;

    public RedisJsonCache(StringRedisTemplate redis, ObjectMapper objectMapper) {
        this.redis = redis;
        this.objectMapper = objectMapper;
    }

    public <T> T get(String key, Class<T> type) {
        if (key == null || key.isBlank() || type == null || shouldFailFast()) {
            return null;
        }
        try {
            String raw = redis.opsForValue().get(key);
            if (raw == null || raw.isBlank()) {
                return null;
            }
            return objectMapper.readValue(raw, type);
        } catch (Exception e) {
            log.debug("redis json cache get failed: key={}, err={}", key, e.toString());
            markRedisDown();
            return null;
        }
    }

    public <T> Map<String, T> mget(List<String> keys, Class<T> type) {
        if (keys == null || keys.isEmpty() || type == null || shouldFailFast()) {
            return Map.of();
        }
        try {
            List<String> raws = redis.opsForValue().multiGet(keys);
            if (raws == null || raws.isEmpty()) {
                return Map.of();
            }
            Map<String, T> out = new LinkedHashMap<>();
            int n = Math.min(keys.size(), raws.size());
            for (int i = 0; i < n; i++) {
                String raw = raws.get(i);
                if (raw == null || raw.isBlank()) {
                    continue;
                }
                try {
                    out.put(keys.get(i), objectMapper.readValue(raw, type));
                } catch (Exception e) {
                    log.debug("redis json cache mget parse failed: key={}, err={}", keys.get(i), e.toString());
                }
            }
            return out;
        } catch (Exception e) {
            log.debug("redis json cache mget failed: size={}, err={}", keys.size(), e.toString());
            markRedisDown();
            return Map.of();
        }
    }

    public void set(String key, Object value, Duration ttl) {
        if (key == null || key.isBlank() || value == null || shouldFailFast()) {
            return;
        }
        long sec = ttl == null ? 0 : ttl.toSeconds();
        if (sec <= 0) {
            sec = 60;
        }
        try {
            redis.opsForValue().set(key, objectMapper.writeValueAsString(value), Duration.ofSeconds(sec));
        } catch (Exception e) {
            log.debug("redis json cache set failed: key={}, err={}", key, e.toString());
            markRedisDown();
        }
    }

    private boolean shouldFailFast() {
        return System.currentTimeMillis() < unavailableUntilMs.get();
    }

    private void markRedisDown() {
        long until = System.currentTimeMillis() + REDIS_FAIL_FAST_MS;
        unavailableUntilMs.accumulateAndGet(until, Math::max);
    }
}
