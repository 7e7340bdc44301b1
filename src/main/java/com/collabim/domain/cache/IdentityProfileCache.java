package com.collabim.domain.cache;

import com.collabim.common.cache.CacheProperties;
import com.collabim.common.cache.RedisJsonCache;
import com.collabim.domain.model.Identity;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class IdentityProfileCache {

    private static final String KEY_PREFIX = "collab:cache:identity:";

    private final CacheProperties props;
    private final RedisJsonCache cache;

    public IdentityProfileCache(CacheProperties props, RedisJsonCache cache) {
        this.props = props;
        this.cache = cache;
    }

    public Identity get(long identityId) {
        if (!props.isEnabled() || identityId <= 0) {
            return null;
        }
        return cache.get(key(identityId), Identity.class);
    }

    public Map<Long, Identity> getBatch(Collection<Long> identityIds) {
        if (!props.isEnabled() || identityIds == null || identityIds.isEmpty()) {
            return new HashMap<>();
        }

        List<Long> ids = identityIds.stream()
                .filter(v -> v != null && v > 0)
                .distinct()
                .toList();
        if (ids.isEmpty()) {
            return new HashMap<>();
        }

        Map<String, Identity> byKey = cache.mget(ids.stream().map(this::key).toList(), Identity.class);
        Map<Long, Identity> out = new HashMap<>();
        for (Long id : ids) {
            Identity v = byKey.get(key(id));
            if (v != null) {
                out.put(id, v);
            }
        }
        return out;
    }

    public void put(Identity identity) {
        if (!props.isEnabled() || identity == null || identity.id() <= 0) {
            return;
        }
        cache.set(key(identity.id()), identity, Duration.ofSeconds(Math.max(1, props.getIdentityTtlSeconds())));
    }

    private String key(long identityId) {
        return KEY_PREFIX + identityId;
    }
}
