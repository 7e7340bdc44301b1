package com.collabim.domain.directory;

import com.collabim.domain.cache.IdentityProfileCache;
import com.collabim.domain.entity.UserEntity;
import com.collabim.domain.mapper.UserMapper;
import com.collabim.domain.model.Identity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 先查 Redis 缓存，miss 再查 t_user 并回填。
 */
@Component
public class MyBatisIdentityDirectory implements IdentityDirectory {

    private final UserMapper userMapper;
    private final IdentityProfileCache cache;

    public MyBatisIdentityDirectory(UserMapper userMapper, IdentityProfileCache cache) {
        this.userMapper = userMapper;
        this.cache = cache;
    }

    @Override
    public Identity getIdentity(long identityId) {
        Identity cached = cache.get(identityId);
        if (cached != null) {
            return cached;
        }
        UserEntity u = userMapper.selectById(identityId);
        if (u == null) {
            return null;
        }
        Identity identity = toIdentity(u);
        cache.put(identity);
        return identity;
    }

    @Override
    public Identity getIdentityFresh(long identityId) {
        UserEntity u = userMapper.selectById(identityId);
        if (u == null) {
            return null;
        }
        Identity identity = toIdentity(u);
        // 顺手刷新缓存里的旧值
        cache.put(identity);
        return identity;
    }

    @Override
    public Map<Long, Identity> getIdentities(Collection<Long> identityIds) {
        Map<Long, Identity> out = new HashMap<>(cache.getBatch(identityIds));
        List<Long> missing = new ArrayList<>();
        for (Long id : identityIds) {
            if (id != null && !out.containsKey(id) && !missing.contains(id)) {
                missing.add(id);
            }
        }
        if (missing.isEmpty()) {
            return out;
        }
        for (UserEntity u : userMapper.selectBatchIds(missing)) {
            Identity identity = toIdentity(u);
            cache.put(identity);
            out.put(identity.id(), identity);
        }
        return out;
    }

    private static Identity toIdentity(UserEntity u) {
        return new Identity(u.getId(), u.getDisplayName(), u.getRole(), u.getLabel(), u.getStanding());
    }
}
