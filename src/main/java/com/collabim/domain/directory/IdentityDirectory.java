package com.collabim.domain.directory;

import com.collabim.domain.model.Identity;

import java.util.Collection;
import java.util.Map;

/**
 * 账号查询。账号的注册与审核不在本服务内。
 */
public interface IdentityDirectory {

    /**
     * @return 不存在时返回 null
     */
    Identity getIdentity(long identityId);

    /**
     * 绕过缓存直接读库。审核状态等权限前置条件必须用它。
     *
     * @return 不存在时返回 null
     */
    Identity getIdentityFresh(long identityId);

    Map<Long, Identity> getIdentities(Collection<Long> identityIds);
}
