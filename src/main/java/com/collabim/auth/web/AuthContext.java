package com.collabim.auth.web;

/**
 * 请求级别的“当前身份”上下文。
 *
 * <p>注意：ThreadLocal 一定要在请求结束时清理，否则线程复用时会串号。
 * 我们在 AccessTokenInterceptor#afterCompletion 里 clear。</p>
 */
public final class AuthContext {

    private static final ThreadLocal<Long> IDENTITY_ID = new ThreadLocal<>();

    private AuthContext() {
    }

    public static void setIdentityId(Long identityId) {
        IDENTITY_ID.set(identityId);
    }

    public static Long getIdentityId() {
        return IDENTITY_ID.get();
    }

    public static void clear() {
        IDENTITY_ID.remove();
    }
}
