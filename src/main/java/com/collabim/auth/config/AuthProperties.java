package com.collabim.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * accessToken 校验参数。token 由账号服务签发，这里只负责验签与解析身份。
 */
@ConfigurationProperties(prefix = "collab.auth")
public record AuthProperties(
        String issuer,
        String jwtSecret,
        long accessTokenTtlSeconds
) {
}
