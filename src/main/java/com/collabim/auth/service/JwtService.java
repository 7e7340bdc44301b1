package com.collabim.auth.service;

import com.collabim.auth.config.AuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

@Service
public class JwtService {

    public static final String CLAIM_IDENTITY_ID = "uid";
    public static final String CLAIM_TOKEN_TYPE = "typ";

    public static final String TOKEN_TYPE_ACCESS = "access";

    private final AuthProperties props;
    private final SecretKey key;
    private final JwtParser parser;

    public JwtService(AuthProperties props) {
        this.props = props;
        this.key = Keys.hmacShaKeyFor(props.jwtSecret().getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(props.issuer())
                .build();
    }

    /**
     * 签发 accessToken（与账号服务同一密钥/issuer）。本服务只在联调脚本和测试里用到。
     */
    public String issueAccessToken(long identityId) {
        Instant now = Instant.now();
        Instant exp = now.plusSeconds(props.accessTokenTtlSeconds());

        return Jwts.builder()
                .issuer(props.issuer())
                .id(UUID.randomUUID().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(exp))
                .claims(Map.of(
                        CLAIM_IDENTITY_ID, identityId,
                        CLAIM_TOKEN_TYPE, TOKEN_TYPE_ACCESS
                ))
                .signWith(key)
                .compact();
    }

    /**
     * 解析并校验 accessToken：签名、issuer、过期时间、typ 必须为 access。
     */
    public Jws<Claims> parseAccessToken(String token) {
        Jws<Claims> jws = parser.parseSignedClaims(token);
        String typ = jws.getPayload().get(CLAIM_TOKEN_TYPE, String.class);
        if (!TOKEN_TYPE_ACCESS.equals(typ)) {
            throw new JwtException("token_type_not_access");
        }
        return jws;
    }

    public long getIdentityId(Claims claims) {
        Number uid = claims.get(CLAIM_IDENTITY_ID, Number.class);
        if (uid == null) {
            throw new JwtException("missing_uid");
        }
        return uid.longValue();
    }
}
