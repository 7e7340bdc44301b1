package com.collabim.auth.web;

import com.collabim.auth.service.JwtService;
import com.collabim.common.api.ApiCodes;
import com.collabim.common.api.Result;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Claims;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * 会话接口一律要求登录：缺少或无法解析 Bearer token 时直接 401，并用统一 Result JSON 输出。
 */
@Slf4j
@Component
public class AccessTokenInterceptor implements HandlerInterceptor {

    public static final String REQ_ATTR_IDENTITY_ID = "X-Auth-IdentityId";

    private final JwtService jwtService;
    private final ObjectMapper objectMapper;

    public AccessTokenInterceptor(JwtService jwtService, ObjectMapper objectMapper) {
        this.jwtService = jwtService;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            return true;
        }
        String header = request.getHeader("Authorization");
        if (header == null || !header.startsWith("Bearer ")) {
            writeUnauthorized(request, response, "unauthorized");
            return false;
        }

        String token = header.substring("Bearer ".length()).trim();
        try {
            Claims claims = jwtService.parseAccessToken(token).getPayload();
            long identityId = jwtService.getIdentityId(claims);
            request.setAttribute(REQ_ATTR_IDENTITY_ID, identityId);
            AuthContext.setIdentityId(identityId);
            return true;
        } catch (Exception e) {
            log.debug("access token rejected: path={}, err={}", request.getRequestURI(), e.toString());
            writeUnauthorized(request, response, "invalid_token");
            return false;
        }
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        AuthContext.clear();
    }

    private void writeUnauthorized(HttpServletRequest request, HttpServletResponse response, String reason) {
        response.setStatus(401);
        response.setCharacterEncoding("UTF-8");
        response.setContentType("application/json;charset=UTF-8");
        try {
            response.getWriter().write(objectMapper.writeValueAsString(Result.fail(ApiCodes.UNAUTHORIZED, reason)));
        } catch (Exception writeErr) {
            log.debug("write unauthorized response failed: path={}, err={}", request.getRequestURI(), writeErr.toString());
        }
    }
}
