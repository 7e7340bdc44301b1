package com.collabim.auth.web;

import com.collabim.auth.config.AuthProperties;
import com.collabim.auth.service.JwtService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class AccessTokenInterceptorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JwtService jwt = new JwtService(
            new AuthProperties("collab-im", "change-me-please-change-me-please-change-me", 1800));
    private final AccessTokenInterceptor interceptor = new AccessTokenInterceptor(jwt, objectMapper);

    @AfterEach
    void tearDown() {
        AuthContext.clear();
    }

    @Test
    void validToken_ShouldPopulateAuthContext() {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/conversations");
        req.addHeader("Authorization", "Bearer " + jwt.issueAccessToken(42L));

        assertThat(interceptor.preHandle(req, new MockHttpServletResponse(), new Object())).isTrue();
        assertThat(AuthContext.getIdentityId()).isEqualTo(42L);
        assertThat(req.getAttribute(AccessTokenInterceptor.REQ_ATTR_IDENTITY_ID)).isEqualTo(42L);

        interceptor.afterCompletion(req, new MockHttpServletResponse(), new Object(), null);
        assertThat(AuthContext.getIdentityId()).isNull();
    }

    @Test
    void missingToken_ShouldWrite401Result() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/conversations");
        MockHttpServletResponse resp = new MockHttpServletResponse();

        assertThat(interceptor.preHandle(req, resp, new Object())).isFalse();
        assertThat(resp.getStatus()).isEqualTo(401);
        JsonNode body = objectMapper.readTree(resp.getContentAsString());
        assertThat(body.get("ok").asBoolean()).isFalse();
        assertThat(body.get("message").asText()).isEqualTo("unauthorized");
    }

    @Test
    void badToken_ShouldWriteInvalidToken() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("POST", "/conversations");
        req.addHeader("Authorization", "Bearer nope");
        MockHttpServletResponse resp = new MockHttpServletResponse();

        assertThat(interceptor.preHandle(req, resp, new Object())).isFalse();
        assertThat(objectMapper.readTree(resp.getContentAsString()).get("message").asText()).isEqualTo("invalid_token");
        assertThat(AuthContext.getIdentityId()).isNull();
    }

    @Test
    void preflight_ShouldPass() {
        MockHttpServletRequest req = new MockHttpServletRequest("OPTIONS", "/conversations");
        assertThat(interceptor.preHandle(req, new MockHttpServletResponse(), new Object())).isTrue();
    }
}
