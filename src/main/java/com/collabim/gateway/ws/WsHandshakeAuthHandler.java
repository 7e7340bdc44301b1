package com.collabim.gateway.ws;

import com.collabim.auth.service.JwtService;
import com.collabim.domain.directory.IdentityDirectory;
import com.collabim.domain.model.Identity;
import io.jsonwebtoken.Claims;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.AttributeKey;
import io.netty.util.CharsetUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * WebSocket 握手阶段（HTTP Upgrade）鉴权：
 * <ul>
 *   <li>从 Authorization: Bearer <token> 或 query 参数 token/accessToken 里取 accessToken</li>
 *   <li>校验 accessToken 并解析 identityId</li>
 *   <li>确认身份存在后，把 identityId 与展示名绑定到 channel，再放行给协议升级</li>
 * </ul>
 */
@Slf4j
public class WsHandshakeAuthHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    public static final AttributeKey<Long> ATTR_IDENTITY_ID = AttributeKey.valueOf("collab:uid");
    public static final AttributeKey<String> ATTR_DISPLAY_INFO = AttributeKey.valueOf("collab:display");

    private static final long IDENTITY_LOOKUP_TIMEOUT_SEC = 3;

    private final String wsPath;
    private final JwtService jwtService;
    private final IdentityDirectory identityDirectory;
    private final Executor dbExecutor;

    public WsHandshakeAuthHandler(String wsPath, JwtService jwtService, IdentityDirectory identityDirectory, Executor dbExecutor) {
        this.wsPath = wsPath;
        this.jwtService = jwtService;
        this.identityDirectory = identityDirectory;
        this.dbExecutor = dbExecutor;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        // 只处理 WS 握手对应的 upgrade 请求；其他 HTTP 请求放行。
        String uri = req.uri();
        if (uri == null || !uri.startsWith(wsPath)) {
            ctx.fireChannelRead(req.retain());
            return;
        }

        if (ctx.channel().attr(ATTR_IDENTITY_ID).get() != null) {
            ctx.fireChannelRead(req.retain());
            return;
        }

        String token = extractAccessToken(req);
        if (token == null || token.isBlank()) {
            writeUnauthorizedAndClose(ctx, "missing_access_token");
            return;
        }

        long identityId;
        try {
            Claims claims = jwtService.parseAccessToken(token).getPayload();
            identityId = jwtService.getIdentityId(claims);
        } catch (Exception e) {
            log.debug("ws handshake rejected: err={}", e.toString());
            writeUnauthorizedAndClose(ctx, "invalid_access_token");
            return;
        }

        // 身份查库不能阻塞 eventLoop：切到 DB 线程池，结果回到 eventLoop 再放行。
        FullHttpRequest retained = req.retain();
        CompletableFuture.supplyAsync(() -> identityDirectory.getIdentity(identityId), dbExecutor)
                .orTimeout(IDENTITY_LOOKUP_TIMEOUT_SEC, TimeUnit.SECONDS)
                .whenComplete((identity, err) -> ctx.executor().execute(() -> onIdentity(ctx, retained, identityId, identity, err)));
    }

    private void onIdentity(ChannelHandlerContext ctx, FullHttpRequest req, long identityId, Identity identity, Throwable err) {
        if (err != null) {
            req.release();
            log.warn("ws handshake identity lookup failed: identityId={}, err={}", identityId, err.toString());
            writeAndClose(ctx, HttpResponseStatus.SERVICE_UNAVAILABLE, "store_unavailable");
            return;
        }
        if (identity == null) {
            req.release();
            writeUnauthorizedAndClose(ctx, "unknown_identity");
            return;
        }
        ctx.channel().attr(ATTR_IDENTITY_ID).set(identityId);
        ctx.channel().attr(ATTR_DISPLAY_INFO).set(identity.displayLabel());
        ctx.fireChannelRead(req);
    }

    private String extractAccessToken(FullHttpRequest req) {
        String auth = req.headers().get(HttpHeaderNames.AUTHORIZATION);
        if (auth != null && auth.startsWith("Bearer ")) {
            return auth.substring("Bearer ".length()).trim();
        }

        QueryStringDecoder decoder = new QueryStringDecoder(req.uri());
        Map<String, List<String>> params = decoder.parameters();

        String fromToken = first(params, "token");
        if (fromToken != null && !fromToken.isBlank()) {
            return fromToken;
        }
        String fromAccessToken = first(params, "accessToken");
        if (fromAccessToken != null && !fromAccessToken.isBlank()) {
            return fromAccessToken;
        }
        return null;
    }

    private String first(Map<String, List<String>> params, String key) {
        List<String> list = params.get(key);
        if (list == null || list.isEmpty()) {
            return null;
        }
        return list.get(0);
    }

    private void writeUnauthorizedAndClose(ChannelHandlerContext ctx, String reason) {
        writeAndClose(ctx, HttpResponseStatus.UNAUTHORIZED, reason);
    }

    private void writeAndClose(ChannelHandlerContext ctx, HttpResponseStatus status, String reason) {
        byte[] bytes = reason.getBytes(CharsetUtil.UTF_8);
        FullHttpResponse resp = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                status,
                Unpooled.wrappedBuffer(bytes)
        );
        resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=UTF-8");
        resp.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(resp);
        ctx.close();
    }
}
