package com.collabim.gateway.ws;

import com.collabim.auth.service.JwtService;
import com.collabim.domain.directory.IdentityDirectory;
import com.collabim.domain.service.MessagePipelineService;
import com.collabim.gateway.config.GatewayProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

@Component
public class NettyWsServer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(NettyWsServer.class);

    /** 客户端至少每 90 秒发一次数据（业务 ping 即可），否则视为断线。 */
    private static final int READER_IDLE_SECONDS = 90;

    private final GatewayProperties props;
    private final ObjectMapper objectMapper;
    private final JwtService jwtService;
    private final IdentityDirectory identityDirectory;
    private final WsWriter writer;
    private final WsPresenceService presenceService;
    private final MessagePipelineService messagePipelineService;
    private final Executor chatDbExecutor;

    private EventLoopGroup boss;
    private EventLoopGroup worker;
    private Channel serverChannel;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public NettyWsServer(GatewayProperties props,
                         ObjectMapper objectMapper,
                         JwtService jwtService,
                         IdentityDirectory identityDirectory,
                         WsWriter writer,
                         WsPresenceService presenceService,
                         MessagePipelineService messagePipelineService,
                         @Qualifier("chatDbExecutor") Executor chatDbExecutor) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.jwtService = jwtService;
        this.identityDirectory = identityDirectory;
        this.writer = writer;
        this.presenceService = presenceService;
        this.messagePipelineService = messagePipelineService;
        this.chatDbExecutor = chatDbExecutor;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }

        log.info("Starting Netty WS gateway on {}:{}{}", props.host(), props.port(), props.path());

        // boss: 负责 accept 新连接；worker: 负责处理已建立连接的读写事件
        boss = new NioEventLoopGroup(1);
        worker = new NioEventLoopGroup();

        ServerBootstrap b = new ServerBootstrap();
        b.group(boss, worker)
                .channel(NioServerSocketChannel.class)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();

                        // 1) HTTP 编解码：WebSocket 握手阶段是 HTTP 协议
                        p.addLast(new HttpServerCodec());

                        // 2) 聚合 HTTP 消息：把多个 HttpContent 聚合成 FullHttpRequest，便于握手处理
                        p.addLast(new HttpObjectAggregator(65536));

                        // 3) 空闲检测：readerIdle 间隔内没有收到任何数据就关闭连接
                        p.addLast(new IdleStateHandler(READER_IDLE_SECONDS, 0, 0));

                        // 4) 握手鉴权：校验 accessToken 并确认身份存在，把 identityId 绑定到 channel
                        p.addLast(new WsHandshakeAuthHandler(props.path(), jwtService, identityDirectory, chatDbExecutor));

                        // 5) WebSocket 协议处理：握手（upgrade）、协议层 Ping/Pong、Close
                        WebSocketServerProtocolConfig wsConfig = WebSocketServerProtocolConfig.newBuilder()
                                .websocketPath(props.path())
                                .checkStartsWith(true)
                                .allowExtensions(true)
                                .build();
                        p.addLast(new WebSocketServerProtocolHandler(wsConfig));

                        // 6) 业务帧处理：JSON 文本协议（join_chat / typing_start / message_read ...）
                        p.addLast(new WsFrameHandler(objectMapper, writer, presenceService, messagePipelineService, chatDbExecutor));
                    }
                });

        try {
            serverChannel = b.bind(props.host(), props.port()).syncUninterruptibly().channel();
            log.info("Netty WS gateway started, listening on {}", serverChannel.localAddress());
        } catch (Exception e) {
            log.error("Failed to start Netty WS gateway on {}:{}{}", props.host(), props.port(), props.path(), e);
            stop();
            throw e;
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        log.info("Stopping Netty WS gateway...");
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
        }
        if (worker != null) {
            worker.shutdownGracefully();
        }
        if (boss != null) {
            boss.shutdownGracefully();
        }
        log.info("Netty WS gateway stopped");
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // 晚于默认 phase 启动、早于其停止：停机时先断开连接，再关闭 DB 线程池
        return Integer.MAX_VALUE - 1000;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    @Override
    public void stop(Runnable callback) {
        stop();
        callback.run();
    }
}
