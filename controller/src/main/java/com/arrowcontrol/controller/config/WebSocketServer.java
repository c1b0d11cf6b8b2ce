package com.arrowcontrol.controller.config;

import com.arrowcontrol.controller.handler.ControlChannelHandler;
import com.arrowcontrol.controller.service.ControlServer;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import io.netty.util.concurrent.ScheduledFuture;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * Netty WebSocket server carrying the control protocol, plus the liveness sweep that pings every session.
 */
@Configuration
public class WebSocketServer {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketServer.class);

    private static final int MAX_HTTP_CONTENT_LENGTH = 65536;
    private static final long HANDSHAKE_TIMEOUT_MILLIS = 10_000;

    // ==================== Dependencies ====================

    private final ControlServerProperties properties;
    private final ControlServer controlServer;
    private final ControlChannelHandler controlChannelHandler;

    // ==================== Server State ====================

    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private ScheduledFuture<?> sweepTask;
    private volatile boolean serverStarted = false;

    public WebSocketServer(ControlServerProperties properties, ControlServer controlServer,
                           ControlChannelHandler controlChannelHandler) {
        this.properties = properties;
        this.controlServer = controlServer;
        this.controlChannelHandler = controlChannelHandler;
        logger.info("🔧 WebSocketServer initialized, waiting for application ready event...");
    }

    // ==================== Server Lifecycle ====================

    @EventListener(ApplicationReadyEvent.class)
    @Order(10)
    public void startServerWhenReady() {
        if (!serverStarted) {
            try {
                startServer();
            } catch (Exception e) {
                logger.error("💥 Failed to start WebSocket server during ApplicationReadyEvent", e);
                throw new IllegalStateException("Server startup failed", e);
            }
        }
    }

    private void startServer() throws Exception {
        logger.info("🚀 Starting WebSocket control server on port {} path {}", properties.port(), properties.path());
        logger.info("📊 Server configuration: bossThreads={}, workerThreads={}, backlog={}, maxFrameSize={}, pingInterval={}",
                properties.bossThreads(), properties.getEffectiveWorkerThreads(), properties.backlog(),
                properties.maxFrameSize(), properties.pingInterval());

        bossGroup = new NioEventLoopGroup(properties.bossThreads());
        workerGroup = new NioEventLoopGroup(properties.getEffectiveWorkerThreads());

        try {
            ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, properties.backlog())
                .option(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                .handler(new LoggingHandler(LogLevel.DEBUG))
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        setupPipeline(ch);
                    }
                });

            ChannelFuture future = bootstrap.bind(properties.port()).sync();
            serverChannel = future.channel();
            serverStarted = true;

            long pingMillis = properties.pingInterval().toMillis();
            sweepTask = workerGroup.scheduleAtFixedRate(this::runSweep, pingMillis, pingMillis, TimeUnit.MILLISECONDS);

            logger.info("🎉 WebSocket control server started, listening on port {}", getPort());
        } catch (Exception e) {
            logger.error("💥 Failed to start WebSocket control server", e);
            shutdown();
            throw e;
        }
    }

    private void setupPipeline(SocketChannel channel) {
        ChannelPipeline pipeline = channel.pipeline();
        logger.debug("🔧 Setting up pipeline for channel: {}", channel.remoteAddress());

        WebSocketServerProtocolConfig webSocketConfig = WebSocketServerProtocolConfig.newBuilder()
            .websocketPath(properties.path())
            .checkStartsWith(true)
            .maxFramePayloadLength(properties.maxFrameSize())
            .handshakeTimeoutMillis(HANDSHAKE_TIMEOUT_MILLIS)
            .dropPongFrames(false)
            .build();

        pipeline.addLast("httpCodec", new HttpServerCodec());
        pipeline.addLast("httpAggregator", new HttpObjectAggregator(MAX_HTTP_CONTENT_LENGTH));
        pipeline.addLast("webSocketProtocol", new WebSocketServerProtocolHandler(webSocketConfig));
        pipeline.addLast("frameAggregator", new WebSocketFrameAggregator(properties.maxFrameSize()));
        pipeline.addLast("controlHandler", controlChannelHandler);
    }

    private void runSweep() {
        try {
            int terminated = controlServer.sweepConnections();
            if (terminated > 0) {
                logger.info("💀 Liveness sweep terminated {} connections", terminated);
            }
        } catch (RuntimeException e) {
            logger.error("💥 Liveness sweep failed", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        logger.info("🛑 Shutting down WebSocket control server...");

        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }

        controlServer.shutdown();

        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).syncUninterruptibly();
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).syncUninterruptibly();
            workerGroup = null;
        }

        serverStarted = false;
        logger.info("✅ WebSocket control server stopped");
    }

    public boolean isRunning() {
        return serverStarted && serverChannel != null && serverChannel.isActive();
    }

    /**
     * The bound port once running, which differs from the configured one when that is 0.
     */
    public int getPort() {
        Channel current = serverChannel;
        if (current != null && current.localAddress() instanceof InetSocketAddress address) {
            return address.getPort();
        }
        return properties.port();
    }
}
