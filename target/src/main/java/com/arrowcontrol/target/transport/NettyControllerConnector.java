package com.arrowcontrol.target.transport;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolConfig;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;

/**
 * Netty WebSocket client. Pings from the controller are answered by the protocol handler.
 */
@Slf4j
public class NettyControllerConnector implements ControllerConnector {

    private static final int MAX_HTTP_CONTENT_LENGTH = 8192;
    private static final int CONNECT_TIMEOUT_MILLIS = 5_000;
    private static final long HANDSHAKE_TIMEOUT_MILLIS = 10_000;

    private final EventLoopGroup group;
    private final int maxFrameSize;

    public NettyControllerConnector(EventLoopGroup group, int maxFrameSize) {
        this.group = group;
        this.maxFrameSize = maxFrameSize;
    }

    @Override
    public ControllerConnection connect(String host, int port, ConnectionListener listener) {
        URI uri = URI.create("ws://" + host + ":" + port + "/");
        NettyControllerConnection connection = new NettyControllerConnection(host + ":" + port, listener);

        WebSocketClientProtocolConfig config = WebSocketClientProtocolConfig.newBuilder()
            .webSocketUri(uri)
            .version(WebSocketVersion.V13)
            .maxFramePayloadLength(maxFrameSize)
            .handshakeTimeoutMillis(HANDSHAKE_TIMEOUT_MILLIS)
            .handleCloseFrames(true)
            .build();

        Bootstrap bootstrap = new Bootstrap()
            .group(group)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
            .option(ChannelOption.TCP_NODELAY, true)
            .option(ChannelOption.SO_KEEPALIVE, true)
            .handler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ChannelPipeline pipeline = ch.pipeline();
                    pipeline.addLast("httpCodec", new HttpClientCodec());
                    pipeline.addLast("httpAggregator", new HttpObjectAggregator(MAX_HTTP_CONTENT_LENGTH));
                    pipeline.addLast("webSocketProtocol", new WebSocketClientProtocolHandler(config));
                    pipeline.addLast("frameAggregator", new WebSocketFrameAggregator(maxFrameSize));
                    pipeline.addLast("controlClientHandler", new WebSocketClientHandler(connection));
                }
            });

        log.info("🔌 Connecting to controller at {}", uri);
        ChannelFuture future = bootstrap.connect(host, port);
        connection.attach(future.channel());
        future.addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                connection.ended(f.cause());
            }
        });
        return connection;
    }
}
