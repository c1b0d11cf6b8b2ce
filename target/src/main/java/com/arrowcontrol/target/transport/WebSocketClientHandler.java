package com.arrowcontrol.target.transport;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import lombok.extern.slf4j.Slf4j;

/**
 * Feeds handshake, text frames and channel teardown of one client channel into its session.
 */
@Slf4j
class WebSocketClientHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    private final NettyControllerConnection connection;

    WebSocketClientHandler(NettyControllerConnection connection) {
        this.connection = connection;
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
            connection.handshakeComplete();
            return;
        }
        if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
            log.warn("⏰ WebSocket handshake with {} timed out", ctx.channel().remoteAddress());
            connection.ended(new WebSocketClientHandshakeException("WebSocket handshake timed out"));
            ctx.close();
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (frame instanceof TextWebSocketFrame text) {
            connection.messageReceived(text.text());
        } else {
            log.debug("Ignoring {} from controller", frame.getClass().getSimpleName());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        connection.ended(null);
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("💥 Client channel error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        connection.ended(cause);
        ctx.close();
    }
}
