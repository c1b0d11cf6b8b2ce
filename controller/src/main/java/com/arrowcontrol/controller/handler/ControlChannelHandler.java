package com.arrowcontrol.controller.handler;

import com.arrowcontrol.controller.model.Connection;
import com.arrowcontrol.controller.service.ControlServer;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.AttributeKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Bridges upgraded WebSocket channels to the control server.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ChannelHandler.Sharable
public class ControlChannelHandler extends SimpleChannelInboundHandler<WebSocketFrame> {

    static final AttributeKey<Connection> CONNECTION_ATTR = AttributeKey.valueOf("CONTROL_CONNECTION");

    private final ControlServer controlServer;

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete handshake) {
            log.debug("🤝 WebSocket handshake complete for {} on {}", ctx.channel().remoteAddress(),
                    handshake.requestUri());
            Connection connection = controlServer.openConnection(ctx.channel());
            ctx.channel().attr(CONNECTION_ATTR).set(connection);
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame) {
        Connection connection = ctx.channel().attr(CONNECTION_ATTR).get();
        if (connection == null) {
            log.warn("⚠️ Frame before handshake completed from {}", ctx.channel().remoteAddress());
            return;
        }

        if (frame instanceof TextWebSocketFrame text) {
            controlServer.handleMessage(connection, text.text());
        } else if (frame instanceof PongWebSocketFrame) {
            controlServer.markAlive(connection);
        } else {
            log.debug("Ignoring {} from {}", frame.getClass().getSimpleName(), connection.getConnectionId());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        Connection connection = ctx.channel().attr(CONNECTION_ATTR).get();
        if (connection != null) {
            controlServer.closeConnection(connection);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("💥 Channel error from {}: {}", ctx.channel().remoteAddress(), cause.getMessage(), cause);
        ctx.close();
    }
}
