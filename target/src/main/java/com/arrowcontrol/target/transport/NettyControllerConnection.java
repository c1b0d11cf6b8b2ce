package com.arrowcontrol.target.transport;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * WebSocket session over a Netty channel. Open once the handshake completes; ends at most once.
 */
@Slf4j
class NettyControllerConnection implements ControllerConnection {

    private final String endpoint;
    private final ConnectionListener listener;
    private final AtomicBoolean ended = new AtomicBoolean(false);

    private volatile Channel channel;
    private volatile boolean open;

    NettyControllerConnection(String endpoint, ConnectionListener listener) {
        this.endpoint = endpoint;
        this.listener = listener;
    }

    void attach(Channel channel) {
        this.channel = channel;
    }

    void handshakeComplete() {
        if (ended.get()) {
            return;
        }
        open = true;
        log.info("🔗 WebSocket session open to {}", endpoint);
        listener.onOpen(this);
    }

    void messageReceived(String text) {
        if (open) {
            listener.onMessage(this, text);
        }
    }

    void ended(Throwable cause) {
        if (!ended.compareAndSet(false, true)) {
            return;
        }
        open = false;
        if (cause != null) {
            log.warn("⚠️ Session to {} ended: {}", endpoint, cause.getMessage());
        } else {
            log.info("📴 Session to {} closed", endpoint);
        }
        listener.onClosed(this, cause);
    }

    @Override
    public boolean send(String text) {
        Channel current = channel;
        if (!open || current == null || !current.isActive()) {
            return false;
        }
        current.writeAndFlush(new TextWebSocketFrame(text)).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.warn("❌ Write to {} failed: {}", endpoint,
                        future.cause() != null ? future.cause().getMessage() : "unknown");
            }
        });
        return true;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void close() {
        Channel current = channel;
        if (current == null) {
            ended(null);
            return;
        }
        if (open && current.isActive()) {
            current.writeAndFlush(new CloseWebSocketFrame()).addListener(ChannelFutureListener.CLOSE);
        } else {
            current.close();
        }
    }

    @Override
    public String toString() {
        return "session(" + endpoint + ")";
    }
}
