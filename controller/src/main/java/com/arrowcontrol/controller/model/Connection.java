package com.arrowcontrol.controller.model;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * One live transport session. Owned by the control server's connection table; the channel never leaves it.
 */
@Getter
public class Connection {

    private final String connectionId;
    private final Channel channel;
    private final String remoteAddress;
    private final Instant openedAt;

    @Setter private volatile boolean alive = true;
    @Setter private volatile Instant lastActivity;
    @Setter private volatile String deviceId;

    public Connection(String connectionId, Channel channel, String remoteAddress, Instant openedAt) {
        this.connectionId = connectionId;
        this.channel = channel;
        this.remoteAddress = remoteAddress;
        this.openedAt = openedAt;
        this.lastActivity = openedAt;
    }

    public boolean isActive() {
        return channel.isActive();
    }

    public boolean isBound() {
        return deviceId != null;
    }

    public ChannelFuture send(String text) {
        return channel.writeAndFlush(new TextWebSocketFrame(text));
    }

    public ChannelFuture ping() {
        return channel.writeAndFlush(new PingWebSocketFrame());
    }

    public void close() {
        channel.close();
    }
}
