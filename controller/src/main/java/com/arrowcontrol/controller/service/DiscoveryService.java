package com.arrowcontrol.controller.service;

import com.arrowcontrol.controller.config.ControlServerProperties;
import com.arrowcontrol.controller.config.ControllerIdentity;
import com.arrowcontrol.controller.config.DiscoveryProperties;
import com.arrowcontrol.controller.handler.DiscoveryDatagramHandler;
import com.arrowcontrol.protocol.MessageType;
import com.arrowcontrol.protocol.ProtocolCodec;
import com.arrowcontrol.protocol.model.DeviceInfo;
import com.arrowcontrol.protocol.model.DeviceType;
import com.arrowcontrol.protocol.payload.AnnouncePayload;
import com.arrowcontrol.protocol.util.NetworkAddresses;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.util.concurrent.ScheduledFuture;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * UDP discovery: periodically broadcasts an announce to targets and listens for targets broadcasting
 * their own register. Only yields address candidates; it authorizes nothing.
 */
@Slf4j
@Service
public class DiscoveryService {

    private final DiscoveryProperties properties;
    private final ControlServerProperties serverProperties;
    private final ControllerIdentity identity;
    private final ProtocolCodec codec;
    private final DiscoveryDatagramHandler datagramHandler;
    private final DiscoveredPeerTracker peerTracker;

    private EventLoopGroup group;
    private volatile Channel channel;
    private ScheduledFuture<?> broadcastTask;

    public DiscoveryService(DiscoveryProperties properties, ControlServerProperties serverProperties,
                            ControllerIdentity identity, ProtocolCodec codec,
                            DiscoveryDatagramHandler datagramHandler, DiscoveredPeerTracker peerTracker) {
        this.properties = properties;
        this.serverProperties = serverProperties;
        this.identity = identity;
        this.codec = codec;
        this.datagramHandler = datagramHandler;
        this.peerTracker = peerTracker;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(20)
    public void startWhenReady() {
        if (!properties.enabled()) {
            log.info("📡 Discovery disabled");
            return;
        }
        group = new NioEventLoopGroup(1);
        try {
            channel = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, true)
                .option(ChannelOption.SO_REUSEADDR, true)
                .handler(datagramHandler)
                .bind(properties.port())
                .sync()
                .channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown();
            throw new IllegalStateException("Interrupted while binding discovery port " + properties.port(), e);
        } catch (Exception e) {
            // Discovery is optional; targets with a configured address still connect.
            log.error("💥 Could not bind discovery port {}: {}", properties.port(), e.getMessage());
            shutdown();
            return;
        }

        long intervalMillis = properties.broadcastInterval().toMillis();
        broadcastTask = group.scheduleAtFixedRate(this::broadcastAnnounce, 0, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("📡 Discovery listening on UDP {} and announcing to {}:{} every {}", getPort(),
                properties.broadcastAddress(), properties.announcePort(), properties.broadcastInterval());
    }

    void broadcastAnnounce() {
        peerTracker.prune();
        Channel current = channel;
        if (current == null || !current.isActive()) {
            return;
        }
        String text = codec.encode(MessageType.ANNOUNCE, identity.sender(), announcePayload());
        InetSocketAddress destination = new InetSocketAddress(properties.broadcastAddress(), properties.announcePort());
        current.writeAndFlush(new DatagramPacket(Unpooled.copiedBuffer(text, StandardCharsets.UTF_8), destination))
            .addListener((ChannelFutureListener) future -> {
                if (!future.isSuccess()) {
                    log.warn("⚠️ Announce broadcast failed: {}",
                            future.cause() != null ? future.cause().getMessage() : "unknown");
                }
            });
    }

    AnnouncePayload announcePayload() {
        DeviceInfo controllerInfo = DeviceInfo.builder()
                .id(identity.id())
                .name(identity.name())
                .ip(NetworkAddresses.localIpv4())
                .type(DeviceType.CONTROLLER)
                .build();
        return new AnnouncePayload(controllerInfo, getPort(), serverProperties.port());
    }

    /**
     * The bound UDP port once listening, which differs from the configured one when that is 0.
     */
    public int getPort() {
        Channel current = channel;
        if (current != null && current.localAddress() instanceof InetSocketAddress address) {
            return address.getPort();
        }
        return properties.port();
    }

    @PreDestroy
    public void shutdown() {
        if (broadcastTask != null) {
            broadcastTask.cancel(false);
            broadcastTask = null;
        }
        if (channel != null) {
            channel.close().syncUninterruptibly();
            channel = null;
        }
        if (group != null) {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
            group = null;
            log.info("📡 Discovery stopped");
        }
    }
}
