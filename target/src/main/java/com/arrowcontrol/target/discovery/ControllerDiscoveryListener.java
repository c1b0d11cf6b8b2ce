package com.arrowcontrol.target.discovery;

import com.arrowcontrol.protocol.MessageType;
import com.arrowcontrol.protocol.ProtocolCodec;
import com.arrowcontrol.protocol.ProtocolConstants;
import com.arrowcontrol.protocol.model.ConnectionStatus;
import com.arrowcontrol.protocol.model.Sender;
import com.arrowcontrol.protocol.payload.AnnouncePayload;
import com.arrowcontrol.protocol.payload.RegisterPayload;
import com.arrowcontrol.target.client.ControlClient;
import com.arrowcontrol.target.config.TargetProperties;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.DatagramPacket;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * Listens for controller announces and, while this target has no session, broadcasts its own register so
 * controllers can list it. Learned addresses are used only when no controller host is configured.
 */
@Slf4j
public class ControllerDiscoveryListener implements AnnounceHandler {

    private static final String BROADCAST_ADDRESS = "255.255.255.255";

    private final ControlClient client;
    private final ProtocolCodec codec;
    private final TargetProperties properties;
    private final EventLoopGroup group;

    private volatile Channel channel;
    private ScheduledFuture<?> broadcastTask;

    public ControllerDiscoveryListener(ControlClient client, ProtocolCodec codec, TargetProperties properties,
                                       EventLoopGroup group) {
        this.client = client;
        this.codec = codec;
        this.properties = properties;
        this.group = group;
    }

    public synchronized void start() {
        if (channel != null) {
            return;
        }
        try {
            channel = new Bootstrap()
                .group(group)
                .channel(NioDatagramChannel.class)
                .option(ChannelOption.SO_BROADCAST, true)
                .option(ChannelOption.SO_REUSEADDR, true)
                .handler(new AnnounceDatagramHandler(codec, this))
                .bind(properties.discoveryPort())
                .sync()
                .channel();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while binding discovery port " + properties.discoveryPort(), e);
        } catch (Exception e) {
            // A configured controller host still works without discovery.
            log.error("💥 Could not bind discovery port {}: {}", properties.discoveryPort(), e.getMessage());
            return;
        }

        long intervalMillis = ProtocolConstants.BROADCAST_INTERVAL.toMillis();
        broadcastTask = group.scheduleAtFixedRate(this::broadcastRegister, 0, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("📡 Listening for controller announces on UDP {}", properties.discoveryPort());
    }

    @Override
    public void onAnnounce(String senderIp, AnnouncePayload announce) {
        String controllerId = announce.controllerInfo() != null ? announce.controllerInfo().getId() : "unknown";
        log.debug("📡 Announce from controller {} at {} (control port {})", controllerId, senderIp,
                announce.controlPort());
        if (properties.hasControllerHost()) {
            return;
        }
        if (client.connectIfIdle(senderIp, announce.controlPort())) {
            log.info("📡 Discovered controller {} at {}:{}", controllerId, senderIp, announce.controlPort());
        }
    }

    void broadcastRegister() {
        Channel current = channel;
        if (current == null || !current.isActive() || client.getStatus() != ConnectionStatus.DISCONNECTED) {
            return;
        }
        String text = codec.encode(MessageType.REGISTER, Sender.target(client.getDeviceInfo().getId()),
                new RegisterPayload(client.getDeviceInfo()));
        InetSocketAddress destination = new InetSocketAddress(BROADCAST_ADDRESS, properties.controllerDiscoveryPort());
        current.writeAndFlush(new DatagramPacket(Unpooled.copiedBuffer(text, StandardCharsets.UTF_8), destination))
            .addListener((ChannelFutureListener) future -> {
                if (!future.isSuccess()) {
                    log.debug("⚠️ Register broadcast failed: {}",
                            future.cause() != null ? future.cause().getMessage() : "unknown");
                }
            });
    }

    public synchronized void stop() {
        if (broadcastTask != null) {
            broadcastTask.cancel(false);
            broadcastTask = null;
        }
        if (channel != null) {
            channel.close().syncUninterruptibly();
            channel = null;
            log.info("📡 Discovery listener stopped");
        }
    }
}
