package com.arrowcontrol.controller.handler;

import com.arrowcontrol.controller.config.ControllerIdentity;
import com.arrowcontrol.controller.service.DiscoveredPeerTracker;
import com.arrowcontrol.protocol.DecodeResult;
import com.arrowcontrol.protocol.MessageType;
import com.arrowcontrol.protocol.ProtocolCodec;
import com.arrowcontrol.protocol.ProtocolException;
import com.arrowcontrol.protocol.model.DeviceInfo;
import com.arrowcontrol.protocol.model.DeviceType;
import com.arrowcontrol.protocol.model.ProtocolMessage;
import com.arrowcontrol.protocol.payload.RegisterPayload;
import com.arrowcontrol.protocol.util.NetworkAddresses;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramPacket;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Records targets that broadcast a raw {@code register} before opening a session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ChannelHandler.Sharable
public class DiscoveryDatagramHandler extends SimpleChannelInboundHandler<DatagramPacket> {

    private final ProtocolCodec codec;
    private final DiscoveredPeerTracker peerTracker;
    private final ControllerIdentity identity;

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet) {
        String ip = NetworkAddresses.hostOf(packet.sender());
        DecodeResult decoded = codec.decode(packet.content().toString(StandardCharsets.UTF_8));
        if (!decoded.isValid()) {
            log.debug("Ignoring datagram from {}: {}", ip, decoded.error());
            return;
        }

        ProtocolMessage message = decoded.message();
        if (identity.id().equals(message.sender().id())) {
            return;
        }
        if (!message.is(MessageType.REGISTER) || message.sender().type() != DeviceType.TARGET) {
            log.debug("Ignoring {} datagram from {}", message.type(), ip);
            return;
        }

        DeviceInfo info;
        try {
            info = codec.payload(message, RegisterPayload.class).deviceInfo();
        } catch (ProtocolException e) {
            log.debug("Ignoring malformed register broadcast from {}: {}", ip, e.getMessage());
            return;
        }
        if (peerTracker.record(ip, info)) {
            log.info("📡 Target {} broadcast from {}", info != null ? info.getId() : "unknown", ip);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("⚠️ Discovery socket error: {}", cause.getMessage());
    }
}
