package com.arrowcontrol.target.discovery;

import com.arrowcontrol.protocol.DecodeResult;
import com.arrowcontrol.protocol.MessageType;
import com.arrowcontrol.protocol.ProtocolCodec;
import com.arrowcontrol.protocol.ProtocolException;
import com.arrowcontrol.protocol.model.DeviceType;
import com.arrowcontrol.protocol.model.ProtocolMessage;
import com.arrowcontrol.protocol.payload.AnnouncePayload;
import com.arrowcontrol.protocol.util.NetworkAddresses;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.DatagramPacket;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * Decodes controller {@code announce} datagrams; everything else on the port is ignored.
 */
@Slf4j
@ChannelHandler.Sharable
public class AnnounceDatagramHandler extends SimpleChannelInboundHandler<DatagramPacket> {

    private final ProtocolCodec codec;
    private final AnnounceHandler announceHandler;

    public AnnounceDatagramHandler(ProtocolCodec codec, AnnounceHandler announceHandler) {
        this.codec = codec;
        this.announceHandler = announceHandler;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, DatagramPacket packet) {
        String ip = NetworkAddresses.hostOf(packet.sender());
        DecodeResult decoded = codec.decode(packet.content().toString(StandardCharsets.UTF_8));
        if (!decoded.isValid()) {
            log.debug("Ignoring datagram from {}: {}", ip, decoded.error());
            return;
        }
        ProtocolMessage message = decoded.message();
        if (!message.is(MessageType.ANNOUNCE) || message.sender().type() != DeviceType.CONTROLLER) {
            log.debug("Ignoring {} datagram from {}", message.type(), ip);
            return;
        }
        AnnouncePayload announce;
        try {
            announce = codec.payload(message, AnnouncePayload.class);
        } catch (ProtocolException e) {
            log.debug("Ignoring malformed announce from {}: {}", ip, e.getMessage());
            return;
        }
        if (announce.controlPort() <= 0 || announce.controlPort() > 65535) {
            log.debug("Ignoring announce from {} with control port {}", ip, announce.controlPort());
            return;
        }
        announceHandler.onAnnounce(ip, announce);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("⚠️ Discovery socket error: {}", cause.getMessage());
    }
}
