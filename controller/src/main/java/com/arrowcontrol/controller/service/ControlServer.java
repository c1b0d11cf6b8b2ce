package com.arrowcontrol.controller.service;

import com.arrowcontrol.controller.application.ports.ControllerEventPublisher;
import com.arrowcontrol.controller.config.ControllerIdentity;
import com.arrowcontrol.controller.domain.events.CommandResultEvent;
import com.arrowcontrol.controller.domain.events.ConnectionEvent;
import com.arrowcontrol.controller.model.Connection;
import com.arrowcontrol.controller.model.RegisteredDevice;
import com.arrowcontrol.protocol.DecodeResult;
import com.arrowcontrol.protocol.ErrorCode;
import com.arrowcontrol.protocol.MessageType;
import com.arrowcontrol.protocol.ProtocolCodec;
import com.arrowcontrol.protocol.ProtocolException;
import com.arrowcontrol.protocol.model.CommandType;
import com.arrowcontrol.protocol.model.DeviceInfo;
import com.arrowcontrol.protocol.model.DeviceType;
import com.arrowcontrol.protocol.model.ProtocolMessage;
import com.arrowcontrol.protocol.payload.CommandParameters;
import com.arrowcontrol.protocol.payload.CommandPayload;
import com.arrowcontrol.protocol.payload.CommandResultPayload;
import com.arrowcontrol.protocol.payload.ErrorPayload;
import com.arrowcontrol.protocol.payload.PairingRequestPayload;
import com.arrowcontrol.protocol.payload.PairingResponsePayload;
import com.arrowcontrol.protocol.payload.RegisterPayload;
import com.arrowcontrol.protocol.payload.RegisteredPayload;
import com.arrowcontrol.protocol.util.NetworkAddresses;
import com.arrowcontrol.protocol.util.Tokens;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Routes protocol messages between live target sessions and the device registry.
 *
 * <p>The connection table and device bindings are guarded by this server's monitor. Lock order is
 * server, then registry.
 */
@Slf4j
@Service
public class ControlServer {

    private final Map<String, Connection> connections = new HashMap<>();
    private final Map<String, String> connectionsByDevice = new HashMap<>();

    private final DeviceRegistry registry;
    private final ProtocolCodec codec;
    private final ControllerEventPublisher eventPublisher;
    private final ControllerIdentity identity;
    private final Clock clock;

    public ControlServer(DeviceRegistry registry, ProtocolCodec codec, ControllerEventPublisher eventPublisher,
                         ControllerIdentity identity, Clock clock) {
        this.registry = registry;
        this.codec = codec;
        this.eventPublisher = eventPublisher;
        this.identity = identity;
        this.clock = clock;
    }

    // ==================== Session lifecycle ====================

    public synchronized Connection openConnection(Channel channel) {
        String remote = NetworkAddresses.hostOf(channel.remoteAddress());
        Connection connection = new Connection(UUID.randomUUID().toString(), channel, remote, clock.instant());
        connections.put(connection.getConnectionId(), connection);
        log.info("🔗 New connection {} from {} (open: {})", connection.getConnectionId(), remote, connections.size());
        publishConnection(ConnectionEvent.Kind.OPENED, connection);
        return connection;
    }

    /**
     * Forgets a connection whose transport went away. A no-op for connections already terminated or superseded,
     * so every session is disconnected at most once.
     */
    public synchronized void closeConnection(Connection connection) {
        if (connections.remove(connection.getConnectionId()) == null) {
            return;
        }
        log.info("📴 Connection {} closed (device={})", connection.getConnectionId(), connection.getDeviceId());
        unbind(connection);
        publishConnection(ConnectionEvent.Kind.CLOSED, connection);
    }

    public synchronized void markAlive(Connection connection) {
        connection.setAlive(true);
        connection.setLastActivity(clock.instant());
    }

    /**
     * One liveness cycle: drops connections that missed the previous ping, then pings the rest.
     *
     * @return number of connections terminated
     */
    public synchronized int sweepConnections() {
        int terminated = 0;
        for (Connection connection : new ArrayList<>(connections.values())) {
            if (!connection.isAlive()) {
                log.warn("💀 Connection {} (device={}) missed its ping, terminating",
                        connection.getConnectionId(), connection.getDeviceId());
                terminate(connection, ConnectionEvent.Kind.TERMINATED);
                terminated++;
                continue;
            }
            connection.setAlive(false);
            connection.ping().addListener((ChannelFutureListener) future -> {
                if (!future.isSuccess()) {
                    log.debug("⚠️ Ping to {} failed: {}", connection.getConnectionId(),
                            future.cause() != null ? future.cause().getMessage() : "unknown");
                }
            });
        }
        return terminated;
    }

    /**
     * Closes every open connection. Bound devices are disconnected.
     */
    public synchronized void shutdown() {
        log.info("🛑 Closing {} open connections", connections.size());
        for (Connection connection : new ArrayList<>(connections.values())) {
            terminate(connection, ConnectionEvent.Kind.CLOSED);
        }
    }

    // ==================== Inbound ====================

    public synchronized void handleMessage(Connection connection, String text) {
        if (!connections.containsKey(connection.getConnectionId())) {
            log.debug("Dropping message on retired connection {}", connection.getConnectionId());
            return;
        }
        markAlive(connection);

        DecodeResult decoded = codec.decode(text);
        if (!decoded.isValid()) {
            log.warn("⚠️ Invalid message from {}: {}", connection.getRemoteAddress(), decoded.error());
            sendError(connection, ErrorCode.INVALID_MESSAGE, decoded.error());
            return;
        }

        ProtocolMessage message = decoded.message();
        try {
            Optional<MessageType> type = message.messageType();
            if (type.isEmpty()) {
                sendError(connection, ErrorCode.INVALID_MESSAGE, "Unsupported message type: " + message.type());
                return;
            }
            log.debug("📨 {} from {} on {}", message.type(), message.sender().id(), connection.getConnectionId());
            switch (type.get()) {
                case REGISTER -> handleRegister(connection, message);
                case PAIRING_REQUEST -> handlePairingRequest(connection, message);
                case HEARTBEAT -> handleHeartbeat(connection);
                case COMMAND_RESULT -> handleCommandResult(connection, message);
                case ERROR -> handleRemoteError(connection, message);
                default -> sendError(connection, ErrorCode.INVALID_MESSAGE,
                        "Unsupported message type: " + message.type());
            }
        } catch (RuntimeException e) {
            log.error("💥 Error handling {} on {}: {}", message.type(), connection.getConnectionId(), e.getMessage(), e);
            sendError(connection, ErrorCode.INTERNAL_ERROR, "Internal server error");
        }
    }

    private void handleRegister(Connection connection, ProtocolMessage message) {
        DeviceInfo info;
        try {
            info = codec.payload(message, RegisterPayload.class).deviceInfo();
        } catch (ProtocolException e) {
            info = null;
        }
        if (info == null || !info.hasIdentity()) {
            sendError(connection, ErrorCode.INVALID_MESSAGE, "Invalid device info");
            return;
        }
        if (message.sender().type() != DeviceType.TARGET || info.getType() != DeviceType.TARGET) {
            sendError(connection, ErrorCode.INVALID_MESSAGE, "Only target devices can register");
            return;
        }
        if (info.getIp() == null || info.getIp().isBlank()) {
            info = info.toBuilder().ip(connection.getRemoteAddress()).build();
        }

        Registration registration = registry.registerDevice(info);
        String deviceId = registration.device().getId();

        // A connection registering under a new identity releases the old one.
        String formerId = connection.getDeviceId();
        if (formerId != null && !formerId.equals(deviceId)) {
            connectionsByDevice.remove(formerId, connection.getConnectionId());
            if (!formerId.equals(registration.previousId())) {
                registry.disconnectDevice(formerId);
            }
        }

        supersede(deviceId, connection);
        if (registration.migrated()) {
            supersede(registration.previousId(), connection);
        }

        connection.setDeviceId(deviceId);
        connectionsByDevice.put(deviceId, connection.getConnectionId());
        RegisteredDevice device = registry.connectDevice(deviceId, connection.getConnectionId())
                .orElse(registration.device());

        boolean pairingRequired = !device.isPaired();
        send(connection, MessageType.REGISTERED, new RegisteredPayload(deviceId, pairingRequired,
                pairingRequired ? device.getPairingToken() : null));
        log.info("✅ Device {} registered on {} (paired={})", deviceId, connection.getConnectionId(), device.isPaired());
    }

    private void handlePairingRequest(Connection connection, ProtocolMessage message) {
        String deviceId = connection.getDeviceId();
        if (deviceId == null) {
            sendError(connection, ErrorCode.INVALID_MESSAGE, "Device not registered");
            return;
        }
        String token;
        try {
            token = codec.payload(message, PairingRequestPayload.class).pairingToken();
        } catch (ProtocolException e) {
            token = null;
        }
        if (token == null || token.isBlank()) {
            sendError(connection, ErrorCode.INVALID_MESSAGE, "Missing pairing token");
            return;
        }

        PairingResult result = registry.pairDevice(deviceId, token);
        if (result.success()) {
            log.info("🤝 Device {} paired", deviceId);
            send(connection, MessageType.PAIRING_RESPONSE,
                    PairingResponsePayload.accepted(result.device().getAuthToken()));
        } else {
            log.warn("🔐 Pairing rejected for {} (token {}): {}", deviceId, Tokens.mask(token), result.error());
            send(connection, MessageType.PAIRING_RESPONSE, PairingResponsePayload.rejected(result.error()));
        }
    }

    private void handleHeartbeat(Connection connection) {
        if (connection.getDeviceId() != null) {
            registry.touchDevice(connection.getDeviceId());
        }
        send(connection, MessageType.HEARTBEAT_ACK, null);
    }

    private void handleCommandResult(Connection connection, ProtocolMessage message) {
        String deviceId = connection.getDeviceId();
        if (deviceId == null) {
            log.warn("⚠️ Command result from unregistered connection {} dropped", connection.getConnectionId());
            return;
        }
        CommandResultPayload result;
        try {
            result = codec.payload(message, CommandResultPayload.class);
        } catch (ProtocolException e) {
            sendError(connection, ErrorCode.INVALID_MESSAGE, e.getMessage());
            return;
        }
        registry.touchDevice(deviceId);
        eventPublisher.publishCommandResult(new CommandResultEvent(deviceId, result.commandType(),
                result.success(), result.error(), result.result(), clock.instant()));
    }

    // Errors from targets are only logged; answering them could loop.
    private void handleRemoteError(Connection connection, ProtocolMessage message) {
        String detail;
        try {
            ErrorPayload error = codec.payload(message, ErrorPayload.class);
            detail = error.code() + " " + error.message();
        } catch (ProtocolException e) {
            detail = "unreadable error payload";
        }
        log.warn("⚠️ Target on {} reported error: {}", connection.getConnectionId(), detail);
    }

    // ==================== Outbound ====================

    /**
     * Sends an arrow command after checking, in order: parameters, device known, device online, device paired,
     * command supported, live connection bound.
     */
    public synchronized CommandDispatchResult sendArrowCommand(String deviceId, String direction,
                                                               Integer repeat, Integer holdTime) {
        Optional<CommandType> commandType = CommandType.fromDirection(direction);
        if (commandType.isEmpty()) {
            return CommandDispatchResult.rejected(CommandDispatchResult.Failure.INVALID_PARAMETERS,
                    "Invalid direction: " + direction);
        }
        CommandParameters parameters;
        try {
            parameters = new CommandParameters(commandType.get().keyName(), repeat, holdTime);
        } catch (IllegalArgumentException e) {
            return CommandDispatchResult.rejected(CommandDispatchResult.Failure.INVALID_PARAMETERS, e.getMessage());
        }
        return sendCommand(deviceId, commandType.get(), parameters);
    }

    public synchronized CommandDispatchResult sendCommand(String deviceId, CommandType commandType,
                                                          CommandParameters parameters) {
        Optional<RegisteredDevice> found = registry.getDevice(deviceId);
        if (found.isEmpty()) {
            return CommandDispatchResult.rejected(CommandDispatchResult.Failure.DEVICE_NOT_FOUND, "Device not found");
        }
        RegisteredDevice device = found.get();
        if (!device.getStatus().isOnline()) {
            return CommandDispatchResult.rejected(CommandDispatchResult.Failure.DEVICE_NOT_CONNECTED,
                    "Device not connected");
        }
        if (!device.isPaired()) {
            return CommandDispatchResult.rejected(CommandDispatchResult.Failure.DEVICE_NOT_PAIRED, "Device not paired");
        }
        if (!device.supports(commandType.wireName())) {
            return CommandDispatchResult.rejected(CommandDispatchResult.Failure.COMMAND_NOT_SUPPORTED,
                    "Device does not support command: " + commandType.wireName());
        }
        Connection connection = liveConnection(deviceId);
        if (connection == null) {
            return CommandDispatchResult.rejected(CommandDispatchResult.Failure.NO_ACTIVE_CONNECTION,
                    "No active connection for device");
        }

        send(connection, MessageType.COMMAND, new CommandPayload(commandType.wireName(), parameters));
        log.info("🎯 Sent {} (repeat={}, holdTime={}ms) to {}", commandType.wireName(),
                parameters.repeat(), parameters.holdTime(), deviceId);
        return CommandDispatchResult.sent("Command " + commandType.wireName() + " sent to " + deviceId);
    }

    /**
     * Unpairs a device and tells its live session, if any, that it must pair again.
     */
    public synchronized PairingResult unpairDevice(String deviceId) {
        PairingResult result = registry.unpairDevice(deviceId);
        if (result.success()) {
            Connection connection = liveConnection(deviceId);
            if (connection != null) {
                sendError(connection, ErrorCode.NOT_PAIRED, "Device has been unpaired");
            }
        }
        return result;
    }

    /**
     * Drops a device record, closing its session first.
     */
    public synchronized boolean removeDevice(String deviceId) {
        String connectionId = connectionsByDevice.get(deviceId);
        Connection connection = connectionId != null ? connections.get(connectionId) : null;
        if (connection != null) {
            terminate(connection, ConnectionEvent.Kind.CLOSED);
        }
        return registry.removeDevice(deviceId);
    }

    public synchronized int getConnectionCount() {
        return connections.size();
    }

    public synchronized Optional<String> connectionIdFor(String deviceId) {
        return Optional.ofNullable(connectionsByDevice.get(deviceId));
    }

    // ==================== Internals ====================

    private Connection liveConnection(String deviceId) {
        String connectionId = connectionsByDevice.get(deviceId);
        if (connectionId == null) {
            return null;
        }
        Connection connection = connections.get(connectionId);
        return connection != null && connection.isActive() ? connection : null;
    }

    // Retires whatever other connection is bound to deviceId without disconnecting the device.
    private void supersede(String deviceId, Connection replacement) {
        String priorId = connectionsByDevice.get(deviceId);
        if (priorId == null || priorId.equals(replacement.getConnectionId())) {
            return;
        }
        connectionsByDevice.remove(deviceId);
        Connection prior = connections.remove(priorId);
        if (prior != null) {
            log.info("♻️ Connection {} superseded by {} for device {}", priorId,
                    replacement.getConnectionId(), deviceId);
            prior.setDeviceId(null);
            publishConnection(ConnectionEvent.Kind.SUPERSEDED, prior);
            prior.close();
        }
    }

    private void terminate(Connection connection, ConnectionEvent.Kind kind) {
        connections.remove(connection.getConnectionId());
        unbind(connection);
        publishConnection(kind, connection);
        connection.close();
    }

    private void unbind(Connection connection) {
        String deviceId = connection.getDeviceId();
        if (deviceId != null && connectionsByDevice.remove(deviceId, connection.getConnectionId())) {
            registry.disconnectDevice(deviceId);
        }
    }

    private void send(Connection connection, MessageType type, Object payload) {
        String text = codec.encode(type, identity.sender(), payload);
        connection.send(text).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.warn("❌ Failed to send {} to {}: {}", type.wireName(), connection.getConnectionId(),
                        future.cause() != null ? future.cause().getMessage() : "unknown");
            }
        });
    }

    private void sendError(Connection connection, ErrorCode code, String message) {
        send(connection, MessageType.ERROR, ErrorPayload.of(code, message));
    }

    private void publishConnection(ConnectionEvent.Kind kind, Connection connection) {
        eventPublisher.publishConnectionEvent(new ConnectionEvent(kind, connection.getConnectionId(),
                connection.getRemoteAddress(), connection.getDeviceId(), clock.instant()));
    }
}
