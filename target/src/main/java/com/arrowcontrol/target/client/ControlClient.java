package com.arrowcontrol.target.client;

import com.arrowcontrol.protocol.DecodeResult;
import com.arrowcontrol.protocol.ErrorCode;
import com.arrowcontrol.protocol.MessageType;
import com.arrowcontrol.protocol.ProtocolCodec;
import com.arrowcontrol.protocol.ProtocolException;
import com.arrowcontrol.protocol.model.CommandType;
import com.arrowcontrol.protocol.model.ConnectionStatus;
import com.arrowcontrol.protocol.model.DeviceInfo;
import com.arrowcontrol.protocol.model.ProtocolMessage;
import com.arrowcontrol.protocol.model.Sender;
import com.arrowcontrol.protocol.payload.CommandParameters;
import com.arrowcontrol.protocol.payload.CommandPayload;
import com.arrowcontrol.protocol.payload.CommandResultPayload;
import com.arrowcontrol.protocol.payload.ErrorPayload;
import com.arrowcontrol.protocol.payload.PairingRequestPayload;
import com.arrowcontrol.protocol.payload.PairingResponsePayload;
import com.arrowcontrol.protocol.payload.RegisterPayload;
import com.arrowcontrol.protocol.payload.RegisteredPayload;
import com.arrowcontrol.protocol.util.Tokens;
import com.arrowcontrol.target.config.TargetProperties;
import com.arrowcontrol.target.keys.KeyPressExecutor;
import com.arrowcontrol.target.transport.ConnectionListener;
import com.arrowcontrol.target.transport.ControllerConnection;
import com.arrowcontrol.target.transport.ControllerConnector;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Consumer;

/**
 * Target side of the control protocol: disconnected, connecting, connected, paired.
 *
 * <p>All state lives behind this client's monitor. Transport callbacks of a session that is no longer current are
 * ignored, so a session ends at most once. At most one reconnect timer is pending at any time.
 */
@Slf4j
public class ControlClient {

    static final String UNSUPPORTED_COMMAND = "Unsupported command";
    static final String INVALID_PARAMETERS = "Invalid command parameters";
    static final String EXECUTION_FAILED = "Command execution failed";
    static final String INTERNAL_ERROR = "Internal error";

    private final DeviceInfo deviceInfo;
    private final Sender sender;
    private final ControllerConnector connector;
    private final ProtocolCodec codec;
    private final TaskScheduler scheduler;
    private final Executor commandExecutor;
    private final KeyPressExecutor keyPressExecutor;
    private final TargetProperties properties;
    private final List<ControlClientListener> listeners = new CopyOnWriteArrayList<>();

    // ==================== State ====================

    private ConnectionStatus status = ConnectionStatus.DISCONNECTED;
    private Session session;
    private String host;
    private int port;
    private boolean manuallyDisconnected;
    private int reconnectAttempts;
    private ScheduledFuture<?> reconnectTask;
    private ScheduledFuture<?> heartbeatTask;
    private String pairingToken;
    private String authToken;
    private CompletableFuture<Boolean> pendingPairing;

    public ControlClient(DeviceInfo deviceInfo, ControllerConnector connector, ProtocolCodec codec,
                         TaskScheduler scheduler, Executor commandExecutor, KeyPressExecutor keyPressExecutor,
                         TargetProperties properties) {
        this.deviceInfo = deviceInfo;
        this.sender = Sender.target(deviceInfo.getId());
        this.connector = connector;
        this.codec = codec;
        this.scheduler = scheduler;
        this.commandExecutor = commandExecutor;
        this.keyPressExecutor = keyPressExecutor;
        this.properties = properties;
    }

    public void addListener(ControlClientListener listener) {
        listeners.add(listener);
    }

    // ==================== Session lifecycle ====================

    /**
     * Opens a session to a controller. Ignored while a session is open or opening; cancels a pending reconnect.
     *
     * @return {@code false} when ignored
     */
    public synchronized boolean connect(String host, int port) {
        if (session != null) {
            log.warn("⚠️ Already connected or connecting to {}:{}, ignoring connect to {}:{}",
                    this.host, this.port, host, port);
            return false;
        }
        cancelReconnect();
        manuallyDisconnected = false;
        reconnectAttempts = 0;
        openSession(host, port);
        return true;
    }

    /**
     * Connects only when no session exists and no reconnect is pending. Used for addresses learned from
     * discovery.
     */
    public synchronized boolean connectIfIdle(String host, int port) {
        if (session != null || reconnectTask != null) {
            return false;
        }
        return connect(host, port);
    }

    /**
     * Operator-initiated close. Cancels every timer and does not reconnect.
     */
    public synchronized void disconnect() {
        manuallyDisconnected = true;
        cancelReconnect();
        stopHeartbeat();
        Session current = session;
        session = null;
        failPendingPairing(new IllegalStateException("Disconnected"));
        setStatus(ConnectionStatus.DISCONNECTED);
        if (current != null && current.connection != null) {
            current.connection.close();
        }
        log.info("👋 Disconnected from controller");
    }

    public void shutdown() {
        log.info("🛑 Shutting down control client for {}", deviceInfo.getId());
        disconnect();
    }

    private void openSession(String host, int port) {
        this.host = host;
        this.port = port;
        setStatus(ConnectionStatus.CONNECTING);
        Session opening = new Session();
        session = opening;
        log.info("🔌 Connecting to controller at {}:{}", host, port);
        try {
            ControllerConnection connection = connector.connect(host, port, opening);
            if (opening.connection == null) {
                opening.connection = connection;
            }
        } catch (RuntimeException e) {
            log.error("💥 Could not start connection to {}:{}: {}", host, port, e.getMessage());
            sessionEnded(opening, e);
        }
    }

    private void sessionOpened() {
        setStatus(ConnectionStatus.CONNECTED);
        reconnectAttempts = 0;
        sendRegistration();
        startHeartbeat();
    }

    private void sessionEnded(Session ended, Throwable cause) {
        if (ended != session) {
            return;
        }
        session = null;
        stopHeartbeat();
        failPendingPairing(new IllegalStateException("Connection lost"));
        setStatus(ConnectionStatus.DISCONNECTED);
        if (cause != null) {
            log.warn("📴 Connection to {}:{} lost: {}", host, port, cause.getMessage());
        } else {
            log.info("📴 Connection to {}:{} closed", host, port);
        }
        if (properties.autoReconnect() && !manuallyDisconnected) {
            scheduleReconnect();
        }
    }

    // ==================== Reconnect ====================

    private void scheduleReconnect() {
        cancelReconnect();
        if (reconnectAttempts >= properties.maxReconnectAttempts()) {
            log.error("🛑 Giving up on {}:{} after {} reconnect attempts", host, port, reconnectAttempts);
            int attempts = reconnectAttempts;
            notifyListeners(listener -> listener.onReconnectGaveUp(attempts));
            return;
        }
        Duration delay = backoffDelay(reconnectAttempts, properties.reconnectBaseDelay(),
                properties.reconnectMaxDelay());
        reconnectAttempts++;
        log.info("🔄 Reconnect attempt {}/{} in {}ms", reconnectAttempts, properties.maxReconnectAttempts(),
                delay.toMillis());
        reconnectTask = scheduler.schedule(this::runReconnect, scheduler.getClock().instant().plus(delay));
    }

    private synchronized void runReconnect() {
        reconnectTask = null;
        if (session != null || manuallyDisconnected) {
            return;
        }
        log.info("🔄 Reconnect attempt {} to {}:{}", reconnectAttempts, host, port);
        openSession(host, port);
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    /**
     * Delay before the reconnect that follows {@code previousAttempts} failed ones: base doubled per attempt,
     * capped.
     */
    static Duration backoffDelay(int previousAttempts, Duration base, Duration cap) {
        if (previousAttempts >= 30) {
            return cap;
        }
        Duration delay = base.multipliedBy(1L << previousAttempts);
        return delay.compareTo(cap) > 0 ? cap : delay;
    }

    // ==================== Heartbeat ====================

    private void startHeartbeat() {
        stopHeartbeat();
        heartbeatTask = scheduler.scheduleAtFixedRate(this::sendHeartbeat, properties.heartbeatInterval());
    }

    private void stopHeartbeat() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
    }

    private synchronized void sendHeartbeat() {
        if (status.isOnline()) {
            send(MessageType.HEARTBEAT, null);
            log.debug("💓 Heartbeat sent");
        }
    }

    // ==================== Pairing ====================

    /**
     * Echoes the held pairing token back to the controller.
     *
     * @return completes {@code true} on acceptance, exceptionally with {@link PairingRejectedException} on
     *         rejection, or at once with {@link IllegalStateException} when not connected or no token is held
     */
    public synchronized CompletableFuture<Boolean> sendPairingRequest() {
        if (session == null || !status.isOnline()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Not connected to controller"));
        }
        if (pairingToken == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No pairing token available"));
        }
        if (pendingPairing != null && !pendingPairing.isDone()) {
            return pendingPairing;
        }
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        if (!send(MessageType.PAIRING_REQUEST, new PairingRequestPayload(pairingToken))) {
            result.completeExceptionally(new IllegalStateException("Not connected to controller"));
            return result;
        }
        pendingPairing = result;
        log.info("🤝 Pairing request sent (token {})", Tokens.mask(pairingToken));
        return result;
    }

    private void failPendingPairing(Throwable cause) {
        if (pendingPairing != null) {
            pendingPairing.completeExceptionally(cause);
            pendingPairing = null;
        }
    }

    // ==================== Inbound ====================

    private void handleMessage(String text) {
        DecodeResult decoded = codec.decode(text);
        if (!decoded.isValid()) {
            log.warn("⚠️ Invalid message from controller: {}", decoded.error());
            return;
        }
        ProtocolMessage message = decoded.message();
        Optional<MessageType> type = message.messageType();
        if (type.isEmpty()) {
            log.warn("⚠️ Unhandled message type: {}", message.type());
            return;
        }
        try {
            switch (type.get()) {
                case REGISTERED -> handleRegistered(message);
                case PAIRING_RESPONSE -> handlePairingResponse(message);
                case COMMAND -> handleCommand(message);
                case HEARTBEAT_ACK -> log.debug("💓 Heartbeat acknowledged");
                case ERROR -> handleError(message);
                default -> log.warn("⚠️ Unhandled message type: {}", message.type());
            }
        } catch (ProtocolException e) {
            log.warn("⚠️ Malformed {} from controller: {}", message.type(), e.getMessage());
        }
    }

    private void handleRegistered(ProtocolMessage message) {
        RegisteredPayload registered = codec.payload(message, RegisteredPayload.class);
        if (!deviceInfo.getId().equals(registered.deviceId())) {
            log.warn("⚠️ Received registration for different device id: {}", registered.deviceId());
            return;
        }
        if (registered.pairingRequired()) {
            pairingToken = registered.pairingToken();
            setStatus(ConnectionStatus.CONNECTED);
            log.info("🔐 Registered, pairing required (token {})", Tokens.mask(pairingToken));
            String token = pairingToken;
            notifyListeners(listener -> listener.onPairingRequired(token));
            if (properties.autoAcceptPairing()) {
                sendPairingRequest().whenComplete((accepted, error) -> {
                    if (error != null) {
                        log.warn("🔐 Automatic pairing failed: {}", error.getMessage());
                    }
                });
            }
        } else {
            pairingToken = null;
            setStatus(ConnectionStatus.PAIRED);
            log.info("✅ Registered, already paired");
        }
    }

    private void handlePairingResponse(ProtocolMessage message) {
        PairingResponsePayload response = codec.payload(message, PairingResponsePayload.class);
        CompletableFuture<Boolean> pending = pendingPairing;
        pendingPairing = null;
        if (response.accepted()) {
            authToken = response.authToken();
            pairingToken = null;
            setStatus(ConnectionStatus.PAIRED);
            log.info("🤝 Pairing accepted (auth token {})", Tokens.mask(authToken));
            if (pending != null) {
                pending.complete(true);
            }
        } else {
            log.warn("🔐 Pairing rejected: {}", response.error());
            notifyListeners(listener -> listener.onPairingRejected(response.error()));
            if (pending != null) {
                pending.completeExceptionally(new PairingRejectedException(response.error()));
            }
        }
    }

    private void handleError(ProtocolMessage message) {
        ErrorPayload error = codec.payload(message, ErrorPayload.class);
        log.warn("⚠️ Controller error [{}] {}", error.code(), error.message());
        notifyListeners(listener -> listener.onControllerError(error.code(), error.message()));

        Optional<ErrorCode> code = error.errorCode();
        if (code.isEmpty()) {
            return;
        }
        switch (code.get()) {
            case AUTHENTICATION_FAILED -> {
                authToken = null;
                pairingToken = null;
                demoteIfPaired();
            }
            case NOT_PAIRED -> {
                authToken = null;
                demoteIfPaired();
                sendRegistration();
            }
            default -> {
            }
        }
    }

    private void demoteIfPaired() {
        if (status == ConnectionStatus.PAIRED) {
            setStatus(ConnectionStatus.CONNECTED);
        }
    }

    // ==================== Commands ====================

    private void handleCommand(ProtocolMessage message) {
        JsonNode data = message.data();
        String commandType = data != null ? data.path("commandType").asText(null) : null;
        Optional<CommandType> type = CommandType.fromWire(commandType);
        if (type.isEmpty() || !deviceInfo.supports(commandType)) {
            log.warn("⚠️ Received unsupported command: {}", commandType);
            sendCommandResult(CommandResultPayload.failed(commandType, UNSUPPORTED_COMMAND));
            return;
        }

        CommandParameters parameters;
        try {
            CommandPayload payload = codec.payload(message, CommandPayload.class);
            parameters = payload.parameters() != null ? payload.parameters() : CommandParameters.of(type.get().keyName());
        } catch (ProtocolException e) {
            log.warn("⚠️ Invalid parameters for {}: {}", commandType, e.getMessage());
            sendCommandResult(CommandResultPayload.failed(commandType, INVALID_PARAMETERS));
            return;
        }

        CommandParameters accepted = parameters;
        try {
            commandExecutor.execute(() -> executeCommand(type.get(), accepted));
        } catch (RejectedExecutionException e) {
            log.error("💥 Command executor rejected {}: {}", commandType, e.getMessage());
            sendCommandResult(CommandResultPayload.failed(commandType, INTERNAL_ERROR));
        }
    }

    private void executeCommand(CommandType type, CommandParameters parameters) {
        log.info("🎯 Executing {} (repeat: {}, holdTime: {}ms)", type.wireName(), parameters.repeat(),
                parameters.holdTime());
        String error = null;
        try {
            if (!keyPressExecutor.press(type.keyName(), parameters)) {
                error = EXECUTION_FAILED;
            }
        } catch (RuntimeException e) {
            log.error("💥 Error executing {}: {}", type.wireName(), e.getMessage(), e);
            error = INTERNAL_ERROR;
        }

        String failure = error;
        synchronized (this) {
            sendCommandResult(failure == null
                    ? CommandResultPayload.succeeded(type.wireName())
                    : CommandResultPayload.failed(type.wireName(), failure));
            notifyListeners(listener -> listener.onCommandExecuted(type.wireName(), failure == null, failure));
        }
    }

    private void sendCommandResult(CommandResultPayload result) {
        if (!send(MessageType.COMMAND_RESULT, result)) {
            log.warn("⚠️ Could not report {} result: not connected", result.commandType());
        }
    }

    // ==================== Outbound ====================

    private void sendRegistration() {
        if (send(MessageType.REGISTER, new RegisterPayload(deviceInfo))) {
            log.info("📝 Sent registration for {} ({})", deviceInfo.getId(), deviceInfo.getName());
        }
    }

    private boolean send(MessageType type, Object payload) {
        Session current = session;
        if (current == null || current.connection == null) {
            return false;
        }
        return current.connection.send(codec.encode(type, sender, payload));
    }

    // ==================== State ====================

    private void setStatus(ConnectionStatus next) {
        if (status == next) {
            return;
        }
        ConnectionStatus previous = status;
        status = next;
        log.info("📶 Status {} -> {}", previous.wireName(), next.wireName());
        notifyListeners(listener -> listener.onStatusChanged(previous, next));
    }

    private void notifyListeners(Consumer<ControlClientListener> event) {
        for (ControlClientListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("⚠️ Client listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    public synchronized ConnectionStatus getStatus() {
        return status;
    }

    public synchronized String getPairingToken() {
        return pairingToken;
    }

    public synchronized String getAuthToken() {
        return authToken;
    }

    public synchronized int getReconnectAttempts() {
        return reconnectAttempts;
    }

    public synchronized boolean isReconnectPending() {
        return reconnectTask != null;
    }

    public DeviceInfo getDeviceInfo() {
        return deviceInfo;
    }

    /**
     * Transport callbacks for one session; stale sessions are ignored.
     */
    private final class Session implements ConnectionListener {

        private ControllerConnection connection;

        @Override
        public void onOpen(ControllerConnection opened) {
            synchronized (ControlClient.this) {
                if (this != session) {
                    opened.close();
                    return;
                }
                connection = opened;
                sessionOpened();
            }
        }

        @Override
        public void onMessage(ControllerConnection from, String text) {
            synchronized (ControlClient.this) {
                if (this == session) {
                    handleMessage(text);
                }
            }
        }

        @Override
        public void onClosed(ControllerConnection closed, Throwable cause) {
            synchronized (ControlClient.this) {
                sessionEnded(this, cause);
            }
        }
    }
}
