package com.arrowcontrol.target.client;

import com.arrowcontrol.protocol.ErrorCode;
import com.arrowcontrol.protocol.MessageType;
import com.arrowcontrol.protocol.ProtocolCodec;
import com.arrowcontrol.protocol.model.ConnectionStatus;
import com.arrowcontrol.protocol.model.DeviceInfo;
import com.arrowcontrol.protocol.model.DeviceType;
import com.arrowcontrol.protocol.model.Sender;
import com.arrowcontrol.protocol.payload.CommandParameters;
import com.arrowcontrol.protocol.payload.CommandPayload;
import com.arrowcontrol.protocol.payload.ErrorPayload;
import com.arrowcontrol.protocol.payload.PairingResponsePayload;
import com.arrowcontrol.protocol.payload.RegisteredPayload;
import com.arrowcontrol.target.config.TargetProperties;
import com.arrowcontrol.target.keys.KeyPressExecutor;
import com.arrowcontrol.target.support.FakeConnector;
import com.arrowcontrol.target.support.FakeConnector.FakeConnection;
import com.arrowcontrol.target.support.ManualTaskScheduler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ControlClientTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ProtocolCodec codec = new ProtocolCodec();
    private final Sender controller = Sender.controller("c1");

    private FakeConnector connector;
    private ManualTaskScheduler scheduler;
    private KeyPressExecutor keys;
    private RecordingListener listener;

    @BeforeEach
    void setUp() {
        connector = new FakeConnector();
        scheduler = new ManualTaskScheduler();
        keys = mock(KeyPressExecutor.class);
        listener = new RecordingListener();
    }

    // ==================== Helpers ====================

    private static TargetProperties properties(boolean autoReconnect, boolean autoAccept, int maxAttempts) {
        return new TargetProperties("t1", "Laptop", null, 8080, autoReconnect, autoAccept, Duration.ofSeconds(30),
                Duration.ofSeconds(1), Duration.ofSeconds(30), maxAttempts, TargetProperties.KeySimulator.LOGGING,
                false, 8081, 3000, false, 65536);
    }

    private ControlClient client(TargetProperties properties) {
        DeviceInfo info = DeviceInfo.builder()
                .id("t1")
                .name("Laptop")
                .ip("10.0.0.7")
                .type(DeviceType.TARGET)
                .supportedCommands(Set.of("arrow_left", "arrow_right"))
                .build();
        ControlClient client = new ControlClient(info, connector, codec, scheduler, Runnable::run, keys, properties);
        client.addListener(listener);
        return client;
    }

    private ControlClient defaultClient() {
        return client(properties(true, false, 10));
    }

    private FakeConnection openSession(ControlClient client) {
        client.connect("10.0.0.1", 8080);
        FakeConnection connection = connector.last();
        connection.open();
        return connection;
    }

    private void receive(FakeConnection connection, MessageType type, Object payload) {
        connection.receive(codec.encode(type, controller, payload));
    }

    private JsonNode lastSent(FakeConnection connection) throws IOException {
        return mapper.readTree(connection.sent.get(connection.sent.size() - 1));
    }

    private List<String> sentTypes(FakeConnection connection) throws IOException {
        List<String> types = new ArrayList<>();
        for (String text : connection.sent) {
            types.add(mapper.readTree(text).get("type").asText());
        }
        return types;
    }

    private CommandPayload command(String commandType, Integer repeat, Integer holdTime) {
        return new CommandPayload(commandType, new CommandParameters("left", repeat, holdTime));
    }

    // ==================== Session ====================

    @Test
    void openSessionRegistersAndStartsHeartbeat() throws IOException {
        ControlClient client = defaultClient();

        client.connect("10.0.0.1", 8080);
        assertThat(client.getStatus()).isEqualTo(ConnectionStatus.CONNECTING);

        FakeConnection connection = connector.last();
        connection.open();

        assertThat(client.getStatus()).isEqualTo(ConnectionStatus.CONNECTED);
        JsonNode register = lastSent(connection);
        assertThat(register.get("type").asText()).isEqualTo("register");
        assertThat(register.at("/sender/type").asText()).isEqualTo("target");
        assertThat(register.at("/data/deviceInfo/id").asText()).isEqualTo("t1");

        scheduler.runDue();
        assertThat(sentTypes(connection)).containsExactly("register", "heartbeat");
        scheduler.advance(Duration.ofSeconds(30));
        assertThat(sentTypes(connection)).containsExactly("register", "heartbeat", "heartbeat");
    }

    @Test
    void connectIsIgnoredWhileSessionExists() {
        ControlClient client = defaultClient();
        client.connect("10.0.0.1", 8080);

        assertThat(client.connect("10.0.0.2", 8080)).isFalse();
        assertThat(client.connectIfIdle("10.0.0.2", 8080)).isFalse();
        assertThat(connector.connections).hasSize(1);
    }

    // ==================== Pairing ====================

    @Test
    void pairingFlowReachesPaired() throws Exception {
        ControlClient client = defaultClient();
        FakeConnection connection = openSession(client);

        receive(connection, MessageType.REGISTERED, new RegisteredPayload("t1", true, "pair-token"));
        assertThat(client.getStatus()).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(client.getPairingToken()).isEqualTo("pair-token");
        assertThat(listener.pairingTokens).containsExactly("pair-token");

        CompletableFuture<Boolean> pairing = client.sendPairingRequest();
        JsonNode request = lastSent(connection);
        assertThat(request.get("type").asText()).isEqualTo("pairing_request");
        assertThat(request.at("/data/pairingToken").asText()).isEqualTo("pair-token");

        receive(connection, MessageType.PAIRING_RESPONSE, PairingResponsePayload.accepted("auth-token"));

        assertThat(pairing).isCompletedWithValue(true);
        assertThat(client.getStatus()).isEqualTo(ConnectionStatus.PAIRED);
        assertThat(client.getAuthToken()).isEqualTo("auth-token");
        assertThat(client.getPairingToken()).isNull();
    }

    @Test
    void rejectedPairingFailsFutureAndStaysConnected() {
        ControlClient client = defaultClient();
        FakeConnection connection = openSession(client);
        receive(connection, MessageType.REGISTERED, new RegisteredPayload("t1", true, "pair-token"));

        CompletableFuture<Boolean> pairing = client.sendPairingRequest();
        receive(connection, MessageType.PAIRING_RESPONSE, PairingResponsePayload.rejected("Invalid pairing token"));

        assertThat(pairing).isCompletedExceptionally();
        assertThat(pairing.handle((value, error) -> error))
                .isCompletedWithValueMatching(error -> error instanceof PairingRejectedException
                        && "Invalid pairing token".equals(error.getMessage()));
        assertThat(client.getStatus()).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(listener.rejections).containsExactly("Invalid pairing token");
    }

    @Test
    void pairingRequestFailsFastWithoutSessionOrToken() {
        ControlClient client = defaultClient();
        assertThat(client.sendPairingRequest()).isCompletedExceptionally();

        openSession(client);
        assertThat(client.sendPairingRequest()).isCompletedExceptionally();
    }

    @Test
    void autoAcceptSendsPairingRequestImmediately() throws IOException {
        ControlClient client = client(properties(true, true, 10));
        FakeConnection connection = openSession(client);

        receive(connection, MessageType.REGISTERED, new RegisteredPayload("t1", true, "pair-token"));

        assertThat(lastSent(connection).get("type").asText()).isEqualTo("pairing_request");
    }

    @Test
    void alreadyPairedRegistrationGoesStraightToPaired() {
        ControlClient client = defaultClient();
        FakeConnection connection = openSession(client);

        receive(connection, MessageType.REGISTERED, new RegisteredPayload("t1", false, null));

        assertThat(client.getStatus()).isEqualTo(ConnectionStatus.PAIRED);
    }

    @Test
    void registrationForAnotherDeviceIsIgnored() {
        ControlClient client = defaultClient();
        FakeConnection connection = openSession(client);

        receive(connection, MessageType.REGISTERED, new RegisteredPayload("someone-else", true, "pair-token"));

        assertThat(client.getPairingToken()).isNull();
        assertThat(listener.pairingTokens).isEmpty();
    }

    @Test
    void notPairedErrorDemotesAndRegistersAgain() throws IOException {
        ControlClient client = defaultClient();
        FakeConnection connection = openSession(client);
        receive(connection, MessageType.REGISTERED, new RegisteredPayload("t1", false, null));

        receive(connection, MessageType.ERROR, ErrorPayload.of(ErrorCode.NOT_PAIRED, "Device has been unpaired"));

        assertThat(client.getStatus()).isEqualTo(ConnectionStatus.CONNECTED);
        assertThat(lastSent(connection).get("type").asText()).isEqualTo("register");
        assertThat(listener.errorCodes).containsExactly(104);
    }

    @Test
    void authenticationFailureClearsTokens() {
        ControlClient client = defaultClient();
        FakeConnection connection = openSession(client);
        receive(connection, MessageType.REGISTERED, new RegisteredPayload("t1", true, "pair-token"));

        receive(connection, MessageType.ERROR, ErrorPayload.of(ErrorCode.AUTHENTICATION_FAILED, "Bad token"));

        assertThat(client.getPairingToken()).isNull();
        assertThat(client.getAuthToken()).isNull();
    }

    // ==================== Commands ====================

    @Test
    void arrowCommandIsExecutedAndReported() throws IOException {
        when(keys.press(eq("left"), any())).thenReturn(true);
        ControlClient client = defaultClient();
        FakeConnection connection = openSession(client);

        receive(connection, MessageType.COMMAND, command("arrow_left", 2, null));

        verify(keys).press("left", new CommandParameters("left", 2, 0));
        JsonNode result = lastSent(connection);
        assertThat(result.get("type").asText()).isEqualTo("command_result");
        assertThat(result.at("/data/commandType").asText()).isEqualTo("arrow_left");
        assertThat(result.at("/data/success").asBoolean()).isTrue();
        assertThat(listener.executed).containsExactly("arrow_left:true");
    }

    @Test
    void failedPressIsReportedAsExecutionFailure() throws IOException {
        when(keys.press(anyString(), any())).thenReturn(false);
        ControlClient client = defaultClient();
        FakeConnection connection = openSession(client);

        receive(connection, MessageType.COMMAND, command("arrow_right", null, null));

        JsonNode result = lastSent(connection);
        assertThat(result.at("/data/success").asBoolean()).isFalse();
        assertThat(result.at("/data/error").asText()).isEqualTo("Command execution failed");
    }

    @Test
    void pressExceptionIsReportedGenerically() throws IOException {
        when(keys.press(anyString(), any())).thenThrow(new IllegalStateException("robot exploded"));
        ControlClient client = defaultClient();
        FakeConnection connection = openSession(client);

        receive(connection, MessageType.COMMAND, command("arrow_left", null, null));

        assertThat(lastSent(connection).at("/data/error").asText()).isEqualTo("Internal error");
    }

    @Test
    void unsupportedCommandNeverReachesKeys() throws IOException {
        ControlClient client = defaultClient();
        FakeConnection connection = openSession(client);

        receive(connection, MessageType.COMMAND, command("arrow_up", null, null));

        verify(keys, never()).press(anyString(), any());
        JsonNode result = lastSent(connection);
        assertThat(result.at("/data/commandType").asText()).isEqualTo("arrow_up");
        assertThat(result.at("/data/error").asText()).isEqualTo("Unsupported command");
    }

    @Test
    void invalidParametersAreRejected() throws IOException {
        ControlClient client = defaultClient();
        FakeConnection connection = openSession(client);

        connection.receive("{\"type\":\"command\",\"version\":\"1.0.0\",\"timestamp\":1,"
                + "\"sender\":{\"id\":\"c1\",\"type\":\"controller\"},"
                + "\"data\":{\"commandType\":\"arrow_left\",\"parameters\":{\"repeat\":0}}}");

        verify(keys, never()).press(anyString(), any());
        assertThat(lastSent(connection).at("/data/error").asText()).isEqualTo("Invalid command parameters");
    }

    // ==================== Reconnect ====================

    @Test
    void backoffDoublesUpToCap() {
        Duration base = Duration.ofSeconds(1);
        Duration cap = Duration.ofSeconds(30);

        assertThat(ControlClient.backoffDelay(0, base, cap)).isEqualTo(Duration.ofSeconds(1));
        assertThat(ControlClient.backoffDelay(1, base, cap)).isEqualTo(Duration.ofSeconds(2));
        assertThat(ControlClient.backoffDelay(4, base, cap)).isEqualTo(Duration.ofSeconds(16));
        assertThat(ControlClient.backoffDelay(5, base, cap)).isEqualTo(cap);
        assertThat(ControlClient.backoffDelay(62, base, cap)).isEqualTo(cap);
    }

    @Test
    void failedAttemptsBackOffAndThenGiveUp() {
        ControlClient client = client(properties(true, false, 3));
        client.connect("10.0.0.1", 8080);

        connector.last().drop(new ConnectException("refused"));
        assertThat(client.getStatus()).isEqualTo(ConnectionStatus.DISCONNECTED);
        assertThat(scheduler.pendingOneShots()).isEqualTo(1);

        scheduler.advance(Duration.ofMillis(999));
        assertThat(connector.connections).hasSize(1);
        scheduler.advance(Duration.ofMillis(1));
        assertThat(connector.connections).hasSize(2);

        connector.last().drop(new ConnectException("refused"));
        scheduler.advance(Duration.ofMillis(1999));
        assertThat(connector.connections).hasSize(2);
        scheduler.advance(Duration.ofMillis(1));
        assertThat(connector.connections).hasSize(3);

        connector.last().drop(new ConnectException("refused"));
        scheduler.advance(Duration.ofSeconds(4));
        assertThat(connector.connections).hasSize(4);

        connector.last().drop(new ConnectException("refused"));

        assertThat(listener.gaveUpAfter).containsExactly(3);
        assertThat(scheduler.pendingOneShots()).isZero();
        assertThat(client.isReconnectPending()).isFalse();
        scheduler.advance(Duration.ofMinutes(10));
        assertThat(connector.connections).hasSize(4);
    }

    @Test
    void successfulOpenResetsAttempts() {
        ControlClient client = defaultClient();
        client.connect("10.0.0.1", 8080);
        connector.last().drop(new ConnectException("refused"));
        scheduler.advance(Duration.ofSeconds(1));
        assertThat(client.getReconnectAttempts()).isEqualTo(1);

        connector.last().open();

        assertThat(client.getReconnectAttempts()).isZero();
        assertThat(connector.last().host).isEqualTo("10.0.0.1");
    }

    @Test
    void sessionEndReportedOnceEvenIfErrorAndCloseBothFire() {
        ControlClient client = defaultClient();
        FakeConnection connection = openSession(client);

        connection.drop(new IOException("reset"));
        connection.drop(null);

        assertThat(client.getReconnectAttempts()).isEqualTo(1);
        assertThat(scheduler.pendingOneShots()).isEqualTo(1);
        assertThat(listener.statuses.stream().filter("disconnected"::equals).count()).isEqualTo(1);
    }

    @Test
    void closeStopsHeartbeat() {
        ControlClient client = client(properties(false, false, 10));
        FakeConnection connection = openSession(client);
        scheduler.runDue();
        int sentBeforeClose = connection.sent.size();

        connection.drop(null);
        scheduler.advance(Duration.ofMinutes(5));

        assertThat(connection.sent).hasSize(sentBeforeClose);
        assertThat(scheduler.activePeriodic()).isZero();
        assertThat(scheduler.pendingOneShots()).isZero();
    }

    @Test
    void manualDisconnectNeverReconnects() {
        ControlClient client = defaultClient();
        FakeConnection connection = openSession(client);

        client.disconnect();
        connection.drop(null);
        scheduler.advance(Duration.ofMinutes(5));

        assertThat(connection.isClosed()).isTrue();
        assertThat(client.getStatus()).isEqualTo(ConnectionStatus.DISCONNECTED);
        assertThat(connector.connections).hasSize(1);
        assertThat(scheduler.pendingOneShots()).isZero();
    }

    @Test
    void explicitConnectCancelsPendingReconnect() {
        ControlClient client = defaultClient();
        openSession(client).drop(null);
        assertThat(client.isReconnectPending()).isTrue();

        client.connect("10.0.0.9", 8080);

        assertThat(client.isReconnectPending()).isFalse();
        assertThat(connector.last().host).isEqualTo("10.0.0.9");
        scheduler.advance(Duration.ofMinutes(1));
        assertThat(connector.connections).hasSize(2);
    }

    private static final class RecordingListener implements ControlClientListener {

        final List<String> statuses = new ArrayList<>();
        final List<String> pairingTokens = new ArrayList<>();
        final List<String> rejections = new ArrayList<>();
        final List<Integer> errorCodes = new ArrayList<>();
        final List<String> executed = new ArrayList<>();
        final List<Integer> gaveUpAfter = new ArrayList<>();

        @Override
        public void onStatusChanged(ConnectionStatus previous, ConnectionStatus current) {
            statuses.add(current.wireName());
        }

        @Override
        public void onPairingRequired(String pairingToken) {
            pairingTokens.add(pairingToken);
        }

        @Override
        public void onPairingRejected(String reason) {
            rejections.add(reason);
        }

        @Override
        public void onControllerError(int code, String message) {
            errorCodes.add(code);
        }

        @Override
        public void onCommandExecuted(String commandType, boolean success, String error) {
            executed.add(commandType + ":" + success);
        }

        @Override
        public void onReconnectGaveUp(int attempts) {
            gaveUpAfter.add(attempts);
        }
    }
}
