package com.arrowcontrol.controller.config;

import com.arrowcontrol.controller.domain.events.CommandResultEvent;
import com.arrowcontrol.controller.domain.events.DeviceEvent;
import com.arrowcontrol.controller.handler.ControlChannelHandler;
import com.arrowcontrol.controller.model.RegisteredDevice;
import com.arrowcontrol.controller.service.CommandDispatchResult;
import com.arrowcontrol.controller.service.ControlServer;
import com.arrowcontrol.controller.service.DeviceRegistry;
import com.arrowcontrol.controller.support.Poll;
import com.arrowcontrol.controller.support.RecordingEventPublisher;
import com.arrowcontrol.protocol.ProtocolCodec;
import com.arrowcontrol.protocol.model.ConnectionStatus;
import com.arrowcontrol.protocol.model.DeviceInfo;
import com.arrowcontrol.protocol.model.DeviceType;
import com.arrowcontrol.protocol.util.SecureTokenGenerator;
import com.arrowcontrol.target.client.ControlClient;
import com.arrowcontrol.target.client.ControlClientListener;
import com.arrowcontrol.target.config.TargetProperties;
import com.arrowcontrol.target.keys.LoggingKeyPressExecutor;
import com.arrowcontrol.target.transport.NettyControllerConnector;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * A real target client against the real WebSocket server over loopback.
 */
class WebSocketServerIntegrationTest {

    private static final Duration PING_INTERVAL = Duration.ofMillis(300);
    private static final Duration WAIT = Duration.ofSeconds(10);

    private RecordingEventPublisher events;
    private DeviceRegistry registry;
    private ControlServer controlServer;
    private WebSocketServer webSocketServer;

    private EventLoopGroup clientGroup;
    private ThreadPoolTaskScheduler clientScheduler;
    private LoggingKeyPressExecutor keys;
    private ControlClient client;

    private final CountDownLatch gaveUp = new CountDownLatch(1);
    private final AtomicInteger gaveUpAfter = new AtomicInteger();

    @BeforeEach
    void setUp() {
        ControlServerProperties serverProperties = new ControlServerProperties(0, "/", 1, 2, 128, 65536,
                PING_INTERVAL, Duration.ofMinutes(5), Duration.ofHours(24));
        Clock clock = Clock.systemUTC();
        ProtocolCodec codec = new ProtocolCodec();
        events = new RecordingEventPublisher();
        registry = new DeviceRegistry(new SecureTokenGenerator(), clock, events, serverProperties);
        controlServer = new ControlServer(registry, codec, events, new ControllerIdentity("c1", "Controller"), clock);
        webSocketServer = new WebSocketServer(serverProperties, controlServer, new ControlChannelHandler(controlServer));
        webSocketServer.startServerWhenReady();

        clientGroup = new NioEventLoopGroup(1);
        clientScheduler = new ThreadPoolTaskScheduler();
        clientScheduler.setPoolSize(1);
        clientScheduler.setThreadNamePrefix("test-target-timer-");
        clientScheduler.initialize();
        keys = new LoggingKeyPressExecutor();

        // Heartbeats are rare here so the sweep is kept satisfied by pong frames alone.
        TargetProperties targetProperties = new TargetProperties("t1", "Laptop", "127.0.0.1",
                webSocketServer.getPort(), true, true, Duration.ofMinutes(1), Duration.ofMillis(200),
                Duration.ofSeconds(2), 3, TargetProperties.KeySimulator.LOGGING, false, 8081, 3000, false, 65536);
        DeviceInfo info = DeviceInfo.builder()
                .id("t1")
                .name("Laptop")
                .ip("127.0.0.1")
                .type(DeviceType.TARGET)
                .supportedCommands(Set.of("arrow_left", "arrow_right"))
                .build();
        client = new ControlClient(info, new NettyControllerConnector(clientGroup, 65536), codec, clientScheduler,
                Runnable::run, keys, targetProperties);
        client.addListener(new ControlClientListener() {
            @Override
            public void onReconnectGaveUp(int attempts) {
                gaveUpAfter.set(attempts);
                gaveUp.countDown();
            }
        });
    }

    @AfterEach
    void tearDown() {
        client.shutdown();
        webSocketServer.shutdown();
        clientScheduler.shutdown();
        clientGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }

    private void connectAndPair() {
        assertThat(webSocketServer.isRunning()).isTrue();
        assertThat(webSocketServer.getPort()).isPositive();

        client.connect("127.0.0.1", webSocketServer.getPort());

        Poll.until(WAIT, "client to pair", () -> client.getStatus() == ConnectionStatus.PAIRED);
    }

    @Test
    void targetPairsExecutesCommandAndStaysAliveAcrossSweeps() throws InterruptedException {
        connectAndPair();

        RegisteredDevice device = registry.getDevice("t1").orElseThrow();
        assertThat(device.isPaired()).isTrue();
        assertThat(device.getStatus()).isEqualTo(ConnectionStatus.PAIRED);
        assertThat(client.getAuthToken()).isNotBlank();

        CommandDispatchResult dispatched = controlServer.sendArrowCommand("t1", "left", 2, null);
        assertThat(dispatched.sent()).isTrue();

        Poll.until(WAIT, "command result", () -> !events.commandResults.isEmpty());
        CommandResultEvent result = events.commandResults.get(0);
        assertThat(result.deviceId()).isEqualTo("t1");
        assertThat(result.commandType()).isEqualTo("arrow_left");
        assertThat(result.success()).isTrue();
        assertThat(keys.getPressCount()).isEqualTo(2);

        Thread.sleep(PING_INTERVAL.toMillis() * 6);

        assertThat(controlServer.getConnectionCount()).isEqualTo(1);
        assertThat(client.getStatus()).isEqualTo(ConnectionStatus.PAIRED);
        assertThat(events.count(DeviceEvent.Kind.DISCONNECTED, "t1")).isZero();
    }

    @Test
    void clientBacksOffAndGivesUpOnceServerIsGone() throws InterruptedException {
        connectAndPair();

        webSocketServer.shutdown();

        assertThat(gaveUp.await(WAIT.toSeconds(), TimeUnit.SECONDS)).isTrue();
        assertThat(gaveUpAfter.get()).isEqualTo(3);
        assertThat(client.getStatus()).isEqualTo(ConnectionStatus.DISCONNECTED);
        assertThat(client.isReconnectPending()).isFalse();
        assertThat(registry.getDevice("t1").orElseThrow().getStatus()).isEqualTo(ConnectionStatus.DISCONNECTED);
    }
}
