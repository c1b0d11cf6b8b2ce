package com.arrowcontrol.target.config;

import com.arrowcontrol.protocol.ProtocolCodec;
import com.arrowcontrol.protocol.model.CommandType;
import com.arrowcontrol.protocol.model.DeviceInfo;
import com.arrowcontrol.protocol.model.DeviceType;
import com.arrowcontrol.protocol.util.NetworkAddresses;
import com.arrowcontrol.target.client.ControlClient;
import com.arrowcontrol.target.discovery.ControllerDiscoveryListener;
import com.arrowcontrol.target.keys.KeyPressExecutor;
import com.arrowcontrol.target.keys.LoggingKeyPressExecutor;
import com.arrowcontrol.target.keys.RobotKeyPressExecutor;
import com.arrowcontrol.target.pairing.ConsolePairingPrompt;
import com.arrowcontrol.target.transport.NettyControllerConnector;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Arrays;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Wires the target agent: identity, Netty transport, timers, key simulation and discovery.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(TargetProperties.class)
public class TargetConfiguration {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Bean
    public ProtocolCodec protocolCodec(ObjectMapper objectMapper) {
        return new ProtocolCodec(objectMapper, Clock.systemUTC());
    }

    /**
     * What this target advertises in every register.
     */
    @Bean
    public DeviceInfo targetDeviceInfo(TargetProperties properties) {
        String id = isBlank(properties.deviceId()) ? UUID.randomUUID().toString() : properties.deviceId();
        String name = isBlank(properties.deviceName())
                ? "ArrowTarget-" + id.substring(0, Math.min(8, id.length()))
                : properties.deviceName();
        return DeviceInfo.builder()
                .id(id)
                .name(name)
                .ip(NetworkAddresses.localIpv4())
                .type(DeviceType.TARGET)
                .supportedCommands(Arrays.stream(CommandType.values())
                        .map(CommandType::wireName)
                        .collect(Collectors.toSet()))
                .build();
    }

    // Destroyed after the client and discovery listener, which depend on it.
    @Bean(destroyMethod = "shutdownGracefully")
    public EventLoopGroup clientEventLoopGroup() {
        return new NioEventLoopGroup(1, new DefaultThreadFactory("target-io"));
    }

    @Bean
    public ThreadPoolTaskScheduler clientTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("target-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    /**
     * Key presses may block for their hold time, so they run off the I/O thread, one at a time.
     */
    @Bean
    public ThreadPoolTaskExecutor keyPressTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("key-press-");
        return executor;
    }

    @Bean
    public KeyPressExecutor keyPressExecutor(TargetProperties properties) {
        if (properties.keySimulator() == TargetProperties.KeySimulator.ROBOT) {
            try {
                return new RobotKeyPressExecutor();
            } catch (IllegalStateException e) {
                log.warn("⌨️ {}; falling back to logging key simulator", e.getMessage());
            }
        }
        log.info("⌨️ Using logging key simulator");
        return new LoggingKeyPressExecutor();
    }

    @Bean(destroyMethod = "shutdown")
    public ControlClient controlClient(DeviceInfo targetDeviceInfo, ProtocolCodec protocolCodec,
                                       EventLoopGroup clientEventLoopGroup,
                                       ThreadPoolTaskScheduler clientTaskScheduler,
                                       @Qualifier("keyPressTaskExecutor") ThreadPoolTaskExecutor keyPressTaskExecutor,
                                       KeyPressExecutor keyPressExecutor, TargetProperties properties) {
        return new ControlClient(targetDeviceInfo,
                new NettyControllerConnector(clientEventLoopGroup, properties.maxFrameSize()),
                protocolCodec, clientTaskScheduler, keyPressTaskExecutor, keyPressExecutor, properties);
    }

    @Bean(destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "arrow-control.target", name = "discovery-enabled", havingValue = "true",
            matchIfMissing = true)
    public ControllerDiscoveryListener controllerDiscoveryListener(ControlClient controlClient,
                                                                   ProtocolCodec protocolCodec,
                                                                   TargetProperties properties,
                                                                   EventLoopGroup clientEventLoopGroup) {
        return new ControllerDiscoveryListener(controlClient, protocolCodec, properties, clientEventLoopGroup);
    }

    /**
     * The single daemon thread that waits on the console; a blocked read never holds the JVM open.
     */
    @Bean
    @ConditionalOnProperty(prefix = "arrow-control.target", name = "pairing-prompt", havingValue = "true",
            matchIfMissing = true)
    public ThreadPoolTaskExecutor pairingPromptTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setThreadNamePrefix("pairing-prompt-");
        return executor;
    }

    @Bean
    @ConditionalOnProperty(prefix = "arrow-control.target", name = "pairing-prompt", havingValue = "true",
            matchIfMissing = true)
    public ConsolePairingPrompt consolePairingPrompt(ControlClient controlClient, TargetProperties properties,
                                                     @Qualifier("pairingPromptTaskExecutor")
                                                     ThreadPoolTaskExecutor pairingPromptTaskExecutor) {
        ConsolePairingPrompt prompt = new ConsolePairingPrompt(controlClient, System.in, pairingPromptTaskExecutor);
        if (!properties.autoAcceptPairing()) {
            controlClient.addListener(prompt);
        }
        return prompt;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
