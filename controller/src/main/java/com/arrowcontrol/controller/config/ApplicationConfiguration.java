package com.arrowcontrol.controller.config;

import com.arrowcontrol.controller.service.ControlServer;
import com.arrowcontrol.controller.service.DeviceRegistry;
import com.arrowcontrol.protocol.ProtocolCodec;
import com.arrowcontrol.protocol.ProtocolConstants;
import com.arrowcontrol.protocol.util.SecureTokenGenerator;
import com.arrowcontrol.protocol.util.TokenGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Core beans of the controller service.
 */
@Configuration
@EnableConfigurationProperties({ControllerProperties.class, ControlServerProperties.class, DiscoveryProperties.class})
public class ApplicationConfiguration implements WebMvcConfigurer {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenGenerator tokenGenerator() {
        return new SecureTokenGenerator();
    }

    @Bean
    public ProtocolCodec protocolCodec(ObjectMapper objectMapper, Clock clock) {
        return new ProtocolCodec(objectMapper, clock);
    }

    @Bean
    public ControllerIdentity controllerIdentity(ControllerProperties properties) {
        return ControllerIdentity.from(properties, UUID.randomUUID().toString());
    }

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
            .info(new Info()
                .title("Arrow Control API")
                .version(ProtocolConstants.PROTOCOL_VERSION)
                .description("Operator API for paired targets: device registry, pairing and arrow-key commands"));
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
            .allowedOriginPatterns("*")
            .allowedMethods("GET", "POST", "DELETE", "OPTIONS")
            .allowedHeaders("*")
            .maxAge(3600);
    }

    @Bean
    public HealthIndicator controlServerHealthIndicator(WebSocketServer webSocketServer,
                                                        ControlServer controlServer,
                                                        DeviceRegistry deviceRegistry) {
        return () -> {
            Health.Builder builder = webSocketServer.isRunning() ? Health.up() : Health.down();
            return builder
                .withDetail("port", webSocketServer.getPort())
                .withDetail("openConnections", controlServer.getConnectionCount())
                .withDetail("connectedDevices", deviceRegistry.getConnectedDevices().size())
                .withDetail("pairedDevices", deviceRegistry.getPairedDevices().size())
                .withDetail("timestamp", Instant.now())
                .build();
        };
    }
}
