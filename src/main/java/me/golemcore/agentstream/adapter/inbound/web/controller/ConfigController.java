package me.golemcore.agentstream.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.agentstream.adapter.inbound.web.dto.PublicConfigResponse;
import me.golemcore.agentstream.infrastructure.config.AgentStreamProperties;
import org.springframework.http.CacheControl;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Health and client-facing configuration endpoints.
 */
@RestController
@RequiredArgsConstructor
public class ConfigController {

    private static final Duration PUBLIC_CONFIG_MAX_AGE = Duration.ofMinutes(5);

    private final AgentStreamProperties properties;

    @GetMapping("/health")
    public Mono<ResponseEntity<Map<String, String>>> health() {
        return Mono.just(ResponseEntity.ok(Map.of("status", "healthy")));
    }

    @GetMapping("/api/v1/config/public")
    public Mono<ResponseEntity<PublicConfigResponse>> publicConfig() {
        PublicConfigResponse response = PublicConfigResponse.builder()
                .env(properties.getEnv())
                .apiVersion(properties.getApiVersion())
                .websocketPath(properties.getStream().getWebsocketPath())
                .streamTimeoutSeconds(properties.getTimeouts().getStream().toSeconds())
                .heartbeatIntervalSeconds(properties.getStream().getHeartbeatInterval().toSeconds())
                .hitlEnabled(properties.getFeatures().isHitlEnabled())
                .defaultAgent(properties.getEngine().getDefaultAgent())
                .build();
        return Mono.just(ResponseEntity.ok()
                .cacheControl(CacheControl.maxAge(PUBLIC_CONFIG_MAX_AGE).cachePublic())
                .body(response));
    }
}
