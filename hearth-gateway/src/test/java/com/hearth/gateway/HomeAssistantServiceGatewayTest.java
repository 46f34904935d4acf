package com.hearth.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HomeAssistantServiceGatewayTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private final AtomicInteger status = new AtomicInteger(200);
    private final AtomicReference<String> responseBody = new AtomicReference<>("[]");
    private final AtomicReference<String> lastPath = new AtomicReference<>();
    private final AtomicReference<String> lastAuth = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private HomeAssistantServiceGateway gateway;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/api/services/", exchange -> {
            lastPath.set(exchange.getRequestURI().getPath());
            lastAuth.set(exchange.getRequestHeaders().getFirst("Authorization"));
            lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = responseBody.get().getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status.get(), bytes.length == 0 ? -1 : bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();
        gateway = new HomeAssistantServiceGateway("http://127.0.0.1:" + server.getAddress().getPort() + "/",
                "secret-token", Duration.ofSeconds(5));
    }

    @AfterEach
    void stopServer() {
        if (server != null) server.stop(0);
    }

    @Test
    void postsDataAndSingleEntity() throws IOException {
        responseBody.set("[{\"entity_id\":\"light.kitchen\",\"state\":\"on\"}]");

        GatewayOutcome outcome = gateway.invoke("light", "turn_on", Set.of("light.kitchen"), Map.of("brightness", 120));

        assertTrue(outcome.isSuccess());
        assertEquals(200, outcome.getStatusCode().getAsInt());
        assertEquals(List.of(Map.of("entity_id", "light.kitchen", "state", "on")), outcome.getResponse());
        assertEquals("/api/services/light/turn_on", lastPath.get());
        assertEquals("Bearer secret-token", lastAuth.get());
        assertEquals(Map.of("brightness", 120, "entity_id", "light.kitchen"), MAPPER.readValue(lastBody.get(), Map.class));
    }

    @Test
    void severalEntitiesAreSentAsList() throws IOException {
        Set<String> target = new LinkedHashSet<>(List.of("light.a", "light.b"));
        gateway.invoke("light", "turn_off", target, Map.of());
        assertEquals(Map.of("entity_id", List.of("light.a", "light.b")), MAPPER.readValue(lastBody.get(), Map.class));
    }

    @Test
    void serverErrorsAndThrottlingAreRetryable() {
        status.set(503);
        responseBody.set("unavailable");
        GatewayOutcome unavailable = gateway.invoke("light", "turn_on", Set.of(), Map.of());
        assertFalse(unavailable.isSuccess());
        assertTrue(unavailable.isRetryable());
        assertTrue(unavailable.getMessage().contains("503"));

        status.set(429);
        assertTrue(gateway.invoke("light", "turn_on", Set.of(), Map.of()).isRetryable());
    }

    @Test
    void clientErrorsAreFinal() {
        status.set(400);
        responseBody.set("{\"message\":\"Service not found\"}");
        GatewayOutcome outcome = gateway.invoke("light", "explode", Set.of(), Map.of());
        assertFalse(outcome.isSuccess());
        assertFalse(outcome.isRetryable());
        assertEquals(400, outcome.getStatusCode().getAsInt());
    }

    @Test
    void unreachablePlatformIsRetryable() {
        server.stop(0);
        server = null;
        GatewayOutcome outcome = gateway.invoke("light", "turn_on", Set.of(), Map.of());
        assertFalse(outcome.isSuccess());
        assertTrue(outcome.isRetryable());
        assertTrue(outcome.getStatusCode().isEmpty());
    }
}
