package com.hearth.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Gateway that calls the Home Assistant REST API: {@code POST {baseUrl}/api/services/{domain}/{service}}
 * with a long-lived access token. The JSON body is the service data plus {@code entity_id}.
 * <p>
 * 2xx is success (the parsed JSON body becomes the response). 5xx, 429, I/O errors and timeouts are retryable;
 * any other status is a permanent rejection.
 */
public final class HomeAssistantServiceGateway implements ServiceCallGateway {

    private static final Logger log = LoggerFactory.getLogger(HomeAssistantServiceGateway.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_BODY_IN_MESSAGE = 300;

    private final String baseUrl;
    private final String token;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public HomeAssistantServiceGateway(String baseUrl, String token, Duration requestTimeout) {
        String url = baseUrl != null && !baseUrl.isBlank() ? baseUrl.trim() : "http://localhost:8123";
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.token = token != null ? token.trim() : "";
        this.requestTimeout = requestTimeout != null ? requestTimeout : Duration.ofSeconds(10);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(this.requestTimeout)
                .build();
    }

    @Override
    public GatewayOutcome invoke(String domain, String service, Set<String> target, Map<String, Object> data) {
        String action = domain + "." + service;
        String body;
        try {
            body = MAPPER.writeValueAsString(requestBody(target, data));
        } catch (JsonProcessingException e) {
            return GatewayOutcome.failure(false, "Service data is not serializable: " + e.getOriginalMessage());
        }

        URI uri = URI.create(baseUrl + "/api/services/" + encode(domain) + "/" + encode(service));
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .header("Content-Type", "application/json")
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        if (!token.isEmpty()) {
            request.header("Authorization", "Bearer " + token);
        }

        if (log.isDebugEnabled()) {
            log.debug("Calling service | action={} | target={} | uri={}", action, target, uri);
        }
        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Service call transport error | action={} | error={}", action, e.toString());
            return GatewayOutcome.failure(true, "Transport error calling " + action + ": " + e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return GatewayOutcome.failure(true, "Interrupted while calling " + action);
        }

        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return GatewayOutcome.success(parseBody(response.body()), status);
        }
        boolean retryable = status >= 500 || status == 429;
        String message = "HTTP " + status + " from " + action + ": " + truncate(response.body());
        if (log.isInfoEnabled()) {
            log.info("Service call rejected | action={} | status={} | retryable={}", action, status, retryable);
        }
        return GatewayOutcome.failure(retryable, message, status);
    }

    private static Map<String, Object> requestBody(Set<String> target, Map<String, Object> data) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (data != null) body.putAll(data);
        if (target != null && !target.isEmpty()) {
            body.put("entity_id", target.size() == 1 ? target.iterator().next() : new ArrayList<>(target));
        }
        return body;
    }

    private static Object parseBody(String body) {
        if (body == null || body.isBlank()) return null;
        try {
            return MAPPER.readValue(body, Object.class);
        } catch (JsonProcessingException e) {
            log.debug("Service response is not JSON, keeping raw text | error={}", e.getOriginalMessage());
            return body;
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }

    private static String truncate(String body) {
        if (body == null) return "";
        return body.length() > MAX_BODY_IN_MESSAGE ? body.substring(0, MAX_BODY_IN_MESSAGE) + "..." : body;
    }
}
