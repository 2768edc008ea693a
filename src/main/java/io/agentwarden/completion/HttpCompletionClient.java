package io.agentwarden.completion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentwarden.error.ExternalServiceException;
import io.agentwarden.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/** Client for the Anthropic Messages API. */
public final class HttpCompletionClient implements CompletionClient {
    public static final String API_VERSION = "2023-06-01";

    private final HttpClient http;
    private final URI endpoint;
    private final String apiKey;
    private final int maxOutputTokens;
    private final Duration requestTimeout;

    public HttpCompletionClient(String baseUrl, String apiKey, int maxOutputTokens, Duration requestTimeout) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("API key is required");
        }
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.endpoint = URI.create(base + "/v1/messages");
        this.apiKey = apiKey;
        this.maxOutputTokens = maxOutputTokens;
        this.requestTimeout = requestTimeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        ObjectNode body = Jsons.mapper().createObjectNode();
        body.put("model", request.modelIdentifier());
        body.put("max_tokens", maxOutputTokens);
        ArrayNode messages = body.putArray("messages");
        messages.addObject()
                .put("role", "user")
                .put("content", request.prompt());

        HttpRequest httpRequest = HttpRequest.newBuilder(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("x-api-key", apiKey)
                .header("anthropic-version", API_VERSION)
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(body), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> response;
        try {
            response = http.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ExternalServiceException("Completion request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException("Completion request interrupted", e);
        }
        if (response.statusCode() / 100 != 2) {
            throw new ExternalServiceException("Completion service returned status " + response.statusCode()
                    + ": " + abbreviate(response.body()));
        }
        return parse(response.body());
    }

    static CompletionResponse parse(String body) {
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(body);
        } catch (IOException e) {
            throw new ExternalServiceException("Completion service returned malformed JSON", e);
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText(""));
            }
        }
        if (text.length() == 0) {
            throw new ExternalServiceException("Completion service returned no text content");
        }
        return new CompletionResponse(
                text.toString(),
                root.path("model").asText(null),
                root.path("stop_reason").asText(null)
        );
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 200 ? body : body.substring(0, 200) + "...";
    }
}
