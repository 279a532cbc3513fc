package com.chathub.ai;

import com.chathub.common.config.ChatHubConfig.AiConfig;
import com.chathub.common.ratelimit.KeyedRateLimiter;
import com.chathub.common.ratelimit.RateLimitDecision;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Single-turn chat completion client for an OpenAI-compatible endpoint.
 *
 * <p>
 * Queries are validated and rate limited per user key before any network call.
 * The HTTP exchange runs on OkHttp's dispatcher; callers get a future that either
 * completes with an {@link AiResponse} or fails with an {@link AiException}.
 * </p>
 */
@Slf4j
public class AiGateway {

    public static final int MAX_PROMPT_CHARS = 1000;

    private static final MediaType JSON = MediaType.parse("application/json");
    private static final String NO_ANSWER = "Geen antwoord ontvangen.";

    private final AiConfig config;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final KeyedRateLimiter<String> rateLimiter;
    private final LongSupplier clock;

    public AiGateway(AiConfig config, ObjectMapper objectMapper) {
        this(config, objectMapper, System::currentTimeMillis);
    }

    public AiGateway(AiConfig config, ObjectMapper objectMapper, LongSupplier clock) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.rateLimiter = new KeyedRateLimiter<>(config.getRateLimit());
        this.httpClient = new OkHttpClient.Builder()
                .callTimeout(Duration.ofSeconds(config.getTimeoutSecs()))
                .connectTimeout(Duration.ofSeconds(config.getTimeoutSecs()))
                .readTimeout(Duration.ofSeconds(config.getTimeoutSecs()))
                .build();
    }

    public boolean isEnabled() {
        return config.isActive();
    }

    public String getModel() {
        return config.getModel();
    }

    /**
     * Ask the model a question on behalf of {@code userKey}.
     *
     * @param userKey rate-limit key; stable across reconnects (e.g. the client's address)
     * @param prompt  raw prompt text, trimmed before use
     */
    public CompletableFuture<AiResponse> query(String userKey, String prompt) {
        if (!isEnabled()) {
            return CompletableFuture.failedFuture(AiException.disabled());
        }

        String trimmed = prompt != null ? prompt.trim() : "";
        if (trimmed.isEmpty()) {
            return CompletableFuture.failedFuture(AiException.emptyPrompt());
        }
        if (trimmed.codePointCount(0, trimmed.length()) > MAX_PROMPT_CHARS) {
            return CompletableFuture.failedFuture(AiException.promptTooLong(MAX_PROMPT_CHARS));
        }

        RateLimitDecision decision = rateLimiter.tryAcquire(userKey, clock.getAsLong());
        if (!decision.allowed()) {
            return CompletableFuture.failedFuture(
                    AiException.rateLimited(rateLimiter.getLimit(), decision.waitSeconds()));
        }

        Request request;
        try {
            request = buildRequest(trimmed);
        } catch (JsonProcessingException e) {
            return CompletableFuture.failedFuture(AiException.badResponse(e));
        }

        log.debug("Sending AI request user={} promptLen={}", userKey, trimmed.length());
        CompletableFuture<AiResponse> future = new CompletableFuture<>();
        long start = System.nanoTime();

        httpClient.newCall(request).enqueue(new Callback() {
            @Override
            public void onFailure(Call call, IOException e) {
                log.error("AI request failed: {}", e.toString());
                if (e instanceof InterruptedIOException) {
                    future.completeExceptionally(AiException.timeout(config.getTimeoutSecs(), e));
                } else {
                    future.completeExceptionally(AiException.transport(e));
                }
            }

            @Override
            public void onResponse(Call call, Response response) {
                long responseMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                try (ResponseBody body = response.body()) {
                    String json = body != null ? body.string() : "";
                    if (!response.isSuccessful()) {
                        log.error("AI error response status={} body={}", response.code(), excerpt(json));
                        future.completeExceptionally(AiException.badStatus(response.code()));
                        return;
                    }
                    AiResponse aiResponse = parseResponse(json, responseMs);
                    log.debug("AI response received len={} ms={} tokens={} cost={}",
                            aiResponse.content().length(), responseMs, aiResponse.tokens(), aiResponse.cost());
                    future.complete(aiResponse);
                } catch (InterruptedIOException e) {
                    future.completeExceptionally(AiException.timeout(config.getTimeoutSecs(), e));
                } catch (IOException e) {
                    future.completeExceptionally(AiException.transport(e));
                } catch (AiException e) {
                    future.completeExceptionally(e);
                } catch (RuntimeException e) {
                    log.error("Unexpected AI response handling failure: {}", e.getMessage(), e);
                    future.completeExceptionally(AiException.badResponse(e));
                }
            }
        });

        return future;
    }

    /**
     * Release OkHttp's dispatcher threads and pooled connections.
     */
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    private Request buildRequest(String prompt) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", config.getModel());
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        body.put("max_tokens", config.getMaxTokens());

        return new Request.Builder()
                .url(config.getApiUrl())
                .header("Authorization", "Bearer " + config.getApiKey())
                .header("content-type", "application/json")
                .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))
                .build();
    }

    /**
     * Parse a completion body. {@code choices} must be an array whose first entry
     * (if any) carries {@code message.content} as text.
     */
    AiResponse parseResponse(String json, long responseMs) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse AI response: {}", e.getOriginalMessage());
            throw AiException.badResponse(e);
        }
        if (root == null || !root.path("choices").isArray()) {
            log.error("AI response without choices array: {}", excerpt(json));
            throw AiException.badResponse(null);
        }

        JsonNode choices = root.get("choices");
        String content = NO_ANSWER;
        if (!choices.isEmpty()) {
            JsonNode contentNode = choices.get(0).path("message").path("content");
            if (!contentNode.isTextual()) {
                log.error("AI response choice without text content: {}", excerpt(json));
                throw AiException.badResponse(null);
            }
            content = contentNode.asText();
        }

        JsonNode usage = root.path("usage");
        Integer tokens = usage.path("total_tokens").isNumber() ? usage.get("total_tokens").asInt() : null;
        Double cost = usage.path("cost").isNumber() ? usage.get("cost").asDouble() : null;

        return new AiResponse(content, responseMs, tokens, cost);
    }

    private static String excerpt(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
