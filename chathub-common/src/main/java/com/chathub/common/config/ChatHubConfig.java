package com.chathub.common.config;

import lombok.Data;

/**
 * Root configuration type for the chat server.
 */
@Data
public class ChatHubConfig {

    public static final int DEFAULT_CLIENT_QUEUE_CAPACITY = 256;

    /**
     * Trust X-Forwarded-For / X-Real-IP from non-loopback peers.
     * Loopback peers are always trusted.
     */
    private boolean trustProxyHeaders;

    /** Capacity of each client's outbound queue. */
    private int clientQueueCapacity = DEFAULT_CLIENT_QUEUE_CAPACITY;

    private AiConfig ai = new AiConfig();

    private RateLimitConfig rateLimit = new RateLimitConfig();

    // --- Nested config types ---

    @Data
    public static class AiConfig {
        public static final String DEFAULT_API_URL = "https://openrouter.ai/api/v1/chat/completions";
        public static final String DEFAULT_MODEL = "openai/gpt-4o";

        private boolean enabled;
        private String apiKey = "";
        private String apiUrl = DEFAULT_API_URL;
        private String model = DEFAULT_MODEL;
        /** Requests per minute per user. */
        private int rateLimit = 5;
        private int timeoutSecs = 30;
        private int maxTokens = 1024;

        /**
         * AI is usable only when switched on and a credential is present.
         */
        public boolean isActive() {
            return enabled && apiKey != null && !apiKey.isBlank();
        }
    }

    @Data
    public static class RateLimitConfig {
        private boolean enabled;
        private int messagesPerMinute = 60;
    }
}
