package com.chathub.common.config;

import com.chathub.common.infra.EnvUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Function;

/**
 * Builds the {@link ChatHubConfig} from environment-style variables.
 *
 * <p>
 * The lookup is a plain function so the same code reads {@code System.getenv},
 * a Spring {@code Environment}, or a test map.
 * </p>
 */
@Slf4j
public class ConfigService {

    public static final String TRUST_PROXY_HEADERS = "TRUST_PROXY_HEADERS";
    public static final String CLIENT_QUEUE_CAPACITY = "CLIENT_QUEUE_CAPACITY";
    public static final String AI_ENABLED = "AI_ENABLED";
    public static final String AI_API_KEY = "OPENROUTER_API_KEY";
    public static final String AI_API_URL = "AI_API_URL";
    public static final String AI_MODEL = "AI_MODEL";
    public static final String AI_RATE_LIMIT = "AI_RATE_LIMIT";
    public static final String AI_TIMEOUT_SECS = "AI_TIMEOUT_SECS";
    public static final String AI_MAX_TOKENS = "AI_MAX_TOKENS";
    public static final String RATE_LIMIT_ENABLED = "RATE_LIMIT_ENABLED";
    public static final String RATE_LIMIT_MSG_PER_MIN = "RATE_LIMIT_MSG_PER_MIN";

    private final Function<String, String> env;

    public ConfigService() {
        this(System::getenv);
    }

    public ConfigService(Function<String, String> env) {
        this.env = env;
    }

    /**
     * Load configuration, applying defaults for anything missing or malformed.
     */
    public ChatHubConfig loadConfig() {
        ChatHubConfig config = new ChatHubConfig();
        config.setTrustProxyHeaders(EnvUtils.isTruthy(env.apply(TRUST_PROXY_HEADERS)));
        int capacity = EnvUtils.parseNonNegativeInt(env.apply(CLIENT_QUEUE_CAPACITY),
                ChatHubConfig.DEFAULT_CLIENT_QUEUE_CAPACITY);
        config.setClientQueueCapacity(capacity > 0 ? capacity : ChatHubConfig.DEFAULT_CLIENT_QUEUE_CAPACITY);

        config.setAi(loadAiConfig());
        config.setRateLimit(loadRateLimitConfig());

        EnvUtils.logAcceptedEnvOption(env, TRUST_PROXY_HEADERS, "trust proxy headers from non-loopback peers");
        return config;
    }

    private ChatHubConfig.AiConfig loadAiConfig() {
        ChatHubConfig.AiConfig defaults = new ChatHubConfig.AiConfig();
        ChatHubConfig.AiConfig ai = new ChatHubConfig.AiConfig();
        ai.setEnabled(EnvUtils.isTruthy(env.apply(AI_ENABLED)));
        ai.setApiKey(EnvUtils.stringOrDefault(env.apply(AI_API_KEY), ""));
        ai.setApiUrl(EnvUtils.stringOrDefault(env.apply(AI_API_URL), defaults.getApiUrl()));
        ai.setModel(EnvUtils.stringOrDefault(env.apply(AI_MODEL), defaults.getModel()));
        ai.setRateLimit(EnvUtils.parseNonNegativeInt(env.apply(AI_RATE_LIMIT), defaults.getRateLimit()));
        ai.setTimeoutSecs(EnvUtils.parseNonNegativeInt(env.apply(AI_TIMEOUT_SECS), defaults.getTimeoutSecs()));
        ai.setMaxTokens(EnvUtils.parseNonNegativeInt(env.apply(AI_MAX_TOKENS), defaults.getMaxTokens()));

        if (ai.isEnabled() && ai.getApiKey().isEmpty()) {
            log.error("{}=true but {} is not set; AI stays disabled", AI_ENABLED, AI_API_KEY);
        }
        EnvUtils.logAcceptedEnvOption(env, AI_API_KEY, "AI credential", true);
        log.info("AI configuration loaded: enabled={} model={} rateLimit={}/min timeout={}s maxTokens={} hasApiKey={}",
                ai.isEnabled(), ai.getModel(), ai.getRateLimit(), ai.getTimeoutSecs(), ai.getMaxTokens(),
                !ai.getApiKey().isEmpty());
        return ai;
    }

    private ChatHubConfig.RateLimitConfig loadRateLimitConfig() {
        ChatHubConfig.RateLimitConfig rateLimit = new ChatHubConfig.RateLimitConfig();
        rateLimit.setEnabled(EnvUtils.isTruthy(env.apply(RATE_LIMIT_ENABLED)));
        int defaultLimit = rateLimit.getMessagesPerMinute();
        int limit = EnvUtils.parseNonNegativeInt(env.apply(RATE_LIMIT_MSG_PER_MIN), defaultLimit);
        if (limit == 0) {
            log.warn("{}=0 would reject every chat message, using {}", RATE_LIMIT_MSG_PER_MIN, defaultLimit);
            limit = defaultLimit;
        }
        rateLimit.setMessagesPerMinute(limit);
        if (rateLimit.isEnabled()) {
            log.info("Rate limiting enabled: {} messages/min", rateLimit.getMessagesPerMinute());
        }
        return rateLimit;
    }
}
