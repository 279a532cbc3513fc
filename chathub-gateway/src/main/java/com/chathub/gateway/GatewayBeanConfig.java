package com.chathub.gateway;

import com.chathub.ai.AiGateway;
import com.chathub.common.config.ChatHubConfig;
import com.chathub.common.config.ConfigService;
import com.chathub.gateway.broadcast.Broadcaster;
import com.chathub.gateway.client.ClientRegistry;
import com.chathub.gateway.dispatch.MessageDispatcher;
import com.chathub.gateway.protocol.MessageCodec;
import com.chathub.gateway.runtime.GatewayShutdown;
import com.chathub.gateway.stats.ServerInfo;
import com.chathub.gateway.stats.StatsTracker;
import com.chathub.gateway.websocket.ChatWebSocketHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for Gateway beans.
 */
@Configuration
public class GatewayBeanConfig {

    @Bean
    public ChatHubConfig chatHubConfig(Environment environment) {
        return new ConfigService(environment::getProperty).loadConfig();
    }

    @Bean
    public MessageCodec messageCodec(ObjectMapper objectMapper) {
        return new MessageCodec(objectMapper);
    }

    @Bean
    public ClientRegistry clientRegistry() {
        return new ClientRegistry();
    }

    @Bean
    public StatsTracker statsTracker() {
        return new StatsTracker();
    }

    @Bean
    public ServerInfo serverInfo() {
        return ServerInfo.current();
    }

    /** Closed by {@link GatewayShutdown}. */
    @Bean(destroyMethod = "")
    public AiGateway aiGateway(ChatHubConfig config, ObjectMapper objectMapper) {
        return new AiGateway(config.getAi(), objectMapper);
    }

    @Bean
    public Broadcaster broadcaster(ClientRegistry registry, MessageCodec codec) {
        return new Broadcaster(registry, codec);
    }

    @Bean
    public MessageDispatcher messageDispatcher(ClientRegistry registry, MessageCodec codec,
            Broadcaster broadcaster, StatsTracker stats, ServerInfo serverInfo,
            AiGateway aiGateway, ChatHubConfig config) {
        return new MessageDispatcher(registry, codec, broadcaster, stats, serverInfo, aiGateway,
                config.getRateLimit());
    }

    /** One send loop per connection. Drained by {@link GatewayShutdown}. */
    @Bean(destroyMethod = "")
    public ExecutorService clientSendExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "chathub-send-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }

    @Bean
    public ChatWebSocketHandler chatWebSocketHandler(ClientRegistry registry, Broadcaster broadcaster,
            MessageDispatcher dispatcher, StatsTracker stats, ChatHubConfig config,
            ExecutorService clientSendExecutor) {
        return new ChatWebSocketHandler(registry, broadcaster, dispatcher, stats, config, clientSendExecutor);
    }

    @Bean(destroyMethod = "shutdown")
    public GatewayShutdown gatewayShutdown(ClientRegistry registry, ExecutorService clientSendExecutor,
            AiGateway aiGateway) {
        return new GatewayShutdown(registry, clientSendExecutor, aiGateway);
    }
}
