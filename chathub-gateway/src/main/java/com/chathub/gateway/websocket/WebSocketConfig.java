package com.chathub.gateway.websocket;

import com.chathub.common.config.ChatHubConfig;
import com.chathub.gateway.net.NetUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import java.util.Map;

/**
 * WebSocket configuration for the chat endpoint.
 * The same handler serves {@code /} and {@code /ws}.
 */
@Slf4j
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    /** Session attribute holding the resolved origin address. */
    public static final String ATTR_CLIENT_IP = "chathub.clientIp";

    private final ChatWebSocketHandler chatWebSocketHandler;
    private final ChatHubConfig config;

    public WebSocketConfig(ChatWebSocketHandler chatWebSocketHandler, ChatHubConfig config) {
        this.chatWebSocketHandler = chatWebSocketHandler;
        this.config = config;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        registry.addHandler(chatWebSocketHandler, "/", "/ws")
                .addInterceptors(clientAddressInterceptor())
                .setAllowedOrigins("*");
    }

    /**
     * Handshake interceptor that resolves the client's origin address once,
     * applying the proxy-header trust policy.
     */
    @Bean
    public HandshakeInterceptor clientAddressInterceptor() {
        return new HandshakeInterceptor() {
            @Override
            public boolean beforeHandshake(@NonNull ServerHttpRequest request,
                    @NonNull ServerHttpResponse response,
                    @NonNull WebSocketHandler wsHandler,
                    @NonNull Map<String, Object> attributes) {
                String remoteAddr = request.getRemoteAddress() != null
                        ? request.getRemoteAddress().getAddress().getHostAddress()
                        : null;
                var headers = request.getHeaders();
                String clientIp = NetUtils.resolveClientIp(remoteAddr,
                        headers.getFirst("X-Forwarded-For"),
                        headers.getFirst("X-Real-IP"),
                        config.isTrustProxyHeaders());
                attributes.put(ATTR_CLIENT_IP, clientIp);
                log.debug("ws handshake remote={} client={}", remoteAddr, clientIp);
                return true;
            }

            @Override
            public void afterHandshake(@NonNull ServerHttpRequest request,
                    @NonNull ServerHttpResponse response,
                    @NonNull WebSocketHandler wsHandler,
                    @Nullable Exception exception) {
                // no-op
            }
        };
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(64 * 1024);
        container.setMaxBinaryMessageBufferSize(64 * 1024);
        return container;
    }
}
