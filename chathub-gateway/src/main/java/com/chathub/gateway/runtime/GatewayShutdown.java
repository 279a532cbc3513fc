package com.chathub.gateway.runtime;

import com.chathub.ai.AiGateway;
import com.chathub.gateway.client.Client;
import com.chathub.gateway.client.ClientRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Orderly stop of the chat gateway, run after the web server has stopped
 * accepting connections.
 *
 * <p>
 * 1. Close every outbox so send loops flush what is queued and exit
 * 2. Wait (bounded) for the send loops, then force the rest
 * 3. Release the AI client
 * </p>
 * Nothing is broadcast to clients.
 */
@Slf4j
public class GatewayShutdown {

    static final long DRAIN_TIMEOUT_MS = 5_000;

    private final ClientRegistry registry;
    private final ExecutorService sendExecutor;
    private final AiGateway aiGateway;
    private final long drainTimeoutMs;

    public GatewayShutdown(ClientRegistry registry, ExecutorService sendExecutor, AiGateway aiGateway) {
        this(registry, sendExecutor, aiGateway, DRAIN_TIMEOUT_MS);
    }

    public GatewayShutdown(ClientRegistry registry, ExecutorService sendExecutor, AiGateway aiGateway,
            long drainTimeoutMs) {
        this.registry = registry;
        this.sendExecutor = sendExecutor;
        this.aiGateway = aiGateway;
        this.drainTimeoutMs = drainTimeoutMs;
    }

    public void shutdown() {
        log.info("gateway shutdown: {} connected clients", registry.size());

        for (Client client : registry.all()) {
            client.getOutbox().close();
        }

        sendExecutor.shutdown();
        try {
            if (!sendExecutor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("send loops still busy after {} ms, interrupting", drainTimeoutMs);
                sendExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sendExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        aiGateway.close();
        log.info("gateway shutdown complete");
    }
}
