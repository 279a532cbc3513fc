package com.chathub.gateway.dispatch;

import com.chathub.ai.AiException;
import com.chathub.ai.AiGateway;
import com.chathub.ai.AiResponse;
import com.chathub.common.config.ChatHubConfig.RateLimitConfig;
import com.chathub.common.ratelimit.RateLimitDecision;
import com.chathub.gateway.broadcast.Broadcaster;
import com.chathub.gateway.client.Client;
import com.chathub.gateway.client.ClientRegistry;
import com.chathub.gateway.protocol.ChatException;
import com.chathub.gateway.protocol.Incoming;
import com.chathub.gateway.protocol.MessageCodec;
import com.chathub.gateway.protocol.Outgoing;
import com.chathub.gateway.stats.ServerInfo;
import com.chathub.gateway.stats.StatsTracker;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.LongSupplier;

/**
 * Routes one inbound text frame of a connection to its handler.
 *
 * <p>
 * Every request-level failure ends up as a unicast {@code error} to the sender;
 * nothing here closes the connection. Only the {@code ai} operation completes
 * asynchronously, the returned future tracks it.
 * </p>
 */
@Slf4j
public class MessageDispatcher {

    public static final int MAX_CHAT_CHARS = 500;
    public static final int MIN_NAME_CHARS = 2;
    public static final int MAX_NAME_CHARS = 32;

    static final String EMPTY_MESSAGE = "Message cannot be empty.";
    static final String MESSAGE_TOO_LONG = "Message is too long (max " + MAX_CHAT_CHARS + " characters).";
    static final String NAME_LENGTH = "Naam moet tussen " + MIN_NAME_CHARS + " en " + MAX_NAME_CHARS + " tekens zijn.";
    static final String NAME_CHARSET = "Naam mag alleen letters, cijfers, spaties, - en _ bevatten.";
    static final String INTERNAL_ERROR = "Interne serverfout.";

    private final ClientRegistry registry;
    private final MessageCodec codec;
    private final Broadcaster broadcaster;
    private final StatsTracker stats;
    private final ServerInfo serverInfo;
    private final AiGateway aiGateway;
    private final RateLimitConfig rateLimit;
    private final LongSupplier clock;

    public MessageDispatcher(ClientRegistry registry, MessageCodec codec, Broadcaster broadcaster,
            StatsTracker stats, ServerInfo serverInfo, AiGateway aiGateway, RateLimitConfig rateLimit) {
        this(registry, codec, broadcaster, stats, serverInfo, aiGateway, rateLimit, System::currentTimeMillis);
    }

    public MessageDispatcher(ClientRegistry registry, MessageCodec codec, Broadcaster broadcaster,
            StatsTracker stats, ServerInfo serverInfo, AiGateway aiGateway, RateLimitConfig rateLimit,
            LongSupplier clock) {
        this.registry = registry;
        this.codec = codec;
        this.broadcaster = broadcaster;
        this.stats = stats;
        this.serverInfo = serverInfo;
        this.aiGateway = aiGateway;
        this.rateLimit = rateLimit;
        this.clock = clock;
    }

    /**
     * Handle one text frame from {@code clientId}.
     *
     * @return completes once every reply of this frame has been enqueued
     */
    public CompletableFuture<Void> dispatch(String clientId, String frame) {
        Optional<Client> found = registry.get(clientId);
        if (found.isEmpty()) {
            log.debug("frame from unregistered conn={} dropped", clientId);
            return CompletableFuture.completedFuture(null);
        }
        Client client = found.get();

        try {
            return route(client, codec.decode(frame));
        } catch (ChatException e) {
            log.debug("rejected frame conn={}: {}", clientId, e.getMessage());
            broadcaster.send(client, Outgoing.error(e.getMessage()));
        } catch (RuntimeException e) {
            log.error("dispatch failed conn={}: {}", clientId, e.getMessage(), e);
            broadcaster.send(client, Outgoing.error(INTERNAL_ERROR));
        }
        return CompletableFuture.completedFuture(null);
    }

    CompletableFuture<Void> route(Client client, Incoming message) {
        if (message instanceof Incoming.Chat chat) {
            handleChat(client, chat);
        } else if (message instanceof Incoming.SetName setName) {
            handleSetName(client, setName);
        } else if (message instanceof Incoming.Status) {
            broadcaster.send(client, buildStatus());
        } else if (message instanceof Incoming.ListUsers) {
            broadcaster.send(client, new Outgoing.UserList(registry.snapshot()));
        } else if (message instanceof Incoming.Ping ping) {
            broadcaster.send(client, new Outgoing.Pong(ping.token(), clock.getAsLong()));
        } else if (message instanceof Incoming.Ai ai) {
            return handleAi(client, ai);
        } else {
            throw new ChatException.ProtocolError(MessageCodec.UNKNOWN_TYPE);
        }
        return CompletableFuture.completedFuture(null);
    }

    // ── chat ──────────────────────────────────────────────────────

    private void handleChat(Client client, Incoming.Chat chat) {
        String text = chat.text().trim();
        if (text.isEmpty()) {
            throw new ChatException.ValidationError(EMPTY_MESSAGE);
        }
        if (codePoints(text) > MAX_CHAT_CHARS) {
            throw new ChatException.ValidationError(MESSAGE_TOO_LONG);
        }

        long now = clock.getAsLong();
        if (rateLimit.isEnabled()) {
            RateLimitDecision decision = client.checkChatRate(now);
            if (!decision.allowed()) {
                throw new ChatException.RateLimitError(decision.waitSeconds());
            }
        }

        stats.onMessageBroadcast();
        int delivered = broadcaster.broadcast(new Outgoing.ChatMessage(client.getName(), text, now));
        log.debug("chat from={} len={} delivered={}", client.getName(), text.length(), delivered);
    }

    // ── setName ───────────────────────────────────────────────────

    private void handleSetName(Client client, Incoming.SetName setName) {
        String name = validateName(setName.name());

        Optional<String> previous = registry.rename(client.getId(), name);
        if (previous.isEmpty()) {
            return;
        }
        long now = clock.getAsLong();
        broadcaster.send(client, new Outgoing.AckName(name, now));
        broadcaster.broadcast(new Outgoing.SystemNotice(previous.get() + " heet nu " + name + ".", now),
                client.getId());
        log.debug("rename conn={} {} -> {}", client.getId(), previous.get(), name);
    }

    /**
     * Trim and check a requested display name.
     *
     * @throws ChatException.ValidationError on a length or charset violation
     */
    static String validateName(String raw) {
        String name = raw.trim();
        int length = codePoints(name);
        if (length < MIN_NAME_CHARS || length > MAX_NAME_CHARS) {
            throw new ChatException.ValidationError(NAME_LENGTH);
        }
        boolean valid = name.codePoints()
                .allMatch(cp -> Character.isLetterOrDigit(cp) || cp == ' ' || cp == '-' || cp == '_');
        if (!valid) {
            throw new ChatException.ValidationError(NAME_CHARSET);
        }
        return name;
    }

    // ── status ────────────────────────────────────────────────────

    private Outgoing.StatusReport buildStatus() {
        long now = clock.getAsLong();
        boolean aiEnabled = aiGateway.isEnabled();
        return new Outgoing.StatusReport(
                serverInfo.version(),
                serverInfo.javaVersion(),
                serverInfo.os(),
                serverInfo.cpuCores(),
                stats.uptimeSeconds(now),
                registry.size(),
                stats.getPeakUsers(),
                stats.getConnectionsTotal(),
                stats.getMessagesSent(),
                stats.messagesPerSecond(now),
                stats.memoryMb(),
                aiEnabled,
                aiEnabled ? aiGateway.getModel() : null);
    }

    // ── ai ────────────────────────────────────────────────────────

    private CompletableFuture<Void> handleAi(Client client, Incoming.Ai ai) {
        String askedBy = client.getName();
        String prompt = ai.prompt().trim();
        return aiGateway.query(client.getIp(), ai.prompt())
                .handle((AiResponse response, Throwable error) -> {
                    if (error != null) {
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause()
                                : error;
                        String message = cause instanceof AiException ? cause.getMessage() : INTERNAL_ERROR;
                        log.debug("ai request from={} failed: {}", askedBy, message);
                        broadcaster.send(client, Outgoing.error(message));
                        return null;
                    }
                    broadcaster.broadcast(new Outgoing.AiAnswer(askedBy, prompt, response.content(),
                            response.responseMs(), response.tokens(), response.cost(), clock.getAsLong()));
                    log.debug("ai answered from={} ms={}", askedBy, response.responseMs());
                    return null;
                });
    }

    private static int codePoints(String text) {
        return text.codePointCount(0, text.length());
    }
}
