package com.chathub.gateway.websocket;

import com.chathub.common.config.ChatHubConfig;
import com.chathub.gateway.broadcast.Broadcaster;
import com.chathub.gateway.client.Client;
import com.chathub.gateway.client.ClientOutbox;
import com.chathub.gateway.client.ClientRegistry;
import com.chathub.gateway.dispatch.MessageDispatcher;
import com.chathub.gateway.protocol.Outgoing;
import com.chathub.gateway.stats.StatsTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.function.LongSupplier;

/**
 * Connection lifecycle of the chat endpoint.
 *
 * <p>
 * On open the client is registered, greeted with its guest name and announced to
 * everyone else. Text frames go to the {@link MessageDispatcher}. Whatever ends
 * the session (close frame, transport error) runs the same cleanup once.
 * </p>
 */
@Slf4j
public class ChatWebSocketHandler extends TextWebSocketHandler {

    static final String ATTR_CLIENT_ID = "chathub.clientId";

    private final ClientRegistry registry;
    private final Broadcaster broadcaster;
    private final MessageDispatcher dispatcher;
    private final StatsTracker stats;
    private final ChatHubConfig config;
    private final ExecutorService sendExecutor;
    private final LongSupplier clock;

    public ChatWebSocketHandler(ClientRegistry registry, Broadcaster broadcaster, MessageDispatcher dispatcher,
            StatsTracker stats, ChatHubConfig config, ExecutorService sendExecutor) {
        this(registry, broadcaster, dispatcher, stats, config, sendExecutor, System::currentTimeMillis);
    }

    public ChatWebSocketHandler(ClientRegistry registry, Broadcaster broadcaster, MessageDispatcher dispatcher,
            StatsTracker stats, ChatHubConfig config, ExecutorService sendExecutor, LongSupplier clock) {
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.dispatcher = dispatcher;
        this.stats = stats;
        this.config = config;
        this.sendExecutor = sendExecutor;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String clientId = UUID.randomUUID().toString();
        String ip = (String) session.getAttributes().getOrDefault(WebSocketConfig.ATTR_CLIENT_IP, "unknown");
        session.getAttributes().put(ATTR_CLIENT_ID, clientId);

        ClientOutbox outbox = new ClientOutbox(clientId, config.getClientQueueCapacity(),
                frame -> session.sendMessage(new TextMessage(frame)));
        Client client = new Client(clientId, Client.guestName(clientId), ip, outbox,
                config.getRateLimit().getMessagesPerMinute());

        outbox.start(sendExecutor);
        registry.register(client);
        stats.onConnect(registry.size());

        long now = clock.getAsLong();
        broadcaster.send(client, new Outgoing.AckName(client.getName(), now));
        broadcaster.broadcast(new Outgoing.SystemNotice(client.getName() + " heeft de chat betreden.", now),
                clientId);

        log.info("client connected id={} name={} ip={} users={}", clientId, client.getName(), ip, registry.size());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String clientId = clientId(session);
        if (clientId == null) {
            return;
        }
        dispatcher.dispatch(clientId, message.getPayload());
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        log.debug("ignoring binary frame conn={} bytes={}", clientId(session), message.getPayloadLength());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("transport error conn={}: {}", clientId(session), exception.getMessage());
        closeQuietly(session, CloseStatus.SERVER_ERROR);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String clientId = clientId(session);
        if (clientId == null) {
            return;
        }
        Optional<Client> removed = registry.remove(clientId);
        if (removed.isEmpty()) {
            return;
        }
        Client client = removed.get();
        client.getOutbox().abort();

        broadcaster.broadcast(Outgoing.system(client.getName() + " heeft de chat verlaten.", clock.getAsLong()));
        log.info("client disconnected id={} name={} ip={} code={} users={}",
                clientId, client.getName(), client.getIp(), status.getCode(), registry.size());
    }

    private static String clientId(WebSocketSession session) {
        return (String) session.getAttributes().get(ATTR_CLIENT_ID);
    }

    private static void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            if (session.isOpen()) {
                session.close(status);
            }
        } catch (IOException e) {
            log.debug("error closing ws {}: {}", session.getId(), e.getMessage());
        }
    }
}
