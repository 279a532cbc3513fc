package com.chathub.gateway.client;

import com.chathub.common.ratelimit.RateLimitDecision;
import com.chathub.common.ratelimit.SlidingWindowLimiter;
import lombok.Getter;

/**
 * Live state of one connection.
 *
 * <p>
 * Identity, origin address and connect time are fixed at connect; only the
 * display name changes, and only through {@link ClientRegistry#rename}.
 * </p>
 */
@Getter
public class Client {

    private final String id;
    private final String ip;
    private final long connectedAt;
    private final ClientOutbox outbox;
    private final SlidingWindowLimiter chatWindow;
    private volatile String name;

    public Client(String id, String name, String ip, ClientOutbox outbox, int messagesPerMinute) {
        this.id = id;
        this.name = name;
        this.ip = ip;
        this.outbox = outbox;
        this.connectedAt = System.currentTimeMillis();
        this.chatWindow = new SlidingWindowLimiter(messagesPerMinute);
    }

    void setName(String name) {
        this.name = name;
    }

    /**
     * Non-blocking enqueue of an already serialized frame.
     */
    public DeliveryResult send(String frame) {
        return outbox.offer(frame);
    }

    /**
     * Admit one chat message into this client's window.
     */
    public RateLimitDecision checkChatRate(long nowMs) {
        return chatWindow.tryAcquire(nowMs);
    }

    /**
     * Default display name for a fresh connection.
     */
    public static String guestName(String id) {
        String hex = id.replace("-", "");
        return "guest-" + hex.substring(0, Math.min(6, hex.length()));
    }
}
