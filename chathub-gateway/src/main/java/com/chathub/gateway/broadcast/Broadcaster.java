package com.chathub.gateway.broadcast;

import com.chathub.gateway.client.Client;
import com.chathub.gateway.client.ClientRegistry;
import com.chathub.gateway.client.DeliveryResult;
import com.chathub.gateway.protocol.MessageCodec;
import com.chathub.gateway.protocol.Outgoing;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;

/**
 * Delivers envelopes to registered clients.
 *
 * <p>
 * A payload is serialized once per call. Each recipient gets a non-blocking
 * enqueue; a full or closed outbox is logged and skipped, so a slow or dead peer
 * never delays anyone else.
 * </p>
 */
@Slf4j
public class Broadcaster {

    private final ClientRegistry registry;
    private final MessageCodec codec;

    public Broadcaster(ClientRegistry registry, MessageCodec codec) {
        this.registry = registry;
        this.codec = codec;
    }

    /**
     * Broadcast to every registered client.
     *
     * @return number of clients the frame was enqueued for
     */
    public int broadcast(Outgoing payload) {
        return broadcast(payload, null);
    }

    /**
     * Broadcast to every registered client except {@code exceptId} (may be null).
     *
     * @return number of clients the frame was enqueued for
     */
    public int broadcast(Outgoing payload, String exceptId) {
        String frame = encode(payload);
        if (frame == null) {
            return 0;
        }

        log.debug("broadcast kind={} targets={} except={}",
                payload.getClass().getSimpleName(), registry.size(), exceptId);

        int delivered = 0;
        for (Client client : registry.all()) {
            if (client.getId().equals(exceptId)) {
                continue;
            }
            if (deliver(client, frame) == DeliveryResult.DELIVERED) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Send to a client object directly (also before it is registered).
     */
    public DeliveryResult send(Client client, Outgoing payload) {
        String frame = encode(payload);
        if (frame == null) {
            return DeliveryResult.CLOSED;
        }
        return deliver(client, frame);
    }

    private DeliveryResult deliver(Client client, String frame) {
        DeliveryResult result = client.send(frame);
        if (result != DeliveryResult.DELIVERED) {
            log.warn("send to conn={} failed: {} (slow client or disconnected)", client.getId(), result);
        }
        return result;
    }

    private String encode(Outgoing payload) {
        try {
            return codec.encode(payload);
        } catch (JsonProcessingException e) {
            log.error("failed to serialize {}: {}", payload.getClass().getSimpleName(), e.getMessage());
            return null;
        }
    }
}
