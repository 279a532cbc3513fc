package com.chathub.gateway.client;

/**
 * Outcome of a non-blocking enqueue onto a client's outbox.
 */
public enum DeliveryResult {
    DELIVERED,
    /** Outbox at capacity; the frame was dropped for this recipient only. */
    QUEUE_FULL,
    /** Send loop has stopped; the peer is going away. */
    CLOSED
}
