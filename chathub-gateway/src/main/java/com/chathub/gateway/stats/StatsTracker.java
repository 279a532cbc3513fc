package com.chathub.gateway.stats;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-lifetime counters for the chat server.
 *
 * <p>
 * All counters are non-blocking and only ever grow. Memory is sampled when asked,
 * never polled.
 * </p>
 */
public class StatsTracker {

    private final long startedAt;
    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong connectionsTotal = new AtomicLong();
    private final AtomicLong peakUsers = new AtomicLong();

    public StatsTracker() {
        this(System.currentTimeMillis());
    }

    public StatsTracker(long startedAt) {
        this.startedAt = startedAt;
    }

    // ── Counters ──────────────────────────────────────────────────

    /**
     * Record an accepted connection.
     *
     * @param liveUsers registry size right after the connection was inserted
     */
    public void onConnect(int liveUsers) {
        connectionsTotal.incrementAndGet();
        peakUsers.accumulateAndGet(liveUsers, Math::max);
    }

    public void onMessageBroadcast() {
        messagesSent.incrementAndGet();
    }

    public long getMessagesSent() {
        return messagesSent.get();
    }

    public long getConnectionsTotal() {
        return connectionsTotal.get();
    }

    public long getPeakUsers() {
        return peakUsers.get();
    }

    public long getStartedAt() {
        return startedAt;
    }

    // ── Derived ───────────────────────────────────────────────────

    public long uptimeSeconds(long nowMs) {
        return Math.max(0, (nowMs - startedAt) / 1000);
    }

    /**
     * Average broadcast chat messages per second since start, 2 decimals.
     */
    public double messagesPerSecond(long nowMs) {
        long uptime = uptimeSeconds(nowMs);
        if (uptime == 0) {
            return 0.0;
        }
        return round2((double) messagesSent.get() / uptime);
    }

    /**
     * Memory currently in use by the JVM heap, in MB (2 decimals).
     */
    public double memoryMb() {
        Runtime rt = Runtime.getRuntime();
        return round2((rt.totalMemory() - rt.freeMemory()) / (1024.0 * 1024.0));
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
