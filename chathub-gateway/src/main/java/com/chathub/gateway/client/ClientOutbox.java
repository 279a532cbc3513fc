package com.chathub.gateway.client;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Bounded outbound queue of one connection plus the send loop that drains it.
 *
 * <p>
 * Producers (dispatcher, broadcaster) only ever call {@link #offer(String)}, which
 * never blocks. The send loop is the only writer to the underlying socket.
 * </p>
 */
@Slf4j
public class ClientOutbox {

    /** Writes one serialized frame to the peer. */
    @FunctionalInterface
    public interface FrameSink {
        void write(String frame) throws IOException;
    }

    private static final long POLL_INTERVAL_MS = 250;

    private final String clientId;
    private final BlockingQueue<String> queue;
    private final FrameSink sink;
    private volatile boolean closed;
    private volatile Future<?> sendLoop;

    public ClientOutbox(String clientId, int capacity, FrameSink sink) {
        this.clientId = clientId;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.sink = sink;
    }

    /**
     * Spawn the send loop on {@code executor}.
     */
    public void start(ExecutorService executor) {
        this.sendLoop = executor.submit(this::runSendLoop);
    }

    /**
     * Enqueue a frame without blocking.
     */
    public DeliveryResult offer(String frame) {
        if (closed) {
            return DeliveryResult.CLOSED;
        }
        return queue.offer(frame) ? DeliveryResult.DELIVERED : DeliveryResult.QUEUE_FULL;
    }

    /**
     * Stop accepting frames; the send loop flushes what is queued, then exits.
     */
    public void close() {
        closed = true;
    }

    /**
     * Stop immediately, discarding queued frames.
     */
    public void abort() {
        closed = true;
        queue.clear();
        Future<?> loop = sendLoop;
        if (loop != null) {
            loop.cancel(true);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public int pending() {
        return queue.size();
    }

    void runSendLoop() {
        try {
            while (!closed || !queue.isEmpty()) {
                String frame = queue.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                if (frame != null) {
                    sink.write(frame);
                }
            }
        } catch (IOException e) {
            log.debug("send loop stopped conn={}: {}", clientId, e.getMessage());
            closed = true;
            queue.clear();
        } catch (RuntimeException e) {
            log.warn("send loop failed conn={}: {}", clientId, e.getMessage());
            closed = true;
            queue.clear();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("send loop finished conn={}", clientId);
    }
}
