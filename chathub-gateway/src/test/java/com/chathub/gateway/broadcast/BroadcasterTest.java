package com.chathub.gateway.broadcast;

import com.chathub.gateway.client.Client;
import com.chathub.gateway.client.ClientOutbox;
import com.chathub.gateway.client.ClientRegistry;
import com.chathub.gateway.client.DeliveryResult;
import com.chathub.gateway.protocol.MessageCodec;
import com.chathub.gateway.protocol.Outgoing;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link Broadcaster} fan-out and its isolation from slow peers.
 */
class BroadcasterTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ClientRegistry registry = new ClientRegistry();
    private final Broadcaster broadcaster = new Broadcaster(registry, new MessageCodec(mapper));
    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        registry.all().forEach(c -> c.getOutbox().abort());
        executor.shutdownNow();
    }

    private BlockingQueue<String> connect(String id) {
        BlockingQueue<String> inbox = new LinkedBlockingQueue<>();
        ClientOutbox outbox = new ClientOutbox(id, 256, inbox::add);
        outbox.start(executor);
        registry.register(new Client(id, "name-" + id, "127.0.0.1", outbox, 60));
        return inbox;
    }

    private JsonNode next(BlockingQueue<String> inbox) throws Exception {
        String frame = inbox.poll(5, TimeUnit.SECONDS);
        assertNotNull(frame, "expected a frame");
        return mapper.readTree(frame);
    }

    @Test
    void broadcastReachesEveryClient() throws Exception {
        BlockingQueue<String> a = connect("a");
        BlockingQueue<String> b = connect("b");

        int delivered = broadcaster.broadcast(new Outgoing.ChatMessage("x", "hello", 1L));

        assertEquals(2, delivered);
        assertEquals("hello", next(a).get("text").asText());
        assertEquals("hello", next(b).get("text").asText());
    }

    @Test
    void broadcastSkipsExcludedClient() throws Exception {
        BlockingQueue<String> a = connect("a");
        BlockingQueue<String> b = connect("b");

        assertEquals(1, broadcaster.broadcast(Outgoing.system("a left", 1L), "a"));

        assertEquals("a left", next(b).get("text").asText());
        assertNull(a.poll(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void saturatedPeerDoesNotBlockOthers() throws Exception {
        BlockingQueue<String> a = connect("a");
        BlockingQueue<String> b = connect("b");

        // never started: its single slot fills up and stays full
        ClientOutbox stuck = new ClientOutbox("slow", 1, frame -> {
        });
        registry.register(new Client("slow", "slow", "127.0.0.1", stuck, 60));
        assertEquals(DeliveryResult.DELIVERED, stuck.offer("{}"));

        int delivered = assertTimeoutPreemptively(Duration.ofSeconds(1), () -> {
            int total = 0;
            for (int i = 0; i < 50; i++) {
                total += broadcaster.broadcast(new Outgoing.ChatMessage("x", "m" + i, i));
            }
            return total;
        });

        assertEquals(100, delivered);
        assertEquals(1, stuck.pending());
        for (int i = 0; i < 50; i++) {
            assertEquals("m" + i, next(a).get("text").asText());
            assertEquals("m" + i, next(b).get("text").asText());
        }
    }

    @Test
    void closedPeerIsSkipped() throws Exception {
        BlockingQueue<String> a = connect("a");
        connect("b");
        registry.get("b").orElseThrow().getOutbox().abort();

        assertEquals(1, broadcaster.broadcast(new Outgoing.ChatMessage("x", "still here", 1L)));
        assertEquals("still here", next(a).get("text").asText());
    }
}
