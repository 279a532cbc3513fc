package com.chathub.app;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Chat rate limiting switched on through environment-style properties.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT, properties = {
        "RATE_LIMIT_ENABLED=true",
        "RATE_LIMIT_MSG_PER_MIN=2"
})
class ChatRateLimitEndToEndTest {

    @LocalServerPort
    private int port;

    @Test
    void thirdMessageWithinAMinuteIsRejected() throws Exception {
        try (TestPeer a = TestPeer.connect(port, "/ws")) {
            a.next("ackName");

            a.send(Map.of("type", "chat", "text", "one"));
            assertEquals("one", a.next("chat").get("text").asText());
            a.send(Map.of("type", "chat", "text", "two"));
            assertEquals("two", a.next("chat").get("text").asText());

            a.send(Map.of("type", "chat", "text", "three"));
            String message = a.next("error").get("message").asText();
            assertTrue(message.matches("Rate limit exceeded\\. Please wait \\d+ seconds\\."), message);
        }
    }
}
