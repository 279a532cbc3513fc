package com.chathub.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the HTTP /health and /status endpoints.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class StatusEndpointTest {

    @Autowired
    private TestRestTemplate restTemplate;

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void healthReturnsOk() throws Exception {
        ResponseEntity<String> response = restTemplate.getForEntity("/health", String.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("ok", mapper.readTree(response.getBody()).get("status").asText());
    }

    @Test
    void statusReportsCounters() throws Exception {
        ResponseEntity<String> response = restTemplate.getForEntity("/status", String.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());

        JsonNode json = mapper.readTree(response.getBody());
        assertEquals("ok", json.get("status").asText());
        assertEquals("0.1.0", json.get("version").asText());
        assertDoesNotThrow(() -> Instant.parse(json.get("startedAt").asText()));
        assertTrue(json.get("uptimeSeconds").asLong() >= 0);
        assertTrue(json.get("userCount").isInt());
        assertTrue(json.has("peakUsers"));
        assertTrue(json.has("connectionsTotal"));
        assertTrue(json.has("messagesSent"));
        assertTrue(json.get("memoryMb").asDouble() > 0);
    }

    @Test
    void unknownPathIsNotFound() {
        ResponseEntity<String> response = restTemplate.getForEntity("/nope", String.class);
        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }
}
