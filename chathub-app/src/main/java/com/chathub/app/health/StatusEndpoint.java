package com.chathub.app.health;

import com.chathub.gateway.client.ClientRegistry;
import com.chathub.gateway.stats.ServerInfo;
import com.chathub.gateway.stats.StatsTracker;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Plain HTTP view of the server for load balancers and dashboards.
 * Provides /health for liveness probes and /status for the live counters.
 */
@RestController
public class StatusEndpoint {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ClientRegistry registry;
    private final StatsTracker stats;
    private final ServerInfo serverInfo;

    public StatusEndpoint(ClientRegistry registry, StatsTracker stats, ServerInfo serverInfo) {
        this.registry = registry;
        this.stats = stats;
        this.serverInfo = serverInfo;
    }

    /**
     * Liveness probe, 200 OK while the JVM is serving.
     */
    @GetMapping("/health")
    public ObjectNode health() {
        var node = mapper.createObjectNode();
        node.put("status", "ok");
        return node;
    }

    @GetMapping("/status")
    public ObjectNode status() {
        long now = System.currentTimeMillis();
        var node = mapper.createObjectNode();
        node.put("status", "ok");
        node.put("version", serverInfo.version());
        node.put("startedAt", Instant.ofEpochMilli(stats.getStartedAt()).toString());
        node.put("uptimeSeconds", stats.uptimeSeconds(now));
        node.put("userCount", registry.size());
        node.put("peakUsers", stats.getPeakUsers());
        node.put("connectionsTotal", stats.getConnectionsTotal());
        node.put("messagesSent", stats.getMessagesSent());
        node.put("memoryMb", stats.memoryMb());
        return node;
    }
}
