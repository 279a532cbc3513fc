package com.chathub.gateway.client;

import com.chathub.gateway.protocol.Outgoing.UserInfo;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ClientRegistry} and {@link Client}.
 */
class ClientRegistryTest {

    private final ClientRegistry registry = new ClientRegistry();

    private static Client client(String id, String name) {
        return new Client(id, name, "10.0.0.1", new ClientOutbox(id, 4, frame -> {
        }), 60);
    }

    @Test
    void registerAndGet() {
        Client a = client("a", "guest-aaaaaa");
        registry.register(a);

        assertSame(a, registry.get("a").orElseThrow());
        assertEquals(1, registry.size());
        assertTrue(registry.get("b").isEmpty());
    }

    @Test
    void duplicateIdentityIsRejected() {
        registry.register(client("a", "one"));
        assertThrows(IllegalStateException.class, () -> registry.register(client("a", "two")));
        assertEquals("one", registry.get("a").orElseThrow().getName());
    }

    @Test
    void renameReturnsPreviousName() {
        registry.register(client("a", "guest-aaaaaa"));

        assertEquals(Optional.of("guest-aaaaaa"), registry.rename("a", "Alice"));
        assertEquals("Alice", registry.get("a").orElseThrow().getName());
        assertEquals(Optional.of("Alice"), registry.rename("a", "Alicia"));
    }

    @Test
    void renameOfGoneClientIsEmpty() {
        assertTrue(registry.rename("ghost", "Alice").isEmpty());
    }

    @Test
    void removeIsIdempotent() {
        registry.register(client("a", "x1"));

        assertTrue(registry.remove("a").isPresent());
        assertTrue(registry.remove("a").isEmpty());
        assertEquals(0, registry.size());
    }

    @Test
    void snapshotListsIdentityNameAndIp() {
        registry.register(client("a", "Alice"));
        registry.register(client("b", "Bob"));

        List<UserInfo> users = registry.snapshot();
        assertEquals(2, users.size());
        assertTrue(users.contains(new UserInfo("a", "Alice", "10.0.0.1")));
        assertTrue(users.contains(new UserInfo("b", "Bob", "10.0.0.1")));
    }

    @Test
    void guestNameUsesFirstSixHexChars() {
        assertEquals("guest-3f2a9c", Client.guestName("3f2a9c11-0000-4000-8000-000000000000"));
        assertEquals("guest-ab", Client.guestName("ab"));
    }
}
