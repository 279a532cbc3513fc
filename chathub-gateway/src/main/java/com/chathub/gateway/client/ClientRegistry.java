package com.chathub.gateway.client;

import com.chathub.gateway.protocol.Outgoing.UserInfo;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Concurrent identity → {@link Client} map of live connections.
 *
 * <p>
 * Iteration is weakly consistent: a broadcast running next to a connect or
 * disconnect may or may not see that entry, and never fails because of it.
 * </p>
 */
public class ClientRegistry {

    private final Map<String, Client> clients = new ConcurrentHashMap<>();

    /**
     * Insert a freshly connected client.
     *
     * @throws IllegalStateException if the identity is already live
     */
    public void register(Client client) {
        Client previous = clients.putIfAbsent(client.getId(), client);
        if (previous != null) {
            throw new IllegalStateException("duplicate client id " + client.getId());
        }
    }

    /**
     * Remove a client; returns it if it was still registered.
     */
    public Optional<Client> remove(String id) {
        return Optional.ofNullable(clients.remove(id));
    }

    public Optional<Client> get(String id) {
        return Optional.ofNullable(clients.get(id));
    }

    /**
     * Atomically rename a client.
     *
     * @return the previous name, or empty if the client is gone
     */
    public Optional<String> rename(String id, String newName) {
        String[] previous = new String[1];
        clients.computeIfPresent(id, (key, client) -> {
            previous[0] = client.getName();
            client.setName(newName);
            return client;
        });
        return Optional.ofNullable(previous[0]);
    }

    public Collection<Client> all() {
        return Collections.unmodifiableCollection(clients.values());
    }

    public int size() {
        return clients.size();
    }

    /**
     * Point-in-time list of users for {@code listUsers}.
     */
    public List<UserInfo> snapshot() {
        return clients.values().stream()
                .map(c -> new UserInfo(c.getId(), c.getName(), c.getIp()))
                .toList();
    }
}
