package com.p14n.livefeed.stream;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Concurrent index of the open streams by connection id. Iteration is weakly
 * consistent, so fan-out can run while connections come and go.
 */
public class ConnectionRegistry {

    private final ConcurrentHashMap<String, ClientConnection> connections = new ConcurrentHashMap<>();

    /**
     * @throws IllegalStateException if the id is already registered
     */
    public String register(ClientConnection connection) {
        if (connections.putIfAbsent(connection.connectionId(), connection) != null) {
            throw new IllegalStateException("Connection already registered: " + connection.connectionId());
        }
        return connection.connectionId();
    }

    /**
     * @return the removed connection, or null if it was not registered
     */
    public ClientConnection unregister(String connectionId) {
        if (connectionId == null) {
            return null;
        }
        return connections.remove(connectionId);
    }

    public ClientConnection get(String connectionId) {
        return connections.get(connectionId);
    }

    public Collection<ClientConnection> connections() {
        return Collections.unmodifiableCollection(connections.values());
    }

    public int size() {
        return connections.size();
    }

    /**
     * Removes every connection and returns those that were removed by this call.
     */
    public List<ClientConnection> unregisterAll() {
        List<ClientConnection> removed = new ArrayList<>();
        for (String id : new ArrayList<>(connections.keySet())) {
            ClientConnection c = connections.remove(id);
            if (c != null) {
                removed.add(c);
            }
        }
        return removed;
    }
}
