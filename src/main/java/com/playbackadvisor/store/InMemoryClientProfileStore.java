package com.playbackadvisor.store;

import com.playbackadvisor.model.ClientProfile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Client profiles keyed case-insensitively by device id.
 */
@Component
public class InMemoryClientProfileStore implements ClientProfileStore {

    private final ConcurrentHashMap<String, ClientProfile> clients = new ConcurrentHashMap<>();

    @Override
    public Optional<ClientProfile> findByDeviceId(String deviceId) {
        if (deviceId == null || deviceId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(key(deviceId)));
    }

    @Override
    public ClientProfile upsert(ClientProfile client) {
        if (client.getDeviceId() == null || client.getDeviceId().isBlank()) {
            throw new IllegalArgumentException("device_id is required");
        }
        clients.put(key(client.getDeviceId()), client);
        return client;
    }

    @Override
    public ClientProfile findOrCreate(String deviceId, Function<String, ClientProfile> creator) {
        if (deviceId == null || deviceId.isBlank()) {
            throw new IllegalArgumentException("device_id is required");
        }
        return clients.computeIfAbsent(key(deviceId), k -> creator.apply(deviceId.trim()));
    }

    @Override
    public List<ClientProfile> findAll() {
        List<ClientProfile> all = new ArrayList<>(clients.values());
        all.sort(Comparator.comparing(ClientProfile::getDeviceId));
        return all;
    }

    private static String key(String deviceId) {
        return deviceId.trim().toLowerCase(Locale.ROOT);
    }
}
