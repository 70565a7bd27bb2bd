package com.playbackadvisor.store;

import com.playbackadvisor.model.ClientProfile;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

public interface ClientProfileStore {

    Optional<ClientProfile> findByDeviceId(String deviceId);

    ClientProfile upsert(ClientProfile client);

    /**
     * Return the stored profile for the device, or store and return the one built by
     * {@code creator}. Concurrent callers for the same device all receive the same instance.
     */
    ClientProfile findOrCreate(String deviceId, Function<String, ClientProfile> creator);

    List<ClientProfile> findAll();
}
