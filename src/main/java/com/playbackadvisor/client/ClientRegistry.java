package com.playbackadvisor.client;

import com.playbackadvisor.model.ClientCategory;
import com.playbackadvisor.model.ClientProfile;
import com.playbackadvisor.store.ClientProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Creates client profiles on first contact and refreshes descriptive fields on later contact.
 *
 * <p>Baseline confidence is only applied when the profile is created; learned confidence of
 * an existing profile is never overwritten here. Concurrent first contacts for one device
 * share a single profile.
 */
public class ClientRegistry {

    private static final Logger log = LoggerFactory.getLogger(ClientRegistry.class);

    private final ClientProfileStore store;

    public ClientRegistry(ClientProfileStore store) {
        this.store = store;
    }

    public ClientProfile register(ClientRegistration registration) {
        if (registration.deviceId() == null || registration.deviceId().isBlank()) {
            throw new IllegalArgumentException("device_id is required");
        }

        AtomicBoolean created = new AtomicBoolean();
        ClientProfile client = store.findOrCreate(registration.deviceId(), deviceId -> {
            created.set(true);
            return create(deviceId, registration);
        });

        if (registration.deviceName() != null) {
            client.setDeviceName(registration.deviceName());
        }
        if (registration.clientName() != null) {
            client.setClientName(registration.clientName());
        }
        if (registration.clientVersion() != null) {
            client.setClientVersion(registration.clientVersion());
        }
        if (registration.category() != null) {
            client.setCategory(registration.category());
        }
        if (registration.maxBitrate() != null) {
            client.setMaxBitrate(registration.maxBitrate());
        }
        client.setLastUpdated(Instant.now());
        store.upsert(client);

        if (created.get()) {
            log.info("Registered client device={} category={} codecs={} containers={}",
                client.getDeviceId(), client.getCategory().getValue(),
                client.getCodecConfidence().size(), client.getContainerConfidence().size());
        }
        return client;
    }

    public Optional<ClientProfile> find(String deviceId) {
        return store.findByDeviceId(deviceId);
    }

    public List<ClientProfile> findAll() {
        return store.findAll();
    }

    private static ClientProfile create(String deviceId, ClientRegistration registration) {
        ClientProfile client = new ClientProfile(deviceId, registration.category());
        client.setFirstSeen(Instant.now());
        if (registration.codecConfidence() != null) {
            registration.codecConfidence().forEach((codec, value) -> client.putCodecConfidence(codec, clamp(value)));
        }
        if (registration.containerConfidence() != null) {
            registration.containerConfidence().forEach((container, value) ->
                client.putContainerConfidence(container, clamp(value)));
        }
        return client;
    }

    private static double clamp(Double value) {
        if (value == null) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Descriptor of a device as the host reports it. Null fields leave the stored value alone.
     */
    public record ClientRegistration(
        String deviceId,
        String deviceName,
        String clientName,
        String clientVersion,
        ClientCategory category,
        Long maxBitrate,
        Map<String, Double> codecConfidence,
        Map<String, Double> containerConfidence
    ) {
    }
}
