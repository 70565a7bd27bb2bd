package com.playbackadvisor.client;

import com.playbackadvisor.client.ClientRegistry.ClientRegistration;
import com.playbackadvisor.model.ClientCategory;
import com.playbackadvisor.model.ClientProfile;
import com.playbackadvisor.store.InMemoryClientProfileStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ClientRegistryTest {

    private ClientRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ClientRegistry(new InMemoryClientProfileStore());
    }

    @Test
    void firstContact_seedsBaselineConfidenceWithLowercaseKeys() {
        ClientProfile client = registry.register(new ClientRegistration("Roku-1", "Bedroom", "Roku", "13.0",
            ClientCategory.ROKU, null, Map.of("H264", 0.95, "HEVC", 1.4), Map.of("MP4", 0.9)));

        assertEquals(ClientCategory.ROKU, client.getCategory());
        assertEquals(0.95, client.codecConfidence("h264").getAsDouble());
        assertEquals(1.0, client.codecConfidence("hevc").getAsDouble());
        assertTrue(client.getContainerConfidence().containsKey("mp4"));
        assertTrue(registry.find("roku-1").isPresent());
    }

    @Test
    void laterContact_keepsLearnedConfidence() {
        registry.register(new ClientRegistration("tv", null, null, null,
            ClientCategory.ANDROID_TV, null, Map.of("hevc", 0.5), null));
        registry.find("tv").orElseThrow().putCodecConfidence("hevc", 0.8);

        ClientProfile again = registry.register(new ClientRegistration("TV", "Living room", null, "2.0",
            null, 20_000_000L, Map.of("hevc", 0.1), null));

        assertEquals(0.8, again.codecConfidence("hevc").getAsDouble());
        assertEquals(ClientCategory.ANDROID_TV, again.getCategory());
        assertEquals("Living room", again.getDeviceName());
        assertEquals(20_000_000L, again.getMaxBitrate());
        assertEquals(1, registry.findAll().size());
    }

    @Test
    void missingDeviceId_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(
            new ClientRegistration(" ", null, null, null, null, null, null, null)));
    }

    @Test
    void concurrentFirstContacts_shareOneProfile() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ClientProfile>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return registry.register(new ClientRegistration("shield", null, null, null,
                        ClientCategory.ANDROID_TV, null, Map.of("hevc", 0.5), null));
                }));
            }
            start.countDown();
            ClientProfile first = futures.get(0).get(10, TimeUnit.SECONDS);
            for (Future<ClientProfile> future : futures) {
                assertSame(first, future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, registry.findAll().size());
        assertSame(registry.find("shield").orElseThrow(), futures.get(0).get());
    }

    @Test
    void learningOnFirstInstance_survivesLaterRegistration() {
        ClientProfile first = registry.register(new ClientRegistration("box", null, null, null,
            ClientCategory.ROKU, null, Map.of("h264", 0.9), null));
        first.putCodecConfidence("h264", 0.95);

        ClientProfile second = registry.register(new ClientRegistration("BOX", null, null, null,
            ClientCategory.ROKU, null, Map.of("h264", 0.1), null));

        assertSame(first, second);
        assertEquals(0.95, registry.find("box").orElseThrow().codecConfidence("h264").getAsDouble());
    }
}
