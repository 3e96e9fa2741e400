package com.sessiongate.sessions;

import com.sessiongate.shared.model.Credential;
import com.sessiongate.support.InMemoryPersistenceSink;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CredentialStoreTest {

    private final InMemoryPersistenceSink sink = new InMemoryPersistenceSink();
    private final CredentialStore store = new CredentialStore(sink);

    @Test
    void loadFallsBackToSink() {
        sink.credentials.put("s1", new Credential("s1", "blob", 3, Instant.now()));

        var loaded = store.load("s1").orElseThrow();

        assertEquals("blob", loaded.blob());
        assertEquals(3, loaded.version());
        assertTrue(store.load("other").isEmpty());
    }

    @Test
    void staleVersionIsIgnored() {
        assertTrue(store.save("s1", "v5", 5));
        assertFalse(store.save("s1", "v4", 4));
        assertTrue(store.save("s1", "v6", 6));

        assertEquals("v6", store.load("s1").orElseThrow().blob());
        assertEquals("v6", sink.credentials.get("s1").blob());
    }

    @Test
    void rejectedWriteDoesNotShadowNewerStoredVersion() {
        sink.credentials.put("s1", new Credential("s1", "v150", 150, Instant.now()));

        assertFalse(store.save("s1", "v70", 70));

        assertEquals("v150", store.load("s1").orElseThrow().blob());
        assertEquals(150, sink.credentials.get("s1").version());
        assertTrue(store.save("s1", "v151", 151));
        assertEquals("v151", store.load("s1").orElseThrow().blob());
    }

    @Test
    void concurrentWritesKeepHighestVersion() throws InterruptedException {
        var pool = Executors.newFixedThreadPool(8);
        var go = new CountDownLatch(1);
        for (int v = 1; v <= 200; v++) {
            final long version = v;
            pool.execute(() -> {
                try {
                    go.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                store.save("s1", "blob-" + version, version);
            });
        }
        go.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));

        assertEquals(200, store.load("s1").orElseThrow().version());
        assertEquals("blob-200", sink.credentials.get("s1").blob());
    }

    @Test
    void invalidateRemovesFromCacheAndSink() {
        store.save("s1", "blob", 1);

        store.invalidate("s1");

        assertTrue(store.load("s1").isEmpty());
        assertFalse(sink.credentials.containsKey("s1"));
        assertEquals(1, sink.deleted.size());
    }

    @Test
    void credentialToStringHidesBlob() {
        var credential = new Credential("s1", "super-secret", 1, Instant.now());
        assertFalse(credential.toString().contains("super-secret"));
    }
}
