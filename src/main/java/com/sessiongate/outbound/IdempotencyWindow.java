package com.sessiongate.outbound;

import com.sessiongate.shared.model.SendReceipt;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Remembers the receipts of the most recent submissions by idempotency key.
 * Not thread-safe; guarded by the owning {@link SessionSendQueue}.
 */
class IdempotencyWindow {

    private final Map<String, CompletableFuture<SendReceipt>> recent;

    IdempotencyWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("idempotency window must be >= 1, got: " + capacity);
        }
        this.recent = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CompletableFuture<SendReceipt>> eldest) {
                return size() > capacity;
            }
        };
    }

    /** Returns the live receipt for a key; failed submissions do not block a retry. */
    CompletableFuture<SendReceipt> find(String key) {
        var existing = recent.get(key);
        if (existing == null || existing.isCompletedExceptionally()) return null;
        return existing;
    }

    void remember(String key, CompletableFuture<SendReceipt> receipt) {
        recent.put(key, receipt);
    }

    int size() {
        return recent.size();
    }
}
