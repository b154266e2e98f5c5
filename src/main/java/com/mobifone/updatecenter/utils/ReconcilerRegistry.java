package com.mobifone.updatecenter.utils;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** In-process registry guaranteeing at most one progress reconciler per batch. */
@Component
public class ReconcilerRegistry {

    @Value
    public static class Registration {
        String progressHandle;
        Instant startedAt;
        Instant deadline;
    }

    private final Map<String, Registration> running = new ConcurrentHashMap<>();

    /** @return false when a reconciler is already registered for the batch */
    public boolean register(String batchId, String progressHandle, Instant deadline) {
        return running.putIfAbsent(batchId, new Registration(progressHandle, Instant.now(), deadline)) == null;
    }

    public void release(String batchId) {
        running.remove(batchId);
    }

    public boolean isActive(String batchId) {
        return running.containsKey(batchId);
    }

    public Registration get(String batchId) {
        return running.get(batchId);
    }

    public Map<String, Registration> snapshot() {
        return Map.copyOf(running);
    }
}
