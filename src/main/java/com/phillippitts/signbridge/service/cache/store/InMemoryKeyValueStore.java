package com.phillippitts.signbridge.service.cache.store;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. State survives cache re-creation within one JVM, not restarts.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> blobs = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String namespace) {
        return Optional.ofNullable(blobs.get(Objects.requireNonNull(namespace, "namespace")));
    }

    @Override
    public void set(String namespace, String blob) {
        blobs.put(Objects.requireNonNull(namespace, "namespace"), Objects.requireNonNull(blob, "blob"));
    }

    @Override
    public void remove(String namespace) {
        blobs.remove(Objects.requireNonNull(namespace, "namespace"));
    }
}
