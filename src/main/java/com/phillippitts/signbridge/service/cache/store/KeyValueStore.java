package com.phillippitts.signbridge.service.cache.store;

import com.phillippitts.signbridge.exception.PersistenceException;

import java.util.Optional;

/**
 * Durable blob store backing the content caches. Each cache owns one namespace and
 * writes its whole state as a single serialized blob.
 *
 * <p>Implementations must be thread-safe. A namespace that was never written reads as
 * {@link Optional#empty()}; I/O problems surface as {@link PersistenceException}.
 */
public interface KeyValueStore {

    /**
     * Reads the blob stored under a namespace.
     *
     * @throws PersistenceException if the store cannot be read
     */
    Optional<String> get(String namespace);

    /**
     * Replaces the blob stored under a namespace. A failed write must leave the
     * previously stored blob readable.
     *
     * @throws PersistenceException if the blob cannot be written
     */
    void set(String namespace, String blob);

    /**
     * Deletes a namespace. Removing an absent namespace is a no-op.
     *
     * @throws PersistenceException if the namespace exists but cannot be removed
     */
    void remove(String namespace);
}
