package com.phillippitts.signbridge.service.cache.store;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryKeyValueStoreTest {

    @Test
    void storesAndRemovesBlobsPerNamespace() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();

        store.set("a", "one");
        store.set("b", "two");
        store.remove("a");

        assertThat(store.get("a")).isEmpty();
        assertThat(store.get("b")).contains("two");
    }
}
