package com.phillippitts.signbridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Content cache sizing and persistence.
 */
@Validated
@ConfigurationProperties(prefix = "cache")
public class CacheProperties {

    public enum StoreType { MEMORY, FILE }

    /** Sign-recognition entries kept (gesture → signs). */
    @Positive(message = "Sign cache capacity must be positive")
    private int signCapacity = 100;

    /** Avatar-animation entries kept (text → glosses/asset). */
    @Positive(message = "Animation cache capacity must be positive")
    private int animationCapacity = 50;

    /** Entry lifetime measured from creation. */
    @NotNull
    private Duration ttl = Duration.ofHours(24);

    @NotNull
    private StoreType store = StoreType.MEMORY;

    /** Directory for {@code FILE} store blobs. */
    @NotBlank
    private String storeDirectory = "./data/cache";

    public int getSignCapacity() {
        return signCapacity;
    }

    public void setSignCapacity(int signCapacity) {
        this.signCapacity = signCapacity;
    }

    public int getAnimationCapacity() {
        return animationCapacity;
    }

    public void setAnimationCapacity(int animationCapacity) {
        this.animationCapacity = animationCapacity;
    }

    public Duration getTtl() {
        return ttl;
    }

    public void setTtl(Duration ttl) {
        this.ttl = ttl;
    }

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public String getStoreDirectory() {
        return storeDirectory;
    }

    public void setStoreDirectory(String storeDirectory) {
        this.storeDirectory = storeDirectory;
    }
}
