package com.phillippitts.signbridge.service.cache;

import com.phillippitts.signbridge.domain.AvatarAnimation;
import com.phillippitts.signbridge.domain.Scenario;
import com.phillippitts.signbridge.domain.SignRecognition;
import com.phillippitts.signbridge.service.cache.store.KeyValueStore;
import com.phillippitts.signbridge.service.phrase.PhraseNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Facade over the two content-cache namespaces used around the avatar:
 * <ul>
 *   <li>sign recognition (gesture → recognized signs), Deaf → hearing direction</li>
 *   <li>avatar animation (text → gloss sequence and rendering asset), hearing → Deaf direction</li>
 * </ul>
 *
 * <p>Both namespaces share one {@link KeyValueStore} under disjoint keys. Callers never
 * reach into either cache's internals; this class is the only write path.
 */
public class AvatarContentCache {

    private static final Logger LOG = LogManager.getLogger(AvatarContentCache.class);

    public static final String SIGN_NAMESPACE = "signbridge_sign_cache";
    public static final String ANIMATION_NAMESPACE = "signbridge_animation_cache";
    public static final int DEFAULT_SIGN_CAPACITY = 100;
    public static final int DEFAULT_ANIMATION_CAPACITY = 50;
    public static final Duration DEFAULT_TTL = Duration.ofHours(24);
    public static final int MOST_USED_LIMIT = 10;

    private final LruContentCache<SignRecognition> signs;
    private final LruContentCache<AvatarAnimation> animations;

    public AvatarContentCache(KeyValueStore store, Clock clock) {
        this(store, clock, DEFAULT_SIGN_CAPACITY, DEFAULT_ANIMATION_CAPACITY, DEFAULT_TTL);
    }

    public AvatarContentCache(KeyValueStore store, Clock clock, int signCapacity, int animationCapacity,
                              Duration ttl) {
        Objects.requireNonNull(store, "store");
        this.signs = new LruContentCache<>(SIGN_NAMESPACE, signCapacity, ttl, store,
                new SignRecognitionCodec(), clock);
        this.animations = new LruContentCache<>(ANIMATION_NAMESPACE, animationCapacity, ttl, store,
                new AvatarAnimationCodec(), clock);
    }

    public Optional<CacheEntry<SignRecognition>> getSignRecognition(String gestureKey) {
        return signs.get(gestureKey);
    }

    public void setSignRecognition(String gestureKey, SignRecognition recognition) {
        signs.set(gestureKey, recognition);
        LOG.debug("Cached sign recognition {}", gestureKey);
    }

    public Optional<CacheEntry<AvatarAnimation>> getAvatarAnimation(String textKey) {
        return animations.get(textKey);
    }

    public void setAvatarAnimation(String textKey, AvatarAnimation animation) {
        animations.set(textKey, animation);
        LOG.debug("Cached avatar animation {}", textKey);
    }

    /**
     * Key for a hand-pose sample. The sample (arrays or lists of numbers) is serialized
     * to JSON and hashed, so equal coordinates always yield the same key.
     */
    public String generateGestureKey(Object handPoseData) {
        return hashKey(String.valueOf(JSONObject.wrap(handPoseData)));
    }

    /**
     * Key for a text rendering in a scenario: normalized text + ":" + scenario.
     */
    public String generateTextKey(String text, Scenario scenario) {
        Scenario s = scenario == null ? Scenario.DEFAULT : scenario;
        return hashKey(PhraseNormalizer.normalize(text) + ":" + s.key());
    }

    /**
     * Base-36 rendering of the absolute 32-bit polynomial string hash. Not collision-free,
     * but short enough to eyeball in logs.
     */
    static String hashKey(String canonical) {
        return Long.toString(Math.abs((long) canonical.hashCode()), 36);
    }

    /**
     * Statistics aggregated over both namespaces.
     */
    public CacheMetrics getMetrics() {
        return CacheMetrics.combine(signs.metrics(), animations.metrics());
    }

    /**
     * Empties both namespaces and deletes their persisted blobs.
     */
    public void clearAll() {
        signs.clear();
        animations.clear();
        LOG.info("Cleared all content caches");
    }

    /**
     * Drops expired entries from both namespaces.
     *
     * @return total entries removed
     */
    public int purgeExpired() {
        return signs.purgeExpired() + animations.purgeExpired();
    }

    public MostUsedKeys getMostUsed() {
        return new MostUsedKeys(signs.mostUsedKeys(MOST_USED_LIMIT), animations.mostUsedKeys(MOST_USED_LIMIT));
    }

    public boolean isPersistenceDegraded() {
        return signs.isPersistenceDegraded() || animations.isPersistenceDegraded();
    }

    LruContentCache<SignRecognition> signCache() {
        return signs;
    }

    LruContentCache<AvatarAnimation> animationCache() {
        return animations;
    }
}
