package com.phillippitts.signbridge.service.events;

import com.phillippitts.signbridge.service.pipeline.event.MediationFailedEvent;
import com.phillippitts.signbridge.service.pipeline.event.SpeechFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator-facing summary of recovered pipeline failures. Privacy-safe (no utterance text)
 * and throttled to one line per failure kind per minute; per-cycle detail is already in the
 * controller's own logs.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener() {
        this(Clock.systemUTC());
    }

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @Async("eventExecutor")
    @EventListener
    void onMediationFailed(MediationFailedEvent e) {
        String key = "mediation-" + e.backend() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Mediation {} on backend={}; users received raw input. Check backend availability "
                    + "and pipeline.mediation-timeout-ms.", e.reason(), e.backend());
        }
    }

    @Async("eventExecutor")
    @EventListener
    void onSpeechFailed(SpeechFailedEvent e) {
        if (shouldLog("speech")) {
            LOG.warn("Speech output failed: {}. Hearing users may be missing audio; subtitles still delivered.",
                    e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
