package com.phillippitts.signbridge.config.properties;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Avatar idle-state timing.
 */
@Validated
@ConfigurationProperties(prefix = "avatar.idle")
public class IdleStateProperties {

    /** Inactivity before the avatar returns to idle. */
    @Positive(message = "Idle timeout must be positive")
    private long idleTimeoutMs = 3000;

    /** Duration of the transitioning state. */
    @PositiveOrZero(message = "Transition duration must be >= 0")
    private long transitionDurationMs = 500;

    public long getIdleTimeoutMs() {
        return idleTimeoutMs;
    }

    public void setIdleTimeoutMs(long idleTimeoutMs) {
        this.idleTimeoutMs = idleTimeoutMs;
    }

    public long getTransitionDurationMs() {
        return transitionDurationMs;
    }

    public void setTransitionDurationMs(long transitionDurationMs) {
        this.transitionDurationMs = transitionDurationMs;
    }
}
