package com.phillippitts.signbridge.service.idle;

/**
 * Avatar presentation state. Exactly one is current at any time.
 */
public enum IdleState {
    /** No recent conversational activity; idle-motion loops may play. */
    IDLE,
    /** Conversation in progress; idle motion suppressed. */
    ACTIVE,
    /** Blending between the two for the configured transition duration. */
    TRANSITIONING
}
