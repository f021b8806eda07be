package com.phillippitts.signbridge.service.speech;

import com.phillippitts.signbridge.domain.Scenario;

/**
 * Speech synthesis parameters. Rate 1.0 is the engine baseline.
 *
 * @param rate   speaking rate multiplier
 * @param pitch  pitch multiplier
 * @param volume volume between 0.0 and 1.0
 */
public record VoiceProfile(double rate, double pitch, double volume) {

    public static final VoiceProfile HOSPITAL = new VoiceProfile(0.9, 1.0, 1.0);
    public static final VoiceProfile EMERGENCY = new VoiceProfile(1.1, 1.0, 1.0);
    public static final VoiceProfile NEUTRAL = new VoiceProfile(1.0, 1.0, 1.0);

    public VoiceProfile {
        if (rate <= 0 || pitch <= 0) {
            throw new IllegalArgumentException("rate and pitch must be positive");
        }
        if (volume < 0.0 || volume > 1.0) {
            throw new IllegalArgumentException("volume must be between 0.0 and 1.0, got: " + volume);
        }
    }

    /**
     * Calmer delivery in hospital, urgent in emergencies.
     */
    public static VoiceProfile forScenario(Scenario scenario) {
        return switch (scenario) {
            case HOSPITAL -> HOSPITAL;
            case EMERGENCY -> EMERGENCY;
            case DEFAULT -> NEUTRAL;
        };
    }
}
