package com.phillippitts.signbridge.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Locations of the phrase tables served by the emergency fast path.
 */
@Validated
@ConfigurationProperties(prefix = "phrases")
public class PhraseProperties {

    static final String DEFAULT_EMERGENCY = "classpath:phrases/emergency-phrases.json";
    static final String DEFAULT_MEDICAL = "classpath:phrases/medical-terms.json";

    @NotBlank
    private final String emergencyLocation;

    @NotBlank
    private final String medicalLocation;

    @ConstructorBinding
    public PhraseProperties(String emergencyLocation, String medicalLocation) {
        this.emergencyLocation = emergencyLocation == null ? DEFAULT_EMERGENCY : emergencyLocation;
        this.medicalLocation = medicalLocation == null ? DEFAULT_MEDICAL : medicalLocation;
    }

    public String getEmergencyLocation() {
        return emergencyLocation;
    }

    public String getMedicalLocation() {
        return medicalLocation;
    }
}
