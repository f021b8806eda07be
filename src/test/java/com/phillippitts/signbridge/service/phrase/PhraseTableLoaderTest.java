package com.phillippitts.signbridge.service.phrase;

import com.phillippitts.signbridge.exception.SignBridgeException;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhraseTableLoaderTest {

    private final PhraseTableLoader loader = new PhraseTableLoader(new DefaultResourceLoader());

    @Test
    void loadsBundledEmergencyTable() {
        List<PhraseSeed> seeds = loader.load("classpath:phrases/emergency-phrases.json");

        assertThat(seeds).isNotEmpty();
        assertThat(seeds).extracting(PhraseSeed::phrase).contains("help", "chest pain");
    }

    @Test
    void loadsBundledMedicalTableWithoutRareDisease() {
        NormalizedPhraseCache medical = NormalizedPhraseCache.growable("medical",
                loader.load("classpath:phrases/medical-terms.json"));

        assertThat(medical.size()).isGreaterThan(10);
        assertThat(medical.isCached("super rare disease")).isFalse();
    }

    @Test
    void missingResourceFails() {
        assertThatThrownBy(() -> loader.load("classpath:phrases/does-not-exist.json"))
                .isInstanceOf(SignBridgeException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void malformedResourceFails() {
        assertThatThrownBy(() -> loader.load("classpath:phrases-test/malformed.json"))
                .isInstanceOf(SignBridgeException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    void parseSkipsIncompleteRows() {
        List<PhraseSeed> seeds = PhraseTableLoader.parse("""
                [
                  {"phrase": "fever", "mediatedText": "I have a fever", "signIntent": "FEVER"},
                  {"phrase": "", "mediatedText": "orphan"},
                  {"phrase": "nausea"},
                  {"phrase": "dizzy", "mediatedText": "I feel dizzy"}
                ]
                """);

        assertThat(seeds).extracting(PhraseSeed::phrase).containsExactly("fever", "dizzy");
        assertThat(seeds.get(0).signIntent()).isEqualTo("FEVER");
        assertThat(seeds.get(1).signIntent()).isNull();
    }
}
