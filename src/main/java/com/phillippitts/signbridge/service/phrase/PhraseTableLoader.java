package com.phillippitts.signbridge.service.phrase;

import com.phillippitts.signbridge.exception.SignBridgeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads phrase tables from JSON resources.
 *
 * <p>Expected format:
 * <pre>{@code
 * [
 *   {"phrase": "chest pain", "mediatedText": "I am experiencing chest pain", "signIntent": "CHEST_PAIN"},
 *   ...
 * ]
 * }</pre>
 *
 * <p>A missing or malformed table is a startup error: the emergency fast path cannot be
 * served without it.
 */
public final class PhraseTableLoader {

    private static final Logger LOG = LogManager.getLogger(PhraseTableLoader.class);

    private final ResourceLoader resourceLoader;

    public PhraseTableLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader");
    }

    /**
     * Loads a phrase table from a Spring resource location
     * (e.g. {@code classpath:phrases/emergency-phrases.json}).
     *
     * @throws SignBridgeException if the resource is missing or not a valid table
     */
    public List<PhraseSeed> load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new SignBridgeException("Phrase table not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            List<PhraseSeed> seeds = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            LOG.info("Loaded {} phrases from {}", seeds.size(), location);
            return seeds;
        } catch (IOException e) {
            throw new SignBridgeException("Failed to read phrase table: " + location, e);
        } catch (JSONException e) {
            throw new SignBridgeException("Malformed phrase table: " + location, e);
        }
    }

    /**
     * Parses a JSON phrase table. Rows without a phrase or mediated text are skipped.
     */
    static List<PhraseSeed> parse(String json) {
        JSONArray rows = new JSONArray(json);
        List<PhraseSeed> seeds = new ArrayList<>(rows.length());
        for (int i = 0; i < rows.length(); i++) {
            JSONObject row = rows.getJSONObject(i);
            String phrase = row.optString("phrase", "").trim();
            String mediated = row.optString("mediatedText", "").trim();
            if (phrase.isEmpty() || mediated.isEmpty()) {
                LOG.warn("Skipping phrase table row {} without phrase/mediatedText", i);
                continue;
            }
            String intent = row.has("signIntent") ? row.optString("signIntent", null) : null;
            seeds.add(new PhraseSeed(phrase, mediated, intent));
        }
        return seeds;
    }
}
