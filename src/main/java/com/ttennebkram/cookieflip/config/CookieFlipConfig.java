package com.ttennebkram.cookieflip.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Top-level configuration, loaded from JSON.
 * Sections or fields missing from the JSON keep their defaults.
 */
public class CookieFlipConfig {

    public static final String DEFAULT_RESOURCE = "/cookieflip.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public ClassifierConfig classifier = new ClassifierConfig();
    public DetectionConfig detection = new DetectionConfig();
    public FeatureConfig features = new FeatureConfig();
    public DataConfig data = new DataConfig();
    public OutputConfig output = new OutputConfig();

    /**
     * Load the bundled default configuration, or built-in defaults if it is absent.
     */
    public static CookieFlipConfig loadDefault() throws IOException {
        try (InputStream in = CookieFlipConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return new CookieFlipConfig();
            }
            return read(new InputStreamReader(in, StandardCharsets.UTF_8));
        }
    }

    public static CookieFlipConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static CookieFlipConfig fromJson(String json) {
        CookieFlipConfig config = GSON.fromJson(json, CookieFlipConfig.class);
        return normalize(config);
    }

    private static CookieFlipConfig read(Reader reader) {
        return normalize(GSON.fromJson(reader, CookieFlipConfig.class));
    }

    // Gson sets explicit JSON nulls; put defaults back
    private static CookieFlipConfig normalize(CookieFlipConfig config) {
        if (config == null) {
            throw new JsonParseException("Configuration is empty");
        }
        if (config.classifier == null) config.classifier = new ClassifierConfig();
        if (config.detection == null) config.detection = new DetectionConfig();
        if (config.features == null) config.features = new FeatureConfig();
        if (config.data == null) config.data = new DataConfig();
        if (config.output == null) config.output = new OutputConfig();
        return config;
    }

    public String toJson() {
        return GSON.toJson(this);
    }
}
