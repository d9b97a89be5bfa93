package com.kicad.extractor.config;

import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

import java.time.Duration;

/**
 * Connection settings for the language-model net inference backend.
 */
@Value
@Builder(toBuilder = true)
public class InferenceConfig {

    public static final String DEFAULT_ENDPOINT = "https://generativelanguage.googleapis.com/v1beta";
    public static final String DEFAULT_MODEL = "gemini-2.5-flash";
    public static final String API_KEY_ENV = "GEMINI_API_KEY";

    @NonNull
    @Builder.Default
    String endpoint = DEFAULT_ENDPOINT;

    @NonNull
    @Builder.Default
    String model = DEFAULT_MODEL;

    /**
     * API key, read from {@value #API_KEY_ENV}. Never logged.
     */
    @ToString.Exclude
    String apiKey;

    @NonNull
    @Builder.Default
    Duration timeout = Duration.ofSeconds(60);

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
