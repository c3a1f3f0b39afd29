package io.trackimport.lambda;

import java.time.Duration;
import java.util.Map;

import io.trackimport.bulkload.common.TrackClient;
import io.trackimport.io.RangeByteSource;
import io.trackimport.pipeline.BatchScheduler;
import io.trackimport.pipeline.TimeBudgetGuard;
import io.trackimport.pipeline.extract.ExtractorType;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Settings of the importer. Credentials and worker width come from the environment, the rest are fixed
 * defaults that tests override through the builder.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "apiKey")
public class ImportConfig {
    public static final String API_KEY_ENV = "BRAZE_API_KEY";
    public static final String API_URL_ENV = "BRAZE_API_URL";
    public static final String THREADS_ENV = "THREADS";
    public static final String EXTRACTOR_ENV = "EXTRACTOR";
    public static final int DEFAULT_THREADS = 15;

    private final String apiKey;
    private final String apiUrl;
    @Builder.Default
    private final int threads = DEFAULT_THREADS;
    @Builder.Default
    private final ExtractorType extractorType = ExtractorType.STREAMING;
    @Builder.Default
    private final int batchSize = BatchScheduler.DEFAULT_BATCH_SIZE;
    @Builder.Default
    private final int chunkSize = RangeByteSource.DEFAULT_CHUNK_SIZE;
    @Builder.Default
    private final Duration timeReserve = TimeBudgetGuard.DEFAULT_RESERVE;
    @Builder.Default
    private final int maxAttempts = TrackClient.DEFAULT_MAX_ATTEMPTS;
    @Builder.Default
    private final Duration initialBackoff = TrackClient.DEFAULT_INITIAL_BACKOFF;

    public static ImportConfig fromEnvironment(Map<String, String> env) {
        return ImportConfig.builder()
            .apiKey(required(env, API_KEY_ENV))
            .apiUrl(required(env, API_URL_ENV))
            .threads(positiveInt(env, THREADS_ENV, DEFAULT_THREADS))
            .extractorType(extractor(env))
            .build();
    }

    private static String required(Map<String, String> env, String name) {
        var value = env.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("API key or URL is missing, cannot process the file. Set " + name);
        }
        return value.trim();
    }

    private static int positiveInt(Map<String, String> env, String name, int defaultValue) {
        var value = env.get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 1) {
                throw new IllegalStateException(name + " must be >= 1, got " + parsed);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalStateException(name + " is not a number: " + value, e);
        }
    }

    private static ExtractorType extractor(Map<String, String> env) {
        var value = env.get(EXTRACTOR_ENV);
        if (value == null || value.isBlank()) {
            return ExtractorType.STREAMING;
        }
        try {
            return ExtractorType.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }
}
