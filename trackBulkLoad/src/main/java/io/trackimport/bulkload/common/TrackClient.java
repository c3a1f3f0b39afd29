package io.trackimport.bulkload.common;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.trackimport.bulkload.common.http.AbstractRestClient;
import io.trackimport.bulkload.common.http.HttpResponse;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Sends batches of track objects to the bulk {@code users/track} endpoint.
 *
 * <p>Throttling (429), server errors (5xx) and I/O faults are retried for the same batch with exponential
 * backoff (initial delay doubling on each retry, no jitter) until {@code maxAttempts} calls have been made,
 * after which the last failure is rethrown. Any other status above 400 fails immediately with a
 * {@link FatalTrackException}. A successful response that lists per-record errors is logged and still
 * counts the records the server reports as processed.
 */
@Slf4j
public class TrackClient {
    public static final String TRACK_PATH = "users/track";
    public static final String BULK_HEADER_NAME = "X-Braze-Bulk";
    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(5);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final Map<String, List<String>> BULK_HEADERS = Map.of(BULK_HEADER_NAME, List.of("true"));

    private final AbstractRestClient client;
    private final int maxAttempts;
    private final Duration initialBackoff;

    public TrackClient(AbstractRestClient client) {
        this(client, DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_BACKOFF);
    }

    public TrackClient(AbstractRestClient client, int maxAttempts, Duration initialBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.client = client;
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
    }

    /**
     * Send one batch. Emits the number of objects the server reports as processed, or 0 without any
     * request when the batch is empty.
     */
    public Mono<Integer> sendTrackRequest(List<TrackObject> objects) {
        if (objects.isEmpty()) {
            return Mono.just(0);
        }

        var body = TrackRequestBody.fromObjects(objects);
        log.atDebug().setMessage("Sending {} events and {} purchases")
            .addArgument(() -> body.events().size())
            .addArgument(() -> body.purchases().size())
            .log();
        var json = body.toJson();

        return Mono.defer(() -> client.postAsync(TRACK_PATH, json, BULK_HEADERS))
            .map(this::handleResponse)
            .retryWhen(Retry.backoff(maxAttempts - 1L, initialBackoff)
                .jitter(0d)
                .filter(TrackClient::isRetryable)
                .doBeforeRetry(signal -> log.warn("Retry attempt: {}/{}. Cause: {}",
                    signal.totalRetries() + 2, maxAttempts, signal.failure().getMessage()))
                .onRetryExhaustedThrow((retrySpec, signal) -> signal.failure()));
    }

    static boolean isRetryable(Throwable t) {
        return t instanceof RetryableTrackException || t instanceof IOException;
    }

    private int handleResponse(HttpResponse response) {
        int status = response.statusCode();
        if (status == 429 || status >= 500) {
            throw new RetryableTrackException(status, "Server error. Retrying..");
        }

        var trackResponse = parse(response);
        if (status == 400) {
            log.error("Encountered error for object batch. {}", response.body());
            throw new FatalTrackException(status, messageOf(trackResponse, response));
        }
        if (status > 400) {
            throw new FatalTrackException(status, messageOf(trackResponse, response));
        }
        if (status < 200 || status >= 300) {
            throw new FatalTrackException(status, "Unexpected response: " + response.body());
        }
        if (trackResponse == null) {
            throw new FatalTrackException(status, "Unparseable response body: " + response.body());
        }

        if (trackResponse.hasErrors()) {
            log.error("Encountered errors processing some objects: {}", trackResponse.errors());
        }
        return trackResponse.processedCount();
    }

    private static TrackResponse parse(HttpResponse response) {
        if (response.body() == null || response.body().isBlank()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(response.body(), TrackResponse.class);
        } catch (JsonProcessingException e) {
            log.atDebug().setMessage("Response body is not a track response: {}").addArgument(response::body).log();
            return null;
        }
    }

    private static String messageOf(TrackResponse trackResponse, HttpResponse response) {
        if (trackResponse != null && trackResponse.message() != null) {
            return trackResponse.message();
        }
        return response.body() != null ? response.body() : response.statusText();
    }
}
