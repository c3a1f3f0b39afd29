package io.trackimport.bulkload.common;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The parts of a track response body the importer reads. Unknown fields are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrackResponse(
    @JsonProperty("message") String message,
    @JsonProperty("events_processed") int eventsProcessed,
    @JsonProperty("purchases_processed") int purchasesProcessed,
    @JsonProperty("errors") JsonNode errors
) {
    public int processedCount() {
        return eventsProcessed + purchasesProcessed;
    }

    /** An {@code errors} key counts even when its value is null; an absent key leaves the field null. */
    public boolean hasErrors() {
        return errors != null;
    }
}
