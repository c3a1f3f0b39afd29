package io.trackimport.bulkload.common;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Body of a bulk track request. Either list is left out of the JSON when it is empty.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TrackRequestBody(
    @JsonProperty("events") List<TrackObject> events,
    @JsonProperty("purchases") List<TrackObject> purchases
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public static TrackRequestBody fromObjects(List<TrackObject> objects) {
        List<TrackObject> events = new ArrayList<>();
        List<TrackObject> purchases = new ArrayList<>();
        for (TrackObject candidate : objects) {
            if (candidate.isPurchase()) {
                purchases.add(candidate);
            } else {
                events.add(candidate);
            }
        }
        return new TrackRequestBody(events, purchases);
    }

    public int size() {
        return events.size() + purchases.size();
    }

    public String toJson() {
        try {
            return OBJECT_MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize track request body", e);
        }
    }
}
