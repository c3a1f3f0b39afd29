package io.trackimport.bulkload.common;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.EqualsAndHashCode;

/**
 * One flat record destined for the track endpoint. A record is a purchase when it carries both a
 * {@value #PRICE_FIELD} and a {@value #CURRENCY_FIELD} field, and an event otherwise.
 */
@EqualsAndHashCode
public final class TrackObject {
    public static final String PRICE_FIELD = "price";
    public static final String CURRENCY_FIELD = "currency";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public enum Kind {
        EVENT,
        PURCHASE
    }

    private final ObjectNode fields;

    public TrackObject(ObjectNode fields) {
        this.fields = Objects.requireNonNull(fields, "fields must not be null");
    }

    /**
     * Parse a single JSON object, mostly useful for tests and fixtures.
     */
    public static TrackObject fromJson(String json) {
        try {
            JsonNode node = OBJECT_MAPPER.readTree(json);
            if (!(node instanceof ObjectNode)) {
                throw new IllegalArgumentException("Not a JSON object: " + json);
            }
            return new TrackObject((ObjectNode) node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON object: " + json, e);
        }
    }

    @JsonValue
    public ObjectNode getFields() {
        return fields;
    }

    public Kind getKind() {
        return fields.has(PRICE_FIELD) && fields.has(CURRENCY_FIELD) ? Kind.PURCHASE : Kind.EVENT;
    }

    public boolean isPurchase() {
        return getKind() == Kind.PURCHASE;
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
