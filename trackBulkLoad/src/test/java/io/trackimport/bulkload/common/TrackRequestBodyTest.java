package io.trackimport.bulkload.common;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TrackRequestBodyTest {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @Test
    void objectWithPriceAndCurrencyIsPurchase() {
        var purchase = TrackObject.fromJson(
            "{\"external_id\":\"u1\",\"product_id\":\"sku\",\"price\":9.99,\"currency\":\"USD\",\"time\":\"2024-01-01\"}");
        var priceOnly = TrackObject.fromJson("{\"external_id\":\"u1\",\"name\":\"viewed\",\"price\":9.99}");
        var currencyOnly = TrackObject.fromJson("{\"external_id\":\"u1\",\"name\":\"viewed\",\"currency\":\"USD\"}");

        assertEquals(TrackObject.Kind.PURCHASE, purchase.getKind());
        assertEquals(TrackObject.Kind.EVENT, priceOnly.getKind());
        assertEquals(TrackObject.Kind.EVENT, currencyOnly.getKind());
    }

    @Test
    void partitionsBatchIntoEventsAndPurchasesInOrder() {
        var e1 = TrackObject.fromJson("{\"name\":\"e1\"}");
        var p1 = TrackObject.fromJson("{\"price\":1,\"currency\":\"EUR\"}");
        var e2 = TrackObject.fromJson("{\"name\":\"e2\"}");

        var body = TrackRequestBody.fromObjects(List.of(e1, p1, e2));

        assertEquals(List.of(e1, e2), body.events());
        assertEquals(List.of(p1), body.purchases());
        assertEquals(3, body.size());
    }

    @Test
    void emptyListsAreLeftOutOfTheJson() throws Exception {
        JsonNode eventsOnly = OBJECT_MAPPER.readTree(
            TrackRequestBody.fromObjects(List.of(TrackObject.fromJson("{\"name\":\"e1\"}"))).toJson());
        assertTrue(eventsOnly.has("events"));
        assertFalse(eventsOnly.has("purchases"));
        assertEquals("e1", eventsOnly.get("events").get(0).get("name").asText());

        JsonNode purchasesOnly = OBJECT_MAPPER.readTree(
            TrackRequestBody.fromObjects(List.of(TrackObject.fromJson("{\"price\":1,\"currency\":\"EUR\"}"))).toJson());
        assertFalse(purchasesOnly.has("events"));
        assertEquals(1, purchasesOnly.get("purchases").size());
    }

    @Test
    void objectsSerializeAsTheirOriginalFields() {
        var json = TrackRequestBody.fromObjects(
            List.of(TrackObject.fromJson("{\"name\":\"e1\",\"properties\":{\"nested\":[1,2]}}"))).toJson();
        assertEquals("{\"events\":[{\"name\":\"e1\",\"properties\":{\"nested\":[1,2]}}]}", json);
    }

    @Test
    void fromJsonRejectsNonObjects() {
        assertThrows(IllegalArgumentException.class, () -> TrackObject.fromJson("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> TrackObject.fromJson("{\"a\":"));
    }
}
