package io.trackimport.pipeline.extract;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import io.trackimport.bulkload.common.TrackObject;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class StreamingObjectExtractorTest {

    private static final String PRETTY_SOURCE = "[\n"
        + "  {\n"
        + "    \"external_id\": \"user-1\",\n"
        + "    \"name\": \"clicked {promo}\",\n"
        + "    \"properties\": {\"tags\": [\"a\", \"b]\"], \"quote\": \"say \\\"}\\\"\"}\n"
        + "  },\n"
        + "  {\"external_id\": \"user-2\", \"product_id\": \"sku\", \"price\": 12.5, \"currency\": \"EUR\"},\n"
        + "  {\"external_id\": \"user-3\", \"name\": \"café ☕\", \"nested\": {\"deep\": {\"x\": null}}}\n"
        + "]\n";

    private static final List<TrackObject> EXPECTED = List.of(
        TrackObject.fromJson("{\"external_id\":\"user-1\",\"name\":\"clicked {promo}\","
            + "\"properties\":{\"tags\":[\"a\",\"b]\"],\"quote\":\"say \\\"}\\\"\"}}"),
        TrackObject.fromJson("{\"external_id\":\"user-2\",\"product_id\":\"sku\",\"price\":12.5,\"currency\":\"EUR\"}"),
        TrackObject.fromJson("{\"external_id\":\"user-3\",\"name\":\"café ☕\",\"nested\":{\"deep\":{\"x\":null}}}")
    );

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 5, 7, 16, 64, 1024})
    void extractionDoesNotDependOnChunkBoundaries(int chunkSize) {
        var data = bytes(PRETTY_SOURCE);
        var extractor = new StreamingObjectExtractor(Chunks.of(data, chunkSize), 0);

        assertEquals(EXPECTED, Chunks.drain(extractor));
        assertEquals(data.length, extractor.drainConfirmedBytes());
        assertEquals(data.length, extractor.getScannedBytes());
    }

    @Test
    void resumingFromAnyConfirmedOffsetYieldsExactlyTheRemainingObjects() {
        var data = bytes(PRETTY_SOURCE);
        for (int consumed = 0; consumed <= EXPECTED.size(); consumed++) {
            var first = new StreamingObjectExtractor(Chunks.of(data, 4), 0);
            for (int i = 0; i < consumed; i++) {
                first.next();
            }
            int offset = (int) first.drainConfirmedBytes();

            var resumed = new StreamingObjectExtractor(
                Chunks.of(Arrays.copyOfRange(data, offset, data.length), 4), offset);
            assertEquals(EXPECTED.subList(consumed, EXPECTED.size()), Chunks.drain(resumed),
                "after consuming " + consumed + " objects");
            assertEquals(data.length - offset, resumed.drainConfirmedBytes());
        }
    }

    @Test
    void bytesAreConfirmedOnlyWhenObjectIsHandedOut() {
        var extractor = new StreamingObjectExtractor(Chunks.of("[{\"a\":1}, {\"a\":2}]", 100), 0);

        assertTrue(extractor.hasNext());
        assertEquals(1, extractor.drainConfirmedBytes(), "only the opening bracket");
        extractor.next();
        assertEquals(7, extractor.drainConfirmedBytes());
        extractor.next();
        assertEquals(2 + 7, extractor.drainConfirmedBytes());
        assertFalse(extractor.hasNext());
        assertEquals(1, extractor.drainConfirmedBytes());
    }

    @Test
    void truncatedTailIsDiscardedAndLeftUnconfirmed() {
        var full = "[{\"a\":1},{\"a\":2},{\"a\":3}]";
        var truncated = full.substring(0, full.indexOf("{\"a\":3") + 4);
        var extractor = new StreamingObjectExtractor(Chunks.of(truncated, 3), 0);

        assertEquals(List.of(TrackObject.fromJson("{\"a\":1}"), TrackObject.fromJson("{\"a\":2}")),
            Chunks.drain(extractor));
        long confirmed = extractor.drainConfirmedBytes();
        assertEquals(full.indexOf("{\"a\":3"), confirmed);

        var resumed = new StreamingObjectExtractor(Chunks.of(full.substring((int) confirmed), 3), confirmed);
        assertEquals(List.of(TrackObject.fromJson("{\"a\":3}")), Chunks.drain(resumed));
    }

    @Test
    void bareScalarReportsAbsoluteOffset() {
        var extractor = new StreamingObjectExtractor(Chunks.of("{\"a\":1}, 42]", 100), 1000);

        assertTrue(extractor.hasNext());
        extractor.next();
        var e = assertThrows(MalformedSourceException.class, extractor::hasNext);
        assertEquals(1009, e.getOffset());
    }

    @Test
    void unparseableElementIsMalformed() {
        var extractor = new StreamingObjectExtractor(Chunks.of("[{\"a\":}]", 100), 0);

        var e = assertThrows(MalformedSourceException.class, extractor::hasNext);
        assertEquals(1, e.getOffset());
    }

    @Test
    void emptyArrayYieldsNothingAndConfirmsEverything() {
        var extractor = new StreamingObjectExtractor(Chunks.of("[ ]\n", 1), 0);

        assertFalse(extractor.hasNext());
        assertEquals(4, extractor.drainConfirmedBytes());
    }

    @Test
    void manyObjectsOnOneLine() {
        var source = Chunks.singleLineArray(200);
        var objects = Chunks.drain(new StreamingObjectExtractor(Chunks.of(source, 1024 * 1024), 0));

        assertEquals(200, objects.size());
        assertEquals(199, objects.get(199).getFields().get("a").asInt());
    }
}
