package io.trackimport.pipeline.extract;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

import io.trackimport.bulkload.common.TrackObject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Line-oriented extractor for sources laid out one object (or one array) per line, or one object spread over
 * several lines.
 *
 * <p>Lines are reassembled across chunk boundaries before decoding. A running count of opening minus closing
 * braces decides when a line ends a value; at depth zero one trailing comma and the enclosing array brackets
 * are stripped, then the accumulated text is parsed. Braces inside string values are counted too, so such
 * sources should use {@link StreamingObjectExtractor}.
 *
 * <p>When a line parses to an array, its bytes are confirmed only once the last element has been handed out.
 */
@Slf4j
public class LineObjectExtractor implements ObjectExtractor {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private record PendingObject(TrackObject object, long bytesToConfirm) {}

    private final Iterator<byte[]> chunks;
    private final long startOffset;

    private byte[] chunk = new byte[0];
    private int position;
    private final ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream();

    private final StringBuilder accumulator = new StringBuilder();
    private long accumulatorStart;
    private int depth;
    private long pendingBytes;
    private long scannedBytes;
    private long confirmedBytes;

    private final Deque<PendingObject> ready = new ArrayDeque<>();
    private boolean exhausted;
    private boolean lineHandedOutPartly;

    public LineObjectExtractor(Iterator<byte[]> chunks, long startOffset) {
        this.chunks = chunks;
        this.startOffset = startOffset;
    }

    @Override
    public boolean hasNext() {
        while (ready.isEmpty() && !exhausted) {
            byte[] line = readLine();
            if (line == null) {
                finish();
                break;
            }
            processLine(line);
        }
        return !ready.isEmpty();
    }

    @Override
    public TrackObject next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more objects in source");
        }
        var pending = ready.poll();
        confirmedBytes += pending.bytesToConfirm();
        lineHandedOutPartly = pending.bytesToConfirm() == 0;
        return pending.object();
    }

    /**
     * Next line including its terminator, or the unterminated remainder at end of stream, or null once
     * nothing is left.
     */
    private byte[] readLine() {
        while (true) {
            for (int i = position; i < chunk.length; i++) {
                if (chunk[i] == '\n') {
                    lineBuffer.write(chunk, position, i + 1 - position);
                    position = i + 1;
                    return takeLine();
                }
            }
            lineBuffer.write(chunk, position, chunk.length - position);
            position = chunk.length;
            if (!chunks.hasNext()) {
                return lineBuffer.size() > 0 ? takeLine() : null;
            }
            chunk = chunks.next();
            position = 0;
        }
    }

    private byte[] takeLine() {
        byte[] line = lineBuffer.toByteArray();
        lineBuffer.reset();
        return line;
    }

    private void processLine(byte[] bytes) {
        long lineStart = startOffset + scannedBytes;
        scannedBytes += bytes.length;
        pendingBytes += bytes.length;

        String line = new String(bytes, StandardCharsets.UTF_8).strip();
        depth += count(line, '{') - count(line, '}');
        if (depth == 0 && !line.isEmpty()) {
            line = stripArrayPunctuation(line);
        }

        if (line.isEmpty()) {
            // structural line, safe to resume after unless an object is still open
            if (accumulator.length() == 0) {
                confirmedBytes += pendingBytes;
                pendingBytes = 0;
            }
            return;
        }

        if (accumulator.length() == 0) {
            accumulatorStart = lineStart;
        }
        accumulator.append(line);
        JsonNode value;
        try {
            value = OBJECT_MAPPER.readTree(accumulator.toString());
        } catch (JsonProcessingException e) {
            return;
        }

        long valueBytes = pendingBytes;
        pendingBytes = 0;
        accumulator.setLength(0);

        if (value.isArray()) {
            if (value.isEmpty()) {
                confirmedBytes += valueBytes;
                return;
            }
            for (int i = 0; i < value.size(); i++) {
                boolean last = i == value.size() - 1;
                ready.add(new PendingObject(toTrackObject(value.get(i), accumulatorStart), last ? valueBytes : 0));
            }
        } else {
            ready.add(new PendingObject(toTrackObject(value, accumulatorStart), valueBytes));
        }
    }

    static String stripArrayPunctuation(String line) {
        if (line.endsWith(",")) {
            line = line.substring(0, line.length() - 1);
        }
        boolean singleLineArray = line.startsWith("[") && line.endsWith("]");
        if (!singleLineArray && line.startsWith("[")) {
            line = line.substring(1);
        }
        if (!singleLineArray && line.endsWith("]")) {
            line = line.substring(0, line.length() - 1);
        }
        return line;
    }

    private static int count(String line, char c) {
        int n = 0;
        for (int i = 0; i < line.length(); i++) {
            if (line.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    private static TrackObject toTrackObject(JsonNode node, long offset) {
        if (!(node instanceof ObjectNode)) {
            throw new MalformedSourceException(offset, "Expected a JSON object but found " + node.getNodeType());
        }
        return new TrackObject((ObjectNode) node);
    }

    private void finish() {
        exhausted = true;
        if (accumulator.length() > 0) {
            log.warn("Discarding {} bytes of an incomplete object starting at byte {}, "
                + "they will be read again on resume", pendingBytes, accumulatorStart);
            accumulator.setLength(0);
        }
    }

    @Override
    public long drainConfirmedBytes() {
        long drained = confirmedBytes;
        confirmedBytes = 0;
        return drained;
    }

    @Override
    public long getScannedBytes() {
        return scannedBytes;
    }

    @Override
    public boolean hasBufferedObjects() {
        return lineHandedOutPartly;
    }
}
