package io.trackimport.pipeline.extract;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import io.trackimport.bulkload.common.TrackObject;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Byte-level tokenizer for a top-level JSON array of objects.
 *
 * <p>Between elements only whitespace, commas and array brackets are accepted; they are confirmed as soon
 * as they are scanned. An element runs from its opening brace to the brace that brings the nesting depth
 * back to zero. Quotes and escapes are tracked, so braces inside string values do not count. Element bytes
 * are confirmed when the element is handed out.
 */
@Slf4j
public class StreamingObjectExtractor implements ObjectExtractor {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final Iterator<byte[]> chunks;
    private final long startOffset;

    private byte[] chunk = new byte[0];
    private int position;
    private long scannedBytes;
    private long confirmedBytes;

    private final ByteArrayOutputStream element = new ByteArrayOutputStream();
    private long elementStart;
    private int depth;
    private boolean inString;
    private boolean escaped;

    private TrackObject nextObject;
    private long nextObjectBytes;
    private boolean exhausted;

    public StreamingObjectExtractor(Iterator<byte[]> chunks, long startOffset) {
        this.chunks = chunks;
        this.startOffset = startOffset;
    }

    @Override
    public boolean hasNext() {
        while (nextObject == null && !exhausted) {
            if (position == chunk.length) {
                if (!chunks.hasNext()) {
                    finish();
                    break;
                }
                chunk = chunks.next();
                position = 0;
                continue;
            }
            scan(chunk[position++]);
        }
        return nextObject != null;
    }

    @Override
    public TrackObject next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more objects in source");
        }
        var result = nextObject;
        confirmedBytes += nextObjectBytes;
        nextObject = null;
        nextObjectBytes = 0;
        return result;
    }

    private void scan(byte b) {
        long offset = startOffset + scannedBytes;
        scannedBytes++;

        if (depth == 0) {
            switch (b) {
                case ' ', '\t', '\n', '\r', ',', '[', ']' -> confirmedBytes++;
                case '{' -> {
                    depth = 1;
                    elementStart = offset;
                    element.write(b);
                }
                default -> throw new MalformedSourceException(offset,
                    "Unexpected character '" + (char) (b & 0xff) + "' outside of an object");
            }
            return;
        }

        element.write(b);
        if (inString) {
            if (escaped) {
                escaped = false;
            } else if (b == '\\') {
                escaped = true;
            } else if (b == '"') {
                inString = false;
            }
            return;
        }
        switch (b) {
            case '"' -> inString = true;
            case '{', '[' -> depth++;
            case '}', ']' -> {
                depth--;
                if (depth == 0) {
                    completeElement();
                }
            }
            default -> {
                // part of a value
            }
        }
    }

    private void completeElement() {
        byte[] bytes = element.toByteArray();
        element.reset();
        JsonNode node;
        try {
            node = OBJECT_MAPPER.readTree(bytes);
        } catch (IOException e) {
            throw new MalformedSourceException(elementStart, "Element is not valid JSON", e);
        }
        if (!(node instanceof ObjectNode)) {
            throw new MalformedSourceException(elementStart, "Element is not a JSON object");
        }
        nextObject = new TrackObject((ObjectNode) node);
        nextObjectBytes = bytes.length;
    }

    private void finish() {
        exhausted = true;
        if (element.size() > 0) {
            log.warn("Discarding {} bytes of an incomplete object starting at byte {}, "
                + "they will be read again on resume", element.size(), elementStart);
            element.reset();
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

    /** Every handed-out object is confirmed on its own, a looked-ahead object is simply read again. */
    @Override
    public boolean hasBufferedObjects() {
        return false;
    }
}
