package io.trackimport.lambda;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Getter;
import lombok.ToString;

/**
 * The S3 notification that starts an import, plus the {@value #BYTE_OFFSET_KEY} a continuation adds to it.
 * The original event is kept so a continuation can be sent with exactly the same records.
 */
@Getter
@ToString(exclude = "rawEvent")
public class ImportEvent {
    public static final String BYTE_OFFSET_KEY = "byte_offset";

    private final String bucketName;
    private final String objectKey;
    private final long byteOffset;
    private final Map<String, Object> rawEvent;

    private ImportEvent(String bucketName, String objectKey, long byteOffset, Map<String, Object> rawEvent) {
        this.bucketName = bucketName;
        this.objectKey = objectKey;
        this.byteOffset = byteOffset;
        this.rawEvent = rawEvent;
    }

    public static ImportEvent fromMap(Map<String, Object> event) {
        if (event == null) {
            throw new IllegalArgumentException("Event must not be null");
        }
        var records = event.get("Records");
        if (!(records instanceof List) || ((List<?>) records).isEmpty()) {
            throw new IllegalArgumentException("Event has no Records: " + event);
        }
        var s3 = child(((List<?>) records).get(0), "s3");
        var bucketName = child(child(s3, "bucket"), "name");
        var encodedKey = child(child(s3, "object"), "key");
        if (!(bucketName instanceof String) || !(encodedKey instanceof String)) {
            throw new IllegalArgumentException("Event record has no S3 bucket name or object key: " + event);
        }
        String objectKey = URLDecoder.decode((String) encodedKey, StandardCharsets.UTF_8);
        return new ImportEvent((String) bucketName, objectKey, parseOffset(event.get(BYTE_OFFSET_KEY)), event);
    }

    private static Object child(Object parent, String key) {
        return parent instanceof Map ? ((Map<?, ?>) parent).get(key) : null;
    }

    private static long parseOffset(Object value) {
        if (value == null) {
            return 0;
        }
        try {
            long offset = value instanceof Number ? ((Number) value).longValue() : Long.parseLong(value.toString());
            if (offset < 0) {
                throw new IllegalArgumentException("byte_offset must be >= 0, got " + offset);
            }
            return offset;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("byte_offset is not a number: " + value, e);
        }
    }

    /**
     * The original event with its byte offset replaced.
     */
    public Map<String, Object> withByteOffset(long byteOffset) {
        Map<String, Object> next = new LinkedHashMap<>(rawEvent);
        next.put(BYTE_OFFSET_KEY, byteOffset);
        return next;
    }

    public String objectUri() {
        return "s3://" + bucketName + "/" + objectKey;
    }
}
