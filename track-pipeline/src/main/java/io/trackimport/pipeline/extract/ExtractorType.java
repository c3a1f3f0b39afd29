package io.trackimport.pipeline.extract;

import java.util.Iterator;
import java.util.Locale;

/**
 * Selects how objects are pulled out of the source bytes.
 */
public enum ExtractorType {
    STREAMING,
    LINE;

    public ObjectExtractor create(Iterator<byte[]> chunks, long startOffset) {
        return switch (this) {
            case STREAMING -> new StreamingObjectExtractor(chunks, startOffset);
            case LINE -> new LineObjectExtractor(chunks, startOffset);
        };
    }

    public static ExtractorType fromString(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown extractor '" + value + "', expected streaming or line", e);
        }
    }
}
