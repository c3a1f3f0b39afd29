package io.trackimport.io.s3;

import java.net.URI;

import com.fasterxml.jackson.annotation.JsonProperty;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Utilities;

/**
 * Location of a single object in S3, as found in an S3 event notification or given as {@code s3://bucket/key}.
 */
public record S3Uri(
    @JsonProperty("bucketName") String bucketName,
    @JsonProperty("key") String key
) {
    public static final String SCHEME_PREFIX = "s3://";

    public S3Uri {
        if (bucketName == null || bucketName.trim().isEmpty()) {
            throw new IllegalArgumentException("Bucket name cannot be null or empty");
        }
        key = key != null ? key : "";
    }

    /**
     * Parse an {@code s3://bucket/key} string. A trailing slash on the key is dropped.
     */
    public static S3Uri parse(String rawUri) {
        if (rawUri == null || !rawUri.startsWith(SCHEME_PREFIX)) {
            throw new IllegalArgumentException("URI must start with s3://: " + rawUri);
        }

        try {
            var parsed = S3Utilities.builder()
                .region(Region.US_EAST_1)
                .build()
                .parseUri(URI.create(rawUri));

            String bucketName = parsed.bucket().orElseThrow(
                () -> new IllegalArgumentException("No bucket found in S3 URI: " + rawUri)
            );
            String key = parsed.key().orElse("");
            if (key.endsWith("/")) {
                key = key.substring(0, key.length() - 1);
            }
            return new S3Uri(bucketName, key);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalArgumentException("Invalid S3 URI: " + rawUri, e);
        }
    }

    public static boolean isS3Uri(String value) {
        return value != null && value.startsWith(SCHEME_PREFIX);
    }

    public String toUri() {
        return SCHEME_PREFIX + bucketName + (key.isEmpty() ? "" : "/" + key);
    }

    @Override
    public String toString() {
        return toUri();
    }
}
