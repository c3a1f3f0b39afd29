package io.trackimport.io.s3;

import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CompletionException;

import io.trackimport.io.BlobSource;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.async.AsyncResponseTransformer;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3AsyncClientBuilder;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

/**
 * BlobSource over the objects of one S3 bucket. Paths are object keys within that bucket.
 */
@Slf4j
public class S3BlobSource implements BlobSource, AutoCloseable {

    private final S3AsyncClient s3Client;
    private final String bucketName;

    /**
     * @param bucketName the bucket to read from
     * @param region the AWS region, or null to use the default region provider chain
     */
    public S3BlobSource(String bucketName, String region) {
        this(createClient(region), bucketName);
    }

    public S3BlobSource(S3AsyncClient s3Client, String bucketName) {
        this.s3Client = s3Client;
        this.bucketName = new S3Uri(bucketName, "").bucketName();
    }

    private static S3AsyncClient createClient(String region) {
        S3AsyncClientBuilder builder = S3AsyncClient.builder()
            .credentialsProvider(DefaultCredentialsProvider.builder().build());
        if (region != null) {
            builder.region(Region.of(region));
        }
        return builder.build();
    }

    @Override
    public InputStream getBlobRange(String key, long startOffset) throws IOException {
        log.debug("Reading S3 object: s3://{}/{} from byte {}", bucketName, key, startOffset);

        GetObjectRequest request = GetObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .range("bytes=" + startOffset + "-")
            .build();

        try {
            return s3Client.getObject(request, AsyncResponseTransformer.toBlockingInputStream()).join();
        } catch (CompletionException e) {
            throw new IOException("Failed to get S3 object: s3://" + bucketName + "/" + key
                + " from byte " + startOffset, e.getCause());
        }
    }

    @Override
    public boolean exists(String key) {
        try {
            s3Client.headObject(headRequest(key)).join();
            return true;
        } catch (CompletionException e) {
            if (e.getCause() instanceof NoSuchKeyException) {
                return false;
            }
            log.warn("Error checking if S3 object exists: s3://{}/{}", bucketName, key, e);
            return false;
        }
    }

    @Override
    public long getBlobSize(String key) throws IOException {
        try {
            return s3Client.headObject(headRequest(key)).join().contentLength();
        } catch (CompletionException e) {
            throw new IOException("Failed to get S3 object size: s3://" + bucketName + "/" + key, e.getCause());
        }
    }

    private HeadObjectRequest headRequest(String key) {
        return HeadObjectRequest.builder()
            .bucket(bucketName)
            .key(key)
            .build();
    }

    @Override
    public void close() {
        s3Client.close();
    }
}
