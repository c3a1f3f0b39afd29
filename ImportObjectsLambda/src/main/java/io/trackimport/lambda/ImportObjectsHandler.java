package io.trackimport.lambda;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

import io.trackimport.io.BlobSource;
import io.trackimport.io.s3.S3BlobSource;
import io.trackimport.pipeline.BlobImportJob;
import io.trackimport.pipeline.TimeBudgetGuard;
import io.trackimport.pipeline.ir.ImportOutcome;
import io.trackimport.pipeline.ir.ResumeCursor;
import io.trackimport.pipeline.sink.ObjectSink;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.s3.S3AsyncClient;

/**
 * Entry point of the import function. Each invocation imports the uploaded blob from its byte offset until
 * the blob is done or the time budget runs low, then invokes itself to carry on from the confirmed offset.
 *
 * <p>Failures propagate out of the handler. No continuation is scheduled for a failed invocation.
 */
@Slf4j
public class ImportObjectsHandler implements RequestHandler<Map<String, Object>, Map<String, Object>> {
    public static final String OBJECTS_SENT = "objects_sent";
    public static final String BYTES_READ = "bytes_read";
    public static final String IS_FINISHED = "is_finished";

    private final ImportConfig config;
    private final Function<String, BlobSource> blobSourceForBucket;
    private final ObjectSink sink;
    private final Function<Context, ContinuationTrigger> continuationForContext;

    public ImportObjectsHandler() {
        this(ImportConfig.fromEnvironment(System.getenv()));
    }

    private ImportObjectsHandler(ImportConfig config) {
        this(config, s3BlobSources(S3AsyncClient.create()), TrackSinkFactory.create(config),
            selfInvocation(LambdaClient.create()));
    }

    ImportObjectsHandler(ImportConfig config,
                         Function<String, BlobSource> blobSourceForBucket,
                         ObjectSink sink,
                         Function<Context, ContinuationTrigger> continuationForContext) {
        this.config = config;
        this.blobSourceForBucket = blobSourceForBucket;
        this.sink = sink;
        this.continuationForContext = continuationForContext;
    }

    private static Function<String, BlobSource> s3BlobSources(S3AsyncClient s3Client) {
        return bucket -> new S3BlobSource(s3Client, bucket);
    }

    private static Function<Context, ContinuationTrigger> selfInvocation(LambdaClient lambdaClient) {
        return context -> new LambdaSelfInvocationTrigger(lambdaClient, context.getFunctionName());
    }

    @Override
    public Map<String, Object> handleRequest(Map<String, Object> input, Context context) {
        var event = ImportEvent.fromMap(input);
        log.info("New object import invoked for {}. Starting at byte {}", event.objectUri(), event.getByteOffset());

        var guard = new TimeBudgetGuard(() -> Duration.ofMillis(context.getRemainingTimeInMillis()),
            config.getTimeReserve());
        var job = BlobImportJob.builder()
            .blobSource(blobSourceForBucket.apply(event.getBucketName()))
            .sink(sink)
            .extractorType(config.getExtractorType())
            .batchSize(config.getBatchSize())
            .batchesPerRound(config.getThreads())
            .chunkSize(config.getChunkSize())
            .build();

        ImportOutcome outcome;
        try {
            outcome = job.run(event.getObjectKey(), new ResumeCursor(event.getByteOffset()), guard);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read " + event.objectUri(), e);
        }

        log.info("Processed {} of the current file", ByteCountFormatter.format(outcome.bytesRead()));
        log.info("Imported {} objects", outcome.objectsSent());

        if (!outcome.finished()) {
            continuationForContext.apply(context).continueFrom(event, outcome.bytesRead());
        } else {
            log.info("File {} imported successfully", event.getObjectKey());
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put(OBJECTS_SENT, outcome.objectsSent());
        result.put(BYTES_READ, outcome.bytesRead());
        result.put(IS_FINISHED, outcome.finished());
        return result;
    }
}
