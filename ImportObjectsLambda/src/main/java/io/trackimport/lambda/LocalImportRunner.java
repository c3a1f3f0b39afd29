package io.trackimport.lambda;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Callable;

import io.trackimport.io.BlobSource;
import io.trackimport.io.FileBlobSource;
import io.trackimport.io.s3.S3BlobSource;
import io.trackimport.io.s3.S3Uri;
import io.trackimport.pipeline.BlobImportJob;
import io.trackimport.pipeline.TimeBudgetGuard;
import io.trackimport.pipeline.extract.ExtractorType;
import io.trackimport.pipeline.ir.ImportOutcome;
import io.trackimport.pipeline.ir.ResumeCursor;
import io.trackimport.pipeline.sink.CollectingObjectSink;
import io.trackimport.pipeline.sink.ObjectSink;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Imports a local file or an S3 object outside of Lambda. Instead of invoking itself, it loops over
 * time-limited invocations of the same job until the import is finished.
 */
@Slf4j
@Command(
    name = "local-import",
    mixinStandardHelpOptions = true,
    description = "Import a JSON array of event and purchase objects through the bulk track endpoint."
)
public class LocalImportRunner implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "SOURCE", description = "Path of a local JSON file, or an s3:// URI.")
    private String source;

    @Option(names = "--byte-offset", defaultValue = "0", paramLabel = "N",
        description = "Byte offset to start from (default: ${DEFAULT-VALUE}).")
    private long byteOffset;

    @Option(names = "--slot-seconds", defaultValue = "900", paramLabel = "SECONDS",
        description = "Length of each simulated invocation (default: ${DEFAULT-VALUE}).")
    private long slotSeconds;

    @Option(names = "--extractor", paramLabel = "streaming|line",
        description = "Overrides the EXTRACTOR environment variable.")
    private String extractor;

    @Option(names = "--region", paramLabel = "REGION", description = "AWS region for s3:// sources.")
    private String region;

    @Option(names = "--dry-run", description = "Parse and batch the source without calling the track API.")
    private boolean dryRun;

    @Getter
    private int invocations;
    @Getter
    private long objectsSent;

    public static void main(String[] args) {
        System.exit(new CommandLine(new LocalImportRunner()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        var config = dryRun ? ImportConfig.builder().build() : ImportConfig.fromEnvironment(System.getenv());
        if (extractor != null) {
            config = config.toBuilder().extractorType(ExtractorType.fromString(extractor)).build();
        }

        String path;
        BlobSource blobSource;
        if (S3Uri.isS3Uri(source)) {
            var uri = S3Uri.parse(source);
            blobSource = new S3BlobSource(uri.bucketName(), region);
            path = uri.key();
        } else {
            var file = Path.of(source).toAbsolutePath();
            blobSource = new FileBlobSource(file.getParent());
            path = file.getFileName().toString();
        }

        try (ObjectSink sink = dryRun ? new CollectingObjectSink() : TrackSinkFactory.create(config)) {
            var job = BlobImportJob.builder()
                .blobSource(blobSource)
                .sink(sink)
                .extractorType(config.getExtractorType())
                .batchSize(config.getBatchSize())
                .batchesPerRound(config.getThreads())
                .chunkSize(config.getChunkSize())
                .build();

            var cursor = new ResumeCursor(byteOffset);
            ImportOutcome outcome;
            do {
                invocations++;
                var clock = Clock.systemUTC();
                var guard = TimeBudgetGuard.untilDeadline(clock, clock.instant().plus(Duration.ofSeconds(slotSeconds)),
                    config.getTimeReserve());
                log.info("Invocation {} starting at byte {}", invocations, cursor.confirmedOffset());
                outcome = job.run(path, cursor, guard);
                objectsSent += outcome.objectsSent();
                log.info("Processed {} of the current file", ByteCountFormatter.format(outcome.bytesRead()));
                cursor = new ResumeCursor(outcome.bytesRead());
            } while (!outcome.finished());

            log.info("File {} imported successfully: {} objects in {} invocations", source, objectsSent, invocations);
        } finally {
            if (blobSource instanceof AutoCloseable) {
                ((AutoCloseable) blobSource).close();
            }
        }
        return 0;
    }
}
