package io.trackimport.pipeline;

import java.io.IOException;

import io.trackimport.io.BlobSource;
import io.trackimport.io.RangeByteSource;
import io.trackimport.pipeline.extract.ExtractorType;
import io.trackimport.pipeline.ir.ImportOutcome;
import io.trackimport.pipeline.ir.ResumeCursor;
import io.trackimport.pipeline.sink.ObjectSink;

import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * One invocation's worth of importing a blob: reads from the resume cursor to the end of the blob (or until
 * the time guard stops it) and sends everything it reads to the sink.
 */
@Slf4j
@Builder
public class BlobImportJob {
    private final BlobSource blobSource;
    private final ObjectSink sink;
    @Builder.Default
    private final ExtractorType extractorType = ExtractorType.STREAMING;
    @Builder.Default
    private final int batchSize = BatchScheduler.DEFAULT_BATCH_SIZE;
    @Builder.Default
    private final int batchesPerRound = 15;
    @Builder.Default
    private final int chunkSize = RangeByteSource.DEFAULT_CHUNK_SIZE;

    public ImportOutcome run(String path, ResumeCursor start, TimeBudgetGuard guard) throws IOException {
        long totalLength = blobSource.getBlobSize(path);
        if (start.confirmedOffset() >= totalLength) {
            log.info("Offset {} is at or past the end of {} ({} bytes), nothing to import",
                start.confirmedOffset(), path, totalLength);
            return new ImportOutcome(0, start.confirmedOffset(), true);
        }

        try (var chunks = RangeByteSource.open(blobSource, path, start.confirmedOffset(), chunkSize)) {
            var extractor = extractorType.create(chunks, start.confirmedOffset());
            var pipeline = new ImportPipeline(extractor, sink, guard, batchSize, batchesPerRound);
            return pipeline.run(start, totalLength);
        }
    }
}
