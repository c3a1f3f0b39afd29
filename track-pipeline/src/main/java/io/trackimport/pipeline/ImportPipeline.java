package io.trackimport.pipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import io.trackimport.bulkload.common.TrackObject;
import io.trackimport.pipeline.extract.ObjectExtractor;
import io.trackimport.pipeline.ir.ImportOutcome;
import io.trackimport.pipeline.ir.ResumeCursor;
import io.trackimport.pipeline.sink.ObjectSink;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;

/**
 * Moves objects from an extractor to a sink one round at a time.
 *
 * <p>It knows nothing about S3, Lambda or the track API. Each round is dispatched and awaited before the next
 * one is assembled; progress is advanced only for rounds that completed. After every full round the time
 * guard is consulted, the final round is always dispatched. The guard is not honoured while the extractor
 * still buffers objects whose bytes are confirmed only together, since stopping there would lose them.
 */
@Slf4j
public class ImportPipeline {

    private final ObjectExtractor extractor;
    private final ObjectSink sink;
    private final TimeBudgetGuard guard;
    private final int batchSize;
    private final int batchesPerRound;

    public ImportPipeline(ObjectExtractor extractor, ObjectSink sink, TimeBudgetGuard guard,
                          int batchSize, int batchesPerRound) {
        this.extractor = extractor;
        this.sink = sink;
        this.guard = guard;
        this.batchSize = batchSize;
        this.batchesPerRound = batchesPerRound;
    }

    public ImportOutcome run(ResumeCursor start, long totalLength) {
        var tracker = new ProgressTracker(start);
        var scheduler = new BatchScheduler(extractor, batchSize, batchesPerRound);

        while (true) {
            var round = scheduler.nextRound();
            log.atDebug().setMessage("Dispatching round of {} batches ({} objects), final: {}")
                .addArgument(() -> round.batches().size())
                .addArgument(round::objectCount)
                .addArgument(round::finalRound)
                .log();
            Integer sent = awaitRound(round.batches());
            tracker.advance(extractor.drainConfirmedBytes(), sent == null ? 0 : sent);

            if (round.finalRound()) {
                break;
            }
            if (guard.shouldStop()) {
                if (extractor.hasBufferedObjects()) {
                    log.debug("Time budget nearly exhausted, continuing until buffered objects are sent");
                    continue;
                }
                log.info("Time budget nearly exhausted, stopping at byte {}", tracker.getConfirmedOffset());
                break;
            }
        }

        return new ImportOutcome(tracker.getProcessedObjects(), tracker.getConfirmedOffset(),
            tracker.isFinished(totalLength));
    }

    private Integer awaitRound(List<List<TrackObject>> batches) {
        try {
            return sink.writeRound(batches).block();
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof IOException) {
                throw new UncheckedIOException("Round failed", (IOException) cause);
            }
            throw e;
        }
    }
}
