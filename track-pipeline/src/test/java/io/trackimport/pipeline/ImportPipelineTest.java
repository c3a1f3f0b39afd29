package io.trackimport.pipeline;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import io.trackimport.bulkload.common.FatalTrackException;
import io.trackimport.io.FileBlobSource;
import io.trackimport.pipeline.extract.Chunks;
import io.trackimport.pipeline.extract.ExtractorType;
import io.trackimport.pipeline.extract.LineObjectExtractor;
import io.trackimport.pipeline.extract.StreamingObjectExtractor;
import io.trackimport.pipeline.ir.ImportOutcome;
import io.trackimport.pipeline.ir.ResumeCursor;
import io.trackimport.pipeline.sink.CollectingObjectSink;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the pipeline over real files with a collecting sink in place of the track API.
 */
class ImportPipelineTest {

    private static final String FILE_NAME = "objects.json";

    @TempDir
    Path tempDir;

    private long write(String content) throws IOException {
        Files.writeString(tempDir.resolve(FILE_NAME), content, StandardCharsets.UTF_8);
        return Files.size(tempDir.resolve(FILE_NAME));
    }

    private static String onePerLine(int count) {
        return IntStream.range(0, count)
            .mapToObj(i -> "  {\"external_id\":\"user-" + i + "\",\"name\":\"event\"}")
            .collect(Collectors.joining(",\n", "[\n", "\n]\n"));
    }

    private BlobImportJob job(CollectingObjectSink sink, ExtractorType type, int batchesPerRound) {
        return BlobImportJob.builder()
            .blobSource(new FileBlobSource(tempDir))
            .sink(sink)
            .extractorType(type)
            .batchesPerRound(batchesPerRound)
            .chunkSize(64)
            .build();
    }

    @ParameterizedTest
    @EnumSource(ExtractorType.class)
    void singleLineArrayOfTwoHundredObjects(ExtractorType type) throws IOException {
        long length = write(Chunks.singleLineArray(200));
        var sink = new CollectingObjectSink();

        var outcome = job(sink, type, 2).run(FILE_NAME, ResumeCursor.START, TimeBudgetGuard.unlimited());

        assertEquals(new ImportOutcome(200, length, true), outcome);
        assertEquals(List.of(75, 75, 50), sink.getBatchSizes());
        assertEquals(List.of(150, 50), sink.getRoundSizes());
        assertEquals(0, sink.getCollectedObjects().get(0).getFields().get("a").asInt());
        assertEquals(199, sink.getCollectedObjects().get(199).getFields().get("a").asInt());
    }

    @ParameterizedTest
    @EnumSource(ExtractorType.class)
    void resumesAcrossInvocationsWithoutGapsOrDuplicates(ExtractorType type) throws IOException {
        int count = 400;
        long length = write(onePerLine(count));
        var sink = new CollectingObjectSink();
        var job = job(sink, type, 1);
        var stopAfterEveryRound = new TimeBudgetGuard(() -> Duration.ZERO, Duration.ofMinutes(3));

        var cursor = ResumeCursor.START;
        List<ImportOutcome> outcomes = new ArrayList<>();
        ImportOutcome outcome;
        do {
            outcome = job.run(FILE_NAME, cursor, stopAfterEveryRound);
            outcomes.add(outcome);
            assertTrue(outcome.bytesRead() >= cursor.confirmedOffset());
            cursor = new ResumeCursor(outcome.bytesRead());
        } while (!outcome.finished());

        // 5 full rounds of 75 plus a final round of 25
        assertEquals(6, outcomes.size());
        assertEquals(length, outcome.bytesRead());
        var ids = sink.getCollectedObjects().stream()
            .map(o -> o.getFields().get("external_id").asText())
            .collect(Collectors.toList());
        assertEquals(IntStream.range(0, count).mapToObj(i -> "user-" + i).collect(Collectors.toList()), ids);
    }

    @Test
    void rerunningFromTheSameCursorGivesTheSameOutcome() throws IOException {
        write(onePerLine(100));
        var guard = new TimeBudgetGuard(() -> Duration.ZERO, Duration.ofMinutes(3));
        var cursor = new ResumeCursor(2);

        var first = job(new CollectingObjectSink(), ExtractorType.STREAMING, 1).run(FILE_NAME, cursor, guard);
        var second = job(new CollectingObjectSink(), ExtractorType.STREAMING, 1).run(FILE_NAME, cursor, guard);

        assertEquals(first, second);
        assertEquals(75, first.objectsSent());
        assertFalse(first.finished());
    }

    @Test
    void offsetAtEndOfBlobIsFinishedWithoutReading() throws IOException {
        long length = write(onePerLine(3));
        var sink = new CollectingObjectSink();

        var outcome = job(sink, ExtractorType.STREAMING, 15)
            .run(FILE_NAME, new ResumeCursor(length), TimeBudgetGuard.unlimited());

        assertEquals(new ImportOutcome(0, length, true), outcome);
        assertTrue(sink.getRoundSizes().isEmpty());
    }

    @Test
    void onlyClosingBracketLeftIsTreatedAsFinished() throws IOException {
        var content = onePerLine(3);
        long length = write(content);

        var outcome = job(new CollectingObjectSink(), ExtractorType.STREAMING, 15)
            .run(FILE_NAME, new ResumeCursor(content.lastIndexOf('\n', content.length() - 2)), TimeBudgetGuard.unlimited());

        assertEquals(0, outcome.objectsSent());
        assertEquals(length, outcome.bytesRead());
        assertTrue(outcome.finished());
    }

    @Test
    void failedRoundPropagatesAndDoesNotAdvance() {
        var data = Chunks.singleLineArray(10);
        var extractor = new StreamingObjectExtractor(Chunks.of(data, 8), 0);
        var pipeline = new ImportPipeline(extractor,
            batches -> Mono.error(new FatalTrackException(400, "Invalid batch")),
            TimeBudgetGuard.unlimited(), 75, 15);

        assertThrows(FatalTrackException.class, () -> pipeline.run(ResumeCursor.START, data.length()));
    }

    @Test
    void ioFailureInRoundSurfacesAsUncheckedIoException() {
        var data = Chunks.singleLineArray(10);
        var extractor = new StreamingObjectExtractor(Chunks.of(data, 8), 0);
        var pipeline = new ImportPipeline(extractor,
            batches -> Mono.error(new IOException("Connection reset")),
            TimeBudgetGuard.unlimited(), 75, 15);

        var thrown = assertThrows(UncheckedIOException.class, () -> pipeline.run(ResumeCursor.START, data.length()));
        assertEquals("Connection reset", thrown.getCause().getMessage());
    }

    @Test
    void lineArrayLargerThanOneRoundIsSentWholeDespiteExpiredBudget() {
        var data = Chunks.singleLineArray(400);
        var sink = new CollectingObjectSink();
        var stopAfterEveryRound = new TimeBudgetGuard(() -> Duration.ZERO, Duration.ofMinutes(3));
        var pipeline = new ImportPipeline(new LineObjectExtractor(Chunks.of(data, 64), 0),
            sink, stopAfterEveryRound, 75, 1);

        var outcome = pipeline.run(ResumeCursor.START, data.length());

        assertEquals(new ImportOutcome(400, data.length(), true), outcome);
        assertEquals(List.of(75, 75, 75, 75, 75, 25), sink.getRoundSizes());
        assertEquals(399, sink.getCollectedObjects().get(399).getFields().get("a").asInt());
    }

    @Test
    void resumedLineArrayLargerThanOneRoundFinishesInOneInvocation() throws IOException {
        long length = write("\n" + Chunks.singleLineArray(400));
        var sink = new CollectingObjectSink();
        var stopAfterEveryRound = new TimeBudgetGuard(() -> Duration.ZERO, Duration.ofMinutes(3));

        var outcome = job(sink, ExtractorType.LINE, 1).run(FILE_NAME, new ResumeCursor(1), stopAfterEveryRound);

        assertEquals(new ImportOutcome(400, length, true), outcome);
        assertEquals(400, sink.getCollectedObjects().size());
    }

    @Test
    void lineExtractorStillStopsBetweenArrayLines() throws IOException {
        var firstLine = Chunks.singleLineArray(150);
        write(firstLine + Chunks.singleLineArray(150));
        var sink = new CollectingObjectSink();
        var stopAfterEveryRound = new TimeBudgetGuard(() -> Duration.ZERO, Duration.ofMinutes(3));

        var outcome = job(sink, ExtractorType.LINE, 1).run(FILE_NAME, ResumeCursor.START, stopAfterEveryRound);

        assertEquals(new ImportOutcome(150, firstLine.length(), false), outcome);
    }

    @Test
    void truncatedBlobStopsBeforeTheIncompleteObject() throws IOException {
        var full = onePerLine(5);
        var truncated = full.substring(0, full.indexOf("user-4") + 3);
        long length = write(truncated);
        var sink = new CollectingObjectSink();

        var outcome = job(sink, ExtractorType.STREAMING, 15)
            .run(FILE_NAME, ResumeCursor.START, TimeBudgetGuard.unlimited());

        assertEquals(4, outcome.objectsSent());
        assertTrue(outcome.bytesRead() < length);
        assertFalse(outcome.finished());
        assertEquals('{', full.charAt((int) outcome.bytesRead()));
    }
}
