package io.trackimport.lambda;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.*;

class LocalImportRunnerTest {

    @TempDir
    Path tempDir;

    private static String singleLineArray(int count) {
        var sb = new StringBuilder("[");
        for (int i = 0; i < count; i++) {
            sb.append(i == 0 ? "" : ",").append("{\"name\":\"event-").append(i).append("\"}");
        }
        return sb.append("]\n").toString();
    }

    @Test
    void dryRunImportsWholeFileInOneInvocation() throws Exception {
        var file = tempDir.resolve("objects.json");
        Files.writeString(file, singleLineArray(200), StandardCharsets.UTF_8);
        var runner = new LocalImportRunner();

        int exitCode = new CommandLine(runner).execute(file.toString(), "--dry-run");

        assertEquals(0, exitCode);
        assertEquals(1, runner.getInvocations());
        assertEquals(200, runner.getObjectsSent());
    }

    @Test
    void loopsOverInvocationsWhenSlotIsShorterThanReserve() throws Exception {
        var file = tempDir.resolve("objects.json");
        Files.writeString(file, singleLineArray(2500), StandardCharsets.UTF_8);
        var runner = new LocalImportRunner();

        // every invocation stops after its first full round of 15 x 75 objects
        int exitCode = new CommandLine(runner).execute(file.toString(), "--dry-run", "--slot-seconds", "0",
            "--extractor", "streaming");

        assertEquals(0, exitCode);
        assertEquals(3, runner.getInvocations());
        assertEquals(2500, runner.getObjectsSent());
    }

    @Test
    void missingFileFails() {
        var runner = new LocalImportRunner();

        int exitCode = new CommandLine(runner).execute(tempDir.resolve("absent.json").toString(), "--dry-run");

        assertNotEquals(0, exitCode);
    }
}
