package com.largomodo.imagebatch;

import com.largomodo.imagebatch.core.domain.OperationStatus;
import com.largomodo.imagebatch.core.domain.OperationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the subcommands over a temporary store, using the
 * built-in VALIDATE_IMAGES executor so no external tools are needed.
 */
class ImageBatchTest {

    @TempDir
    Path tempDir;

    private Path storeDir;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        storeDir = tempDir.resolve("store");
    }

    @Test
    void testRunValidatesImagesAndPersistsResult() throws IOException {
        Path first = image("win10.wim", 1024);
        Path second = image("win11 pro.esd", 2048);

        int exitCode = execute("run", "-n", "validate lab images", "-t", "validate_images", "-p", "2",
                first.toString(), second.toString());

        assertEquals(0, exitCode, err.toString());
        String output = out.toString();
        assertTrue(output.contains("started"), output);
        assertTrue(output.contains("finished COMPLETED"), output);
        assertTrue(output.contains("2 successful, 0 failed"), output);
        assertEquals(1, snapshotCount());
    }

    @Test
    void testRunWithFailedImageCompletesWithErrors() throws IOException {
        Path good = image("good.wim", 10);
        Path missing = tempDir.resolve("missing.wim");

        int exitCode = execute("run", "-n", "partial", "-t", "VALIDATE_IMAGES", good.toString(), missing.toString());

        assertEquals(0, exitCode, "Partial success is still a completed run");
        assertTrue(out.toString().contains("COMPLETED_WITH_ERRORS"), out.toString());
        assertTrue(out.toString().contains("FAILED"), "Progress line for the failed image");
    }

    @Test
    void testStopOnErrorFailsRun() throws IOException {
        Path missing = tempDir.resolve("missing.wim");
        Path good = image("good.wim", 10);

        int exitCode = execute("run", "-n", "strict", "-t", "VALIDATE_IMAGES", "-p", "1", "--stop-on-error",
                missing.toString(), good.toString());

        assertEquals(1, exitCode);
        String output = out.toString();
        assertTrue(output.contains("finished FAILED"), output);
        assertTrue(output.contains("1 skipped"), output);
        assertTrue(output.contains("Error: " + missing.toAbsolutePath()), output);
    }

    @Test
    void testCreateShowListAndDelete() throws IOException {
        Path image = image("install.wim", 64);

        assertEquals(0, execute("create", "-n", "Nightly debloat", "-t", "DEBLOAT_IMAGES",
                "-c", "command=dism /Image:{image} /Cleanup-Image", "--tag", "nightly", "--index", "3",
                image.toString()));
        String operationId = out.toString().trim();
        assertFalse(operationId.isEmpty());

        assertEquals(0, execute("show", operationId));
        String details = out.toString();
        assertTrue(details.contains("Status:      PENDING"), details);
        assertTrue(details.contains("Tags:        nightly"), details);
        assertTrue(details.contains(image.toAbsolutePath() + " [3]"), details);

        assertEquals(0, execute("list", "--tag", "NIGHTLY"));
        assertTrue(out.toString().contains(operationId), out.toString());
        assertTrue(out.toString().contains("Page 1 of 1 (1 operations)"), out.toString());

        assertEquals(0, execute("list", "--type", "validate_images"));
        assertFalse(out.toString().contains(operationId));

        assertEquals(0, execute("delete", operationId));
        assertEquals("Deleted " + operationId, out.toString().trim());
        assertEquals(0, snapshotCount());
    }

    @Test
    void testCancelPendingOperation() throws IOException {
        Path image = image("install.wim", 64);
        execute("create", "-n", "later", "-t", "VALIDATE_IMAGES", image.toString());
        String operationId = out.toString().trim();

        assertEquals(0, execute("cancel", operationId));
        assertEquals(operationId + " CANCELLED", out.toString().trim());

        assertEquals(1, execute("start", operationId), "A cancelled operation cannot be started");
        assertTrue(err.toString().contains("CANCELLED"), err.toString());
    }

    @Test
    void testStartCreatedOperation() throws IOException {
        Path image = image("install.wim", 64);
        execute("create", "-n", "deferred", "-t", "VALIDATE_IMAGES", image.toString());
        String operationId = out.toString().trim();

        assertEquals(0, execute("start", operationId));
        assertTrue(out.toString().contains("finished COMPLETED"), out.toString());
    }

    @Test
    void testRetryAfterFixingImage() throws IOException {
        Path late = tempDir.resolve("late.wim");
        execute("run", "-n", "retry me", "-t", "VALIDATE_IMAGES", image("ok.wim", 1).toString(), late.toString());
        String operationId = extractId(out.toString());

        Files.write(late, new byte[32]);
        assertEquals(0, execute("retry", operationId));

        assertTrue(out.toString().contains("finished COMPLETED "), out.toString());
        assertTrue(out.toString().contains("2 successful, 0 failed"), out.toString());
    }

    @Test
    void testStatsAfterRuns() throws IOException {
        execute("run", "-n", "a", "-t", "VALIDATE_IMAGES", image("a.wim", 8).toString());
        execute("run", "-n", "b", "-t", "VALIDATE_IMAGES", tempDir.resolve("nope.wim").toString());

        assertEquals(0, execute("stats"));

        String output = out.toString();
        assertTrue(output.contains("Operations:       2"), output);
        assertTrue(output.contains("Completed:        1"), output);
        assertTrue(output.contains("Success rate:     50.00%"), output);
    }

    @Test
    void testUnknownOperationIsExecutionError() {
        assertEquals(1, execute("show", "no-such-operation"));
        assertTrue(err.toString().startsWith("ERROR: Batch operation 'no-such-operation' not found"), err.toString());
    }

    @Test
    void testMissingRequiredOptionIsUsageError() throws IOException {
        assertEquals(2, execute("run", "-t", "VALIDATE_IMAGES", image("a.wim", 1).toString()));
        assertTrue(err.toString().contains("--name"), err.toString());
    }

    @Test
    void testInvalidParallelismIsUsageError() throws IOException {
        assertEquals(2, execute("create", "-n", "x", "-t", "CUSTOM", "-p", "0", image("a.wim", 1).toString()));
        assertEquals(0, snapshotCount());
    }

    @Test
    void testNegativeTimeoutIsUsageError() throws IOException {
        assertEquals(2, execute("--image-timeout=-PT1S", "create", "-n", "x", "-t", "CUSTOM",
                image("a.wim", 1).toString()));
    }

    @Test
    void testMissingSubcommandIsUsageError() {
        assertEquals(2, execute());
    }

    @Test
    void testExitCodes() {
        assertEquals(0, ImageBatch.exitCodeFor(OperationStatus.COMPLETED));
        assertEquals(0, ImageBatch.exitCodeFor(OperationStatus.COMPLETED_WITH_ERRORS));
        assertEquals(1, ImageBatch.exitCodeFor(OperationStatus.FAILED));
        assertEquals(1, ImageBatch.exitCodeFor(OperationStatus.CANCELLED));
    }

    @Test
    void testEveryTypeHasAnExecutor() {
        for (OperationType type : OperationType.values()) {
            assertTrue(ImageBatch.defaultExecutors().find(type).isPresent(), type.name());
        }
    }

    private int execute(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        List<String> all = new ArrayList<>(List.of("--store-dir", storeDir.toString()));
        all.addAll(List.of(args));
        CommandLine cmd = ImageBatch.commandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(all.toArray(String[]::new));
    }

    private Path image(String name, int size) throws IOException {
        return Files.write(tempDir.resolve(name), new byte[size]);
    }

    private long snapshotCount() throws IOException {
        if (!Files.isDirectory(storeDir)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(storeDir)) {
            return files.filter(p -> p.toString().endsWith(".json")).count();
        }
    }

    private static String extractId(String output) {
        for (String line : output.split("\\R")) {
            if (line.startsWith("Operation ") && line.endsWith(" started")) {
                return line.substring("Operation ".length(), line.length() - " started".length());
            }
        }
        throw new AssertionError("No operation id in output:\n" + output);
    }
}
