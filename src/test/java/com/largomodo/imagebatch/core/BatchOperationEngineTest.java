package com.largomodo.imagebatch.core;

import com.largomodo.imagebatch.core.ScriptedExecutor.Outcome;
import com.largomodo.imagebatch.core.domain.BatchOperation;
import com.largomodo.imagebatch.core.domain.CreateOperationRequest;
import com.largomodo.imagebatch.core.domain.FailureKind;
import com.largomodo.imagebatch.core.domain.ImageStatus;
import com.largomodo.imagebatch.core.domain.OperationStatus;
import com.largomodo.imagebatch.core.domain.OperationType;
import com.largomodo.imagebatch.core.domain.TargetImage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * Lifecycle tests for BatchOperationEngine against an in-memory store.
 * <p>
 * Tests verify:
 * - End-to-end outcomes for continue-on-error and stop-on-error runs
 * - Per-operation concurrency bound and independent gates across operations
 * - State machine guards (start/pause/resume/cancel/delete/retry)
 * - Cancellation marks un-started images CANCELLED
 * - Per-image timeout, crash recovery, best-effort audit/notification/persistence
 */
class BatchOperationEngineTest {

    private static final Duration WAIT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    private InMemoryOperationStore store;
    private ScriptedExecutor executor;
    private BatchOperationEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemoryOperationStore();
        executor = new ScriptedExecutor();
        engine = newEngine(Duration.ZERO, event -> {
        }, NotificationDispatcher.NONE, OperationObserver.NONE);
    }

    @AfterEach
    void tearDown() {
        executor.releaseBlocked();
        engine.close();
    }

    private BatchOperationEngine newEngine(Duration imageTimeout, AuditSink audit,
                                           NotificationDispatcher notifier, OperationObserver observer) {
        ExecutorRegistry registry = ExecutorRegistry.builder()
                .register(OperationType.CUSTOM, executor)
                .register(OperationType.VALIDATE_IMAGES, executor)
                .build();
        EngineSettings settings = new EngineSettings(tempDir, imageTimeout, Duration.ofSeconds(5));
        return BatchOperationEngine.builder(store, registry, settings)
                .auditSink(audit)
                .notifier(notifier)
                .observer(observer)
                .build();
    }

    private static CreateOperationRequest.Builder request(String... images) {
        CreateOperationRequest.Builder builder = CreateOperationRequest.builder("batch", OperationType.CUSTOM)
                .createdBy("tester");
        for (String image : images) {
            builder.image(image);
        }
        return builder;
    }

    private BatchOperation runToEnd(CreateOperationRequest request) throws Exception {
        BatchOperation created = engine.create(request);
        engine.start(created.getId());
        return engine.awaitCompletion(created.getId(), WAIT);
    }

    private static void awaitCondition(BooleanSupplier condition, String message) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail(message);
            }
            Thread.sleep(10);
        }
    }

    private static TargetImage image(BatchOperation operation, String path) {
        return operation.getTargetImages().stream()
                .filter(i -> i.getImagePath().equals(path))
                .findFirst()
                .orElseThrow();
    }

    @Test
    void testCreate_PersistsPendingRecord() {
        BatchOperation created = engine.create(request("A.wim", "B.wim", "C.wim").build());

        assertEquals(OperationStatus.PENDING, created.getStatus());
        assertEquals(3, created.getSummary().getTotalImages());
        assertEquals(0, created.getProgressPercentage());
        assertEquals("tester", created.getCreatedBy());
        assertNotNull(created.getCreatedAt());
        assertTrue(created.getTargetImages().stream().allMatch(i -> i.getStatus() == ImageStatus.PENDING));

        BatchOperation stored = store.stored(created.getId());
        assertEquals(OperationStatus.PENDING, stored.getStatus());
        assertFalse(engine.isActive(created.getId()), "Created operation must not be active before start");
    }

    @Test
    void testCreate_UnregisteredTypeRejected() {
        CreateOperationRequest request = CreateOperationRequest.builder("backup", OperationType.BACKUP_IMAGES)
                .image("A.wim")
                .build();

        assertThrows(IllegalArgumentException.class, () -> engine.create(request));
        assertTrue(store.listAll().isEmpty(), "Rejected request must not be persisted");
    }

    @Test
    void testCreate_BlankImagePathRejected() {
        CreateOperationRequest request = request("A.wim", " ").build();

        assertThrows(IllegalArgumentException.class, () -> engine.create(request));
        assertTrue(store.listAll().isEmpty());
    }

    @Test
    void testContinueOnError_OneFailure_CompletedWithErrors() throws Exception {
        executor.outcome("B.wim", Outcome.FAIL);

        BatchOperation result = runToEnd(request("A.wim", "B.wim", "C.wim")
                .maxParallelOperations(2)
                .continueOnError(true)
                .build());

        assertEquals(OperationStatus.COMPLETED_WITH_ERRORS, result.getStatus());
        assertEquals(3, result.getSummary().getTotalImages());
        assertEquals(2, result.getSummary().getSuccessfulImages());
        assertEquals(1, result.getSummary().getFailedImages());
        assertEquals(0, result.getSummary().getSkippedImages());
        assertEquals(0, result.getSummary().getCancelledImages());
        assertEquals(66.67, result.getSummary().getSuccessRate(), 1e-9);
        assertEquals(100, result.getProgressPercentage());
        assertEquals(2048, result.getSummary().getTotalBytesProcessed());
        assertNotNull(result.getCompletedAt());

        TargetImage failed = image(result, "B.wim");
        assertEquals(ImageStatus.FAILED, failed.getStatus());
        assertEquals(FailureKind.OPERATION_FAILED, failed.getFailureKind());
        assertEquals("simulated failure for B.wim", failed.getErrorMessage());

        assertFalse(engine.isActive(result.getId()), "Finished operation must leave the active registry");
        assertEquals(OperationStatus.COMPLETED_WITH_ERRORS, store.stored(result.getId()).getStatus());
    }

    @Test
    void testStopOnError_FirstFailureAbortsFanOut() throws Exception {
        executor.outcome("A.wim", Outcome.BLOCK).outcome("B.wim", Outcome.FAIL);
        BatchOperation created = engine.create(request("A.wim", "B.wim", "C.wim")
                .maxParallelOperations(2)
                .continueOnError(false)
                .build());

        engine.start(created.getId());
        awaitCondition(() -> image(engine.get(created.getId()), "B.wim").getStatus() == ImageStatus.FAILED,
                "B never failed");
        executor.releaseBlocked();
        BatchOperation result = engine.awaitCompletion(created.getId(), WAIT);

        assertEquals(OperationStatus.FAILED, result.getStatus());
        assertNotNull(result.getErrorMessage());
        assertTrue(result.getErrorMessage().contains("B.wim"), result.getErrorMessage());
        assertTrue(result.getErrorMessage().contains("simulated failure for B.wim"), result.getErrorMessage());
        assertFalse(executor.started.contains("C.wim"), "C must not be launched after B aborted the fan-out");
        assertEquals(ImageStatus.COMPLETED, image(result, "A.wim").getStatus());
        assertEquals(ImageStatus.SKIPPED, image(result, "C.wim").getStatus());
        assertEquals(1, result.getSummary().getSkippedImages());
        assertEquals(3, result.getSummary().getTotalImages());
    }

    @Test
    void testConcurrencyBound_NeverExceedsMaxParallel() throws Exception {
        executor.workMillis(30);
        AtomicInteger maxRunningInRecord = new AtomicInteger();
        engine.close();
        engine = newEngine(Duration.ZERO, event -> {
        }, NotificationDispatcher.NONE, new OperationObserver() {
            @Override
            public void onImageStarted(BatchOperation operation, TargetImage image) {
                int running = (int) operation.getTargetImages().stream()
                        .filter(i -> i.getStatus() == ImageStatus.RUNNING)
                        .count();
                maxRunningInRecord.accumulateAndGet(running, Math::max);
            }
        });

        BatchOperation result = runToEnd(request("1.wim", "2.wim", "3.wim", "4.wim", "5.wim", "6.wim", "7.wim", "8.wim")
                .maxParallelOperations(3)
                .build());

        assertEquals(OperationStatus.COMPLETED, result.getStatus());
        assertTrue(executor.maxRunning.get() <= 3, "Executor saw " + executor.maxRunning.get() + " concurrent images");
        assertTrue(maxRunningInRecord.get() <= 3, "Record showed " + maxRunningInRecord.get() + " RUNNING images");
    }

    @Test
    void testLaunchOrder_FollowsListOrder() throws Exception {
        runToEnd(request("C.wim", "A.wim", "B.wim").maxParallelOperations(1).build());

        assertEquals(List.of("C.wim", "A.wim", "B.wim"), executor.started);
    }

    @Test
    void testConcurrencyBound_IsPerOperation() throws Exception {
        executor.byDefault(Outcome.BLOCK);
        BatchOperation first = engine.create(request("A1.wim", "A2.wim").maxParallelOperations(1).build());
        BatchOperation second = engine.create(request("B1.wim", "B2.wim").maxParallelOperations(1).build());

        engine.start(first.getId());
        engine.start(second.getId());
        awaitCondition(() -> executor.running.get() == 2, "Each operation should run one image independently");
        assertEquals(2, engine.listActive().size());

        executor.releaseBlocked();
        assertEquals(OperationStatus.COMPLETED, engine.awaitCompletion(first.getId(), WAIT).getStatus());
        assertEquals(OperationStatus.COMPLETED, engine.awaitCompletion(second.getId(), WAIT).getStatus());
        assertTrue(engine.listActive().isEmpty());
    }

    @Test
    void testManyParallelCompletions_NoLostUpdates() throws Exception {
        CreateOperationRequest.Builder builder = request().maxParallelOperations(8);
        for (int i = 0; i < 40; i++) {
            builder.image("img-" + i + ".wim");
        }

        BatchOperation result = runToEnd(builder.build());

        BatchOperation stored = store.stored(result.getId());
        assertEquals(40, stored.getSummary().getSuccessfulImages());
        assertTrue(stored.getTargetImages().stream().allMatch(i -> i.getStatus() == ImageStatus.COMPLETED),
                "Every image outcome must survive concurrent snapshot writes");
        assertEquals(100, stored.getProgressPercentage());
    }

    @Test
    void testEmptyOperation_CompletesImmediately() throws Exception {
        BatchOperation result = runToEnd(request().build());

        assertEquals(OperationStatus.COMPLETED, result.getStatus());
        assertEquals(0, result.getSummary().getTotalImages());
        assertEquals(100, result.getProgressPercentage());
    }

    @Test
    void testStartImmediately_RunsWithoutExplicitStart() throws Exception {
        BatchOperation created = engine.create(request("A.wim").startImmediately(true).build());

        assertNotEquals(OperationStatus.PENDING, created.getStatus());
        assertEquals(OperationStatus.COMPLETED, engine.awaitCompletion(created.getId(), WAIT).getStatus());
    }

    @Test
    void testStart_InvalidStates() throws Exception {
        BatchOperation done = runToEnd(request("A.wim").build());
        assertThrows(InvalidOperationStateException.class, () -> engine.start(done.getId()));

        executor.outcome("R.wim", Outcome.BLOCK);
        BatchOperation running = engine.create(request("R.wim").build());
        engine.start(running.getId());
        awaitCondition(() -> engine.get(running.getId()).getStatus() == OperationStatus.RUNNING, "Never RUNNING");
        InvalidOperationStateException e =
                assertThrows(InvalidOperationStateException.class, () -> engine.start(running.getId()));
        assertEquals(OperationStatus.RUNNING, e.getCurrentStatus());

        assertThrows(OperationNotFoundException.class, () -> engine.start("missing"));
    }

    @Test
    void testPauseResume_StopsNewLaunchesOnly() throws Exception {
        executor.byDefault(Outcome.BLOCK);
        BatchOperation created = engine.create(request("A.wim", "B.wim", "C.wim").maxParallelOperations(1).build());
        engine.start(created.getId());
        awaitCondition(() -> executor.started.size() == 1, "A never started");

        BatchOperation paused = engine.pause(created.getId());
        assertEquals(OperationStatus.PAUSED, paused.getStatus());
        assertEquals(OperationStatus.PAUSED, store.stored(created.getId()).getStatus());

        executor.releaseBlocked();
        awaitCondition(() -> image(engine.get(created.getId()), "A.wim").getStatus() == ImageStatus.COMPLETED,
                "Running image must finish while paused");
        Thread.sleep(200);
        assertEquals(1, executor.started.size(), "No image may start while paused");
        assertEquals(OperationStatus.PAUSED, engine.get(created.getId()).getStatus());

        assertEquals(OperationStatus.RUNNING, engine.resume(created.getId()).getStatus());
        BatchOperation result = engine.awaitCompletion(created.getId(), WAIT);
        assertEquals(OperationStatus.COMPLETED, result.getStatus());
        assertEquals(3, executor.started.size());
    }

    @Test
    void testStartOnActivePausedOperation_Resumes() throws Exception {
        executor.byDefault(Outcome.BLOCK);
        BatchOperation created = engine.create(request("A.wim", "B.wim").maxParallelOperations(1).build());
        engine.start(created.getId());
        awaitCondition(() -> executor.started.size() == 1, "A never started");
        engine.pause(created.getId());

        assertEquals(OperationStatus.RUNNING, engine.start(created.getId()).getStatus());
        executor.releaseBlocked();
        assertEquals(OperationStatus.COMPLETED, engine.awaitCompletion(created.getId(), WAIT).getStatus());
    }

    @Test
    void testPauseAndResume_Guards() {
        BatchOperation pending = engine.create(request("A.wim").build());

        assertThrows(InvalidOperationStateException.class, () -> engine.pause(pending.getId()));
        assertThrows(InvalidOperationStateException.class, () -> engine.resume(pending.getId()));
        assertThrows(OperationNotFoundException.class, () -> engine.pause("missing"));
    }

    @Test
    void testResume_OnRunningOperationRejected() throws Exception {
        executor.byDefault(Outcome.BLOCK);
        BatchOperation created = engine.create(request("A.wim").build());
        engine.start(created.getId());
        awaitCondition(() -> engine.get(created.getId()).getStatus() == OperationStatus.RUNNING, "Never RUNNING");

        assertThrows(InvalidOperationStateException.class, () -> engine.resume(created.getId()));
    }

    @Test
    void testCancelActive_MarksUnstartedImagesCancelled() throws Exception {
        executor.byDefault(Outcome.BLOCK);
        BatchOperation created = engine.create(request("A.wim", "B.wim", "C.wim", "D.wim")
                .maxParallelOperations(1)
                .build());
        engine.start(created.getId());
        awaitCondition(() -> executor.started.size() == 1, "A never started");

        engine.cancel(created.getId());
        BatchOperation result = engine.awaitCompletion(created.getId(), WAIT);

        assertEquals(OperationStatus.CANCELLED, result.getStatus());
        assertEquals(1, executor.started.size(), "No image may start after cancellation");
        assertTrue(result.getTargetImages().stream().allMatch(i -> i.getStatus() == ImageStatus.CANCELLED),
                "Every image must end CANCELLED: " + result.getTargetImages());
        assertEquals(4, result.getSummary().getCancelledImages());
        assertFalse(engine.isActive(created.getId()));

        // Idempotent
        BatchOperation again = engine.cancel(created.getId());
        assertEquals(OperationStatus.CANCELLED, again.getStatus());
    }

    @Test
    void testCancelPending_CancelsDirectly() {
        BatchOperation created = engine.create(request("A.wim", "B.wim").build());

        BatchOperation cancelled = engine.cancel(created.getId());

        assertEquals(OperationStatus.CANCELLED, cancelled.getStatus());
        assertEquals(2, cancelled.getSummary().getCancelledImages());
        assertNotNull(cancelled.getCompletedAt());
        assertEquals(OperationStatus.CANCELLED, store.stored(created.getId()).getStatus());
        assertDoesNotThrow(() -> engine.cancel(created.getId()), "Second cancel must be a no-op");
        assertThrows(InvalidOperationStateException.class, () -> engine.start(created.getId()));
    }

    @Test
    void testCancelFinishedOperation_Rejected() throws Exception {
        BatchOperation done = runToEnd(request("A.wim").build());

        assertThrows(InvalidOperationStateException.class, () -> engine.cancel(done.getId()));
    }

    @Test
    void testDelete_ConflictWhileActive() throws Exception {
        executor.byDefault(Outcome.BLOCK);
        BatchOperation created = engine.create(request("A.wim").build());
        engine.start(created.getId());

        assertThrows(OperationConflictException.class, () -> engine.delete(created.getId()));
        assertTrue(store.load(created.getId()).isPresent(), "Active operation must survive a rejected delete");

        engine.cancel(created.getId());
        engine.awaitCompletion(created.getId(), WAIT);
        engine.delete(created.getId());

        assertThrows(OperationNotFoundException.class, () -> engine.get(created.getId()));
        assertThrows(OperationNotFoundException.class, () -> engine.delete(created.getId()));
    }

    @Test
    void testRetryFailedImages_OnlyResetsFailed() throws Exception {
        executor.outcome("B.wim", Outcome.FAIL);
        BatchOperation first = runToEnd(request("A.wim", "B.wim", "C.wim").build());
        assertEquals(OperationStatus.COMPLETED_WITH_ERRORS, first.getStatus());
        Instant aCompletedAt = image(first, "A.wim").getCompletedAt();
        Instant cCompletedAt = image(first, "C.wim").getCompletedAt();

        executor.outcome("B.wim", Outcome.SUCCEED);
        engine.retryFailedImages(first.getId());
        BatchOperation retried = engine.awaitCompletion(first.getId(), WAIT);

        assertEquals(OperationStatus.COMPLETED, retried.getStatus());
        assertEquals(4, executor.started.size(), "Only B may run again");
        assertEquals("B.wim", executor.started.get(3));
        assertEquals(aCompletedAt, image(retried, "A.wim").getCompletedAt(), "A's outcome must be untouched");
        assertEquals(cCompletedAt, image(retried, "C.wim").getCompletedAt(), "C's outcome must be untouched");
        TargetImage b = image(retried, "B.wim");
        assertEquals(ImageStatus.COMPLETED, b.getStatus());
        assertNull(b.getErrorMessage());
        assertNull(b.getFailureKind());
        assertNull(retried.getErrorMessage());
        assertEquals(3, retried.getSummary().getSuccessfulImages());
    }

    @Test
    void testRetryFailedImages_RequiresTerminalOperation() {
        BatchOperation pending = engine.create(request("A.wim").build());

        assertThrows(InvalidOperationStateException.class, () -> engine.retryFailedImages(pending.getId()));
    }

    @Test
    void testExecutorException_RecordedOnImage() throws Exception {
        executor.outcome("B.wim", Outcome.THROW);

        BatchOperation result = runToEnd(request("A.wim", "B.wim").build());

        TargetImage b = image(result, "B.wim");
        assertEquals(ImageStatus.FAILED, b.getStatus());
        assertEquals(FailureKind.EXCEPTION, b.getFailureKind());
        assertEquals("boom B.wim", b.getErrorMessage());
        assertEquals(ImageStatus.COMPLETED, image(result, "A.wim").getStatus());
        assertEquals(OperationStatus.COMPLETED_WITH_ERRORS, result.getStatus());
    }

    @Test
    void testImageTimeout_RecordedAsTimeoutFailure() throws Exception {
        engine.close();
        engine = newEngine(Duration.ofMillis(200), event -> {
        }, NotificationDispatcher.NONE, OperationObserver.NONE);
        executor.outcome("A.wim", Outcome.BLOCK);

        BatchOperation result = runToEnd(request("A.wim", "B.wim").maxParallelOperations(1).build());

        TargetImage a = image(result, "A.wim");
        assertEquals(ImageStatus.FAILED, a.getStatus());
        assertEquals(FailureKind.TIMEOUT, a.getFailureKind());
        assertEquals("Timed out after 200 ms", a.getErrorMessage());
        assertEquals(ImageStatus.COMPLETED, image(result, "B.wim").getStatus(),
                "A timed out image must free its slot for the next one");
        assertEquals(OperationStatus.COMPLETED_WITH_ERRORS, result.getStatus());
    }

    @Test
    void testRecoverInterrupted_OrphanedRunBecomesPaused() throws Exception {
        BatchOperation orphan = new BatchOperation();
        orphan.setName("orphan");
        orphan.setType(OperationType.CUSTOM);
        orphan.setStatus(OperationStatus.RUNNING);
        orphan.setCreatedAt(Instant.parse("2024-01-01T00:00:00Z"));
        orphan.setMaxParallelOperations(1);
        TargetImage done = new TargetImage("done.wim");
        done.setStatus(ImageStatus.COMPLETED);
        done.setCompletedAt(Instant.parse("2024-01-01T00:01:00Z"));
        TargetImage inFlight = new TargetImage("inflight.wim");
        inFlight.setStatus(ImageStatus.RUNNING);
        orphan.setTargetImages(List.of(done, inFlight, new TargetImage("todo.wim")));
        store.save(orphan);

        assertEquals(1, engine.recoverInterrupted());

        BatchOperation recovered = store.stored(orphan.getId());
        assertEquals(OperationStatus.PAUSED, recovered.getStatus());
        assertEquals("Interrupted; restart to continue", recovered.getStatusMessage());
        assertEquals(ImageStatus.PENDING, image(recovered, "inflight.wim").getStatus());
        assertEquals(0, engine.recoverInterrupted(), "Recovery must be idempotent");

        engine.start(orphan.getId());
        BatchOperation result = engine.awaitCompletion(orphan.getId(), WAIT);
        assertEquals(OperationStatus.COMPLETED, result.getStatus());
        assertEquals(List.of("inflight.wim", "todo.wim"), executor.started);
    }

    @Test
    void testAudit_RecordsLifecycleActions() throws Exception {
        AuditSink audit = mock(AuditSink.class);
        engine.close();
        engine = newEngine(Duration.ZERO, audit, NotificationDispatcher.NONE, OperationObserver.NONE);

        BatchOperation result = runToEnd(request("A.wim").build());
        engine.delete(result.getId());

        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(audit, times(4)).record(captor.capture());
        assertEquals(List.of("CreateBatchOperation", "StartBatchOperation", "CompleteBatchOperation",
                        "DeleteBatchOperation"),
                captor.getAllValues().stream().map(AuditEvent::action).toList());
        assertTrue(captor.getAllValues().stream().allMatch(e -> result.getId().equals(e.resourceId())));
    }

    @Test
    void testAuditFailure_DoesNotAffectOutcome() throws Exception {
        AuditSink audit = mock(AuditSink.class);
        doThrow(new IllegalStateException("audit store offline")).when(audit).record(any());
        engine.close();
        engine = newEngine(Duration.ZERO, audit, NotificationDispatcher.NONE, OperationObserver.NONE);

        BatchOperation result = runToEnd(request("A.wim", "B.wim").build());

        assertEquals(OperationStatus.COMPLETED, result.getStatus());
        verify(audit, atLeast(3)).record(any());
    }

    @Test
    void testNotification_FailedOperation() throws Exception {
        NotificationDispatcher notifier = mock(NotificationDispatcher.class);
        engine.close();
        engine = newEngine(Duration.ZERO, event -> {
        }, notifier, OperationObserver.NONE);
        executor.outcome("A.wim", Outcome.FAIL);

        BatchOperation result = runToEnd(request("A.wim").continueOnError(false).build());

        assertEquals(OperationStatus.FAILED, result.getStatus());
        verify(notifier, timeout(2000)).dispatch(argThat(n ->
                n.eventType() == OperationNotification.EventType.BATCH_OPERATION_FAILED
                        && n.operationId().equals(result.getId())
                        && n.summary().getFailedImages() == 1));
    }

    @Test
    void testNotificationFailure_DoesNotAffectOutcome() throws Exception {
        NotificationDispatcher notifier = mock(NotificationDispatcher.class);
        doThrow(new IllegalStateException("smtp down")).when(notifier).dispatch(any());
        engine.close();
        engine = newEngine(Duration.ZERO, event -> {
        }, notifier, OperationObserver.NONE);

        BatchOperation result = runToEnd(request("A.wim").build());

        assertEquals(OperationStatus.COMPLETED, result.getStatus());
        verify(notifier, timeout(2000)).dispatch(any());
    }

    @Test
    void testSnapshotWriteFailure_RunContinuesInMemory() throws Exception {
        BatchOperation created = engine.create(request("A.wim", "B.wim").build());
        engine.start(created.getId());
        store.failSaves = true;

        BatchOperation result = engine.awaitCompletion(created.getId(), WAIT);

        assertEquals(OperationStatus.COMPLETED, result.getStatus());
        assertEquals(2, result.getSummary().getSuccessfulImages());
    }

    @Test
    void testObserver_ReceivesEveryImageAndOneFinish() throws Exception {
        List<String> finishedImages = new CopyOnWriteArrayList<>();
        AtomicInteger finishedOperations = new AtomicInteger();
        engine.close();
        engine = newEngine(Duration.ZERO, event -> {
        }, NotificationDispatcher.NONE, new OperationObserver() {
            @Override
            public void onImageFinished(BatchOperation operation, TargetImage image) {
                finishedImages.add(image.getImagePath());
            }

            @Override
            public void onOperationFinished(BatchOperation operation) {
                finishedOperations.incrementAndGet();
            }
        });

        runToEnd(request("A.wim", "B.wim", "C.wim").build());

        assertEquals(3, finishedImages.size());
        assertEquals(1, finishedOperations.get());
    }

    @Test
    void testAwaitCompletion_TimesOutWhileRunning() {
        executor.byDefault(Outcome.BLOCK);
        BatchOperation created = engine.create(request("A.wim").build());
        engine.start(created.getId());

        assertThrows(TimeoutException.class, () -> engine.awaitCompletion(created.getId(), Duration.ofMillis(100)));
    }

    @Test
    void testShutdown_CancelsActiveOperations() throws Exception {
        executor.byDefault(Outcome.BLOCK);
        BatchOperation created = engine.create(request("A.wim", "B.wim").maxParallelOperations(1).build());
        engine.start(created.getId());
        awaitCondition(() -> executor.started.size() == 1, "A never started");

        engine.close();

        BatchOperation stored = store.stored(created.getId());
        assertEquals(OperationStatus.CANCELLED, stored.getStatus());
        assertTrue(stored.getTargetImages().stream().allMatch(i -> i.getStatus() == ImageStatus.CANCELLED));
        assertThrows(BatchOperationException.class, () -> engine.create(request("X.wim").build()));
    }

    @Test
    void testSummaryTotal_NeverChanges() throws Exception {
        executor.outcome("B.wim", Outcome.FAIL);
        BatchOperation created = engine.create(request("A.wim", "B.wim", "C.wim").build());
        engine.start(created.getId());
        BatchOperation result = engine.awaitCompletion(created.getId(), WAIT);

        assertEquals(3, result.getSummary().getTotalImages());
        int accounted = result.getSummary().getSuccessfulImages() + result.getSummary().getFailedImages()
                + result.getSummary().getSkippedImages() + result.getSummary().getCancelledImages();
        assertEquals(3, accounted);
    }
}
