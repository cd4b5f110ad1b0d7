package com.largomodo.imagebatch.core;

import com.largomodo.imagebatch.core.domain.BatchOperation;
import com.largomodo.imagebatch.core.domain.CreateOperationRequest;
import com.largomodo.imagebatch.core.domain.FailureKind;
import com.largomodo.imagebatch.core.domain.ImageStatus;
import com.largomodo.imagebatch.core.domain.OperationStatus;
import com.largomodo.imagebatch.core.domain.TargetImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Batch operation state machine driver.
 * <p>
 * Lifecycle: {@code PENDING -> QUEUED -> RUNNING <-> PAUSED -> terminal}. Each started
 * operation gets its own driver task on the supervisor pool. The driver launches
 * pending images in list order through the operation's {@link ConcurrencyGate},
 * waits for every launched image to finish, then derives the final status with
 * the {@link ProgressAggregator}, persists it and leaves the {@link ActiveRegistry}.
 * <p>
 * Error policy:
 * <ul>
 *   <li>Invalid requests (unknown id, wrong state, deleting active work) throw
 *       {@link BatchOperationException} subclasses and change nothing.</li>
 *   <li>Image failures are recorded on the image. With continue-on-error disabled the
 *       first failure stops further launches and the operation ends FAILED.</li>
 *   <li>Orchestration failures end the operation FAILED with its error message.</li>
 *   <li>Snapshot write, audit, notification and observer failures are logged only.</li>
 * </ul>
 * Cancellation is cooperative: it stops new launches and is passed to executors
 * through their {@link CancellationToken}; images that never started are marked
 * CANCELLED when the driver drains, and the operation becomes CANCELLED at that point.
 */
public class BatchOperationEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchOperationEngine.class);

    private final OperationStore store;
    private final ExecutorRegistry executors;
    private final EngineSettings settings;
    private final AuditSink auditSink;
    private final NotificationDispatcher notifier;
    private final OperationObserver observer;
    private final Clock clock;

    private final ActiveRegistry registry = new ActiveRegistry();
    private final ExecutorService supervisor;
    private final ExecutorService workers;
    private final ExecutorService notifications;
    // Serializes lifecycle requests (start/pause/resume/cancel/delete/retry)
    private final Object lifecycleLock = new Object();
    private volatile boolean closed;

    private BatchOperationEngine(Builder builder) {
        this.store = builder.store;
        this.executors = builder.executors;
        this.settings = builder.settings;
        this.auditSink = builder.auditSink;
        this.notifier = builder.notifier;
        this.observer = builder.observer;
        this.clock = builder.clock;
        this.supervisor = Executors.newCachedThreadPool(namedThreads("batch-driver"));
        this.workers = Executors.newCachedThreadPool(namedThreads("batch-worker"));
        this.notifications = Executors.newSingleThreadExecutor(namedThreads("batch-notifier"));
    }

    public static Builder builder(OperationStore store, ExecutorRegistry executors, EngineSettings settings) {
        return new Builder(store, executors, settings);
    }

    /**
     * Persist a new PENDING operation and optionally start it.
     *
     * @return snapshot of the created (or started) operation
     * @throws IllegalArgumentException if no executor handles the type or an image path is blank
     * @throws OperationStoreException  if the record cannot be written
     */
    public BatchOperation create(CreateOperationRequest request) {
        ensureOpen();
        executors.resolve(request.type());

        BatchOperation operation = new BatchOperation();
        operation.setName(request.name());
        operation.setDescription(request.description());
        operation.setType(request.type());
        operation.setCreatedAt(clock.instant());
        operation.setCreatedBy(request.createdBy());
        List<TargetImage> images = new ArrayList<>();
        for (TargetImage source : request.targetImages()) {
            if (source.getImagePath() == null || source.getImagePath().isBlank()) {
                throw new IllegalArgumentException("Target image path must not be blank");
            }
            TargetImage image = new TargetImage(source.getImagePath(), source.getImageIndex());
            image.setMetadata(new LinkedHashMap<>(source.getMetadata()));
            images.add(image);
        }
        operation.setTargetImages(images);
        operation.setConfiguration(new LinkedHashMap<>(request.configuration()));
        operation.setTemplateId(request.templateId());
        operation.setProfileId(request.profileId());
        operation.setPriority(request.priority());
        operation.setMaxParallelOperations(request.maxParallelOperations());
        operation.setContinueOnError(request.continueOnError());
        operation.setTags(new ArrayList<>(request.tags()));
        operation.setStatusMessage("Created");
        ProgressAggregator.refresh(operation);

        saveOrThrow(operation, "Failed to create batch operation");

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("BatchOperationId", operation.getId());
        metadata.put("Type", operation.getType().name());
        metadata.put("ImageCount", images.size());
        audit(new AuditEvent(AuditCategory.SYSTEM, "CreateBatchOperation", operation.getId(),
                "Created batch operation '" + operation.getName() + "' with " + images.size() + " images",
                0, true, metadata));
        log.info("Batch operation created: {} '{}' ({}, {} images)",
                operation.getId(), operation.getName(), operation.getType(), images.size());

        if (request.startImmediately()) {
            return start(operation.getId());
        }
        return operation.copy();
    }

    /**
     * Current state: live snapshot for active operations, stored snapshot otherwise.
     *
     * @throws OperationNotFoundException if the id is unknown
     */
    public BatchOperation get(String operationId) {
        Optional<OperationRun> active = registry.get(operationId);
        if (active.isPresent()) {
            return active.get().snapshot();
        }
        return loadOrThrow(operationId);
    }

    /**
     * Start a PENDING or PAUSED operation. Starting an active PAUSED operation resumes it.
     * <p>
     * Images left RUNNING by an interrupted process are reset to PENDING first.
     *
     * @return snapshot in QUEUED (or RUNNING when resuming)
     * @throws InvalidOperationStateException if the operation is in any other state
     */
    public BatchOperation start(String operationId) {
        synchronized (lifecycleLock) {
            ensureOpen();
            Optional<OperationRun> active = registry.get(operationId);
            if (active.isPresent()) {
                OperationRun run = active.get();
                if (run.status() == OperationStatus.PAUSED) {
                    return resume(operationId);
                }
                throw new InvalidOperationStateException(operationId, run.status(), "started");
            }

            BatchOperation operation = loadOrThrow(operationId);
            OperationStatus status = operation.getStatus();
            if (status != OperationStatus.PENDING && status != OperationStatus.PAUSED) {
                throw new InvalidOperationStateException(operationId, status, "started");
            }
            ImageOperationExecutor executor = executors.resolve(operation.getType());

            for (TargetImage image : operation.getTargetImages()) {
                if (image.getStatus() == ImageStatus.RUNNING) {
                    image.resetToPending();
                }
            }
            operation.setStatus(OperationStatus.QUEUED);
            operation.setStatusMessage("Queued");
            operation.setStartedAt(clock.instant());
            operation.setCompletedAt(null);
            operation.setDurationMs(0);
            operation.setErrorMessage(null);
            ProgressAggregator.refresh(operation);

            OperationRun run = new OperationRun(operation, store);
            BatchOperation queued = run.update(op -> {
            });
            registry.register(run);
            audit(AuditEvent.success("StartBatchOperation", operationId,
                    "Started batch operation '" + operation.getName() + "'"));
            try {
                supervisor.submit(() -> drive(run, executor));
            } catch (RejectedExecutionException e) {
                registry.unregister(operationId);
                throw new BatchOperationException("Engine is shutting down, cannot start " + operationId, e);
            }
            log.info("Batch operation queued: {}", operationId);
            return queued;
        }
    }

    /**
     * Stop launching new images. Images already running continue to completion.
     *
     * @throws InvalidOperationStateException if the operation is not RUNNING
     */
    public BatchOperation pause(String operationId) {
        synchronized (lifecycleLock) {
            OperationRun run = activeOrThrow(operationId, "paused");
            run.gate().pause();
            if (!run.transition(OperationStatus.RUNNING, OperationStatus.PAUSED, "Paused")) {
                run.gate().resume();
                throw new InvalidOperationStateException(operationId, run.status(), "paused");
            }
            log.info("Paused batch operation: {}", operationId);
            return run.snapshot();
        }
    }

    /**
     * Allow launches again after {@link #pause(String)}.
     *
     * @throws InvalidOperationStateException if the operation is not PAUSED
     */
    public BatchOperation resume(String operationId) {
        synchronized (lifecycleLock) {
            OperationRun run = activeOrThrow(operationId, "resumed");
            if (!run.transition(OperationStatus.PAUSED, OperationStatus.RUNNING, "Running")) {
                throw new InvalidOperationStateException(operationId, run.status(), "resumed");
            }
            run.gate().resume();
            log.info("Resumed batch operation: {}", operationId);
            return run.snapshot();
        }
    }

    /**
     * Cancel a non-terminal operation. Idempotent: cancelling a CANCELLED operation
     * (or one already draining after a cancel) is a no-op.
     * <p>
     * Active operations finish as CANCELLED once in-flight images drain; use
     * {@link #awaitCompletion(String, Duration)} to wait for that. Inactive ones
     * (PENDING, or left over by an interrupted process) are cancelled on the spot.
     *
     * @throws InvalidOperationStateException if the operation already finished otherwise
     */
    public BatchOperation cancel(String operationId) {
        OperationRun run;
        synchronized (lifecycleLock) {
            run = registry.get(operationId).orElse(null);
            if (run == null) {
                return cancelInactive(operationId);
            }
        }
        // Token listeners call into executors; they run without the lifecycle lock
        if (run.token().cancel()) {
            run.updateIfRunning(op -> op.setStatusMessage("Cancellation requested"));
            audit(AuditEvent.success("CancelBatchOperation", operationId, "Cancelled batch operation"));
            log.info("Cancellation requested for batch operation: {}", operationId);
        }
        return run.snapshot();
    }

    private BatchOperation cancelInactive(String operationId) {
        BatchOperation operation = loadOrThrow(operationId);
        if (operation.getStatus() == OperationStatus.CANCELLED) {
            return operation;
        }
        if (operation.getStatus().isTerminal()) {
            throw new InvalidOperationStateException(operationId, operation.getStatus(), "cancelled");
        }
        for (TargetImage image : operation.getTargetImages()) {
            if (!image.getStatus().isTerminal()) {
                image.setStatus(ImageStatus.CANCELLED);
                image.setStatusMessage("Cancelled before start");
            }
        }
        ProgressAggregator.refresh(operation);
        operation.setStatus(OperationStatus.CANCELLED);
        operation.setStatusMessage("Cancelled");
        operation.setCompletedAt(clock.instant());
        saveOrThrow(operation, "Failed to cancel batch operation");

        audit(AuditEvent.success("CancelBatchOperation", operationId, "Cancelled batch operation"));
        log.info("Cancelled inactive batch operation: {}", operationId);
        return operation.copy();
    }

    /**
     * Remove a stored operation.
     *
     * @throws OperationConflictException while the operation is active
     * @throws OperationNotFoundException if nothing is stored under the id
     */
    public void delete(String operationId) {
        synchronized (lifecycleLock) {
            if (registry.isActive(operationId)) {
                throw new OperationConflictException(
                        "Cannot delete active batch operation '" + operationId + "'. Cancel it first.");
            }
            boolean removed;
            try {
                removed = store.delete(operationId);
            } catch (IOException e) {
                throw new OperationStoreException("Failed to delete batch operation " + operationId, e);
            }
            if (!removed) {
                throw new OperationNotFoundException(operationId);
            }
            audit(AuditEvent.success("DeleteBatchOperation", operationId, "Deleted batch operation"));
            log.info("Deleted batch operation: {}", operationId);
        }
    }

    /**
     * Re-run only the FAILED images of a finished operation. COMPLETED, SKIPPED and
     * CANCELLED images keep their recorded outcome.
     *
     * @return snapshot of the restarted operation
     * @throws InvalidOperationStateException if the operation has not finished
     */
    public BatchOperation retryFailedImages(String operationId) {
        synchronized (lifecycleLock) {
            ensureOpen();
            Optional<OperationRun> active = registry.get(operationId);
            if (active.isPresent()) {
                throw new InvalidOperationStateException(operationId, active.get().status(), "retried");
            }
            BatchOperation operation = loadOrThrow(operationId);
            if (!operation.getStatus().isTerminal()) {
                throw new InvalidOperationStateException(operationId, operation.getStatus(), "retried");
            }
            int reset = 0;
            for (TargetImage image : operation.getTargetImages()) {
                if (image.getStatus() == ImageStatus.FAILED) {
                    image.resetToPending();
                    reset++;
                }
            }
            operation.setStatus(OperationStatus.PENDING);
            operation.setStatusMessage("Retrying " + reset + " failed images");
            operation.setErrorMessage(null);
            operation.setCompletedAt(null);
            ProgressAggregator.refresh(operation);
            saveOrThrow(operation, "Failed to reset batch operation for retry");

            log.info("Retrying {} failed images of batch operation {}", reset, operationId);
            return start(operationId);
        }
    }

    /**
     * Snapshots of every QUEUED, RUNNING or PAUSED operation in this process.
     */
    public List<BatchOperation> listActive() {
        return registry.runs().stream().map(OperationRun::snapshot).toList();
    }

    public boolean isActive(String operationId) {
        return registry.isActive(operationId);
    }

    /**
     * Wait for an active operation to reach a terminal status.
     *
     * @return final snapshot; the stored snapshot if the operation is not active
     * @throws TimeoutException     if it is still active after {@code timeout}
     * @throws InterruptedException if interrupted while waiting
     */
    public BatchOperation awaitCompletion(String operationId, Duration timeout)
            throws InterruptedException, TimeoutException {
        Optional<OperationRun> active = registry.get(operationId);
        if (active.isEmpty()) {
            return loadOrThrow(operationId);
        }
        try {
            return active.get().completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new BatchOperationException("Driver for " + operationId + " failed", e.getCause());
        }
    }

    /**
     * Mark operations that a previous process left QUEUED or RUNNING as PAUSED, so
     * they can be restarted with {@link #start(String)}. Images caught RUNNING go back
     * to PENDING.
     *
     * @return number of operations recovered
     */
    public int recoverInterrupted() {
        synchronized (lifecycleLock) {
            List<BatchOperation> stored;
            try {
                stored = store.listAll();
            } catch (IOException e) {
                throw new OperationStoreException("Failed to scan stored batch operations", e);
            }
            int recovered = 0;
            for (BatchOperation operation : stored) {
                OperationStatus status = operation.getStatus();
                if ((status != OperationStatus.QUEUED && status != OperationStatus.RUNNING)
                        || registry.isActive(operation.getId())) {
                    continue;
                }
                for (TargetImage image : operation.getTargetImages()) {
                    if (image.getStatus() == ImageStatus.RUNNING) {
                        image.resetToPending();
                    }
                }
                ProgressAggregator.refresh(operation);
                operation.setStatus(OperationStatus.PAUSED);
                operation.setStatusMessage("Interrupted; restart to continue");
                try {
                    store.save(operation);
                    recovered++;
                    log.warn("Recovered interrupted batch operation {} as PAUSED", operation.getId());
                } catch (IOException e) {
                    log.warn("Failed to recover batch operation {}: {}", operation.getId(), e.getMessage());
                }
            }
            return recovered;
        }
    }

    /**
     * Shut down with the configured grace period.
     */
    @Override
    public void close() {
        shutdown(settings.shutdownGrace());
    }

    /**
     * Cancel all active operations, wait up to {@code grace} for their drivers to
     * drain, then force shutdown. Standard two-phase shutdown. Later calls are no-ops.
     */
    public void shutdown(Duration grace) {
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        List<OperationRun> runs = registry.runs();
        if (!runs.isEmpty()) {
            log.info("Shutting down: cancelling {} active batch operation(s)", runs.size());
        }
        runs.forEach(run -> run.token().cancel());

        supervisor.shutdown();
        try {
            if (!supervisor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Batch drivers did not drain within {}, forcing shutdown", grace);
                supervisor.shutdownNow();
            }
        } catch (InterruptedException e) {
            supervisor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        workers.shutdownNow();
        notifications.shutdown();
        try {
            if (!notifications.awaitTermination(5, TimeUnit.SECONDS)) {
                notifications.shutdownNow();
            }
        } catch (InterruptedException e) {
            notifications.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------------------------------------------------------------------
    // Driver
    // ---------------------------------------------------------------------

    private void drive(OperationRun run, ImageOperationExecutor executor) {
        MDC.put("operation", run.id());
        long startNanos = System.nanoTime();
        List<CompletableFuture<Void>> launched = new ArrayList<>();
        Throwable orchestrationError = null;
        try {
            run.transition(OperationStatus.QUEUED, OperationStatus.RUNNING, "Running");
            log.info("Executing batch operation: {}", run.id());

            List<Integer> pending = pendingIndexes(run.snapshot());
            fanOut:
            for (int index : pending) {
                while (true) {
                    if (run.token().isCancelled() || run.isAborted()) {
                        break fanOut;
                    }
                    if (!run.gate().acquire(run.token())) {
                        break fanOut;
                    }
                    // A failure may have landed while waiting for the slot
                    if (run.isAborted()) {
                        run.gate().release();
                        break fanOut;
                    }
                    CompletableFuture<Void> future = launch(run, executor, index);
                    if (future != null) {
                        launched.add(future);
                        break;
                    }
                    // Paused after the slot was granted; wait for resume
                    run.gate().release();
                }
            }
            awaitAll(launched);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!run.token().isCancelled()) {
                orchestrationError = e;
            }
        } catch (RuntimeException e) {
            if (!run.token().isCancelled()) {
                log.error("Batch operation orchestration failed: {}", run.id(), e);
                orchestrationError = e;
                run.token().cancel();
            }
            try {
                awaitAll(launched);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        } finally {
            try {
                finish(run, orchestrationError, Duration.ofNanos(System.nanoTime() - startNanos));
            } finally {
                MDC.remove("operation");
            }
        }
    }

    /**
     * Mark the image RUNNING and hand it to a worker. The caller holds a gate slot,
     * which the returned stage releases.
     *
     * @return null without launching if the operation was paused meanwhile; the slot stays with the caller
     */
    private CompletableFuture<Void> launch(OperationRun run, ImageOperationExecutor executor, int index) {
        BatchOperation started = run.updateUnlessPaused(op -> {
            TargetImage image = op.getTargetImages().get(index);
            image.setStatus(ImageStatus.RUNNING);
            image.setStatusMessage("Running");
            image.setStartedAt(clock.instant());
        });
        if (started == null) {
            return null;
        }
        CancellationToken imageToken = run.token().child();
        TargetImage image = started.getTargetImages().get(index);
        notifyObserver(() -> observer.onImageStarted(started, image));

        ImageOperationRequest request = new ImageOperationRequest(started.getId(), started.getType(),
                image.getImagePath(), image.getImageIndex(), started.getConfiguration(),
                started.getTemplateId(), started.getProfileId());
        long startNanos = System.nanoTime();

        CompletableFuture<ImageOperationResult> call;
        try {
            call = CompletableFuture.supplyAsync(() -> invoke(run.id(), executor, request, imageToken), workers);
        } catch (RejectedExecutionException e) {
            imageToken.detach();
            run.gate().release();
            throw e;
        }
        if (settings.hasImageTimeout()) {
            call = call.orTimeout(settings.imageTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }
        return call
                .handle((result, error) -> {
                    // May run on the driver thread when the call finished before this stage was attached
                    Map<String, String> previous = MDC.getCopyOfContextMap();
                    MDC.put("operation", run.id());
                    MDC.put("image", fileName(request.imagePath()));
                    try {
                        recordOutcome(run, index, result, unwrap(error), imageToken,
                                Duration.ofNanos(System.nanoTime() - startNanos));
                    } catch (RuntimeException e) {
                        log.error("Failed to record outcome for {}", request.imagePath(), e);
                    } finally {
                        imageToken.detach();
                        run.gate().release();
                        if (previous == null) {
                            MDC.clear();
                        } else {
                            MDC.setContextMap(previous);
                        }
                    }
                    return null;
                });
    }

    private ImageOperationResult invoke(String operationId, ImageOperationExecutor executor,
                                        ImageOperationRequest request, CancellationToken token) {
        MDC.put("operation", operationId);
        MDC.put("image", fileName(request.imagePath()));
        try {
            log.info("Processing image: {}", request.imagePath());
            token.throwIfCancelled();
            return executor.execute(request, token);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        } finally {
            MDC.clear();
        }
    }

    private void recordOutcome(OperationRun run, int index, ImageOperationResult result, Throwable error,
                               CancellationToken imageToken, Duration elapsed) {
        boolean timedOut = error instanceof TimeoutException;
        if (timedOut) {
            // Ask the executor to stop; its late result is discarded
            imageToken.cancel();
        }
        BatchOperation after = run.updateIfRunning(op -> {
            TargetImage image = op.getTargetImages().get(index);
            image.setCompletedAt(clock.instant());
            image.setDurationMs(elapsed.toMillis());

            if (error == null && result != null && result.success()) {
                image.setStatus(ImageStatus.COMPLETED);
                image.setProgressPercentage(100);
                image.setBytesProcessed(result.bytesProcessed());
                image.setStatusMessage("Completed");
            } else if (run.token().isCancelled() && !timedOut) {
                image.setStatus(ImageStatus.CANCELLED);
                image.setStatusMessage("Cancelled");
            } else {
                FailureKind kind;
                String message;
                if (timedOut) {
                    kind = FailureKind.TIMEOUT;
                    message = "Timed out after " + settings.imageTimeout().toMillis() + " ms";
                } else if (error != null) {
                    kind = FailureKind.EXCEPTION;
                    message = describe(error);
                } else if (result == null) {
                    kind = FailureKind.OPERATION_FAILED;
                    message = "Executor returned no result";
                } else {
                    kind = FailureKind.OPERATION_FAILED;
                    message = result.errorMessage() == null ? "Image operation failed" : result.errorMessage();
                }
                image.setStatus(ImageStatus.FAILED);
                image.setFailureKind(kind);
                image.setErrorMessage(message);
                image.setStatusMessage("Failed");
                if (!op.isContinueOnError()) {
                    // Set before the slot is released so the driver sees it on its next launch
                    run.abort(image.getImagePath() + ": " + message);
                }
            }
            ProgressAggregator.refresh(op);
        });
        if (after == null) {
            log.warn("Discarding late outcome for image #{} of finished operation {}", index, run.id());
            return;
        }
        TargetImage image = after.getTargetImages().get(index);
        if (image.getStatus() == ImageStatus.FAILED) {
            log.error("FAILED: {} - {}", image.getImagePath(), image.getErrorMessage());
        } else {
            log.info("Image {}: {} ({} ms)", image.getStatus(), image.getImagePath(), image.getDurationMs());
        }
        notifyObserver(() -> observer.onImageFinished(after, image));
    }

    private void finish(OperationRun run, Throwable orchestrationError, Duration elapsed) {
        boolean cancelled = run.token().isCancelled() && orchestrationError == null;
        BatchOperation result = run.finish(op -> {
            for (TargetImage image : op.getTargetImages()) {
                if (image.getStatus() == ImageStatus.RUNNING) {
                    // Only reachable when the driver was interrupted while images were in flight
                    image.setStatus(ImageStatus.CANCELLED);
                    image.setStatusMessage("Abandoned at shutdown");
                    image.setCompletedAt(clock.instant());
                } else if (image.getStatus() == ImageStatus.PENDING) {
                    image.setStatus(cancelled ? ImageStatus.CANCELLED : ImageStatus.SKIPPED);
                    image.setStatusMessage(cancelled ? "Cancelled before start" : "Not attempted");
                }
            }
            ProgressAggregator.refresh(op);
            if (op.getTargetImages().isEmpty()) {
                op.setProgressPercentage(100);
            }

            if (cancelled) {
                op.setStatus(OperationStatus.CANCELLED);
                op.setStatusMessage("Cancelled");
            } else if (orchestrationError != null) {
                op.setStatus(OperationStatus.FAILED);
                op.setErrorMessage(describe(orchestrationError));
                op.setStatusMessage("Failed");
            } else {
                OperationStatus outcome = ProgressAggregator.outcome(op.getTargetImages(), op.isContinueOnError());
                op.setStatus(outcome);
                if (outcome == OperationStatus.FAILED) {
                    op.setErrorMessage(run.abortReason());
                }
                op.setStatusMessage(op.getSummary().getSuccessfulImages() + "/" + op.getSummary().getTotalImages()
                        + " images successful");
            }
            op.setCompletedAt(clock.instant());
            op.setDurationMs(elapsed.toMillis());
        });

        registry.unregister(run.id());
        log.info("Batch operation finished: {} - {} ({})", result.getId(), result.getStatus(), result.getSummary());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("SuccessfulImages", result.getSummary().getSuccessfulImages());
        metadata.put("FailedImages", result.getSummary().getFailedImages());
        metadata.put("TotalImages", result.getSummary().getTotalImages());
        metadata.put("Status", result.getStatus().name());
        boolean failed = result.getStatus() == OperationStatus.FAILED;
        audit(new AuditEvent(AuditCategory.SYSTEM,
                failed ? "ExecuteBatchOperation" : "CompleteBatchOperation",
                result.getId(),
                failed ? String.valueOf(result.getErrorMessage())
                        : "Batch operation completed: " + result.getSummary().getSuccessfulImages() + "/"
                        + result.getSummary().getTotalImages() + " successful",
                result.getDurationMs(), !failed, metadata));

        dispatch(new OperationNotification(
                failed ? OperationNotification.EventType.BATCH_OPERATION_FAILED
                        : OperationNotification.EventType.BATCH_OPERATION_COMPLETED,
                result.getId(), result.getName(), result.getStatus(), result.getSummary().copy(),
                result.getErrorMessage()));
        notifyObserver(() -> observer.onOperationFinished(result));
        run.completion().complete(result);
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private static List<Integer> pendingIndexes(BatchOperation operation) {
        List<Integer> indexes = new ArrayList<>();
        List<TargetImage> images = operation.getTargetImages();
        for (int i = 0; i < images.size(); i++) {
            if (images.get(i).getStatus() == ImageStatus.PENDING) {
                indexes.add(i);
            }
        }
        return indexes;
    }

    // Image paths usually name Windows locations, so split on both separators
    static String fileName(String imagePath) {
        int cut = Math.max(imagePath.lastIndexOf('/'), imagePath.lastIndexOf('\\'));
        return cut >= 0 && cut < imagePath.length() - 1 ? imagePath.substring(cut + 1) : imagePath;
    }

    private static void awaitAll(List<CompletableFuture<Void>> launched) throws InterruptedException {
        try {
            CompletableFuture.allOf(launched.toArray(new CompletableFuture[0])).get();
        } catch (ExecutionException e) {
            // Outcome handlers swallow their own errors; nothing left to report here
            log.debug("Image task completed exceptionally", e.getCause());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable error) {
        if (error instanceof CancellationException) {
            return "Cancelled";
        }
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private OperationRun activeOrThrow(String operationId, String action) {
        Optional<OperationRun> active = registry.get(operationId);
        if (active.isPresent()) {
            return active.get();
        }
        BatchOperation stored = loadOrThrow(operationId);
        throw new InvalidOperationStateException(operationId, stored.getStatus(), action);
    }

    private BatchOperation loadOrThrow(String operationId) {
        try {
            return store.load(operationId).orElseThrow(() -> new OperationNotFoundException(operationId));
        } catch (IOException e) {
            throw new OperationStoreException("Failed to load batch operation " + operationId, e);
        }
    }

    private void saveOrThrow(BatchOperation operation, String message) {
        try {
            store.save(operation);
        } catch (IOException e) {
            throw new OperationStoreException(message, e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new BatchOperationException("Batch operation engine is shut down");
        }
    }

    private void audit(AuditEvent event) {
        try {
            auditSink.record(event);
        } catch (RuntimeException e) {
            log.warn("Audit sink rejected {} for {}: {}", event.action(), event.resourceId(), e.getMessage());
        }
    }

    private void dispatch(OperationNotification notification) {
        try {
            notifications.execute(() -> {
                try {
                    notifier.dispatch(notification);
                } catch (RuntimeException e) {
                    log.warn("Notification for {} failed: {}", notification.operationId(), e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Notification for {} dropped, notifier shut down", notification.operationId());
        }
    }

    private static void notifyObserver(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Operation observer threw: {}", e.getMessage());
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Wires the engine's collaborators. Audit, notification, observer and clock are optional.
     */
    public static final class Builder {
        private final OperationStore store;
        private final ExecutorRegistry executors;
        private final EngineSettings settings;
        private AuditSink auditSink = event -> {
        };
        private NotificationDispatcher notifier = NotificationDispatcher.NONE;
        private OperationObserver observer = OperationObserver.NONE;
        private Clock clock = Clock.systemUTC();

        private Builder(OperationStore store, ExecutorRegistry executors, EngineSettings settings) {
            if (store == null || executors == null || settings == null) {
                throw new IllegalArgumentException("store, executors and settings are required");
            }
            this.store = store;
            this.executors = executors;
            this.settings = settings;
        }

        public Builder auditSink(AuditSink auditSink) {
            this.auditSink = auditSink;
            return this;
        }

        public Builder notifier(NotificationDispatcher notifier) {
            this.notifier = notifier;
            return this;
        }

        public Builder observer(OperationObserver observer) {
            this.observer = observer;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public BatchOperationEngine build() {
            return new BatchOperationEngine(this);
        }
    }
}
