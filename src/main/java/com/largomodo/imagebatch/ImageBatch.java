package com.largomodo.imagebatch;

import com.largomodo.imagebatch.core.BatchOperationEngine;
import com.largomodo.imagebatch.core.BatchOperationException;
import com.largomodo.imagebatch.core.EngineSettings;
import com.largomodo.imagebatch.core.ExecutorRegistry;
import com.largomodo.imagebatch.core.OperationObserver;
import com.largomodo.imagebatch.core.OperationQueryService;
import com.largomodo.imagebatch.core.domain.BatchOperation;
import com.largomodo.imagebatch.core.domain.CreateOperationRequest;
import com.largomodo.imagebatch.core.domain.OperationQuery;
import com.largomodo.imagebatch.core.domain.OperationQueryResult;
import com.largomodo.imagebatch.core.domain.OperationStatistics;
import com.largomodo.imagebatch.core.domain.OperationStatus;
import com.largomodo.imagebatch.core.domain.OperationType;
import com.largomodo.imagebatch.core.domain.TargetImage;
import com.largomodo.imagebatch.service.BackupImageExecutor;
import com.largomodo.imagebatch.service.ExternalCommandExecutor;
import com.largomodo.imagebatch.service.JsonOperationStore;
import com.largomodo.imagebatch.service.LoggingNotificationDispatcher;
import com.largomodo.imagebatch.service.Slf4jAuditSink;
import com.largomodo.imagebatch.service.ValidateImageExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * CLI entry point for batch servicing of offline Windows images.
 * <p>
 * Operations are persisted under the store directory, so they can be created in
 * one invocation and started, inspected, retried or deleted in later ones. The
 * engine lives only as long as the invocation: {@code run}, {@code start} and
 * {@code retry} block until the operation finishes, and Ctrl+C cancels it and
 * waits for in-flight images to drain.
 * <p>
 * Operations left QUEUED or RUNNING by a process that died are turned into
 * PAUSED on startup and can be continued with {@code start}.
 */
@Command(
        name = "imagebatch",
        mixinStandardHelpOptions = true,
        resourceBundle = "imagebatch.imagebatch",
        version = "${bundle:application.version}",
        header = "Runs servicing operations over batches of offline Windows images.",
        description = {
                "Applies one operation type (validate, backup, apply template, add drivers, ...) to many" +
                        " .wim/.esd/.vhd(x)/.iso images with bounded parallelism.",
                "",
                "Progress and results are persisted as one JSON document per operation, so operations" +
                        " can be inspected, retried and resumed across invocations."
        },
        subcommands = {
                ImageBatch.RunCommand.class,
                ImageBatch.CreateCommand.class,
                ImageBatch.StartCommand.class,
                ImageBatch.RetryCommand.class,
                ImageBatch.CancelCommand.class,
                ImageBatch.DeleteCommand.class,
                ImageBatch.ShowCommand.class,
                ImageBatch.ListCommand.class,
                ImageBatch.StatsCommand.class
        },
        exitCodeListHeading = "%nExit Codes:%n",
        exitCodeList = {
                "0:Successful completion",
                "1:Execution error, or the operation finished FAILED or CANCELLED",
                "2:Invalid command line arguments"
        },
        footerHeading = "%nSee Also:%n",
        footer = {
                "Project home: ${bundle:application.url}"
        }
)
public class ImageBatch {

    private static final Logger log = LoggerFactory.getLogger(ImageBatch.class);

    static final Duration WAIT_FOREVER = Duration.ofMillis(Long.MAX_VALUE);

    @Option(names = "--store-dir",
            description = {
                    "Directory holding one JSON document per operation.",
                    "Default: ${DEFAULT-VALUE}"
            },
            defaultValue = "${sys:user.home}/.imagebatch/operations")
    Path storeDir;

    @Option(names = "--image-timeout", defaultValue = "PT2H",
            description = {
                    "Deadline for a single image (ISO-8601 duration, PT0S disables).",
                    "Default: ${DEFAULT-VALUE}"
            })
    Duration imageTimeout;

    @Option(names = "--shutdown-grace", defaultValue = "PT5M",
            description = {
                    "How long Ctrl+C waits for running images before abandoning them.",
                    "Default: ${DEFAULT-VALUE}"
            })
    Duration shutdownGrace;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    boolean verbose;

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Command line with the handlers shared by {@link #main} and tests.
     */
    static CommandLine commandLine() {
        CommandLine cmd = new CommandLine(new ImageBatch());
        cmd.setCaseInsensitiveEnumValuesAllowed(true);
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof BatchOperationException || ex instanceof IllegalArgumentException) {
                commandLine.getErr().println("ERROR: " + ex.getMessage());
            } else {
                log.error("Command failed", ex);
                commandLine.getErr().println("ERROR: " + ex);
            }
            return 1;
        });
        return cmd;
    }

    void configureLogging() {
        if (verbose) {
            ch.qos.logback.classic.Logger root =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
            root.setLevel(ch.qos.logback.classic.Level.DEBUG);
        }
    }

    EngineSettings settings(CommandSpec spec) {
        if (imageTimeout.isNegative()) {
            throw new ParameterException(spec.commandLine(), "--image-timeout must not be negative: " + imageTimeout);
        }
        if (shutdownGrace.isNegative()) {
            throw new ParameterException(spec.commandLine(), "--shutdown-grace must not be negative: " + shutdownGrace);
        }
        return new EngineSettings(storeDir, imageTimeout, shutdownGrace);
    }

    static ExecutorRegistry defaultExecutors() {
        ExternalCommandExecutor external = new ExternalCommandExecutor();
        ExecutorRegistry.Builder builder = ExecutorRegistry.builder();
        for (OperationType type : OperationType.values()) {
            builder.register(type, external);
        }
        builder.register(OperationType.VALIDATE_IMAGES, new ValidateImageExecutor());
        builder.register(OperationType.BACKUP_IMAGES, new BackupImageExecutor());
        return builder.build();
    }

    /**
     * Engine over the configured store, with interrupted operations recovered.
     */
    BatchOperationEngine openEngine(CommandSpec spec, OperationObserver observer) throws IOException {
        configureLogging();
        EngineSettings settings = settings(spec);
        BatchOperationEngine engine = BatchOperationEngine
                .builder(new JsonOperationStore(settings.storageDirectory()), defaultExecutors(), settings)
                .auditSink(new Slf4jAuditSink())
                .notifier(new LoggingNotificationDispatcher())
                .observer(observer)
                .build();
        int recovered = engine.recoverInterrupted();
        if (recovered > 0) {
            log.warn("{} interrupted operation(s) marked PAUSED; use 'start <id>' to continue", recovered);
        }
        return engine;
    }

    OperationQueryService openQueries() throws IOException {
        configureLogging();
        return new OperationQueryService(new JsonOperationStore(storeDir));
    }

    /**
     * Block until the operation finishes; Ctrl+C cancels it and drains running images.
     *
     * @return exit code for the final status
     */
    static int awaitAndReport(BatchOperationEngine engine, String operationId, PrintWriter out)
            throws InterruptedException, TimeoutException {
        Thread hook = new Thread(() -> {
            if (engine.isActive(operationId)) {
                log.info("Interrupt received, cancelling {} and waiting for running images...", operationId);
                engine.close();
            }
        }, "imagebatch-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        try {
            BatchOperation result = engine.awaitCompletion(operationId, WAIT_FOREVER);
            Printer.summary(out, result);
            return exitCodeFor(result.getStatus());
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                // JVM already shutting down; the hook is running
                log.debug("Shutdown in progress, hook left registered");
            }
        }
    }

    static int exitCodeFor(OperationStatus status) {
        return status == OperationStatus.COMPLETED || status == OperationStatus.COMPLETED_WITH_ERRORS ? 0 : 1;
    }

    /**
     * Options shared by {@code run} and {@code create}.
     */
    static class OperationOptions {

        @Option(names = {"-n", "--name"}, required = true, description = "Display name of the operation")
        String name;

        @Option(names = {"-t", "--type"}, required = true,
                description = {
                        "Operation type.",
                        "Valid values: ${COMPLETION-CANDIDATES}"
                })
        OperationType type;

        @Option(names = {"-d", "--description"}, defaultValue = "", description = "Free-form description")
        String description;

        @Option(names = {"-c", "--config"}, paramLabel = "KEY=VALUE",
                description = {
                        "Executor configuration entry, repeatable.",
                        "e.g. command=\"dism /image:{image} /index:{index} ...\" or destination=D:\\backup"
                })
        Map<String, String> configuration = new LinkedHashMap<>();

        @Option(names = {"-p", "--parallel"}, defaultValue = "2",
                description = "Maximum images processed at once. Default: ${DEFAULT-VALUE}")
        int maxParallel;

        @Option(names = "--stop-on-error", description = "Stop launching images after the first failure")
        boolean stopOnError;

        @Option(names = "--priority", defaultValue = "5", description = "Priority hint. Default: ${DEFAULT-VALUE}")
        int priority;

        @Option(names = "--index", defaultValue = "1",
                description = "Image index inside multi-image containers. Default: ${DEFAULT-VALUE}")
        int imageIndex;

        @Option(names = "--template", description = "Template identifier passed to the executor")
        String templateId;

        @Option(names = "--profile", description = "Profile identifier passed to the executor")
        String profileId;

        @Option(names = "--tag", description = "Label, repeatable")
        List<String> tags = new ArrayList<>();

        @Parameters(arity = "1..*", paramLabel = "IMAGE", description = "Image files to process, in order")
        List<Path> images = new ArrayList<>();

        CreateOperationRequest toRequest(CommandSpec spec, boolean startImmediately) {
            if (maxParallel < 1) {
                throw new ParameterException(spec.commandLine(), "--parallel must be at least 1, got: " + maxParallel);
            }
            if (imageIndex < 1) {
                throw new ParameterException(spec.commandLine(), "--index must be at least 1, got: " + imageIndex);
            }
            CreateOperationRequest.Builder builder = CreateOperationRequest.builder(name, type)
                    .description(description)
                    .templateId(templateId)
                    .profileId(profileId)
                    .priority(priority)
                    .maxParallelOperations(maxParallel)
                    .continueOnError(!stopOnError)
                    .startImmediately(startImmediately)
                    .tags(tags);
            configuration.forEach(builder::configuration);
            for (Path image : images) {
                builder.image(image.toAbsolutePath().toString(), imageIndex);
            }
            return builder.build();
        }
    }

    @Command(name = "run", mixinStandardHelpOptions = true,
            description = "Create an operation, run it to completion and print the summary.")
    static class RunCommand implements Callable<Integer> {

        @ParentCommand
        ImageBatch parent;

        @Spec
        CommandSpec spec;

        @Mixin
        OperationOptions options;

        @Override
        public Integer call() throws Exception {
            CreateOperationRequest request = options.toRequest(spec, true);
            PrintWriter out = spec.commandLine().getOut();
            try (BatchOperationEngine engine = parent.openEngine(spec, progressObserver(out))) {
                BatchOperation started = engine.create(request);
                out.println("Operation " + started.getId() + " started");
                out.flush();
                return awaitAndReport(engine, started.getId(), out);
            }
        }
    }

    @Command(name = "create", mixinStandardHelpOptions = true,
            description = "Create a PENDING operation without starting it; prints its id.")
    static class CreateCommand implements Callable<Integer> {

        @ParentCommand
        ImageBatch parent;

        @Spec
        CommandSpec spec;

        @Mixin
        OperationOptions options;

        @Override
        public Integer call() throws Exception {
            CreateOperationRequest request = options.toRequest(spec, false);
            try (BatchOperationEngine engine = parent.openEngine(spec, OperationObserver.NONE)) {
                BatchOperation created = engine.create(request);
                spec.commandLine().getOut().println(created.getId());
            }
            return 0;
        }
    }

    @Command(name = "start", mixinStandardHelpOptions = true,
            description = "Start a PENDING or PAUSED operation and wait for it to finish.")
    static class StartCommand implements Callable<Integer> {

        @ParentCommand
        ImageBatch parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "ID", description = "Operation id")
        String operationId;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            try (BatchOperationEngine engine = parent.openEngine(spec, progressObserver(out))) {
                engine.start(operationId);
                return awaitAndReport(engine, operationId, out);
            }
        }
    }

    @Command(name = "retry", mixinStandardHelpOptions = true,
            description = "Re-run the failed images of a finished operation and wait for it to finish.")
    static class RetryCommand implements Callable<Integer> {

        @ParentCommand
        ImageBatch parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "ID", description = "Operation id")
        String operationId;

        @Override
        public Integer call() throws Exception {
            PrintWriter out = spec.commandLine().getOut();
            try (BatchOperationEngine engine = parent.openEngine(spec, progressObserver(out))) {
                engine.retryFailedImages(operationId);
                return awaitAndReport(engine, operationId, out);
            }
        }
    }

    @Command(name = "cancel", mixinStandardHelpOptions = true,
            description = "Cancel an operation that has not finished.")
    static class CancelCommand implements Callable<Integer> {

        @ParentCommand
        ImageBatch parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "ID", description = "Operation id")
        String operationId;

        @Override
        public Integer call() throws Exception {
            try (BatchOperationEngine engine = parent.openEngine(spec, OperationObserver.NONE)) {
                BatchOperation cancelled = engine.cancel(operationId);
                spec.commandLine().getOut().println(cancelled.getId() + " " + cancelled.getStatus());
            }
            return 0;
        }
    }

    @Command(name = "delete", mixinStandardHelpOptions = true, description = "Delete a stored operation.")
    static class DeleteCommand implements Callable<Integer> {

        @ParentCommand
        ImageBatch parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "ID", description = "Operation id")
        String operationId;

        @Override
        public Integer call() throws Exception {
            try (BatchOperationEngine engine = parent.openEngine(spec, OperationObserver.NONE)) {
                engine.delete(operationId);
                spec.commandLine().getOut().println("Deleted " + operationId);
            }
            return 0;
        }
    }

    @Command(name = "show", mixinStandardHelpOptions = true,
            description = "Print an operation with the status of each image.")
    static class ShowCommand implements Callable<Integer> {

        @ParentCommand
        ImageBatch parent;

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", paramLabel = "ID", description = "Operation id")
        String operationId;

        @Override
        public Integer call() throws Exception {
            try (BatchOperationEngine engine = parent.openEngine(spec, OperationObserver.NONE)) {
                Printer.details(spec.commandLine().getOut(), engine.get(operationId));
            }
            return 0;
        }
    }

    @Command(name = "list", mixinStandardHelpOptions = true,
            description = "List stored operations, newest first unless sorted otherwise.")
    static class ListCommand implements Callable<Integer> {

        @ParentCommand
        ImageBatch parent;

        @Spec
        CommandSpec spec;

        @Option(names = "--status", description = "Only operations in this status")
        OperationStatus status;

        @Option(names = "--type", description = "Only operations of this type")
        OperationType type;

        @Option(names = "--created-by", description = "Only operations created by this user")
        String createdBy;

        @Option(names = "--tag", description = "Only operations carrying this tag")
        String tag;

        @Option(names = "--name", description = "Only operations whose name contains this text")
        String nameContains;

        @Option(names = "--from", description = "Created at or after this instant (ISO-8601)")
        Instant createdFrom;

        @Option(names = "--to", description = "Created at or before this instant (ISO-8601)")
        Instant createdTo;

        @Option(names = "--sort", defaultValue = "createdAt",
                description = "createdAt, name, type, status or priority. Default: ${DEFAULT-VALUE}")
        String sortBy;

        @Option(names = "--asc", description = "Sort ascending instead of descending")
        boolean ascending;

        @Option(names = "--page", defaultValue = "1", description = "Page number. Default: ${DEFAULT-VALUE}")
        int page;

        @Option(names = "--page-size", defaultValue = "50", description = "Page size (max 500). Default: ${DEFAULT-VALUE}")
        int pageSize;

        @Override
        public Integer call() throws Exception {
            OperationQuery query = OperationQuery.builder()
                    .status(status)
                    .type(type)
                    .createdBy(createdBy)
                    .tag(tag)
                    .nameContains(nameContains)
                    .createdFrom(createdFrom)
                    .createdTo(createdTo)
                    .sortBy(sortBy, ascending ? OperationQuery.SortDirection.ASC : OperationQuery.SortDirection.DESC)
                    .page(page, pageSize)
                    .build();
            OperationQueryResult result = parent.openQueries().query(query);
            Printer.table(spec.commandLine().getOut(), result);
            return 0;
        }
    }

    @Command(name = "stats", mixinStandardHelpOptions = true, description = "Print aggregate statistics.")
    static class StatsCommand implements Callable<Integer> {

        @ParentCommand
        ImageBatch parent;

        @Spec
        CommandSpec spec;

        @Option(names = "--from", description = "Created at or after this instant (ISO-8601)")
        Instant from;

        @Option(names = "--to", description = "Created at or before this instant (ISO-8601)")
        Instant to;

        @Override
        public Integer call() throws Exception {
            OperationStatistics statistics = parent.openQueries().statistics(from, to);
            Printer.statistics(spec.commandLine().getOut(), statistics);
            return 0;
        }
    }

    static OperationObserver progressObserver(PrintWriter out) {
        return new OperationObserver() {
            @Override
            public void onImageFinished(BatchOperation operation, TargetImage image) {
                synchronized (out) {
                    out.printf("[%3d%%] %-9s %s%n", operation.getProgressPercentage(), image.getStatus(),
                            image.getImagePath());
                    out.flush();
                }
            }
        };
    }
}
