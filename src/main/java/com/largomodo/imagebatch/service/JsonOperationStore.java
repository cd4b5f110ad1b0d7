package com.largomodo.imagebatch.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.largomodo.imagebatch.core.OperationStore;
import com.largomodo.imagebatch.core.domain.BatchOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * File-backed operation store: one pretty-printed JSON document per operation,
 * named {@code <id>.json}, in a single directory.
 * <p>
 * Saves write a temp file in the same directory and move it over the previous
 * snapshot, atomically where the filesystem allows, so readers see the old or
 * the new document but never a partial one.
 */
public class JsonOperationStore implements OperationStore {

    private static final Logger log = LoggerFactory.getLogger(JsonOperationStore.class);

    private static final String EXTENSION = ".json";
    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonOperationStore(Path directory) throws IOException {
        this.directory = directory;
        this.mapper = createMapper();
        Files.createDirectories(directory);
    }

    static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    public Path directory() {
        return directory;
    }

    @Override
    public void save(BatchOperation operation) throws IOException {
        Path target = fileFor(requireValidId(operation.getId()));
        Path temp = Files.createTempFile(directory, operation.getId() + ".", ".tmp");
        try {
            mapper.writeValue(temp.toFile(), operation);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public Optional<BatchOperation> load(String operationId) throws IOException {
        if (operationId == null || !VALID_ID.matcher(operationId).matches()) {
            return Optional.empty();
        }
        Path file = fileFor(operationId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(file.toFile(), BatchOperation.class));
    }

    @Override
    public List<BatchOperation> listAll() throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            stream.forEach(files::add);
        }
        files.sort(null);

        List<BatchOperation> operations = new ArrayList<>(files.size());
        for (Path file : files) {
            try {
                operations.add(mapper.readValue(file.toFile(), BatchOperation.class));
            } catch (IOException e) {
                log.warn("Skipping unreadable operation snapshot {}: {}", file.getFileName(), e.getMessage());
            }
        }
        return operations;
    }

    @Override
    public boolean delete(String operationId) throws IOException {
        if (operationId == null || !VALID_ID.matcher(operationId).matches()) {
            return false;
        }
        return Files.deleteIfExists(fileFor(operationId));
    }

    private Path fileFor(String operationId) {
        return directory.resolve(operationId + EXTENSION);
    }

    private static String requireValidId(String operationId) {
        if (operationId == null || !VALID_ID.matcher(operationId).matches()) {
            throw new IllegalArgumentException("Invalid operation id: " + operationId);
        }
        return operationId;
    }
}
