package com.largomodo.imagebatch.service;

import com.largomodo.imagebatch.core.CancellationToken;
import com.largomodo.imagebatch.core.ImageOperationExecutor;
import com.largomodo.imagebatch.core.ImageOperationRequest;
import com.largomodo.imagebatch.core.ImageOperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Copies each image into the directory named by configuration key {@code destination}.
 * <p>
 * The copy lands in a temp file next to the target and is then moved into place,
 * atomically where the filesystem allows, so an interrupted backup never leaves a
 * truncated file under the final name. Cancellation is checked between chunks.
 */
public class BackupImageExecutor implements ImageOperationExecutor {

    private static final Logger log = LoggerFactory.getLogger(BackupImageExecutor.class);

    public static final String DESTINATION_KEY = "destination";
    private static final int BUFFER_SIZE = 1 << 20;

    @Override
    public ImageOperationResult execute(ImageOperationRequest request, CancellationToken token) throws IOException {
        String destination = request.configString(DESTINATION_KEY, null);
        if (destination == null || destination.isBlank()) {
            throw new IllegalArgumentException("Configuration key '" + DESTINATION_KEY + "' is required for backups");
        }
        Path source = Path.of(request.imagePath());
        if (!Files.isRegularFile(source)) {
            return ImageOperationResult.failed("Image not found: " + source);
        }

        Path destinationDir = Path.of(destination);
        Files.createDirectories(destinationDir);
        Path target = destinationDir.resolve(source.getFileName());
        Path temp = destinationDir.resolve(source.getFileName() + "." + request.operationId() + ".tmp");

        long copied;
        try {
            copied = copy(source, temp, token);
            promote(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Backed up {} to {} ({} bytes)", source, target, copied);
        return ImageOperationResult.succeeded(copied);
    }

    private static long copy(Path source, Path temp, CancellationToken token) throws IOException {
        long total = 0;
        byte[] buffer = new byte[BUFFER_SIZE];
        try (InputStream in = Files.newInputStream(source);
             OutputStream out = Files.newOutputStream(temp)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                token.throwIfCancelled();
                out.write(buffer, 0, read);
                total += read;
            }
        }
        return total;
    }

    private static void promote(Path temp, Path target) throws IOException {
        if (Files.exists(target)) {
            log.warn("Overwriting existing backup: {}", target);
        }
        try {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
