package com.largomodo.imagebatch.core;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Engine configuration, built by the CLI from command line options.
 *
 * @param storageDirectory directory holding one JSON snapshot per operation
 * @param imageTimeout     per-image executor deadline; zero disables the timeout
 * @param shutdownGrace    how long {@link BatchOperationEngine#close()} waits for drivers to drain
 */
public record EngineSettings(Path storageDirectory, Duration imageTimeout, Duration shutdownGrace) {

    public static final Duration DEFAULT_IMAGE_TIMEOUT = Duration.ofHours(2);
    public static final Duration DEFAULT_SHUTDOWN_GRACE = Duration.ofMinutes(5);

    public EngineSettings {
        if (storageDirectory == null) {
            throw new IllegalArgumentException("storageDirectory must not be null");
        }
        imageTimeout = imageTimeout == null ? DEFAULT_IMAGE_TIMEOUT : imageTimeout;
        shutdownGrace = shutdownGrace == null ? DEFAULT_SHUTDOWN_GRACE : shutdownGrace;
        if (imageTimeout.isNegative()) {
            throw new IllegalArgumentException("imageTimeout must not be negative, got: " + imageTimeout);
        }
        if (shutdownGrace.isNegative()) {
            throw new IllegalArgumentException("shutdownGrace must not be negative, got: " + shutdownGrace);
        }
    }

    public static EngineSettings defaults(Path storageDirectory) {
        return new EngineSettings(storageDirectory, DEFAULT_IMAGE_TIMEOUT, DEFAULT_SHUTDOWN_GRACE);
    }

    public boolean hasImageTimeout() {
        return !imageTimeout.isZero();
    }
}
