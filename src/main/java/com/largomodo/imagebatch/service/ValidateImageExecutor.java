package com.largomodo.imagebatch.service;

import com.largomodo.imagebatch.core.CancellationToken;
import com.largomodo.imagebatch.core.ImageOperationExecutor;
import com.largomodo.imagebatch.core.ImageOperationRequest;
import com.largomodo.imagebatch.core.ImageOperationResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Pre-flight check of an image file: present, readable, a non-empty regular
 * file and one of the known container formats. Reports the file size as bytes processed.
 */
public class ValidateImageExecutor implements ImageOperationExecutor {

    static final Set<String> KNOWN_EXTENSIONS = Set.of("wim", "esd", "swm", "vhd", "vhdx", "iso", "ffu");

    @Override
    public ImageOperationResult execute(ImageOperationRequest request, CancellationToken token) throws IOException {
        token.throwIfCancelled();
        Path image = Path.of(request.imagePath());

        if (!Files.exists(image)) {
            return ImageOperationResult.failed("Image not found: " + image);
        }
        if (!Files.isRegularFile(image)) {
            return ImageOperationResult.failed("Not a regular file: " + image);
        }
        if (!Files.isReadable(image)) {
            return ImageOperationResult.failed("Image is not readable: " + image);
        }
        String extension = extension(image);
        if (!KNOWN_EXTENSIONS.contains(extension)) {
            return ImageOperationResult.failed("Unsupported image format '" + extension + "': " + image);
        }
        long size = Files.size(image);
        if (size == 0) {
            return ImageOperationResult.failed("Image is empty: " + image);
        }
        return ImageOperationResult.succeeded(size);
    }

    private static String extension(Path image) {
        String name = image.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
