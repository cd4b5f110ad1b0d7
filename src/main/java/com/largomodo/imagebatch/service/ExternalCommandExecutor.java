package com.largomodo.imagebatch.service;

import com.largomodo.imagebatch.core.CancellationToken;
import com.largomodo.imagebatch.core.ImageOperationExecutor;
import com.largomodo.imagebatch.core.ImageOperationRequest;
import com.largomodo.imagebatch.core.ImageOperationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Runs a configured servicing tool once per image.
 * <p>
 * Configuration keys:
 * <ul>
 *   <li>{@code command}: list of arguments, or a single string split on whitespace.
 *       Placeholders {@code {image}}, {@code {index}} and {@code {operation}} are
 *       substituted per image.</li>
 *   <li>{@code timeoutSeconds}: watchdog timeout, default one hour.</li>
 * </ul>
 * A non-zero exit code or a watchdog timeout is reported as a failed image;
 * failing to launch the tool at all propagates as an exception.
 */
public class ExternalCommandExecutor extends ExternalProcessDriver implements ImageOperationExecutor {

    private static final Logger log = LoggerFactory.getLogger(ExternalCommandExecutor.class);

    public static final String COMMAND_KEY = "command";
    public static final String TIMEOUT_KEY = "timeoutSeconds";

    @Override
    public ImageOperationResult execute(ImageOperationRequest request, CancellationToken token) throws IOException {
        List<String> command = expand(commandTemplate(request), request);
        long timeoutMs = timeoutMs(request);
        log.debug("Running {}", command);
        try {
            String output = executeCommand(command, timeoutMs, token);
            if (!output.isEmpty()) {
                log.debug("Tool output for {}: {}", request.imagePath(), output);
            }
            return ImageOperationResult.succeeded();
        } catch (ProcessTimeoutException | ProcessFailureException e) {
            return ImageOperationResult.failed(e.getMessage());
        }
    }

    static List<String> commandTemplate(ImageOperationRequest request) {
        Object raw = request.configuration().get(COMMAND_KEY);
        List<String> template = new ArrayList<>();
        if (raw instanceof Collection<?> parts) {
            for (Object part : parts) {
                template.add(String.valueOf(part));
            }
        } else if (raw != null) {
            for (String part : raw.toString().trim().split("\\s+")) {
                if (!part.isEmpty()) {
                    template.add(part);
                }
            }
        }
        if (template.isEmpty()) {
            throw new IllegalArgumentException("Configuration key '" + COMMAND_KEY + "' is required for "
                    + request.type() + " operations");
        }
        return template;
    }

    static List<String> expand(List<String> template, ImageOperationRequest request) {
        List<String> expanded = new ArrayList<>(template.size());
        for (String part : template) {
            expanded.add(part
                    .replace("{image}", request.imagePath())
                    .replace("{index}", Integer.toString(request.imageIndex()))
                    .replace("{operation}", request.operationId()));
        }
        return expanded;
    }

    private static long timeoutMs(ImageOperationRequest request) {
        String raw = request.configString(TIMEOUT_KEY, null);
        if (raw == null) {
            return DEFAULT_TIMEOUT_MS;
        }
        try {
            long seconds = Long.parseLong(raw.trim());
            if (seconds <= 0) {
                throw new IllegalArgumentException(TIMEOUT_KEY + " must be positive, got: " + raw);
            }
            return seconds * 1000;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(TIMEOUT_KEY + " is not a number: " + raw, e);
        }
    }
}
