package com.largomodo.imagebatch.core;

import com.largomodo.imagebatch.core.domain.OperationType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything an executor needs to process one image. The engine never inspects
 * {@code configuration}, {@code templateId} or {@code profileId}.
 */
public record ImageOperationRequest(String operationId,
                                    OperationType type,
                                    String imagePath,
                                    int imageIndex,
                                    Map<String, Object> configuration,
                                    String templateId,
                                    String profileId) {

    public ImageOperationRequest {
        configuration = configuration == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(configuration));
    }

    /**
     * String view of a configuration entry, or {@code fallback} when absent.
     */
    public String configString(String key, String fallback) {
        Object value = configuration.get(key);
        return value == null ? fallback : value.toString();
    }
}
