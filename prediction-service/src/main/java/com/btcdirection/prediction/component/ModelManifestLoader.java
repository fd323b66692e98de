package com.btcdirection.prediction.component;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads {@link ModelManifest}s from Spring resource locations
 * ({@code classpath:models/lr/manifest.json}, {@code file:/opt/models/...}).
 */
@Component
public class ModelManifestLoader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public ModelManifestLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper   = objectMapper;
    }

    /**
     * @throws FileNotFoundException when nothing exists at {@code location}
     * @throws IOException           when the manifest cannot be read or parsed
     */
    public ModelManifest load(String location) throws IOException {
        if (location == null || location.isBlank()) {
            throw new FileNotFoundException("no manifest location configured");
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new FileNotFoundException("manifest not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, ModelManifest.class);
        }
    }
}
