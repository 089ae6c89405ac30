/*
 * ShgFrog — Ultrashort Pulse Retrieval Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.com
 */
package ai.evacortex.shgfrog.core.config;

import ai.evacortex.shgfrog.core.exceptions.InvalidConfigurationException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@link RetrievalConfig} from JSON. User documents are laid over the
 * bundled {@code shgfrog-defaults.json}, so a file only names what it changes.
 * The historical parameter names ({@code GTol}, {@code iterMAX},
 * {@code prepFrogSize}, ...) are accepted; unknown keys are rejected.
 */
public final class RetrievalConfigLoader {

    public static final String DEFAULTS_RESOURCE = "/shgfrog-defaults.json";

    private final ObjectMapper mapper;

    public RetrievalConfigLoader() {
        this.mapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    /**
     * Bundled defaults only.
     */
    public RetrievalConfig loadDefaults() {
        return defaultsBuilder().build();
    }

    public RetrievalConfig load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        if (!Files.isRegularFile(path)) {
            throw new InvalidConfigurationException("no configuration file at " + path);
        }
        try (InputStream in = Files.newInputStream(path)) {
            return load(in);
        } catch (IOException e) {
            throw new InvalidConfigurationException("cannot read " + path + ": " + e.getMessage(), e);
        }
    }

    public RetrievalConfig load(InputStream in) {
        Objects.requireNonNull(in, "stream must not be null");
        RetrievalConfig.Builder builder = defaultsBuilder();
        try {
            mapper.readerForUpdating(builder).readValue(in);
        } catch (IOException e) {
            throw new InvalidConfigurationException(e.getMessage(), e);
        }
        return builder.build();
    }

    private RetrievalConfig.Builder defaultsBuilder() {
        RetrievalConfig.Builder builder = RetrievalConfig.builder();
        try (InputStream in = RetrievalConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new InvalidConfigurationException("bundled defaults " + DEFAULTS_RESOURCE + " not found");
            }
            mapper.readerForUpdating(builder).readValue(in);
        } catch (IOException e) {
            throw new InvalidConfigurationException("bundled defaults are unreadable", e);
        }
        return builder;
    }
}
