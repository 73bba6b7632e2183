package com.deda.config;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads and writes configuration layer files. A missing file is not an error (the caller falls
 * back to defaults); a file that exists but does not parse is reported as a {@link ConfigParseException}.
 */
final class LayerStore {

    private static final Logger log = LoggerFactory.getLogger(LayerStore.class);

    /**
     * Loads the layer stored at {@code file}.
     *
     * @return the parsed layer, or empty if the file does not exist
     * @throws ConfigParseException  if the file exists but is malformed
     * @throws UncheckedIOException  if the file exists but cannot be read
     */
    <T extends LayerConfig> Optional<T> load(Path file, Class<T> type, ScopeKey scopeKey) {
        if (file == null || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read configuration file " + file, e);
        }
        try {
            T config = ConfigCodec.fromJson(json, type, scopeKey);
            log.debug("Loaded {} from {}", type.getSimpleName(), file);
            return Optional.of(config);
        } catch (JsonProcessingException e) {
            throw new ConfigParseException(file, diagnostic(e), e);
        }
    }

    /** Writes the layer to {@code file}, creating parent directories as needed. */
    void save(Path file, LayerConfig config) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, ConfigCodec.toJson(config), StandardCharsets.UTF_8);
            log.info("Saved {} to {}", config.getClass().getSimpleName(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write configuration file " + file, e);
        }
    }

    private static String diagnostic(JsonProcessingException e) {
        JsonLocation loc = e.getLocation();
        String msg = e.getOriginalMessage();
        if (loc == null) return msg;
        return msg + " (line " + loc.getLineNr() + ", column " + loc.getColumnNr() + ")";
    }
}
