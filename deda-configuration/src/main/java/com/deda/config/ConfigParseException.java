package com.deda.config;

import java.nio.file.Path;

/**
 * Thrown when a persisted configuration file cannot be parsed. Carries the offending path and the
 * parser diagnostic. The layer that was cached before the failed load stays in effect.
 */
public final class ConfigParseException extends RuntimeException {

    private final Path path;
    private final String diagnostic;

    public ConfigParseException(Path path, String diagnostic, Throwable cause) {
        super("Malformed configuration file " + path + ": " + diagnostic, cause);
        this.path = path;
        this.diagnostic = diagnostic;
    }

    public Path getPath() {
        return path;
    }

    /** Parser message describing what is wrong and where. */
    public String getDiagnostic() {
        return diagnostic;
    }
}
