package com.example.ttsbatch;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The persisted manifest cannot be read or contradicts the current input.
 */
public class ManifestCorruptionException extends IOException {
    private final Path manifestPath;

    public ManifestCorruptionException(Path manifestPath, String message) {
        super(message + " (" + manifestPath + ")");
        this.manifestPath = manifestPath;
    }

    public ManifestCorruptionException(Path manifestPath, String message, Throwable cause) {
        super(message + " (" + manifestPath + ")", cause);
        this.manifestPath = manifestPath;
    }

    public Path manifestPath() {
        return manifestPath;
    }
}
