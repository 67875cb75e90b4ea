package com.backupserver.archive;

import java.nio.file.Path;

public record ManagedFile(
        String path,       // configured path, reported back to clients
        Path   location,
        boolean exists,
        long   sizeBytes,
        String sizeFormatted
) {
    public String baseName() { return location.getFileName().toString(); }
}
