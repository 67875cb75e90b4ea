package com.backupserver.archive;

import java.nio.file.Path;

public record Archive(
        Path   location,
        long   length,
        String checksum    // hex, algorithm of the ChecksumEngine
) {
    public String fileName() { return location.getFileName().toString(); }
}
