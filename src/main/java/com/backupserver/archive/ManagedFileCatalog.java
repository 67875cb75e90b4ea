package com.backupserver.archive;

import com.backupserver.config.TransferProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

@Component
public class ManagedFileCatalog {

    private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB", "TB"};

    private final List<String> paths;

    public ManagedFileCatalog(TransferProperties props) {
        if (props.managedFiles() == null || props.managedFiles().isEmpty())
            throw new IllegalArgumentException("transfer.managed-files must list at least one file");
        this.paths = List.copyOf(props.managedFiles());
    }

    /** Current state of every managed file, read from disk on each call. */
    public List<ManagedFile> snapshot() {
        return paths.stream().map(ManagedFileCatalog::inspect).toList();
    }

    private static ManagedFile inspect(String configured) {
        Path location = Path.of(configured);
        if (!Files.isRegularFile(location)) {
            return new ManagedFile(configured, location, false, 0, formatSize(0));
        }
        try {
            long size = Files.size(location);
            return new ManagedFile(configured, location, true, size, formatSize(size));
        } catch (IOException e) {
            throw new UncheckedIOException("cannot stat " + configured, e);
        }
    }

    public static String formatSize(long sizeBytes) {
        if (sizeBytes == 0) return "0 B";
        double size = sizeBytes;
        int i = 0;
        while (size >= 1024 && i < SIZE_UNITS.length - 1) {
            size /= 1024;
            i++;
        }
        return String.format(Locale.ROOT, "%.2f %s", size, SIZE_UNITS[i]);
    }
}
