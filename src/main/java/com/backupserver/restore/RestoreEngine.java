package com.backupserver.restore;

import com.backupserver.archive.ArchiveCodec;
import com.backupserver.archive.ManagedFile;
import com.backupserver.archive.ManagedFileCatalog;
import com.backupserver.error.ErrorKind;
import com.backupserver.error.TransferException;
import com.backupserver.operation.OperationRegistry;
import com.backupserver.operation.OperationStatus;
import com.backupserver.operation.TransferOperation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

// .bak copies are left for manual recovery; nothing is rolled back
@Slf4j
@Component
public class RestoreEngine {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ArchiveCodec codec;
    private final ManagedFileCatalog catalog;
    private final OperationRegistry registry;
    private final Clock clock;

    public RestoreEngine(ArchiveCodec codec, ManagedFileCatalog catalog, OperationRegistry registry, Clock clock) {
        this.codec = codec;
        this.catalog = catalog;
        this.registry = registry;
        this.clock = clock;
    }

    public TransferOperation restore(Path archive, String operationId) {
        TransferOperation op = registry.find(operationId)
                .orElseThrow(() -> new TransferException(ErrorKind.UNKNOWN_OPERATION, "Upload session not found"));
        if (op.status() != OperationStatus.RESTORING)
            throw new IllegalStateException("operation " + operationId + " is " + op.status().wireName() + ", not restoring");

        log.info("Restore {} started from {}", operationId, archive.getFileName());
        try {
            Set<String> entries = codec.openAndList(archive);

            List<ManagedFile> files = catalog.snapshot();
            snapshotExisting(files);

            Map<String, Path> destinations = new LinkedHashMap<>();
            Map<Path, String> reported = new LinkedHashMap<>();
            for (ManagedFile f : files) {
                if (!entries.contains(f.baseName())) continue;
                Path parent = f.location().toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
                destinations.put(f.baseName(), f.location());
                reported.put(f.location(), f.path());
            }

            List<Path> written = codec.extract(archive, destinations.keySet(), destinations);
            if (written.isEmpty())
                throw new TransferException(ErrorKind.NOTHING_TO_RESTORE, "No valid database files found in the backup");

            List<String> restored = new ArrayList<>();
            for (Map.Entry<Path, String> e : reported.entrySet()) {
                if (written.contains(e.getKey())) restored.add(e.getValue());
            }
            TransferOperation done = registry.markCompleted(operationId, restored);
            log.info("Restore {} completed: {}", operationId, restored);
            return done;
        } catch (TransferException e) {
            registry.markFailed(operationId, e.getMessage());
            log.warn("Restore {} failed: {}", operationId, e.getMessage());
            throw e.forUpload(operationId);
        } catch (IOException | RuntimeException e) {
            registry.markFailed(operationId, String.valueOf(e.getMessage()));
            log.error("Restore {} failed", operationId, e);
            throw new TransferException(ErrorKind.IO_FAILURE, "Restore failed: " + e.getMessage(), e).forUpload(operationId);
        }
    }

    private void snapshotExisting(List<ManagedFile> files) throws IOException {
        String stamp = LocalDateTime.now(clock).format(STAMP);
        for (ManagedFile f : files) {
            if (!f.exists()) continue;
            Path bak = f.location().resolveSibling(f.baseName() + "." + stamp + ".bak");
            Files.copy(f.location(), bak, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
            log.info("Snapshot {} -> {}", f.path(), bak.getFileName());
        }
    }
}
