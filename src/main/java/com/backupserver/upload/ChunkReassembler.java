package com.backupserver.upload;

import com.backupserver.config.TransferProperties;
import com.backupserver.error.ErrorKind;
import com.backupserver.error.TransferException;
import com.backupserver.operation.OperationRegistry;
import com.backupserver.operation.OperationStatus;
import com.backupserver.operation.TransferOperation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

// <temp-uploads>/<upload id>/chunk_<n>
@Slf4j
@Component
public class ChunkReassembler {

    static final String COMBINED_NAME = "combined.zip";
    static final String SINGLE_NAME = "backup.zip";

    private static final Pattern UPLOAD_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final OperationRegistry registry;
    private final Path uploadsRoot;

    @Autowired
    public ChunkReassembler(OperationRegistry registry, TransferProperties props) {
        this(registry, Path.of(props.tempUploadsDir()));
    }

    public ChunkReassembler(OperationRegistry registry, Path uploadsRoot) {
        this.registry = registry;
        this.uploadsRoot = uploadsRoot;
    }

    public TransferOperation begin(Optional<String> requestedId, int totalChunks) {
        if (totalChunks < 1) throw new IllegalArgumentException("total_chunks must be >= 1");
        String id = requestedId.filter(s -> !s.isBlank()).orElseGet(() -> UUID.randomUUID().toString());
        requireValidId(id);

        Path dir = stagingDir(id);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new TransferException(ErrorKind.IO_FAILURE, "cannot create staging directory: " + e.getMessage(), e);
        }
        TransferOperation op = registry.create(id, totalChunks, dir.toString());
        if (op.totalChunks() != totalChunks)
            log.warn("Upload {} already open with total_chunks={}, ignoring {}", id, op.totalChunks(), totalChunks);
        return op;
    }

    // a repeated index overwrites the earlier bytes and is counted once
    public ChunkOutcome accept(String id, int chunkIndex, InputStream bytes) {
        TransferOperation op = registry.find(id)
                .orElseThrow(() -> new TransferException(ErrorKind.UNKNOWN_OPERATION, "Upload session not found"));
        if (op.status() != OperationStatus.UPLOADING)
            throw new TransferException(ErrorKind.OPERATION_CONFLICT, "Upload " + id + " is already " + op.status().wireName());
        if (chunkIndex < 0 || chunkIndex >= op.totalChunks())
            throw new IllegalArgumentException("chunk " + chunkIndex + " outside 0.." + (op.totalChunks() - 1));

        Path dir = Path.of(op.stagingDir());
        writeAtomically(bytes, dir, chunkName(chunkIndex));

        TransferOperation updated = registry.recordChunk(id, chunkIndex);
        log.debug("Upload {}: chunk {} stored ({}/{})", id, chunkIndex, updated.chunksReceived(), updated.totalChunks());
        return new ChunkOutcome(updated.allChunksReceived()
                ? ChunkOutcome.Kind.READY_TO_ASSEMBLE
                : ChunkOutcome.Kind.MORE_EXPECTED, updated);
    }

    public Path assemble(String id) {
        TransferOperation op = registry.find(id)
                .orElseThrow(() -> new TransferException(ErrorKind.UNKNOWN_OPERATION, "Upload session not found"));
        Path dir = Path.of(op.stagingDir());
        Path combined = dir.resolve(COMBINED_NAME);

        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(combined))) {
            for (int i = 0; i < op.totalChunks(); i++) {
                try {
                    Files.copy(dir.resolve(chunkName(i)), out);
                } catch (NoSuchFileException e) {
                    throw new TransferException(ErrorKind.MISSING_CHUNK, "Missing chunk " + i + " of " + op.totalChunks(), e);
                }
            }
        } catch (IOException e) {
            throw new TransferException(ErrorKind.IO_FAILURE, "cannot assemble upload: " + e.getMessage(), e);
        }
        log.info("Upload {}: assembled {} chunks", id, op.totalChunks());
        return combined;
    }

    public Path stage(String id, InputStream bytes) {
        TransferOperation op = registry.find(id)
                .orElseThrow(() -> new TransferException(ErrorKind.UNKNOWN_OPERATION, "Upload session not found"));
        return writeAtomically(bytes, Path.of(op.stagingDir()), SINGLE_NAME);
    }

    public Path stagingDir(String id) {
        return uploadsRoot.resolve(id);
    }

    private static Path writeAtomically(InputStream bytes, Path dir, String name) {
        Path tmp = null;
        try (bytes) {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, name + ".", ".part");
            Files.copy(bytes, tmp, StandardCopyOption.REPLACE_EXISTING);
            return Files.move(tmp, dir.resolve(name), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException suppressed) {
                    e.addSuppressed(suppressed);
                }
            }
            throw new TransferException(ErrorKind.IO_FAILURE, "cannot store " + name + ": " + e.getMessage(), e);
        }
    }

    private static String chunkName(int index) { return "chunk_" + index; }

    private static void requireValidId(String id) {
        if (!UPLOAD_ID.matcher(id).matches())
            throw new IllegalArgumentException("upload_id must match " + UPLOAD_ID.pattern());
    }
}
