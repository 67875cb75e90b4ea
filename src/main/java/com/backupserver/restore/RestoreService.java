package com.backupserver.restore;

import com.backupserver.checksum.ChecksumEngine;
import com.backupserver.error.ErrorKind;
import com.backupserver.error.TransferException;
import com.backupserver.operation.OperationRegistry;
import com.backupserver.operation.TransferOperation;
import com.backupserver.reclaim.DeferredReclaimer;
import com.backupserver.upload.ChunkOutcome;
import com.backupserver.upload.ChunkReassembler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class RestoreService {

    private final ChunkReassembler reassembler;
    private final OperationRegistry registry;
    private final ChecksumEngine checksums;
    private final RestoreEngine engine;
    private final DeferredReclaimer reclaimer;

    public RestoreService(ChunkReassembler reassembler,
                          OperationRegistry registry,
                          ChecksumEngine checksums,
                          RestoreEngine engine,
                          DeferredReclaimer reclaimer) {
        this.reassembler = reassembler;
        this.registry = registry;
        this.checksums = checksums;
        this.engine = engine;
        this.reclaimer = reclaimer;
    }

    // ====== Public APIs ======

    public Map<String, Object> restoreSingle(Optional<String> uploadId, InputStream body, String checksum) {
        TransferOperation op = reassembler.begin(uploadId, 1);
        String id = op.id();
        if (op.totalChunks() != 1)
            throw new TransferException(ErrorKind.OPERATION_CONFLICT,
                    "Upload " + id + " is a chunked upload still in progress").forUpload(id);
        Path staged = reassembler.stage(id, body);
        if (!registry.markRestoring(id))
            throw new TransferException(ErrorKind.OPERATION_CONFLICT, "Upload is already being restored").forUpload(id);
        return verifyAndRestore(id, staged, checksum);
    }

    // chunk 0 opens the operation
    public Map<String, Object> restoreChunk(Optional<String> uploadId, int chunk, int totalChunks,
                                            InputStream body, String checksum) {
        String id = chunk == 0
                ? reassembler.begin(uploadId, totalChunks).id()
                : uploadId.orElseThrow(() -> new TransferException(ErrorKind.UNKNOWN_OPERATION, "Upload session not found"));

        ChunkOutcome outcome = reassembler.accept(id, chunk, body);
        TransferOperation op = outcome.operation();
        if (!outcome.readyToAssemble()) {
            return progress(id, "Chunk " + chunk + " received successfully", op);
        }
        if (!registry.markRestoring(id)) {
            return progress(id, "Chunk " + chunk + " received, restore already in progress", op);
        }

        Path combined;
        try {
            combined = reassembler.assemble(id);
        } catch (TransferException e) {
            fail(id, e.getMessage());
            throw e.forUpload(id);
        }
        return verifyAndRestore(id, combined, checksum);
    }

    // ====== Helpers ======

    private Map<String, Object> verifyAndRestore(String id, Path archive, String clientChecksum) {
        if (clientChecksum != null && !clientChecksum.isBlank()) {
            String calculated = digest(id, archive);
            if (!calculated.equalsIgnoreCase(clientChecksum.trim())) {
                fail(id, "Checksum verification failed");
                throw TransferException.checksumMismatch(id, clientChecksum, calculated);
            }
        }

        TransferOperation done;
        try {
            done = engine.restore(archive, id);
        } finally {
            reclaimer.scheduleOperation(id);
        }
        reclaimer.scheduleFile(archive, Duration.ZERO);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("message", "Database restore completed successfully");
        body.put("restored_files", done.restoredFiles());
        body.put("upload_id", id);
        return body;
    }

    private String digest(String id, Path archive) {
        try {
            return checksums.digest(archive);
        } catch (TransferException e) {
            fail(id, e.getMessage());
            throw e.forUpload(id);
        } catch (RuntimeException e) {
            fail(id, "cannot checksum upload: " + e.getMessage());
            throw new TransferException(ErrorKind.IO_FAILURE, "cannot checksum upload: " + e.getMessage(), e).forUpload(id);
        }
    }

    private void fail(String id, String error) {
        registry.markFailed(id, error);
        reclaimer.scheduleOperation(id);
        log.warn("Upload {} failed: {}", id, error);
    }

    private static Map<String, Object> progress(String id, String message, TransferOperation op) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("upload_id", id);
        body.put("message", message);
        body.put("chunks_received", op.chunksReceived());
        body.put("total_chunks", op.totalChunks());
        return body;
    }
}
