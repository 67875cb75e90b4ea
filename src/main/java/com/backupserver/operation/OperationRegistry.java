package com.backupserver.operation;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface OperationRegistry {

    // returns the existing record while it is still uploading, conflicts otherwise
    TransferOperation create(String id, int totalChunks, String stagingDir);

    Optional<TransferOperation> find(String id);

    Collection<TransferOperation> findAll();

    TransferOperation recordChunk(String id, int chunkIndex);

    /** uploading -> restoring; true for exactly one caller. */
    boolean markRestoring(String id);

    TransferOperation markCompleted(String id, List<String> restoredFiles);

    /** Moves an uploading or restoring operation to failed; a terminal one is returned unchanged. */
    TransferOperation markFailed(String id, String error);

    /** Re-checks status and last activity under the key before failing. */
    boolean failIfIdle(String id, Instant cutoff, String error);

    void remove(String id);
}
