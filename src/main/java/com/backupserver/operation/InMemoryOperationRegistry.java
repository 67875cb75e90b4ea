package com.backupserver.operation;

import com.backupserver.error.ErrorKind;
import com.backupserver.error.TransferException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;

@Slf4j
@Repository
public class InMemoryOperationRegistry implements OperationRegistry {
    private final ConcurrentHashMap<String, TransferOperation> store = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryOperationRegistry(Clock clock) { this.clock = clock; }

    @Override
    public TransferOperation create(String id, int totalChunks, String stagingDir) {
        return store.compute(id, (k, cur) -> {
            if (cur == null) return TransferOperation.uploading(id, totalChunks, stagingDir, clock.instant());
            if (cur.status() != OperationStatus.UPLOADING)
                throw new TransferException(ErrorKind.OPERATION_CONFLICT,
                        "Upload " + id + " is already " + cur.status().wireName());
            return cur;
        });
    }

    @Override
    public Optional<TransferOperation> find(String id) { return Optional.ofNullable(store.get(id)); }

    @Override
    public Collection<TransferOperation> findAll() { return List.copyOf(store.values()); }

    @Override
    public TransferOperation recordChunk(String id, int chunkIndex) {
        return update(id, cur -> {
            if (cur.status() != OperationStatus.UPLOADING)
                throw new TransferException(ErrorKind.OPERATION_CONFLICT,
                        "Upload " + id + " is already " + cur.status().wireName());
            if (chunkIndex < 0 || chunkIndex >= cur.totalChunks())
                throw new IllegalArgumentException("chunk " + chunkIndex + " outside 0.." + (cur.totalChunks() - 1));
            return cur.withChunk(chunkIndex, clock.instant());
        });
    }

    @Override
    public boolean markRestoring(String id) {
        AtomicBoolean claimed = new AtomicBoolean(false);
        update(id, cur -> {
            if (cur.status() != OperationStatus.UPLOADING) return cur;
            claimed.set(true);
            return cur.withStatus(OperationStatus.RESTORING, clock.instant());
        });
        return claimed.get();
    }

    @Override
    public TransferOperation markCompleted(String id, List<String> restoredFiles) {
        return update(id, cur -> {
            if (cur.status() != OperationStatus.RESTORING)
                throw new IllegalStateException("cannot complete " + id + " from " + cur.status().wireName());
            return cur.completed(restoredFiles, clock.instant());
        });
    }

    @Override
    public TransferOperation markFailed(String id, String error) {
        return update(id, cur -> {
            if (cur.status().isTerminal()) {
                log.debug("Operation {} already {}, ignoring failure: {}", id, cur.status().wireName(), error);
                return cur;
            }
            return cur.failed(error, clock.instant());
        });
    }

    @Override
    public boolean failIfIdle(String id, Instant cutoff, String error) {
        AtomicBoolean failed = new AtomicBoolean(false);
        store.computeIfPresent(id, (k, cur) -> {
            if (cur.status() != OperationStatus.UPLOADING || !cur.lastActivityAt().isBefore(cutoff)) return cur;
            failed.set(true);
            return cur.failed(error, clock.instant());
        });
        return failed.get();
    }

    @Override
    public void remove(String id) { store.remove(id); }

    private TransferOperation update(String id, UnaryOperator<TransferOperation> fn) {
        TransferOperation next = store.computeIfPresent(id, (k, cur) -> fn.apply(cur));
        if (next == null) throw new TransferException(ErrorKind.UNKNOWN_OPERATION, "Upload session not found");
        return next;
    }
}
