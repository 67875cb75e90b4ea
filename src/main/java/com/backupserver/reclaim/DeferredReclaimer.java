package com.backupserver.reclaim;

import com.backupserver.config.TransferProperties;
import com.backupserver.operation.OperationRegistry;
import com.backupserver.operation.OperationStatus;
import com.backupserver.operation.TransferOperation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

// best-effort; the only place a registry record is dropped
@Slf4j
@Component
public class DeferredReclaimer {

    static final String ABANDONED = "upload abandoned after idle timeout";

    private final TaskScheduler scheduler;
    private final OperationRegistry registry;
    private final Clock clock;
    private final Duration operationRetention;
    private final Duration idleTimeout;

    public DeferredReclaimer(TaskScheduler scheduler, OperationRegistry registry, Clock clock, TransferProperties props) {
        this.scheduler = scheduler;
        this.registry = registry;
        this.clock = clock;
        this.operationRetention = props.operation().retention();
        this.idleTimeout = props.operation().idleTimeout();
    }

    public ScheduledFuture<?> scheduleFile(Path file, Duration delay) {
        log.debug("Scheduling removal of {} in {}", file, delay);
        return scheduler.schedule(() -> deleteFile(file), at(delay));
    }

    public ScheduledFuture<?> scheduleOperation(String id, Duration delay) {
        log.debug("Scheduling reclamation of operation {} in {}", id, delay);
        return scheduler.schedule(() -> purgeOperation(id), at(delay));
    }

    public ScheduledFuture<?> scheduleOperation(String id) {
        return scheduleOperation(id, operationRetention);
    }

    @Scheduled(fixedDelayString = "${transfer.operation.sweep-interval:PT1M}")
    public void sweepIdleUploads() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        for (TransferOperation op : registry.findAll()) {
            if (op.status() != OperationStatus.UPLOADING || !op.lastActivityAt().isBefore(cutoff)) continue;
            // the snapshot may be stale; the registry re-checks under the key
            if (registry.failIfIdle(op.id(), cutoff, ABANDONED)) {
                log.info("Upload {} idle since {}, marked failed", op.id(), op.lastActivityAt());
                scheduleOperation(op.id());
            }
        }
    }

    private Instant at(Duration delay) {
        return clock.instant().plus(delay);
    }

    void deleteFile(Path file) {
        try {
            if (Files.deleteIfExists(file)) log.info("Removed temp archive {}", file);
        } catch (IOException | RuntimeException e) {
            log.debug("Could not remove {}: {}", file, e.getMessage());
        }
    }

    void purgeOperation(String id) {
        try {
            registry.find(id).ifPresent(op -> {
                deleteTree(op.stagingDir());
                registry.remove(id);
                log.info("Reclaimed operation {} ({})", id, op.status().wireName());
            });
        } catch (RuntimeException e) {
            log.debug("Could not reclaim operation {}: {}", id, e.getMessage());
        }
    }

    private static void deleteTree(String dir) {
        if (dir == null) return;
        try {
            FileSystemUtils.deleteRecursively(Path.of(dir));
        } catch (IOException e) {
            log.debug("Could not remove staging directory {}: {}", dir, e.getMessage());
        }
    }
}
