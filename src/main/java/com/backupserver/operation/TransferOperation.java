package com.backupserver.operation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

// immutable; the registry swaps in a new value on every transition
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"upload_id", "type", "status", "started_at", "completed_at", "last_activity_at",
        "chunks_received", "total_chunks", "temp_dir", "restored_files", "error"})
public record TransferOperation(
        @JsonProperty("upload_id")        String id,
        @JsonProperty("type")             String kind,
        @JsonProperty("status")           OperationStatus status,
        @JsonProperty("started_at")       Instant createdAt,
        @JsonProperty("completed_at")     Instant completedAt,
        @JsonProperty("last_activity_at") Instant lastActivityAt,
        @JsonIgnore                       Set<Integer> receivedChunks,
        @JsonProperty("total_chunks")     int totalChunks,
        @JsonProperty("temp_dir")         String stagingDir,
        @JsonProperty("restored_files")   List<String> restoredFiles,
        @JsonProperty("error")            String error
) {
    public static final String KIND_RESTORE = "restore";

    public TransferOperation {
        receivedChunks = Set.copyOf(receivedChunks);
        restoredFiles = restoredFiles == null ? null : List.copyOf(restoredFiles);
    }

    public static TransferOperation uploading(String id, int totalChunks, String stagingDir, Instant now) {
        return new TransferOperation(id, KIND_RESTORE, OperationStatus.UPLOADING, now, null, now,
                Set.of(), totalChunks, stagingDir, null, null);
    }

    @JsonProperty("chunks_received")
    public int chunksReceived() { return receivedChunks.size(); }

    @JsonIgnore
    public boolean allChunksReceived() { return receivedChunks.size() >= totalChunks; }

    TransferOperation withChunk(int index, Instant now) {
        Set<Integer> chunks = new HashSet<>(receivedChunks);
        chunks.add(index);
        return new TransferOperation(id, kind, status, createdAt, completedAt, now, chunks, totalChunks,
                stagingDir, restoredFiles, error);
    }

    TransferOperation withStatus(OperationStatus next, Instant now) {
        return new TransferOperation(id, kind, next, createdAt, completedAt, now, receivedChunks, totalChunks,
                stagingDir, restoredFiles, error);
    }

    TransferOperation completed(List<String> restored, Instant now) {
        return new TransferOperation(id, kind, OperationStatus.COMPLETED, createdAt, now, now, receivedChunks,
                totalChunks, stagingDir, restored, null);
    }

    TransferOperation failed(String detail, Instant now) {
        return new TransferOperation(id, kind, OperationStatus.FAILED, createdAt, now, now, receivedChunks,
                totalChunks, stagingDir, null, detail);
    }
}
