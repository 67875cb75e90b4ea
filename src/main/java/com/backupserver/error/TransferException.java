package com.backupserver.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class TransferException extends RuntimeException {

    private final ErrorKind kind;
    private final String uploadId;
    private final Map<String, Object> details;

    public TransferException(ErrorKind kind, String message) {
        this(kind, message, null, Map.of(), null);
    }

    public TransferException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, null, Map.of(), cause);
    }

    private TransferException(ErrorKind kind, String message, String uploadId,
                              Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.uploadId = uploadId;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static TransferException checksumMismatch(String uploadId, String expected, String calculated) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expected", expected);
        details.put("calculated", calculated);
        return new TransferException(ErrorKind.CHECKSUM_MISMATCH, "Checksum verification failed",
                uploadId, details, null);
    }

    public TransferException forUpload(String id) {
        return new TransferException(kind, getMessage(), id, details, getCause());
    }

    public ErrorKind getKind() { return kind; }

    public String getUploadId() { return uploadId; }

    public Map<String, Object> getDetails() { return details; }
}
