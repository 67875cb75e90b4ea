package com.backupserver.error;

import org.springframework.http.HttpStatus;

public enum ErrorKind {
    SOURCE_MISSING(HttpStatus.NOT_FOUND),
    CORRUPT_ARCHIVE(HttpStatus.BAD_REQUEST),
    RANGE_NOT_SATISFIABLE(HttpStatus.REQUESTED_RANGE_NOT_SATISFIABLE),
    INVALID_RANGE(HttpStatus.BAD_REQUEST),
    UNKNOWN_OPERATION(HttpStatus.NOT_FOUND),
    MISSING_CHUNK(HttpStatus.BAD_REQUEST),
    CHECKSUM_MISMATCH(HttpStatus.BAD_REQUEST),
    NOTHING_TO_RESTORE(HttpStatus.BAD_REQUEST),
    OPERATION_CONFLICT(HttpStatus.CONFLICT),
    ARCHIVE_NOT_FOUND(HttpStatus.NOT_FOUND),
    IO_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR);

    public final HttpStatus status;
    ErrorKind(HttpStatus status) { this.status = status; }
}
