package com.backupserver.operation;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OperationStatus {
    UPLOADING,
    RESTORING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() { return this == COMPLETED || this == FAILED; }

    @JsonValue
    public String wireName() { return name().toLowerCase(Locale.ROOT); }
}
