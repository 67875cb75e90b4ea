package com.backupserver.upload;

import com.backupserver.operation.TransferOperation;

public record ChunkOutcome(Kind kind, TransferOperation operation) {

    public enum Kind { MORE_EXPECTED, READY_TO_ASSEMBLE }

    public boolean readyToAssemble() { return kind == Kind.READY_TO_ASSEMBLE; }
}
