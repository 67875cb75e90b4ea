package com.backupserver.operation;

import com.backupserver.error.ErrorKind;
import com.backupserver.error.TransferException;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/operation")
@RequiredArgsConstructor
public class OperationController {

    private final OperationRegistry registry;

    @GetMapping("/status/{uploadId}")
    public TransferOperation status(@PathVariable String uploadId) {
        return registry.find(uploadId)
                .orElseThrow(() -> new TransferException(ErrorKind.UNKNOWN_OPERATION, "Operation not found"));
    }
}
