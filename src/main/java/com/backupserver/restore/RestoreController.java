package com.backupserver.restore;

import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Optional;

@RestController
@RequiredArgsConstructor
public class RestoreController {

    private final RestoreService service;

    @PostMapping(value = "/restore", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Map<String, Object> restore(@RequestParam(name = "backup_file", required = false) MultipartFile file,
                                       @RequestParam(name = "chunk", required = false) Integer chunk,
                                       @RequestParam(name = "upload_id", required = false) String uploadId,
                                       @RequestParam(name = "total_chunks", defaultValue = "1") int totalChunks,
                                       @RequestParam(name = "checksum", required = false) String checksum) throws IOException {
        if (file == null) throw new IllegalArgumentException("No backup file provided");
        if (file.getOriginalFilename() == null || file.getOriginalFilename().isBlank())
            throw new IllegalArgumentException("No backup file selected");

        Optional<String> id = Optional.ofNullable(uploadId).filter(s -> !s.isBlank());
        try (InputStream in = file.getInputStream()) {
            return chunk == null
                    ? service.restoreSingle(id, in, checksum)
                    : service.restoreChunk(id, chunk, totalChunks, in, checksum);
        }
    }
}
