package com.backupserver.backup;

import com.backupserver.range.ByteRangeReader;
import com.backupserver.range.RangeWindow;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.UncheckedIOException;
import java.util.Map;

@RestController
@RequestMapping("/backup")
@RequiredArgsConstructor
public class BackupController {

    static final String CHECKSUM_HEADER = "X-Checksum";
    static final String TOTAL_SIZE_HEADER = "X-Total-Size";

    private final BackupService service;

    @GetMapping
    public ResponseEntity<StreamingResponseBody> backup(@RequestHeader(name = HttpHeaders.RANGE, required = false) String range,
                                                        @RequestParam(name = "chunk_size", required = false) Integer chunkSize) {
        BackupService.Download d = service.prepareDownload(range, chunkSize);
        RangeWindow w = d.window();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentDisposition(ContentDisposition.attachment().filename(d.archive().fileName()).build());
        headers.set(HttpHeaders.ACCEPT_RANGES, "bytes");
        headers.setCacheControl("no-cache");
        headers.setContentLength(w.contentLength());
        headers.set(CHECKSUM_HEADER, d.archive().checksum());
        headers.set(TOTAL_SIZE_HEADER, String.valueOf(w.total()));
        if (w.partial()) headers.set(HttpHeaders.CONTENT_RANGE, w.contentRange());

        StreamingResponseBody body = out -> {
            try (ByteRangeReader reader = new ByteRangeReader(d.archive().location(), w, d.chunkSize())) {
                while (reader.hasNext()) out.write(reader.next());
                out.flush();
            } catch (UncheckedIOException e) {
                throw e.getCause();
            } finally {
                service.downloadFinished(d);
            }
        };

        return ResponseEntity.status(w.partial() ? HttpStatus.PARTIAL_CONTENT : HttpStatus.OK)
                .headers(headers)
                .contentType(MediaType.parseMediaType("application/zip"))
                .body(body);
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        return service.status();
    }

    @GetMapping("/verify")
    public Map<String, Object> verify(@RequestParam(required = false) String checksum,
                                      @RequestParam(required = false) String filename) {
        return service.verify(checksum, filename);
    }
}
