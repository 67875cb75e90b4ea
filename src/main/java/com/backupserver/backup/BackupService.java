package com.backupserver.backup;

import com.backupserver.archive.Archive;
import com.backupserver.archive.ArchiveCodec;
import com.backupserver.archive.ManagedFile;
import com.backupserver.archive.ManagedFileCatalog;
import com.backupserver.checksum.ChecksumEngine;
import com.backupserver.config.TransferProperties;
import com.backupserver.error.ErrorKind;
import com.backupserver.error.TransferException;
import com.backupserver.range.ByteRange;
import com.backupserver.range.RangeNegotiator;
import com.backupserver.range.RangeWindow;
import com.backupserver.reclaim.DeferredReclaimer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class BackupService {

    private final ManagedFileCatalog catalog;
    private final ArchiveCodec codec;
    private final ChecksumEngine checksums;
    private final DeferredReclaimer reclaimer;
    private final int defaultChunkSize;
    private final Duration archiveRetention;

    public BackupService(ManagedFileCatalog catalog,
                         ArchiveCodec codec,
                         ChecksumEngine checksums,
                         DeferredReclaimer reclaimer,
                         TransferProperties props) {
        this.catalog = catalog;
        this.codec = codec;
        this.checksums = checksums;
        this.reclaimer = reclaimer;
        this.defaultChunkSize = props.download().chunkSize();
        this.archiveRetention = props.download().archiveRetention();
    }

    public record Download(Archive archive, RangeWindow window, int chunkSize) {}

    // range and chunk size are checked before any file is touched
    public Download prepareDownload(String rangeHeader, Integer chunkSize) {
        Optional<ByteRange> requested = RangeNegotiator.parse(rangeHeader);
        int blockSize = chunkSize == null ? defaultChunkSize : chunkSize;
        if (blockSize <= 0) throw new IllegalArgumentException("chunk_size must be > 0");

        Archive archive = codec.build(catalog.snapshot());
        try {
            RangeWindow window = RangeNegotiator.resolve(requested, archive.length());
            log.info("Serving {} bytes {}-{}/{}", archive.fileName(), window.start(), window.end(), window.total());
            return new Download(archive, window, blockSize);
        } catch (TransferException e) {
            reclaimer.scheduleFile(archive.location(), Duration.ZERO);
            throw e;
        }
    }

    // also called when the client goes away mid-stream
    public void downloadFinished(Download download) {
        reclaimer.scheduleFile(download.archive().location(), archiveRetention);
    }

    public Map<String, Object> status() {
        List<Map<String, Object>> databases = new ArrayList<>();
        long total = 0;
        boolean allExist = true;
        for (ManagedFile f : catalog.snapshot()) {
            Map<String, Object> db = new LinkedHashMap<>();
            db.put("path", f.path());
            db.put("exists", f.exists());
            db.put("size_bytes", f.sizeBytes());
            db.put("size_formatted", f.sizeFormatted());
            databases.add(db);
            total += f.sizeBytes();
            allExist &= f.exists();
        }

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("databases", databases);
        status.put("total_size_bytes", total);
        status.put("total_size_formatted", ManagedFileCatalog.formatSize(total));
        status.put("all_files_exist", allExist);
        return status;
    }

    public Map<String, Object> verify(String checksum, String filename) {
        if (checksum == null || checksum.isBlank() || filename == null || filename.isBlank())
            throw new IllegalArgumentException("Missing checksum or filename");
        if (filename.contains("/") || filename.contains("\\") || filename.equals("..") || filename.equals("."))
            throw new IllegalArgumentException("filename must not contain path components");

        Path archive = codec.backupsRoot().resolve(filename);
        if (!Files.isRegularFile(archive))
            throw new TransferException(ErrorKind.ARCHIVE_NOT_FOUND, "Backup file not found");

        String calculated = checksums.digest(archive);
        Map<String, Object> result = new LinkedHashMap<>();
        if (calculated.equalsIgnoreCase(checksum.trim())) {
            result.put("verified", true);
        } else {
            result.put("verified", false);
            result.put("expected", calculated);
            result.put("received", checksum);
        }
        return result;
    }
}
