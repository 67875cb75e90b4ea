package com.backupserver.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

@ConfigurationProperties(prefix = "transfer")
public record TransferProperties(
        @DefaultValue({"database/books_data.db", "database/books_static.db"}) List<String> managedFiles,
        @DefaultValue("temp_uploads") String tempUploadsDir,
        @DefaultValue("temp_backups") String tempBackupsDir,
        @DefaultValue("books_db_backup") String archivePrefix,
        @DefaultValue Download download,
        @DefaultValue Checksum checksum,
        @DefaultValue Operation operation
) {

    public record Download(
            @DefaultValue("1048576") int chunkSize,         // bytes per streamed block
            @DefaultValue("PT10M") Duration archiveRetention
    ) {}

    public record Checksum(
            @DefaultValue("MD5") String algorithm,
            @DefaultValue("4096") int blockSize
    ) {}

    public record Operation(
            @DefaultValue("PT1H") Duration retention,       // grace period after completed/failed
            @DefaultValue("PT30M") Duration idleTimeout,    // uploading with no chunk activity
            @DefaultValue("PT1M") Duration sweepInterval
    ) {}
}
