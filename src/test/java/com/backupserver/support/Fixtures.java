package com.backupserver.support;

import com.backupserver.config.TransferProperties;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

public final class Fixtures {

    private Fixtures() {}

    public static TransferProperties properties(Path root, List<Path> managed) {
        return new TransferProperties(
                managed.stream().map(Path::toString).toList(),
                root.resolve("temp_uploads").toString(),
                root.resolve("temp_backups").toString(),
                "books_db_backup",
                new TransferProperties.Download(1024 * 1024, Duration.ofMinutes(10)),
                new TransferProperties.Checksum("MD5", 4096),
                new TransferProperties.Operation(Duration.ofHours(1), Duration.ofMinutes(30), Duration.ofMinutes(1)));
    }

    public static Path zip(Path target, Map<String, byte[]> entries) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        try (OutputStream fos = Files.newOutputStream(target); ZipOutputStream zip = new ZipOutputStream(fos)) {
            for (Map.Entry<String, byte[]> e : entries.entrySet()) {
                zip.putNextEntry(new ZipEntry(e.getKey()));
                zip.write(e.getValue());
                zip.closeEntry();
            }
        }
        return target;
    }

    public static byte[] randomBytes(int n, long seed) {
        byte[] b = new byte[n];
        new Random(seed).nextBytes(b);
        return b;
    }

    public static Path write(Path file, byte[] content) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        return Files.write(file, content);
    }
}
