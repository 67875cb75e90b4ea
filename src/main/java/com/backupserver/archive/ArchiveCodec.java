package com.backupserver.archive;

import com.backupserver.checksum.ChecksumEngine;
import com.backupserver.config.TransferProperties;
import com.backupserver.error.ErrorKind;
import com.backupserver.error.TransferException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;
import java.util.zip.ZipOutputStream;

@Slf4j
@Component
public class ArchiveCodec {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final int MAX_NAME_ATTEMPTS = 100;

    private final Path backupsRoot;
    private final String prefix;
    private final ChecksumEngine checksums;
    private final Clock clock;

    @Autowired
    public ArchiveCodec(TransferProperties props, ChecksumEngine checksums, Clock clock) {
        this(Path.of(props.tempBackupsDir()), props.archivePrefix(), checksums, clock);
    }

    public ArchiveCodec(Path backupsRoot, String prefix, ChecksumEngine checksums, Clock clock) {
        this.backupsRoot = backupsRoot;
        this.prefix = prefix;
        this.checksums = checksums;
        this.clock = clock;
    }

    public Path backupsRoot() { return backupsRoot; }

    // all sources are checked before anything is written
    public Archive build(List<ManagedFile> sources) {
        for (ManagedFile f : sources) {
            if (!f.exists() || !Files.isRegularFile(f.location()))
                throw new TransferException(ErrorKind.SOURCE_MISSING, "Database file " + f.path() + " not found");
        }

        Path target = null;
        try {
            target = claimArchivePath();
            try (ZipOutputStream zip = new ZipOutputStream(new BufferedOutputStream(Files.newOutputStream(target)))) {
                zip.setMethod(ZipOutputStream.DEFLATED);
                for (ManagedFile f : sources) {
                    ZipEntry entry = new ZipEntry(f.baseName());
                    // source mtime keeps rebuilds of unchanged files byte-identical
                    entry.setTime(Files.getLastModifiedTime(f.location()).toMillis());
                    zip.putNextEntry(entry);
                    Files.copy(f.location(), zip);
                    zip.closeEntry();
                }
            }
            Archive archive = new Archive(target.toAbsolutePath(), Files.size(target), checksums.digest(target));
            log.info("Built archive {} ({} bytes, {} entries)", archive.fileName(), archive.length(), sources.size());
            return archive;
        } catch (IOException e) {
            deleteQuietly(target);
            throw new TransferException(ErrorKind.IO_FAILURE, "Backup failed: " + e.getMessage(), e);
        }
    }

    public Set<String> openAndList(Path archive) {
        try (ZipFile zf = new ZipFile(archive.toFile())) {
            Set<String> names = new LinkedHashSet<>();
            Enumeration<? extends ZipEntry> en = zf.entries();
            while (en.hasMoreElements()) {
                ZipEntry ze = en.nextElement();
                if (!ze.isDirectory()) names.add(ze.getName());
            }
            return names;
        } catch (ZipException e) {
            throw new TransferException(ErrorKind.CORRUPT_ARCHIVE, "Invalid zip file provided", e);
        } catch (IOException e) {
            throw new TransferException(ErrorKind.IO_FAILURE, "cannot open archive: " + e.getMessage(), e);
        }
    }

    /** @return destinations actually written, in archive order */
    public List<Path> extract(Path archive, Set<String> wanted, Map<String, Path> destinations) throws IOException {
        List<Path> written = new ArrayList<>();
        try (ZipFile zf = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> en = zf.entries();
            while (en.hasMoreElements()) {
                ZipEntry ze = en.nextElement();
                if (ze.isDirectory() || !wanted.contains(ze.getName())) continue;
                Path dest = destinations.get(ze.getName());
                if (dest == null || written.contains(dest)) continue;

                try (InputStream in = zf.getInputStream(ze)) {
                    Files.copy(in, dest, StandardCopyOption.REPLACE_EXISTING);
                }
                written.add(dest);
                log.debug("Extracted {} -> {}", ze.getName(), dest);
            }
        } catch (ZipException e) {
            throw new TransferException(ErrorKind.CORRUPT_ARCHIVE, "Invalid zip file provided", e);
        }
        return written;
    }

    private Path claimArchivePath() throws IOException {
        Files.createDirectories(backupsRoot);
        String base = prefix + "_" + LocalDateTime.now(clock).format(STAMP);
        for (int i = 0; i < MAX_NAME_ATTEMPTS; i++) {
            String name = i == 0 ? base + ".zip" : base + "_" + i + ".zip";
            try {
                return Files.createFile(backupsRoot.resolve(name));
            } catch (FileAlreadyExistsException taken) {
                log.debug("Archive name {} taken, trying next", name);
            }
        }
        throw new IOException("no free archive name for " + base);
    }

    private static void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.debug("Could not remove partial archive {}: {}", p, e.getMessage());
        }
    }
}
