package com.backupserver.restore;

import com.backupserver.support.Fixtures;
import com.backupserver.support.TransferIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;
import org.springframework.util.DigestUtils;

import java.io.ByteArrayOutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.hamcrest.Matchers.notNullValue;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class RestoreControllerTest extends TransferIntegrationTest {

    private static final byte[] NEW_A = Fixtures.randomBytes(4000, 31);
    private static final byte[] NEW_B = Fixtures.randomBytes(3000, 32);

    @Test
    void testChunkedRestoreInThreeParts() throws Exception {
        byte[] archive = zip(Map.of("a.db", NEW_A, "b.db", NEW_B));
        String checksum = DigestUtils.md5DigestAsHex(archive);
        byte[][] parts = split(archive, 3);
        byte[] oldA = Files.readAllBytes(DB_A);

        mvc.perform(chunk(parts[0], 0, "scenario-3", 3).param("checksum", checksum))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.upload_id").value("scenario-3"))
                .andExpect(jsonPath("$.chunks_received").value(1))
                .andExpect(jsonPath("$.total_chunks").value(3));
        mvc.perform(chunk(parts[2], 2, "scenario-3", 3).param("checksum", checksum))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chunks_received").value(2));

        mvc.perform(get("/operation/status/scenario-3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("uploading"))
                .andExpect(jsonPath("$.chunks_received").value(2));

        mvc.perform(chunk(parts[1], 1, "scenario-3", 3).param("checksum", checksum))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Database restore completed successfully"))
                .andExpect(jsonPath("$.restored_files[0]").value(DB_A.toString()))
                .andExpect(jsonPath("$.restored_files[1]").value(DB_B.toString()));

        mvc.perform(get("/operation/status/scenario-3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.upload_id").value("scenario-3"))
                .andExpect(jsonPath("$.type").value("restore"))
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.chunks_received").value(3))
                .andExpect(jsonPath("$.completed_at").value(notNullValue()))
                .andExpect(jsonPath("$.restored_files.length()").value(2));

        assertArrayEquals(NEW_A, Files.readAllBytes(DB_A));
        assertArrayEquals(NEW_B, Files.readAllBytes(DB_B));
        Path bakA = snapshots().stream().filter(p -> p.getFileName().toString().startsWith("a.db.")).findFirst().orElseThrow();
        assertArrayEquals(oldA, Files.readAllBytes(bakA));
        assertTrue(snapshots().stream().anyMatch(p -> p.getFileName().toString().startsWith("b.db.")));
    }

    @Test
    void testChunkAfterCompletionConflicts() throws Exception {
        byte[] archive = zip(Map.of("a.db", NEW_A));
        mvc.perform(chunk(archive, 0, "done-once", 1))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.restored_files[0]").value(DB_A.toString()));

        mvc.perform(chunk(archive, 0, "done-once", 1))
                .andExpect(status().isConflict());
    }

    @Test
    void testSingleShotRestoreMintsUploadId() throws Exception {
        byte[] archive = zip(Map.of("b.db", NEW_B));

        mvc.perform(multipart("/restore").file(file(archive)).param("checksum", DigestUtils.md5DigestAsHex(archive)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.upload_id").value(notNullValue()))
                .andExpect(jsonPath("$.restored_files.length()").value(1))
                .andExpect(jsonPath("$.restored_files[0]").value(DB_B.toString()));

        assertArrayEquals(NEW_B, Files.readAllBytes(DB_B));
    }

    @Test
    void testChecksumMismatchAbortsBeforeRestore() throws Exception {
        byte[] archive = zip(Map.of("a.db", NEW_A));
        byte[] oldA = Files.readAllBytes(DB_A);

        mvc.perform(multipart("/restore").file(file(archive)).param("upload_id", "bad-sum")
                        .param("checksum", "00000000000000000000000000000000"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Checksum verification failed"))
                .andExpect(jsonPath("$.upload_id").value("bad-sum"))
                .andExpect(jsonPath("$.expected").value("00000000000000000000000000000000"))
                .andExpect(jsonPath("$.calculated").value(DigestUtils.md5DigestAsHex(archive)));

        mvc.perform(get("/operation/status/bad-sum"))
                .andExpect(jsonPath("$.status").value("failed"));
        assertArrayEquals(oldA, Files.readAllBytes(DB_A));
        assertTrue(snapshots().isEmpty());
    }

    @Test
    void testInvalidZipFailsOperation() throws Exception {
        mvc.perform(multipart("/restore").file(file("definitely not a zip".getBytes())).param("upload_id", "not-zip"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Invalid zip file provided"))
                .andExpect(jsonPath("$.upload_id").value("not-zip"));

        mvc.perform(get("/operation/status/not-zip"))
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error").value("Invalid zip file provided"));
    }

    @Test
    void testArchiveWithoutDatabasesLeavesFilesUnchanged() throws Exception {
        byte[] oldA = Files.readAllBytes(DB_A);
        byte[] oldB = Files.readAllBytes(DB_B);

        mvc.perform(multipart("/restore").file(file(zip(Map.of("notes.txt", "hi".getBytes())))).param("upload_id", "empty-restore"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No valid database files found in the backup"));

        assertArrayEquals(oldA, Files.readAllBytes(DB_A));
        assertArrayEquals(oldB, Files.readAllBytes(DB_B));
    }

    @Test
    void testChunkForUnknownSession() throws Exception {
        mvc.perform(chunk(new byte[]{1, 2}, 1, "never-started", 3))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Upload session not found"));
    }

    @Test
    void testMissingFile() throws Exception {
        mvc.perform(multipart("/restore").param("chunk", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("No backup file provided"));
    }

    @Test
    void testUnknownOperationStatus() throws Exception {
        mvc.perform(get("/operation/status/nothing-here"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Operation not found"));
    }

    private static MockHttpServletRequestBuilder chunk(byte[] bytes, int index, String uploadId, int total) {
        return multipart("/restore")
                .file(file(bytes))
                .param("chunk", String.valueOf(index))
                .param("upload_id", uploadId)
                .param("total_chunks", String.valueOf(total));
    }

    private static MockMultipartFile file(byte[] bytes) {
        return new MockMultipartFile("backup_file", "backup.zip", "application/zip", bytes);
    }

    private static byte[] zip(Map<String, byte[]> entries) throws Exception {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(bytes)) {
            for (Map.Entry<String, byte[]> e : new LinkedHashMap<>(entries).entrySet()) {
                zip.putNextEntry(new ZipEntry(e.getKey()));
                zip.write(e.getValue());
                zip.closeEntry();
            }
        }
        return bytes.toByteArray();
    }

    private static byte[][] split(byte[] data, int n) {
        byte[][] parts = new byte[n][];
        int size = (data.length + n - 1) / n;
        for (int i = 0; i < n; i++) parts[i] = Arrays.copyOfRange(data, i * size, Math.min((i + 1) * size, data.length));
        return parts;
    }
}
