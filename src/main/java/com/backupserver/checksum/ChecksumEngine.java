package com.backupserver.checksum;

import com.backupserver.config.TransferProperties;
import com.backupserver.error.ErrorKind;
import com.backupserver.error.TransferException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

@Component
public class ChecksumEngine {

    private final HashAlgo algo;
    private final int blockSize;

    @Autowired
    public ChecksumEngine(TransferProperties props) {
        this(HashAlgo.of(props.checksum().algorithm()), props.checksum().blockSize());
    }

    public ChecksumEngine(HashAlgo algo, int blockSize) {
        if (blockSize <= 0) throw new IllegalArgumentException("checksum block size must be > 0");
        this.algo = algo;
        this.blockSize = blockSize;
    }

    public HashAlgo algo() { return algo; }

    public String digest(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            MessageDigest md = MessageDigest.getInstance(algo.jcaName);
            byte[] buf = new byte[blockSize];
            int n;
            while ((n = in.read(buf)) != -1) md.update(buf, 0, n);
            return toHex(md.digest());
        } catch (IOException e) {
            throw new TransferException(ErrorKind.IO_FAILURE, "cannot digest " + file + ": " + e.getMessage(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("digest algorithm unavailable: " + algo.jcaName, e);
        }
    }

    public boolean matches(Path file, String expected) {
        return expected != null && digest(file).equalsIgnoreCase(expected.trim());
    }

    static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) sb.append(Character.forDigit((b >>> 4) & 0xF, 16))
                .append(Character.forDigit(b & 0xF, 16));
        return sb.toString();
    }
}
