package com.backupserver.range;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

public class ByteRangeReader implements Iterator<byte[]>, Closeable {

    private final FileChannel channel;
    private final int chunkSize;
    private long position;
    private long remaining;
    private byte[] next;

    public ByteRangeReader(Path file, RangeWindow window, int chunkSize) throws IOException {
        if (chunkSize <= 0) throw new IllegalArgumentException("chunk_size must be > 0");
        this.channel = FileChannel.open(file, StandardOpenOption.READ);
        this.chunkSize = chunkSize;
        this.position = window.start();
        this.remaining = window.contentLength();
    }

    @Override
    public boolean hasNext() {
        if (next == null && remaining > 0) next = readBlock();
        return next != null;
    }

    @Override
    public byte[] next() {
        if (!hasNext()) throw new NoSuchElementException();
        byte[] block = next;
        next = null;
        return block;
    }

    private byte[] readBlock() {
        ByteBuffer buf = ByteBuffer.allocate((int) Math.min(chunkSize, remaining));
        try {
            int n = channel.read(buf, position);
            if (n <= 0) {
                remaining = 0;
                return null;
            }
            position += n;
            remaining -= n;
            return n == buf.capacity() ? buf.array() : Arrays.copyOf(buf.array(), n);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
