package com.backupserver.range;

/**
 * Resolved span to serve, {@code end} inclusive.
 */
public record RangeWindow(long start, long end, long total, boolean partial) {

    public long contentLength() { return Math.max(0, end - start + 1); }

    public String contentRange() { return "bytes " + start + "-" + end + "/" + total; }
}
