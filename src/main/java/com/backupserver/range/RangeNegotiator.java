package com.backupserver.range;

import com.backupserver.error.ErrorKind;
import com.backupserver.error.TransferException;

import java.util.Optional;

public final class RangeNegotiator {

    private static final String UNIT = "bytes=";

    private RangeNegotiator() {}

    public static Optional<ByteRange> parse(String header) {
        if (header == null) return Optional.empty();
        String value = header.trim();
        if (value.regionMatches(true, 0, UNIT, 0, UNIT.length())) value = value.substring(UNIT.length()).trim();

        int dash = value.indexOf('-');
        if (dash < 0 || dash != value.lastIndexOf('-'))
            throw invalid(header);

        Long start = bound(value.substring(0, dash), header);
        Long end = bound(value.substring(dash + 1), header);
        if (start != null && end != null && start > end)
            throw invalid(header);
        return Optional.of(new ByteRange(start, end));
    }

    public static RangeWindow resolve(Optional<ByteRange> requested, long total) {
        if (requested.isEmpty()) return new RangeWindow(0, total - 1, total, false);

        ByteRange r = requested.get();
        long start = r.start() == null ? 0 : r.start();
        long end = r.end() == null ? total - 1 : r.end();
        if (start >= total)
            throw new TransferException(ErrorKind.RANGE_NOT_SATISFIABLE, "Range not satisfiable");
        if (end >= total) end = total - 1;
        return new RangeWindow(start, end, total, true);
    }

    private static Long bound(String s, String header) {
        String v = s.trim();
        if (v.isEmpty()) return null;
        if (!v.chars().allMatch(Character::isDigit)) throw invalid(header);
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new TransferException(ErrorKind.INVALID_RANGE, "Invalid range header", e);
        }
    }

    private static TransferException invalid(String header) {
        return new TransferException(ErrorKind.INVALID_RANGE, "Invalid range header: " + header);
    }
}
